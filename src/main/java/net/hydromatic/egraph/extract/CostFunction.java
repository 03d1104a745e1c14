/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.egraph.extract;

import java.util.function.Function;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Computes the cost of a node from the costs of its children.
 *
 * <p>The cost must be monotone: a node costs at least as much as each of
 * its children. The {@link Extractor} relies on this to terminate and to
 * build finite terms from an e-graph that has cycles.
 *
 * @param <N> Node type
 * @param <C> Cost type
 */
@FunctionalInterface
public interface CostFunction<N extends Node<N>, C extends Comparable<C>> {
  /**
   * Returns the cost of a node.
   *
   * @param node Node; its children are class ids
   * @param childCost Returns the best known cost of a child class
   */
  C cost(N node, Function<Id, C> childCost);
}

// End CostFunction.java
