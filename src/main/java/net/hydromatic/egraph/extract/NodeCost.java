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

import net.hydromatic.egraph.lang.Node;

/**
 * Cost of a single node, excluding its children, for exact extraction.
 *
 * <p>Unlike a {@link CostFunction}, a node cost does not depend on the
 * children: {@link ExactExtractor} adds the cost of each selected node once,
 * however many times the term refers to it.
 *
 * @param <N> Node type
 */
@FunctionalInterface
public interface NodeCost<N extends Node<N>> {
  /** Returns the cost of a node. Must be finite and not negative. */
  double cost(N node);

  /** Returns a cost function where every node costs 1. */
  static <N extends Node<N>> NodeCost<N> unit() {
    return node -> 1d;
  }
}

// End NodeCost.java
