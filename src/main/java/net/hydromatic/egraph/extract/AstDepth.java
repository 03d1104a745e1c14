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
 * Cost function that measures the depth of a term. A leaf has depth 1.
 *
 * @param <N> Node type
 */
public final class AstDepth<N extends Node<N>>
    implements CostFunction<N, Integer> {
  @SuppressWarnings("rawtypes")
  private static final AstDepth INSTANCE = new AstDepth();

  private AstDepth() {}

  /** Returns the instance. */
  @SuppressWarnings("unchecked")
  public static <N extends Node<N>> AstDepth<N> instance() {
    return (AstDepth<N>) INSTANCE;
  }

  @Override
  public Integer cost(N node, Function<Id, Integer> childCost) {
    int depth = 0;
    for (Id child : node.children()) {
      depth = Math.max(depth, childCost.apply(child));
    }
    return depth == Integer.MAX_VALUE ? depth : depth + 1;
  }
}

// End AstDepth.java
