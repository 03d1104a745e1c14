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
package net.hydromatic.egraph.graph;

import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Attaches a value to every e-class, and keeps it up to date as classes
 * merge.
 *
 * <p>A typical analysis is constant folding: the value of a class is the
 * constant it is known to be equal to, if any.
 *
 * @param <N> Node type
 * @param <D> Type of the value attached to each class
 */
public interface Analysis<N extends Node<N>, D> {
  /**
   * Computes the value of a single node. The node's children are canonical,
   * and their values are available via {@link EGraph#data(Id)}.
   */
  D make(EGraph<N, D> egraph, N node);

  /**
   * Combines the values of two classes that are being merged, and returns the
   * combined value. The e-graph detects a change by comparing the result with
   * each input using {@link Object#equals}.
   *
   * <p>Must be commutative, associative and idempotent, so that the value of
   * a class does not depend on the order in which its members were merged.
   *
   * @throws MergeConflictException if the values contradict each other, for
   *     example two different constants; this means that the rewrite rules
   *     are unsound for the current input
   */
  D merge(D a, D b);

  /**
   * Called once for each class that a rebuild has touched, and after a class
   * is created. May add nodes and perform unions, for example to add a
   * constant node to a class whose value is known.
   *
   * <p>This hook is re-entrant: any unions it performs dirty the graph again,
   * and the current rebuild processes them before it returns. It must
   * therefore be idempotent: calling it again on a class that it has already
   * modified must not change the graph, or rebuild will not terminate.
   */
  default void modify(EGraph<N, D> egraph, Id id) {}
}

// End Analysis.java
