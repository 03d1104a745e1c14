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
package net.hydromatic.egraph.run;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.pattern.Rewrite;
import net.hydromatic.egraph.pattern.SearchMatches;

/**
 * Decides which rules a {@link Runner} searches and applies in each
 * iteration.
 *
 * <p>The default methods search and apply every rule in every iteration,
 * and allow the runner to stop as soon as the e-graph stops changing.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public interface Scheduler<N extends Node<N>, D> {
  /** Returns whether a rule may search in a given iteration. */
  default boolean canSearch(int iteration, String ruleName) {
    return true;
  }

  /**
   * Returns whether the runner may declare saturation after an iteration
   * in which no rule changed the e-graph.
   */
  default boolean canStop(int iteration) {
    return true;
  }

  /** Searches for matches of a rule, or returns none if it may not run. */
  default List<SearchMatches<N>> searchRewrite(
      int iteration, EGraph<N, D> egraph, Rewrite<N, D> rewrite) {
    if (!canSearch(iteration, rewrite.name)) {
      return ImmutableList.of();
    }
    return rewrite.search(egraph);
  }

  /**
   * Applies a rule to the matches found by {@link #searchRewrite}. Returns
   * the number of classes merged.
   */
  default int applyRewrite(
      int iteration,
      EGraph<N, D> egraph,
      Rewrite<N, D> rewrite,
      List<SearchMatches<N>> matches) {
    return rewrite.apply(egraph, matches).size();
  }
}

// End Scheduler.java
