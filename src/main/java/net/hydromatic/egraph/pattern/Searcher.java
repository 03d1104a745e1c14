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
package net.hydromatic.egraph.pattern;

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.egraph.graph.EClass;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The left-hand side of a {@link Rewrite}: finds the places in an e-graph
 * where a rule applies.
 *
 * <p>{@link Pattern} is the usual implementation; callers may write their
 * own.
 *
 * @param <N> Node type
 */
public interface Searcher<N extends Node<N>> {
  /**
   * Searches one class, returning at most {@code limit} substitutions, or null
   * if there are none.
   */
  @Nullable SearchMatches<N> searchEClassWithLimit(
      EGraph<N, ?> egraph, Id eclass, int limit);

  /** Returns the variables that every substitution binds. */
  Set<Var> vars();

  /** Returns the pattern this searcher matches, if it is a pattern. */
  default @Nullable PatternAst<N> ast() {
    return null;
  }

  /** Searches one class, returning null if there are no matches. */
  default @Nullable SearchMatches<N> searchEClass(
      EGraph<N, ?> egraph, Id eclass) {
    return searchEClassWithLimit(egraph, eclass, Integer.MAX_VALUE);
  }

  /** Searches every class. */
  default List<SearchMatches<N>> search(EGraph<N, ?> egraph) {
    return searchWithLimit(egraph, Integer.MAX_VALUE);
  }

  /**
   * Searches every class, stopping once {@code limit} substitutions have been
   * found.
   *
   * @throws IllegalStateException if the graph needs to be rebuilt
   */
  default List<SearchMatches<N>> searchWithLimit(
      EGraph<N, ?> egraph, int limit) {
    checkState(egraph.isClean(), "graph must be rebuilt before searching");
    final List<SearchMatches<N>> list = new ArrayList<>();
    int remaining = limit;
    for (EClass<N, ?> eclass : egraph.classes()) {
      if (remaining <= 0) {
        break;
      }
      final SearchMatches<N> matches =
          searchEClassWithLimit(egraph, eclass.id(), remaining);
      if (matches != null) {
        list.add(matches);
        remaining -= matches.substs.size();
      }
    }
    return list;
  }
}

// End Searcher.java
