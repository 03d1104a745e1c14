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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The right-hand side of a {@link Rewrite}: modifies an e-graph at a place
 * where the rule's searcher matched.
 *
 * <p>{@link Pattern} is the usual implementation, and adds the instantiated
 * pattern to the matched class. Appliers that need the analysis value of a
 * class declare the value type {@code D}.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value that this applier reads
 */
public interface Applier<N extends Node<N>, D> {
  /**
   * Applies to one substitution that matched {@code eclass}. Returns the ids
   * of classes that were merged as a result; an empty list means the graph
   * did not change.
   *
   * @param ruleName Name of the rule, to justify unions
   */
  List<Id> applyOne(
      EGraph<N, ? extends D> egraph,
      Id eclass,
      Subst subst,
      @Nullable PatternAst<N> searcherAst,
      String ruleName);

  /** Applies to every substitution in a list of matches. */
  default List<Id> applyMatches(
      EGraph<N, ? extends D> egraph,
      List<SearchMatches<N>> matchesList,
      String ruleName) {
    final List<Id> ids = new ArrayList<>();
    for (SearchMatches<N> matches : matchesList) {
      for (Subst subst : matches.substs) {
        ids.addAll(
            applyOne(egraph, matches.eclass, subst, matches.ast, ruleName));
      }
    }
    return ids;
  }

  /** Returns the variables that this applier reads from a substitution. */
  default Set<Var> vars() {
    return ImmutableSet.of();
  }
}

// End Applier.java
