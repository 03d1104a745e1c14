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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.lang.NodeFactory;

/**
 * A rewrite rule: a name, a {@link Searcher} and an {@link Applier}.
 *
 * <p>Searchers and appliers are interchangeable. The most common rule has a
 * {@link Pattern} on each side, as in {@code (+ ?x ?y) => (+ ?y ?x)}, but a
 * caller may pair a pattern with a custom applier, or guard an applier with a
 * {@link Condition}.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public final class Rewrite<N extends Node<N>, D> {
  public final String name;
  private final Searcher<N> searcher;
  private final Applier<N, ? super D> applier;

  private Rewrite(
      String name, Searcher<N> searcher, Applier<N, ? super D> applier) {
    this.name = requireNonNull(name);
    this.searcher = requireNonNull(searcher);
    this.applier = requireNonNull(applier);
    final Set<Var> bound = searcher.vars();
    for (Var var : applier.vars()) {
      if (!bound.contains(var)) {
        throw new PatternCompileException(
            "Rewrite " + name + " refers to unbound var " + var);
      }
    }
  }

  /**
   * Creates a rewrite.
   *
   * @throws PatternCompileException if the applier uses a variable that the
   *     searcher does not bind
   */
  public static <N extends Node<N>, D> Rewrite<N, D> create(
      String name, Searcher<N> searcher, Applier<N, ? super D> applier) {
    return new Rewrite<>(name, searcher, applier);
  }

  /** Creates a rewrite from two patterns in textual syntax. */
  public static <N extends Node<N>, D> Rewrite<N, D> parse(
      String name, String lhs, String rhs, NodeFactory<N> factory) {
    return new Rewrite<>(
        name, Pattern.parse(lhs, factory), Pattern.parse(rhs, factory));
  }

  /**
   * Creates a rewrite from two patterns in textual syntax, that applies only
   * if a condition holds.
   */
  public static <N extends Node<N>, D> Rewrite<N, D> parse(
      String name,
      String lhs,
      String rhs,
      NodeFactory<N> factory,
      Condition<N, ? super D> condition) {
    final Applier<N, D> applier =
        new ConditionalApplier<>(condition, Pattern.parse(rhs, factory));
    return new Rewrite<>(name, Pattern.parse(lhs, factory), applier);
  }

  /**
   * Creates a pair of rewrites, one in each direction. The second is named
   * {@code name + "-rev"}.
   */
  public static <N extends Node<N>, D> List<Rewrite<N, D>> bidirectional(
      String name, String lhs, String rhs, NodeFactory<N> factory) {
    return ImmutableList.of(
        Rewrite.<N, D>parse(name, lhs, rhs, factory),
        Rewrite.<N, D>parse(name + "-rev", rhs, lhs, factory));
  }

  /** Returns the searcher. */
  public Searcher<N> searcher() {
    return searcher;
  }

  /** Returns the applier. */
  public Applier<N, ? super D> applier() {
    return applier;
  }

  /** Finds all matches of this rule's searcher. */
  public List<SearchMatches<N>> search(EGraph<N, D> egraph) {
    return searcher.search(egraph);
  }

  /** Finds matches of this rule's searcher, up to a limit. */
  public List<SearchMatches<N>> searchWithLimit(
      EGraph<N, D> egraph, int limit) {
    return searcher.searchWithLimit(egraph, limit);
  }

  /**
   * Applies this rule's applier to matches. Returns the ids of classes that
   * were merged.
   */
  public List<Id> apply(EGraph<N, D> egraph, List<SearchMatches<N>> matches) {
    return applier.applyMatches(egraph, matches, name);
  }

  /** Searches, then applies to all matches. Does not rebuild. */
  public List<Id> run(EGraph<N, D> egraph) {
    return apply(egraph, search(egraph));
  }

  @Override
  public String toString() {
    return "Rewrite(" + name + ", " + searcher + " => " + applier + ")";
  }
}

// End Rewrite.java
