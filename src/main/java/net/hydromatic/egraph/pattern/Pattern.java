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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.graph.Justification;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.lang.NodeFactory;
import net.hydromatic.egraph.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A pattern, compiled for matching.
 *
 * <p>As a {@link Searcher}, finds the classes that contain an instance of the
 * pattern. As an {@link Applier}, adds the pattern, instantiated with a
 * substitution, and merges it with the matched class.
 *
 * @param <N> Node type
 */
public final class Pattern<N extends Node<N>>
    implements Searcher<N>, Applier<N, Object> {
  public final PatternAst<N> ast;
  private final Program<N> program;

  /**
   * Creates a pattern.
   *
   * @throws PatternCompileException if the pattern is malformed
   */
  public Pattern(PatternAst<N> ast) {
    this.ast = requireNonNull(ast);
    this.program = Program.compile(ast);
  }

  /** Parses and compiles a pattern such as {@code (+ ?x 0)}. */
  public static <N extends Node<N>> Pattern<N> parse(
      String s, NodeFactory<N> factory) {
    return new Pattern<>(Parsers.parsePatternAst(s, factory));
  }

  /** Returns the compiled program. */
  public Program<N> program() {
    return program;
  }

  @Override
  public PatternAst<N> ast() {
    return ast;
  }

  @Override
  public ImmutableSet<Var> vars() {
    return ast.vars();
  }

  @Override
  public @Nullable SearchMatches<N> searchEClassWithLimit(
      EGraph<N, ?> egraph, Id eclass, int limit) {
    final List<Subst> substs = new ArrayList<>();
    new Machine<>(program).run(egraph, eclass, limit, substs::add);
    if (substs.isEmpty()) {
      return null;
    }
    return new SearchMatches<>(egraph.find(eclass), substs, ast);
  }

  @Override
  public List<Id> applyOne(
      EGraph<N, ?> egraph,
      Id eclass,
      Subst subst,
      @Nullable PatternAst<N> searcherAst,
      String ruleName) {
    final Id id = egraph.addInstantiation(ast, subst);
    if (egraph.union(id, eclass, Justification.rule(ruleName))) {
      return ImmutableList.of(egraph.find(id));
    }
    return ImmutableList.of();
  }

  @Override
  public int hashCode() {
    return ast.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Pattern && ast.equals(((Pattern<?>) obj).ast);
  }

  @Override
  public String toString() {
    return ast.toString();
  }
}

// End Pattern.java
