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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.egraph.lang.Node;

/**
 * Abstract syntax of a pattern: a tree of node templates and variables.
 *
 * <p>A pattern such as {@code (+ ?x (* ?y 2))} is a {@link NodeTerm} whose
 * template is a "+" node and whose arguments are a {@link VarTerm} and
 * another {@link NodeTerm}. A variable may occur more than once; all
 * occurrences must match the same e-class.
 *
 * @param <N> Node type
 */
public abstract class PatternAst<N extends Node<N>> {
  private PatternAst() {}

  /** Creates a variable term. */
  public static <N extends Node<N>> VarTerm<N> var(Var var) {
    return new VarTerm<>(var);
  }

  /**
   * Creates a node term. The children of {@code template} are ignored; the
   * pattern's arguments take their place.
   */
  public static <N extends Node<N>> NodeTerm<N> node(
      N template, List<? extends PatternAst<N>> args) {
    return new NodeTerm<>(template, ImmutableList.copyOf(args));
  }

  /** Accepts a visitor. */
  public abstract <R> R accept(Visitor<N, R> visitor);

  /** Returns the variables, in order of first occurrence. */
  public ImmutableSet<Var> vars() {
    final Set<Var> vars = new LinkedHashSet<>();
    collectVars(vars);
    return ImmutableSet.copyOf(vars);
  }

  abstract void collectVars(Set<Var> vars);

  /** Returns whether this pattern contains no variables. */
  public boolean isGround() {
    return vars().isEmpty();
  }

  /** Appends this pattern in parenthesized-prefix syntax. */
  abstract StringBuilder unparse(StringBuilder buf);

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /**
   * Visitor for pattern terms.
   *
   * @param <N> Node type
   * @param <R> Return type
   */
  public interface Visitor<N extends Node<N>, R> {
    R visit(VarTerm<N> varTerm);

    R visit(NodeTerm<N> nodeTerm);
  }

  /**
   * Pattern term that is a variable.
   *
   * @param <N> Node type
   */
  public static final class VarTerm<N extends Node<N>> extends PatternAst<N> {
    public final Var var;

    VarTerm(Var var) {
      this.var = requireNonNull(var);
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    void collectVars(Set<Var> vars) {
      vars.add(var);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(var);
    }

    @Override
    public int hashCode() {
      return var.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof VarTerm && var.equals(((VarTerm<?>) obj).var);
    }
  }

  /**
   * Pattern term that is an operator applied to argument patterns.
   *
   * @param <N> Node type
   */
  public static final class NodeTerm<N extends Node<N>>
      extends PatternAst<N> {
    /** Node whose operator this term matches; its children are ignored. */
    public final N template;

    public final ImmutableList<PatternAst<N>> args;

    NodeTerm(N template, ImmutableList<PatternAst<N>> args) {
      this.template = requireNonNull(template);
      this.args = requireNonNull(args);
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    void collectVars(Set<Var> vars) {
      for (PatternAst<N> arg : args) {
        arg.collectVars(vars);
      }
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (args.isEmpty()) {
        return buf.append(template.operator());
      }
      buf.append('(').append(template.operator());
      for (PatternAst<N> arg : args) {
        arg.unparse(buf.append(' '));
      }
      return buf.append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(template.operator(), args);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof NodeTerm
              && template
                  .operator()
                  .equals(((NodeTerm<?>) obj).template.operator())
              && args.equals(((NodeTerm<?>) obj).args);
    }
  }
}

// End PatternAst.java
