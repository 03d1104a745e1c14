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
package net.hydromatic.egraph.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.lang.NodeFactory;
import net.hydromatic.egraph.pattern.Pattern;
import net.hydromatic.egraph.pattern.PatternAst;
import net.hydromatic.egraph.pattern.Var;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses terms and patterns written in parenthesized-prefix syntax.
 *
 * <p>An atom is a run of characters other than white space and parentheses.
 * A list such as {@code (+ 1 x)} applies its first atom, the operator, to the
 * remaining elements. In a pattern, an atom that starts with {@code ?} is a
 * variable.
 */
public abstract class Parsers {
  private Parsers() {}

  /** Parses an expression such as {@code (* 2 (+ 1 1))}. */
  public static <N extends Node<N>> Expr<N> parseExpr(
      String s, NodeFactory<N> factory) {
    final SExpr sexpr = new Reader(s).readAll();
    final Expr.Builder<N> builder = Expr.builder();
    toExpr(sexpr, factory, builder);
    return builder.build();
  }

  /** Parses a pattern such as {@code (+ ?x 0)}. */
  public static <N extends Node<N>> PatternAst<N> parsePatternAst(
      String s, NodeFactory<N> factory) {
    return toPattern(new Reader(s).readAll(), factory);
  }

  /** Parses and compiles a pattern. */
  public static <N extends Node<N>> Pattern<N> parsePattern(
      String s, NodeFactory<N> factory) {
    return new Pattern<>(parsePatternAst(s, factory));
  }

  private static <N extends Node<N>> Id toExpr(
      SExpr sexpr, NodeFactory<N> factory, Expr.Builder<N> builder) {
    if (sexpr.atom != null) {
      if (Var.isVar(sexpr.atom)) {
        throw new EGraphParseException(
            "variable " + sexpr.atom + " is not allowed in an expression",
            sexpr.offset);
      }
      return builder.add(create(factory, sexpr, ImmutableList.of()));
    }
    final List<Id> children = new ArrayList<>();
    for (SExpr arg : sexpr.args()) {
      children.add(toExpr(arg, factory, builder));
    }
    return builder.add(create(factory, sexpr, children));
  }

  private static <N extends Node<N>> PatternAst<N> toPattern(
      SExpr sexpr, NodeFactory<N> factory) {
    if (sexpr.atom != null) {
      if (Var.isVar(sexpr.atom)) {
        try {
          return PatternAst.var(Var.of(sexpr.atom));
        } catch (IllegalArgumentException e) {
          throw new EGraphParseException(e.getMessage(), sexpr.offset, e);
        }
      }
      return PatternAst.node(
          create(factory, sexpr, ImmutableList.of()), ImmutableList.of());
    }
    final List<PatternAst<N>> args = new ArrayList<>();
    final List<Id> placeholders = new ArrayList<>();
    for (SExpr arg : sexpr.args()) {
      placeholders.add(Id.of(args.size()));
      args.add(toPattern(arg, factory));
    }
    return PatternAst.node(create(factory, sexpr, placeholders), args);
  }

  private static <N extends Node<N>> N create(
      NodeFactory<N> factory, SExpr sexpr, List<Id> children) {
    final String operator = sexpr.operator();
    try {
      return factory.create(operator, children);
    } catch (IllegalArgumentException e) {
      throw new EGraphParseException(
          "invalid node " + operator + ": " + e.getMessage(), sexpr.offset, e);
    }
  }

  /** An atom, or a list whose first element is an atom. */
  private static class SExpr {
    final int offset;
    final @Nullable String atom;
    final @Nullable List<SExpr> list;

    SExpr(int offset, @Nullable String atom, @Nullable List<SExpr> list) {
      this.offset = offset;
      this.atom = atom;
      this.list = list;
    }

    String operator() {
      if (atom != null) {
        return atom;
      }
      if (list == null || list.isEmpty()) {
        throw new EGraphParseException("empty list", offset);
      }
      final SExpr head = list.get(0);
      if (head.atom == null) {
        throw new EGraphParseException(
            "operator must be an atom", head.offset);
      }
      return head.atom;
    }

    List<SExpr> args() {
      operator();
      return requireNonNull(list).subList(1, list.size());
    }
  }

  /** Reads s-expressions from a string. */
  private static class Reader {
    private final String s;
    private int pos;

    Reader(String s) {
      this.s = s;
    }

    SExpr readAll() {
      final SExpr sexpr = read();
      skipSpace();
      if (pos < s.length()) {
        throw new EGraphParseException(
            "unexpected '" + s.charAt(pos) + "' after end of term", pos);
      }
      return sexpr;
    }

    private SExpr read() {
      skipSpace();
      if (pos >= s.length()) {
        throw new EGraphParseException("unexpected end of input", pos);
      }
      final int start = pos;
      final char c = s.charAt(pos);
      if (c == ')') {
        throw new EGraphParseException("unexpected ')'", pos);
      }
      if (c == '(') {
        ++pos;
        final List<SExpr> list = new ArrayList<>();
        for (;;) {
          skipSpace();
          if (pos >= s.length()) {
            throw new EGraphParseException("missing ')'", start);
          }
          if (s.charAt(pos) == ')') {
            ++pos;
            return new SExpr(start, null, list);
          }
          list.add(read());
        }
      }
      while (pos < s.length()
          && !Character.isWhitespace(s.charAt(pos))
          && s.charAt(pos) != '('
          && s.charAt(pos) != ')') {
        ++pos;
      }
      return new SExpr(start, s.substring(start, pos), null);
    }

    private void skipSpace() {
      while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
        ++pos;
      }
    }
  }
}

// End Parsers.java
