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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.SymbolNode;
import net.hydromatic.egraph.pattern.PatternAst;
import net.hydromatic.egraph.pattern.Var;
import org.junit.jupiter.api.Test;

/** Tests {@link Parsers}. */
public class ParsersTest {
  private static Expr<SymbolNode> expr(String s) {
    return Parsers.parseExpr(s, SymbolNode.FACTORY);
  }

  private static PatternAst<SymbolNode> pattern(String s) {
    return Parsers.parsePatternAst(s, SymbolNode.FACTORY);
  }

  /** Parses a string that is invalid, and returns the error. */
  private static String parseError(String s) {
    final EGraphParseException e =
        assertThrows(EGraphParseException.class, () -> expr(s));
    return e.describeTo(new StringBuilder()).toString();
  }

  @Test
  void testParseExpr() {
    final Expr<SymbolNode> e = expr("(* 2 (+ 1 1))");
    assertThat(e, hasToString("(* 2 (+ 1 1))"));
    assertThat(e.size(), is(5));
    assertThat(e.get(e.root()).op, is("*"));
    assertThat(
        e.get(e.root()).children(),
        is(ImmutableList.of(Id.of(0), Id.of(3))));

    assertThat(expr("  ( f   a\n b )  "), hasToString("(f a b)"));
    assertThat(expr("x"), hasToString("x"));
    assertThat(expr("x").size(), is(1));
  }

  @Test
  void testParseErrors() {
    assertThat(parseError("(f a"), is("Error at offset 0: missing ')'"));
    assertThat(parseError("()"), is("Error at offset 0: empty list"));
    assertThat(parseError(")"), is("Error at offset 0: unexpected ')'"));
    assertThat(
        parseError(""), is("Error at offset 0: unexpected end of input"));
    assertThat(
        parseError("a b"),
        is("Error at offset 2: unexpected 'b' after end of term"));
    assertThat(
        parseError("((f) a)"),
        is("Error at offset 1: operator must be an atom"));
    assertThat(
        parseError("(f ?x)"),
        is("Error at offset 3: variable ?x is not allowed in an expression"));
  }

  @Test
  void testParsePattern() {
    final PatternAst<SymbolNode> p = pattern("(+ ?x (* ?y 2))");
    assertThat(p, hasToString("(+ ?x (* ?y 2))"));
    assertThat(p.vars(), hasToString("[?x, ?y]"));
    assertThat(p.isGround(), is(false));

    final PatternAst<SymbolNode> v = pattern("?x");
    assertThat(v instanceof PatternAst.VarTerm, is(true));
    assertThat(((PatternAst.VarTerm<SymbolNode>) v).var, is(Var.of("?x")));

    assertThat(pattern("(f ?#1 ?#1)").vars(), hasToString("[?#1]"));
    assertThat(pattern("(f a b)").isGround(), is(true));
  }

  @Test
  void testParsePatternError() {
    final EGraphParseException e =
        assertThrows(EGraphParseException.class, () -> pattern("(f ?#z)"));
    assertThat(e.getMessage(), is("number pattern variable ?#z was malformed"));
    assertThat(e.offset(), is(3));
  }
}

// End ParsersTest.java
