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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.SymbolNode;
import net.hydromatic.egraph.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests {@link EGraph}. */
public class EGraphTest {
  static Expr<SymbolNode> expr(String s) {
    return Parsers.parseExpr(s, SymbolNode.FACTORY);
  }

  @Test
  void testAddIsHashConsed() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id a = egraph.add(SymbolNode.leaf("a"));
    final Id a2 = egraph.add(SymbolNode.leaf("a"));
    assertThat(a2, is(a));
    final Id fa = egraph.add(SymbolNode.of("f", a));
    assertThat(egraph.add(SymbolNode.of("f", a2)), is(fa));
    assertThat(egraph.numberOfClasses(), is(2));
    assertThat(egraph.totalSize(), is(2));

    // Shared subterms are added once.
    final Id e = egraph.addExpr(expr("(g (f a) (f a))"));
    assertThat(egraph.numberOfClasses(), is(3));
    assertThat(
        egraph.getClass(e).nodes().get(0), is(SymbolNode.of("g", fa, fa)));
    assertThat(egraph.getClass(fa).parentIds(), is(ImmutableList.of(e)));
    egraph.checkInvariants();
  }

  /**
   * Merging {@code a} and {@code b} makes {@code (f a)} and {@code (f b)}
   * equal, but only after rebuild.
   */
  @Test
  void testCongruence() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id a = egraph.addExpr(expr("a"));
    final Id b = egraph.addExpr(expr("b"));
    final Id fa = egraph.addExpr(expr("(f a)"));
    final Id fb = egraph.addExpr(expr("(f b)"));
    assertThat(egraph.isClean(), is(true));

    egraph.union(a, b);
    assertThat(egraph.find(a), is(egraph.find(b)));
    assertThat(egraph.isClean(), is(false));
    assertThat(egraph.find(fa), not(egraph.find(fb)));

    assertThat(egraph.rebuild(), is(1));
    assertThat(egraph.isClean(), is(true));
    assertThat(egraph.find(fa), is(egraph.find(fb)));
    assertThat(egraph.numberOfClasses(), is(2));
    assertThat(egraph.totalSize(), is(3));
    egraph.checkInvariants();
  }

  /**
   * Merging parents first and then their children leaves one node in the
   * parent class.
   */
  @Test
  void testUnionParentsThenChildren() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id a = egraph.addExpr(expr("a"));
    final Id b = egraph.addExpr(expr("b"));
    final Id fa = egraph.addExpr(expr("(f a)"));
    final Id fb = egraph.addExpr(expr("(f b)"));
    egraph.union(fa, fb);
    egraph.rebuild();
    assertThat(egraph.getClass(fa).size(), is(2));

    egraph.union(a, b);
    egraph.rebuild();
    assertThat(egraph.getClass(fa).size(), is(1));
    assertThat(egraph.numberOfClasses(), is(2));
    assertThat(egraph.totalSize(), is(3));
    egraph.checkInvariants();
    assertThat(
        egraph.getClass(fa).nodes().get(0),
        is(SymbolNode.of("f", ImmutableList.of(egraph.find(a)))));
  }

  /** Congruence propagates upwards through several levels. */
  @Test
  void testCongruenceChain() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id x = egraph.addExpr(expr("(f (g (h a)))"));
    final Id y = egraph.addExpr(expr("(f (g (h b)))"));
    final Id z = egraph.addExpr(expr("(f (g c))"));
    assertThat(egraph.numberOfClasses(), is(11));

    egraph.union(egraph.lookupExpr(expr("a")), egraph.lookupExpr(expr("b")));
    assertThat(egraph.rebuild(), is(3));
    assertThat(egraph.find(x), is(egraph.find(y)));
    assertThat(egraph.find(x), not(egraph.find(z)));
    assertThat(egraph.numberOfClasses(), is(7));
    egraph.checkInvariants();
  }

  @Test
  void testRebuildIsIdempotent() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id fab = egraph.addExpr(expr("(f a b)"));
    final Id fba = egraph.addExpr(expr("(f b a)"));
    egraph.union(egraph.lookupExpr(expr("a")), egraph.lookupExpr(expr("b")));
    assertThat(egraph.rebuild(), is(1));
    assertThat(egraph.find(fab), is(egraph.find(fba)));

    final int classes = egraph.numberOfClasses();
    final int nodes = egraph.totalSize();
    final int unions = egraph.unionCount();
    assertThat(egraph.rebuild(), is(0));
    assertThat(egraph.numberOfClasses(), is(classes));
    assertThat(egraph.totalSize(), is(nodes));
    assertThat(egraph.unionCount(), is(unions));
    egraph.checkInvariants();
  }

  /** Once two ids are equal, they stay equal. */
  @Test
  void testUnionIsMonotonic() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id a = egraph.addExpr(expr("a"));
    final Id b = egraph.addExpr(expr("b"));
    final Id c = egraph.addExpr(expr("c"));
    assertThat(egraph.union(a, b, Justification.rule("r")), is(true));
    assertThat(egraph.union(b, a, Justification.rule("r")), is(false));
    egraph.rebuild();
    egraph.addExpr(expr("(f a c)"));
    egraph.union(c, egraph.addExpr(expr("d")));
    egraph.rebuild();
    assertThat(egraph.find(a), is(egraph.find(b)));
    assertThat(egraph.find(a), not(egraph.find(c)));
    assertThat(egraph.unionCount(), is(2));
  }

  @Test
  void testLookup() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id id = egraph.addExpr(expr("(+ x (* y 2))"));
    assertThat(egraph.lookupExpr(expr("(+ x (* y 2))")), is(id));
    assertThat(egraph.lookupExpr(expr("(* y 2)")), notNullValue());
    assertThat(egraph.lookupExpr(expr("(* y 3)")), nullValue());
    assertThat(egraph.lookup(SymbolNode.leaf("z")), nullValue());
    // Lookup does not add.
    assertThat(egraph.numberOfClasses(), is(5));
  }

  @Test
  void testInvalidId() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    egraph.addExpr(expr("(f a)"));
    final InvalidIdException e =
        assertThrows(InvalidIdException.class, () -> egraph.find(Id.of(5)));
    assertThat(e.getMessage(), is("invalid id 5; e-graph has 2 ids"));
    assertThat(e.id(), is(Id.of(5)));
    assertThrows(
        InvalidIdException.class,
        () -> egraph.add(SymbolNode.of("g", Id.of(7))));
    assertThrows(
        InvalidIdException.class, () -> egraph.union(Id.of(0), Id.of(9)));
    assertThat(egraph.numberOfClasses(), is(2));
  }

  @Test
  void testCheckInvariantsRequiresRebuild() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    egraph.union(egraph.addExpr(expr("a")), egraph.addExpr(expr("b")));
    assertThrows(IllegalStateException.class, egraph::checkInvariants);
    egraph.rebuild();
    egraph.checkInvariants();
  }
}

// End EGraphTest.java
