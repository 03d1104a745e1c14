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

import static net.hydromatic.egraph.graph.EGraphTest.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.SymbolNode;
import org.junit.jupiter.api.Test;

/** Tests {@link Analysis}, using constant folding. */
public class AnalysisTest {
  /**
   * Analysis whose value is the constant a class is equal to, if known.
   * Adds the constant to the class.
   */
  public static class ConstantFolding
      implements Analysis<SymbolNode, Optional<Long>> {
    @Override
    public Optional<Long> make(
        EGraph<SymbolNode, Optional<Long>> egraph, SymbolNode node) {
      if (node.isLeaf()) {
        try {
          return Optional.of(Long.parseLong(node.op));
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      }
      if (node.arity() != 2) {
        return Optional.empty();
      }
      final Optional<Long> a = egraph.data(node.children().get(0));
      final Optional<Long> b = egraph.data(node.children().get(1));
      if (!a.isPresent() || !b.isPresent()) {
        return Optional.empty();
      }
      switch (node.op) {
      case "+":
        return Optional.of(a.get() + b.get());
      case "*":
        return Optional.of(a.get() * b.get());
      default:
        return Optional.empty();
      }
    }

    @Override
    public Optional<Long> merge(Optional<Long> a, Optional<Long> b) {
      if (a.isPresent() && b.isPresent() && !a.equals(b)) {
        throw MergeConflictException.of(a.get(), b.get());
      }
      return a.isPresent() ? a : b;
    }

    @Override
    public void modify(EGraph<SymbolNode, Optional<Long>> egraph, Id id) {
      final Optional<Long> value = egraph.data(id);
      if (value.isPresent()) {
        final Id constant =
            egraph.add(SymbolNode.leaf(Long.toString(value.get())));
        egraph.union(id, constant, Justification.rule("constant-fold"));
      }
    }
  }

  @Test
  void testMake() {
    final EGraph<SymbolNode, Optional<Long>> egraph =
        new EGraph<>(new ConstantFolding());
    final Id id = egraph.addExpr(expr("(+ 1 2)"));
    egraph.rebuild();
    assertThat(egraph.data(id), is(Optional.of(3L)));
    assertThat(egraph.lookupExpr(expr("3")), is(egraph.find(id)));
    assertThat(egraph.getClass(id).size(), is(2));
    egraph.checkInvariants();
  }

  /** A value learned by a union propagates to parents during rebuild. */
  @Test
  void testPropagate() {
    final EGraph<SymbolNode, Optional<Long>> egraph =
        new EGraph<>(new ConstantFolding());
    final Id x = egraph.addExpr(expr("x"));
    final Id sum = egraph.addExpr(expr("(+ x 1)"));
    final Id product = egraph.addExpr(expr("(* (+ x 1) 4)"));
    assertThat(egraph.data(sum), is(Optional.empty()));
    assertThat(egraph.data(product), is(Optional.empty()));

    egraph.union(x, egraph.addExpr(expr("2")));
    egraph.rebuild();
    assertThat(egraph.data(x), is(Optional.of(2L)));
    assertThat(egraph.data(sum), is(Optional.of(3L)));
    assertThat(egraph.data(product), is(Optional.of(12L)));
    assertThat(egraph.lookupExpr(expr("3")), is(egraph.find(sum)));
    assertThat(egraph.lookupExpr(expr("12")), is(egraph.find(product)));
    egraph.checkInvariants();

    // Nothing left to do.
    assertThat(egraph.rebuild(), is(0));
  }

  /** Proving that two different constants are equal is a conflict. */
  @Test
  void testMergeConflict() {
    final EGraph<SymbolNode, Optional<Long>> egraph =
        new EGraph<>(new ConstantFolding());
    final Id one = egraph.addExpr(expr("1"));
    final Id two = egraph.addExpr(expr("2"));
    final MergeConflictException e =
        assertThrows(
            MergeConflictException.class, () -> egraph.union(one, two));
    assertThat(e.getMessage(), is("cannot merge 1 with 2"));

    // The graph is unchanged.
    assertThat(egraph.find(one), not(egraph.find(two)));
    assertThat(egraph.isClean(), is(true));
    assertThat(egraph.numberOfClasses(), is(2));
  }
}

// End AnalysisTest.java
