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
package net.hydromatic.egraph.extract;

import static net.hydromatic.egraph.extract.ExtractorTest.add;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.graph.Unit;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.SymbolNode;
import org.junit.jupiter.api.Test;

/** Tests {@link ExactExtractor}, {@link ExtractionProblem} and
 * {@link ExhaustiveSolver}. */
public class ExactExtractorTest {
  /** Costs 10 for leaves "x" and "y", 1 for everything else. */
  private static final NodeCost<SymbolNode> EXPENSIVE_LEAVES =
      node -> node.operator().equals("x") || node.operator().equals("y")
          ? 10d
          : 1d;

  /** A term with a repeated subterm is cheaper than a smaller tree once
   * each class is paid for only once. */
  @Test
  void testDagCost() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id root = add(egraph, "(p (q (s a)) (q (s a)))");
    final Id other = add(egraph, "(r a b c d)");
    egraph.union(root, other);
    egraph.rebuild();

    assertThat(
        new Extractor<>(egraph, AstSize.<SymbolNode>instance())
            .findBest(root).expr,
        hasToString("(r a b c d)"));

    final ExactExtractor.Result<SymbolNode> result =
        new ExactExtractor<>(egraph, NodeCost.<SymbolNode>unit()).solve(root);
    assertThat(result.cost, is(4d));
    assertThat(result.size(), is(4));
    assertThat(result.expr(root), hasToString("(p (q (s a)) (q (s a)))"));
    assertThat(result.node(root).operator(), is("p"));
    assertThat(result, hasToString("Result{cost=4.0, nodes=4}"));

    // Class "b" is not used by the selection.
    final Id b = add(egraph, "b");
    assertThrows(IllegalArgumentException.class, () -> result.node(b));
  }

  /** The cheapest node of a class would close a cycle, so the solver must
   * pay for an expensive leaf instead. */
  @Test
  void testCycle() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id x = add(egraph, "x");
    final Id y = add(egraph, "y");
    final Id fy = add(egraph, "(f y)");
    final Id gx = add(egraph, "(g x)");
    final Id root = add(egraph, "(h x)");
    egraph.union(x, fy);
    egraph.union(y, gx);
    egraph.rebuild();

    final ExactExtractor.Result<SymbolNode> result =
        new ExactExtractor<>(egraph, EXPENSIVE_LEAVES).solve(root);
    assertThat(result.cost, is(11d));
    assertThat(result.expr(root), hasToString("(h x)"));
    assertThat(result.size(), is(2));
  }

  @Test
  void testSeveralRoots() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id f = add(egraph, "(f (s a))");
    final Id g = add(egraph, "(g (s a))");
    final ExactExtractor.Result<SymbolNode> result =
        new ExactExtractor<>(egraph, NodeCost.<SymbolNode>unit())
            .solve(ImmutableList.of(f, g));
    assertThat(result.cost, is(4d));
    assertThat(result.expr(f), hasToString("(f (s a))"));
    assertThat(result.expr(g), hasToString("(g (s a))"));
  }

  @Test
  void testProblem() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id x = add(egraph, "x");
    final Id fx = add(egraph, "(f x)");
    egraph.union(x, fx);
    egraph.rebuild();

    final ExtractionProblem problem =
        ExtractionProblem.create(
            egraph, NodeCost.<SymbolNode>unit(), ImmutableList.of(fx));
    assertThat(problem.classCount(), is(1));
    assertThat(problem.nodeCount(0), is(2));
    assertThat(problem.classOrdinal(egraph.find(x)), is(0));

    // Choosing "(f x)" for the only class is a cycle.
    final int f = problem.children.get(0).get(0).isEmpty() ? 1 : 0;
    assertThat(
        problem.evaluate(ImmutableList.of(f)), is(Double.POSITIVE_INFINITY));
    assertThat(problem.evaluate(ImmutableList.of(1 - f)), is(1d));
    assertThat(problem.evaluate(ImmutableList.of(-1)),
        is(Double.POSITIVE_INFINITY));

    final ExtractionSolver.Solution solution =
        new ExhaustiveSolver().solve(problem);
    assertThat(solution, notNullValue());
    assertThat(solution.cost, is(1d));
    assertThat(solution.choices, is(ImmutableList.of(1 - f)));
  }

  @Test
  void testStepLimit() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id root = add(egraph, "(f a)");
    final ExtractionProblem problem =
        ExtractionProblem.create(
            egraph, NodeCost.<SymbolNode>unit(), ImmutableList.of(root));
    assertThat(new ExhaustiveSolver(0).solve(problem), nullValue());

    final UnextractableException e =
        assertThrows(UnextractableException.class, () ->
            new ExactExtractor<>(egraph, NodeCost.<SymbolNode>unit(),
                new ExhaustiveSolver(0))
                .solve(root));
    assertThat(e.id(), is(egraph.find(root)));
  }

  @Test
  void testInvalidCost() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id root = add(egraph, "(f a)");
    assertThrows(IllegalArgumentException.class, () ->
        new ExactExtractor<>(egraph, node -> -1d).solve(root));
  }

  @Test
  void testRequiresRebuild() {
    final EGraph<SymbolNode, Unit> egraph = EGraph.create();
    final Id a = add(egraph, "a");
    final Id b = add(egraph, "b");
    egraph.union(a, b);
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, () ->
            new ExactExtractor<>(egraph, NodeCost.<SymbolNode>unit())
                .solve(a));
    assertThat(e.getMessage(), is("e-graph must be rebuilt before extraction"));
  }
}

// End ExactExtractorTest.java
