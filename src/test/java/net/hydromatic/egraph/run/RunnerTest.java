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
package net.hydromatic.egraph.run;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import net.hydromatic.egraph.graph.AnalysisTest;
import net.hydromatic.egraph.graph.Unit;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.SymbolNode;
import net.hydromatic.egraph.parse.Parsers;
import net.hydromatic.egraph.pattern.Rewrite;
import org.junit.jupiter.api.Test;

/** Tests {@link Runner}. */
public class RunnerTest {
  static Expr<SymbolNode> expr(String s) {
    return Parsers.parseExpr(s, SymbolNode.FACTORY);
  }

  static Rewrite<SymbolNode, Unit> rule(String name, String lhs, String rhs) {
    return Rewrite.parse(name, lhs, rhs, SymbolNode.FACTORY);
  }

  /** Rule that never saturates; each iteration adds two nodes. */
  static final Rewrite<SymbolNode, Unit> GROW =
      rule("grow", "(f ?x)", "(f (h ?x))");

  static final Rewrite<SymbolNode, Unit> COMM =
      rule("comm", "(+ ?x ?y)", "(+ ?y ?x)");

  /** Ticker that only moves when a test advances it. */
  static Ticker fakeTicker(AtomicLong nanos) {
    return new Ticker() {
      @Override
      public long read() {
        return nanos.get();
      }
    };
  }

  @Test
  void testSaturate() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(+ a b)"))
            .withScheduler(new SimpleScheduler<>())
            .run(ImmutableList.of(COMM));
    assertThat(runner.stopReason(), is(StopReason.SATURATED));
    assertThat(runner.stopReason().isSaturated(), is(true));
    assertThat(runner.isRunning(), is(false));
    assertThat(runner.iterations(), hasSize(2));
    assertThat(
        runner.iterations().get(0).applied, is(ImmutableMap.of("comm", 1)));
    assertThat(runner.iterations().get(0).appliedCount(), is(1));
    assertThat(runner.iterations().get(1).applied.isEmpty(), is(true));
    assertThat(runner.egraph().isClean(), is(true));

    final Id root = runner.roots().get(0);
    assertThat(
        runner.egraph().lookupExpr(expr("(+ b a)")),
        is(runner.egraph().find(root)));
  }

  /** The default scheduler is the backoff scheduler, which gives the same
   * result when no rule exceeds its match limit. */
  @Test
  void testSaturateWithDefaultScheduler() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(* (+ a b) (+ c d))"))
            .run(ImmutableList.of(COMM));
    assertThat(runner.stopReason(), is(StopReason.SATURATED));
    assertThat(runner.iterations(), hasSize(2));
    assertThat(runner.egraph().numberOfClasses(), is(7));
  }

  @Test
  void testIterationLimit() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withIterationLimit(4)
            .run(ImmutableList.of(GROW));
    assertThat(runner.stopReason(), is(StopReason.iterationLimit(4)));
    assertThat(runner.stopReason(), hasToString("ITERATION_LIMIT(4)"));
    assertThat(runner.iterations(), hasSize(4));
    assertThat(runner.iterations().get(3).nodeCount, is(10));
    assertThat(runner.egraph().isClean(), is(true));

    // With a limit of zero, no iteration happens.
    final Runner<SymbolNode, Unit> runner2 =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withIterationLimit(0)
            .run(ImmutableList.of(GROW));
    assertThat(runner2.stopReason(), hasToString("ITERATION_LIMIT(0)"));
    assertThat(runner2.iterations(), hasSize(0));
  }

  @Test
  void testNodeLimit() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withNodeLimit(7)
            .withScheduler(new SimpleScheduler<>())
            .run(ImmutableList.of(GROW));
    assertThat(runner.stopReason(), hasToString("NODE_LIMIT(7)"));
    assertThat(runner.iterations(), hasSize(3));
    assertThat(runner.egraph().totalSize(), is(8));
  }

  @Test
  void testTimeLimit() {
    final AtomicLong nanos = new AtomicLong();
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withTicker(fakeTicker(nanos))
            .withTimeLimit(Duration.ofMillis(2_500))
            .withHook(r -> {
              nanos.addAndGet(TimeUnit.SECONDS.toNanos(1));
              return null;
            })
            .run(ImmutableList.of(GROW));
    assertThat(runner.stopReason(), is(StopReason.timeLimit(2_500)));
    assertThat(runner.stopReason(), hasToString("TIME_LIMIT(2500ms)"));
    assertThat(runner.iterations(), hasSize(3));
    assertThat(runner.elapsed(), is(Duration.ofSeconds(3)));
  }

  @Test
  void testHook() {
    final List<Boolean> running = new ArrayList<>();
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withHook(r -> {
              running.add(r.isRunning());
              return r.iterations().size() >= 2 ? "enough" : null;
            })
            .run(ImmutableList.of(GROW));
    assertThat(runner.stopReason(), is(StopReason.stopped("enough")));
    assertThat(runner.stopReason(), hasToString("STOPPED(enough)"));
    assertThat(runner.iterations(), hasSize(2));
    assertThat(running, is(ImmutableList.of(true, true, true)));
  }

  /**
   * A rule that proves two different constants equal stops the run, and
   * the runner still reports.
   */
  @Test
  void testMergeConflict() {
    final Rewrite<SymbolNode, Optional<Long>> first =
        Rewrite.parse("first", "(+ ?x ?y)", "?x", SymbolNode.FACTORY);
    final Runner<SymbolNode, Optional<Long>> runner =
        new Runner<>(new AnalysisTest.ConstantFolding())
            .withExpr(expr("(+ 1 2)"))
            .withTicker(fakeTicker(new AtomicLong()))
            .run(ImmutableList.of(first));
    final StopReason stopReason = runner.stopReason();
    assertThat(stopReason.kind, is(StopReason.Kind.STOPPED));
    assertThat(stopReason.message,
        startsWith("merge conflict: cannot merge"));
    assertThat(runner.isRunning(), is(false));
    assertThat(runner.report().stopReason, is(stopReason));
    assertThat(runner.elapsed(), is(Duration.ZERO));
  }

  @Test
  void testProps() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withProps(
                ImmutableMap.of("iterationLimit", "3", "SCHEDULER", "simple"));
    assertThat((Integer) runner.prop(Prop.ITERATION_LIMIT), is(3));
    assertThat(
        runner.prop(Prop.SCHEDULER), is((Object) Prop.SchedulerKind.SIMPLE));
    assertThat((Integer) runner.prop(Prop.NODE_LIMIT), is(10_000));

    runner.withExpr(expr("(f a)")).run(ImmutableList.of(GROW));
    assertThat(runner.stopReason(), hasToString("ITERATION_LIMIT(3)"));

    final Runner<SymbolNode, Unit> runner2 = Runner.create();
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            runner2.withProps(ImmutableMap.of("foo", 1)));
    assertThat(e.getMessage(), is("property foo not found"));

    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class, () ->
            runner2.withProps(ImmutableMap.of("nodeLimit", "-1")));
    assertThat(
        e2.getMessage(),
        is("value for property nodeLimit must not be negative"));
  }

  @Test
  void testErrors() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create().withExpr(expr("(+ a b)"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            runner.run(ImmutableList.of(COMM, COMM)));
    assertThat(e.getMessage(), is("duplicate rule name comm"));
    assertThrows(IllegalStateException.class, runner::report);

    runner.run(ImmutableList.of(COMM));
    assertThrows(IllegalStateException.class, () ->
        runner.run(ImmutableList.of(COMM)));
  }

  @Test
  void testReport() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(+ a b)"))
            .withTicker(fakeTicker(new AtomicLong()))
            .run(ImmutableList.of(COMM));
    final Runner.Report report = runner.report();
    assertThat(report.iterationCount, is(2));
    final String expected = "Runner report\n"
        + "=============\n"
        + "  Stop reason: SATURATED\n"
        + "  Iterations: 2\n"
        + "  E-graph size: 4 nodes, 3 classes\n"
        + "  Rebuild unions: 0\n"
        + "  Total time: 0.000ms\n"
        + "    Search:  0.000ms (0.0%)\n"
        + "    Apply:   0.000ms (0.0%)\n"
        + "    Rebuild: 0.000ms (0.0%)\n";
    assertThat(report, hasToString(expected));
  }

  @Test
  void testPrintTracer() {
    final StringWriter sw = new StringWriter();
    final List<StopReason> stops = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnStop(
            Tracers.printTracer(new PrintWriter(sw)), stops::add);
    Runner.<SymbolNode>create()
        .withExpr(expr("(* x 2)"))
        .withScheduler(new SimpleScheduler<>())
        .withTracer(tracer)
        .run(ImmutableList.of(rule("shift", "(* ?a 2)", "(<< ?a 1)")));
    final String nl = System.lineSeparator();
    final String expected = "Iteration 0: 5 nodes, 4 classes, applied {shift=1}"
        + nl
        + "Iteration 1: 5 nodes, 4 classes"
        + nl
        + "Stopped after 2 iterations: SATURATED"
        + nl;
    assertThat(sw, hasToString(expected));
    assertThat(stops, is(ImmutableList.of(StopReason.SATURATED)));
  }

  @Test
  void testExplanations() {
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExplanationsEnabled()
            .withExpr(expr("(+ a b)"))
            .run(ImmutableList.of(COMM));
    final Id root = runner.roots().get(0);
    final Id swapped = runner.egraph().lookupExpr(expr("(+ b a)"));
    assertThat(
        runner.explainEquivalence(root, swapped).ruleNames(),
        is(ImmutableList.of("comm")));
    assertThat((Boolean) runner.prop(Prop.EXPLANATIONS_ENABLED), is(true));

    // Setting the property has the same effect.
    final Runner<SymbolNode, Unit> runner2 =
        Runner.<SymbolNode>create()
            .withProps(ImmutableMap.of("explanationsEnabled", "true"));
    assertThat(runner2.egraph().areExplanationsEnabled(), is(true));
  }
}

// End RunnerTest.java
