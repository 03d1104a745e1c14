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

import static net.hydromatic.egraph.run.RunnerTest.GROW;
import static net.hydromatic.egraph.run.RunnerTest.expr;
import static net.hydromatic.egraph.run.RunnerTest.rule;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.egraph.graph.Unit;
import net.hydromatic.egraph.lang.SymbolNode;
import net.hydromatic.egraph.pattern.Rewrite;
import org.junit.jupiter.api.Test;

/** Tests {@link BackoffScheduler}. */
public class BackoffSchedulerTest {
  private static final Rewrite<SymbolNode, Unit> FG =
      rule("fg", "(f ?x)", "(g ?x)");

  /** A rule that matches twice with a match limit of one is banned in the
   * first iteration. The ban is brought forward because nothing else can
   * happen, and the rule runs in the second iteration with a doubled
   * threshold. */
  @Test
  void testBanThenSaturate() {
    final StringWriter sw = new StringWriter();
    final BackoffScheduler<SymbolNode, Unit> scheduler =
        new BackoffScheduler<SymbolNode, Unit>(1, 5)
            .withTracer(Tracers.printTracer(new PrintWriter(sw)));
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withExpr(expr("(f b)"))
            .withScheduler(scheduler)
            .run(ImmutableList.of(FG));
    assertThat(runner.stopReason(), is(StopReason.SATURATED));
    assertThat(runner.iterations(), hasSize(3));
    assertThat(runner.iterations().get(0).applied.isEmpty(), is(true));
    assertThat(runner.iterations().get(1).appliedCount(), is(2));
    assertThat(scheduler.timesBanned("fg"), is(1));
    assertThat(scheduler.timesApplied("fg"), is(2));
    assertThat(scheduler.bannedUntil("fg"), is(1));
    assertThat(
        sw,
        hasToString("Banning fg (2 matches, threshold 1) until iteration 5"
            + System.lineSeparator()));
  }

  @Test
  void testDoNotBan() {
    final BackoffScheduler<SymbolNode, Unit> scheduler =
        new BackoffScheduler<SymbolNode, Unit>(1, 5).doNotBan("fg");
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withExpr(expr("(f b)"))
            .withScheduler(scheduler)
            .run(ImmutableList.of(FG));
    assertThat(runner.stopReason(), is(StopReason.SATURATED));
    assertThat(runner.iterations(), hasSize(2));
    assertThat(scheduler.timesBanned("fg"), is(0));
    assertThat(scheduler.canSearch(0, "fg"), is(true));
  }

  /** A rule whose matches grow every iteration is banned repeatedly, and the
   * runner never reports saturation. */
  @Test
  void testRepeatedBans() {
    final List<String> banned = new ArrayList<>();
    final BackoffScheduler<SymbolNode, Unit> scheduler =
        new BackoffScheduler<SymbolNode, Unit>(1, 2)
            .withTracer(Tracers.withOnBan(Tracers.empty(), banned::add));
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withIterationLimit(10)
            .withScheduler(scheduler)
            .run(ImmutableList.of(GROW));
    assertThat(runner.stopReason(), hasToString("ITERATION_LIMIT(10)"));
    assertThat(scheduler.timesBanned("grow"), greaterThanOrEqualTo(2));
    assertThat(banned, hasSize(scheduler.timesBanned("grow")));
    assertThat(banned.get(0), is("grow"));
  }

  @Test
  void testRuleLimits() {
    final BackoffScheduler<SymbolNode, Unit> scheduler =
        new BackoffScheduler<SymbolNode, Unit>()
            .withRuleMatchLimit("fg", 1)
            .withRuleBanLength("fg", 3);
    final Runner<SymbolNode, Unit> runner =
        Runner.<SymbolNode>create()
            .withExpr(expr("(f a)"))
            .withExpr(expr("(f b)"))
            .withScheduler(scheduler)
            .run(ImmutableList.of(FG));
    assertThat(runner.stopReason(), is(StopReason.SATURATED));
    assertThat(scheduler.timesBanned("fg"), is(1));
    assertThat(scheduler.timesBanned("unknown"), is(0));
    assertThat(scheduler.bannedUntil("unknown"), is(0));

    assertThrows(IllegalArgumentException.class, () ->
        new BackoffScheduler<SymbolNode, Unit>().withInitialMatchLimit(-1));
    assertThrows(IllegalArgumentException.class, () ->
        new BackoffScheduler<SymbolNode, Unit>(1_000, -5));
  }

  @Test
  void testShift() {
    assertThat(BackoffScheduler.shift(5, 2), is(20));
    assertThat(BackoffScheduler.shift(1_000, 0), is(1_000));
    assertThat(BackoffScheduler.shift(1_000, 40), is(Integer.MAX_VALUE));
    assertThat(BackoffScheduler.shift(1 << 30, 1), is(Integer.MAX_VALUE));
    assertThat(BackoffScheduler.shift(0, 100), is(0));
  }
}

// End BackoffSchedulerTest.java
