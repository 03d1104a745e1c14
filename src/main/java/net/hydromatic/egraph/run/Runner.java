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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import net.hydromatic.egraph.graph.Analysis;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.graph.Explanation;
import net.hydromatic.egraph.graph.MergeConflictException;
import net.hydromatic.egraph.graph.Unit;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.pattern.Rewrite;
import net.hydromatic.egraph.pattern.SearchMatches;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applies rewrite rules to an e-graph until it saturates or a limit is
 * reached.
 *
 * <p>Each iteration has three phases. First every rule searches, and all
 * matches are collected; then every rule applies its matches; then the
 * e-graph is rebuilt once. Because no rule applies before all rules have
 * searched, the result of an iteration does not depend on the order of the
 * rules.
 *
 * <p>Limits and hooks are checked between iterations. Limits are not
 * errors: the runner records a {@link StopReason}, and the e-graph is left
 * clean and usable for extraction.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * Runner<SymbolNode, Unit> runner =
 *     Runner.<SymbolNode>create()
 *         .withExpr(Parsers.parseExpr("(* a 2)", SymbolNode.FACTORY))
 *         .run(rules);
 * Extractor<SymbolNode, Integer> extractor =
 *     new Extractor<>(runner.egraph(), AstSize.instance());
 * }</pre>
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public class Runner<N extends Node<N>, D> {
  private final EGraph<N, D> egraph;
  private final List<Id> roots = new ArrayList<>();
  private final List<Iteration> iterations = new ArrayList<>();
  private final Map<Prop, Object> props = new LinkedHashMap<>();
  private final List<Hook<N, D>> hooks = new ArrayList<>();
  private @Nullable Scheduler<N, D> scheduler;
  private Tracer tracer = Tracers.empty();
  private Ticker ticker = Ticker.systemTicker();
  private @Nullable Stopwatch stopwatch;
  private @Nullable StopReason stopReason;

  /** Creates a runner over an empty e-graph with a given analysis. */
  public Runner(Analysis<N, D> analysis) {
    this(new EGraph<>(analysis));
  }

  /** Creates a runner over an existing e-graph. */
  public Runner(EGraph<N, D> egraph) {
    this.egraph = requireNonNull(egraph);
  }

  /** Creates a runner over an empty e-graph without analysis. */
  public static <N extends Node<N>> Runner<N, Unit> create() {
    return new Runner<>(EGraph.<N>create());
  }

  /** Adds an expression to the e-graph, and records its class as a root. */
  public Runner<N, D> withExpr(Expr<N> expr) {
    roots.add(egraph.addExpr(expr));
    return this;
  }

  /** Sets the maximum number of iterations. */
  public Runner<N, D> withIterationLimit(int iterationLimit) {
    Prop.ITERATION_LIMIT.set(props, iterationLimit);
    return this;
  }

  /** Sets the number of e-nodes beyond which the runner stops. */
  public Runner<N, D> withNodeLimit(int nodeLimit) {
    Prop.NODE_LIMIT.set(props, nodeLimit);
    return this;
  }

  /** Sets the time after which the runner stops. */
  public Runner<N, D> withTimeLimit(Duration timeLimit) {
    checkArgument(!timeLimit.isNegative(), "time limit must not be negative");
    final long millis = timeLimit.toMillis();
    Prop.TIME_LIMIT_MILLIS.set(
        props, (int) Math.min(millis, Integer.MAX_VALUE));
    return this;
  }

  /**
   * Sets the scheduler. If not set, the runner creates one according to
   * the {@link Prop#SCHEDULER} property.
   */
  public Runner<N, D> withScheduler(Scheduler<N, D> scheduler) {
    this.scheduler = requireNonNull(scheduler);
    return this;
  }

  /** Adds a hook, called before each iteration. */
  public Runner<N, D> withHook(Hook<N, D> hook) {
    hooks.add(requireNonNull(hook));
    return this;
  }

  /** Sets the tracer. */
  public Runner<N, D> withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Sets the source of time. Tests use a fake ticker. */
  public Runner<N, D> withTicker(Ticker ticker) {
    this.ticker = requireNonNull(ticker);
    return this;
  }

  /**
   * Enables explanations in the e-graph. Must be called before any
   * expression is added.
   */
  public Runner<N, D> withExplanationsEnabled() {
    if (!egraph.areExplanationsEnabled()) {
      egraph.withExplanationsEnabled();
    }
    Prop.EXPLANATIONS_ENABLED.set(props, true);
    return this;
  }

  /**
   * Sets properties from a map whose keys are property names, either in
   * camel case ("iterationLimit") or upper case ("ITERATION_LIMIT"). Values
   * may be strings.
   *
   * @throws IllegalArgumentException if a property is unknown or a value is
   *     invalid
   */
  public Runner<N, D> withProps(Map<String, ?> map) {
    map.forEach((name, value) -> Prop.lookup(name).setLenient(props, value));
    if (Prop.EXPLANATIONS_ENABLED.booleanValue(props)) {
      withExplanationsEnabled();
    }
    return this;
  }

  /** Returns the value of a property. */
  public Object prop(Prop prop) {
    return prop.get(props);
  }

  /** Returns the e-graph. */
  public EGraph<N, D> egraph() {
    return egraph;
  }

  /** Returns the classes of the expressions added via {@link #withExpr}. */
  public List<Id> roots() {
    return ImmutableList.copyOf(roots);
  }

  /** Returns the iterations performed so far. */
  public List<Iteration> iterations() {
    return ImmutableList.copyOf(iterations);
  }

  /** Returns why the runner stopped, or null if it has not run. */
  public @Nullable StopReason stopReason() {
    return stopReason;
  }

  /** Returns whether the runner has started and has not yet stopped. */
  public boolean isRunning() {
    return stopwatch != null && stopReason == null;
  }

  /** Returns the time since the runner started. */
  public Duration elapsed() {
    return stopwatch == null ? Duration.ZERO : stopwatch.elapsed();
  }

  /** Explains why two classes are equal. Requires explanations. */
  public Explanation<N> explainEquivalence(Id a, Id b) {
    return egraph.explainEquivalence(a, b);
  }

  /**
   * Runs rules until the e-graph saturates or a limit is reached. A runner
   * can run only once.
   *
   * <p>If the analysis reports a {@link MergeConflictException}, the runner
   * stops with reason {@code STOPPED("merge conflict: ...")}; the e-graph
   * may then need a rebuild, which will fail in the same way.
   *
   * @throws IllegalArgumentException if two rules have the same name
   */
  public Runner<N, D> run(Iterable<? extends Rewrite<N, D>> rules) {
    checkState(stopwatch == null, "runner has already run");
    final List<Rewrite<N, D>> ruleList = ImmutableList.copyOf(rules);
    final Set<String> names = new HashSet<>();
    for (Rewrite<N, D> rule : ruleList) {
      checkArgument(names.add(rule.name), "duplicate rule name %s", rule.name);
    }
    final Scheduler<N, D> scheduler = scheduler();
    stopwatch = Stopwatch.createStarted(ticker);
    StopReason reason;
    try {
      egraph.rebuild();
      reason = checkLimits();
      while (reason == null) {
        reason = runOne(ruleList, scheduler);
        if (reason == null) {
          reason = checkLimits();
        }
      }
    } catch (MergeConflictException e) {
      // The rules proved two incompatible values equal. The e-graph may
      // hold unions that were not rebuilt.
      reason = StopReason.stopped("merge conflict: " + e.getMessage());
    }
    stopwatch.stop();
    stopReason = reason;
    tracer.onStop(reason, iterations.size());
    return this;
  }

  private Scheduler<N, D> scheduler() {
    if (scheduler != null) {
      return scheduler;
    }
    final Prop.SchedulerKind kind =
        Prop.SCHEDULER.enumValue(props, Prop.SchedulerKind.class);
    switch (kind) {
    case SIMPLE:
      return new SimpleScheduler<>();
    case BACKOFF:
      return new BackoffScheduler<N, D>(
              Prop.MATCH_LIMIT.intValue(props),
              Prop.BAN_LENGTH.intValue(props))
          .withTracer(tracer);
    default:
      throw new AssertionError(kind);
    }
  }

  /** Performs one iteration. Returns a stop reason if saturated. */
  private @Nullable StopReason runOne(
      List<Rewrite<N, D>> rules, Scheduler<N, D> scheduler) {
    final int i = iterations.size();
    final Stopwatch total = Stopwatch.createStarted(ticker);

    final Stopwatch search = Stopwatch.createStarted(ticker);
    final List<List<SearchMatches<N>>> matchesList = new ArrayList<>();
    for (Rewrite<N, D> rule : rules) {
      final List<SearchMatches<N>> matches =
          scheduler.searchRewrite(i, egraph, rule);
      matchesList.add(matches);
      tracer.onSearch(i, rule.name, SearchMatches.count(matches));
    }
    search.stop();

    final Stopwatch apply = Stopwatch.createStarted(ticker);
    final int unionCount = egraph.unionCount();
    final int nodeCount = egraph.totalSize();
    final Map<String, Integer> applied = new LinkedHashMap<>();
    for (int k = 0; k < rules.size(); k++) {
      final List<SearchMatches<N>> matches = matchesList.get(k);
      if (matches.isEmpty()) {
        continue;
      }
      final Rewrite<N, D> rule = rules.get(k);
      final int n = scheduler.applyRewrite(i, egraph, rule, matches);
      if (n > 0) {
        applied.merge(rule.name, n, Integer::sum);
      }
    }
    final boolean changed =
        egraph.unionCount() != unionCount || egraph.totalSize() != nodeCount;
    apply.stop();

    final Stopwatch rebuild = Stopwatch.createStarted(ticker);
    final int rebuildUnions = egraph.rebuild();
    rebuild.stop();

    final Iteration iteration =
        new Iteration(
            i,
            egraph.totalSize(),
            egraph.numberOfClasses(),
            applied,
            rebuildUnions,
            search.elapsed(),
            apply.elapsed(),
            rebuild.elapsed(),
            total.elapsed());
    iterations.add(iteration);
    tracer.onIteration(iteration);

    if (!changed && scheduler.canStop(i)) {
      return StopReason.SATURATED;
    }
    return null;
  }

  /** Checks limits and hooks. Returns a stop reason, or null to go on. */
  private @Nullable StopReason checkLimits() {
    final int iterationLimit = Prop.ITERATION_LIMIT.intValue(props);
    if (iterations.size() >= iterationLimit) {
      return StopReason.iterationLimit(iterationLimit);
    }
    final int nodeLimit = Prop.NODE_LIMIT.intValue(props);
    if (egraph.totalSize() > nodeLimit) {
      return StopReason.nodeLimit(nodeLimit);
    }
    final int timeLimit = Prop.TIME_LIMIT_MILLIS.intValue(props);
    if (requireNonNull(stopwatch).elapsed(TimeUnit.MILLISECONDS) > timeLimit) {
      return StopReason.timeLimit(timeLimit);
    }
    for (Hook<N, D> hook : hooks) {
      final String message = hook.check(this);
      if (message != null) {
        return StopReason.stopped(message);
      }
    }
    return null;
  }

  /** Returns a summary of the run. */
  public Report report() {
    checkState(stopReason != null, "runner has not run");
    Duration search = Duration.ZERO;
    Duration apply = Duration.ZERO;
    Duration rebuild = Duration.ZERO;
    int rebuildUnions = 0;
    for (Iteration iteration : iterations) {
      search = search.plus(iteration.searchTime);
      apply = apply.plus(iteration.applyTime);
      rebuild = rebuild.plus(iteration.rebuildTime);
      rebuildUnions += iteration.rebuildUnions;
    }
    return new Report(
        stopReason,
        iterations.size(),
        egraph.totalSize(),
        egraph.numberOfClasses(),
        rebuildUnions,
        elapsed(),
        search,
        apply,
        rebuild);
  }

  /** Summary of a run. */
  public static final class Report {
    public final StopReason stopReason;
    public final int iterationCount;
    public final int nodeCount;
    public final int classCount;
    public final int rebuildUnions;
    public final Duration totalTime;
    public final Duration searchTime;
    public final Duration applyTime;
    public final Duration rebuildTime;

    Report(
        StopReason stopReason,
        int iterationCount,
        int nodeCount,
        int classCount,
        int rebuildUnions,
        Duration totalTime,
        Duration searchTime,
        Duration applyTime,
        Duration rebuildTime) {
      this.stopReason = requireNonNull(stopReason);
      this.iterationCount = iterationCount;
      this.nodeCount = nodeCount;
      this.classCount = classCount;
      this.rebuildUnions = rebuildUnions;
      this.totalTime = totalTime;
      this.searchTime = searchTime;
      this.applyTime = applyTime;
      this.rebuildTime = rebuildTime;
    }

    @Override
    public String toString() {
      final long totalNanos = Math.max(1L, totalTime.toNanos());
      return "Runner report\n"
          + "=============\n"
          + "  Stop reason: "
          + stopReason
          + "\n"
          + "  Iterations: "
          + iterationCount
          + "\n"
          + "  E-graph size: "
          + nodeCount
          + " nodes, "
          + classCount
          + " classes\n"
          + "  Rebuild unions: "
          + rebuildUnions
          + "\n"
          + "  Total time: "
          + millis(totalTime)
          + "\n"
          + "    Search:  "
          + millis(searchTime)
          + " ("
          + percent(searchTime, totalNanos)
          + ")\n"
          + "    Apply:   "
          + millis(applyTime)
          + " ("
          + percent(applyTime, totalNanos)
          + ")\n"
          + "    Rebuild: "
          + millis(rebuildTime)
          + " ("
          + percent(rebuildTime, totalNanos)
          + ")\n";
    }

    private static String millis(Duration d) {
      return String.format(Locale.ROOT, "%.3fms", d.toNanos() / 1_000_000d);
    }

    private static String percent(Duration d, long totalNanos) {
      return String.format(
          Locale.ROOT, "%.1f%%", 100d * d.toNanos() / totalNanos);
    }
  }
}

// End Runner.java
