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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.pattern.Rewrite;
import net.hydromatic.egraph.pattern.SearchMatches;

/**
 * Scheduler that bans rules that match too often.
 *
 * <p>Each rule has a match limit and a ban length. When a rule finds more
 * than {@code matchLimit << timesBanned} matches in one iteration, its
 * matches are discarded and the rule is banned for {@code banLength <<
 * timesBanned} iterations. Rules such as associativity, which would
 * otherwise grow the e-graph exponentially, run less and less often, while
 * well-behaved rules run every iteration.
 *
 * <p>While any rule is banned, {@link #canStop} returns false and
 * fast-forwards all bans so that the banned rules search in the next
 * iteration. The runner therefore only declares saturation when no rule,
 * banned or not, can change the e-graph.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public class BackoffScheduler<N extends Node<N>, D> implements Scheduler<N, D> {
  private int defaultMatchLimit;
  private int defaultBanLength;
  private final Map<String, RuleStats> stats = new HashMap<>();
  private Tracer tracer = Tracers.empty();

  /** Creates a scheduler with match limit 1,000 and ban length 5. */
  public BackoffScheduler() {
    this(1_000, 5);
  }

  /** Creates a scheduler with a given default match limit and ban length. */
  public BackoffScheduler(int matchLimit, int banLength) {
    checkArgument(matchLimit >= 0, "match limit must not be negative");
    checkArgument(banLength >= 0, "ban length must not be negative");
    this.defaultMatchLimit = matchLimit;
    this.defaultBanLength = banLength;
  }

  /** Sets the match limit of rules that have not yet run. */
  public BackoffScheduler<N, D> withInitialMatchLimit(int matchLimit) {
    checkArgument(matchLimit >= 0, "match limit must not be negative");
    this.defaultMatchLimit = matchLimit;
    return this;
  }

  /** Sets the ban length of rules that have not yet run. */
  public BackoffScheduler<N, D> withInitialBanLength(int banLength) {
    checkArgument(banLength >= 0, "ban length must not be negative");
    this.defaultBanLength = banLength;
    return this;
  }

  /** Sets the tracer that is told about bans. */
  public BackoffScheduler<N, D> withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Never bans a rule. */
  public BackoffScheduler<N, D> doNotBan(String ruleName) {
    final RuleStats s = stats(ruleName);
    s.matchLimit = Integer.MAX_VALUE;
    s.banLength = 0;
    return this;
  }

  /** Sets the match limit of a rule. */
  public BackoffScheduler<N, D> withRuleMatchLimit(
      String ruleName, int matchLimit) {
    checkArgument(matchLimit >= 0, "match limit must not be negative");
    stats(ruleName).matchLimit = matchLimit;
    return this;
  }

  /** Sets the ban length of a rule. */
  public BackoffScheduler<N, D> withRuleBanLength(
      String ruleName, int banLength) {
    checkArgument(banLength >= 0, "ban length must not be negative");
    stats(ruleName).banLength = banLength;
    return this;
  }

  private RuleStats stats(String ruleName) {
    return stats.computeIfAbsent(
        ruleName, n -> new RuleStats(defaultMatchLimit, defaultBanLength));
  }

  /** Returns how many times a rule has been banned. */
  public int timesBanned(String ruleName) {
    final RuleStats s = stats.get(ruleName);
    return s == null ? 0 : s.timesBanned;
  }

  /** Returns how many times a rule has searched without being banned. */
  public int timesApplied(String ruleName) {
    final RuleStats s = stats.get(ruleName);
    return s == null ? 0 : s.timesApplied;
  }

  /** Returns the first iteration in which a rule may search again. */
  public int bannedUntil(String ruleName) {
    final RuleStats s = stats.get(ruleName);
    return s == null ? 0 : s.bannedUntil;
  }

  @Override
  public boolean canSearch(int iteration, String ruleName) {
    final RuleStats s = stats.get(ruleName);
    return s == null || iteration >= s.bannedUntil;
  }

  @Override
  public boolean canStop(int iteration) {
    int minBannedUntil = Integer.MAX_VALUE;
    for (RuleStats s : stats.values()) {
      if (s.bannedUntil > iteration) {
        minBannedUntil = Math.min(minBannedUntil, s.bannedUntil);
      }
    }
    if (minBannedUntil == Integer.MAX_VALUE) {
      return true;
    }
    // Bring the earliest ban forward to the next iteration, and shift the
    // other bans by the same amount.
    final int delta = minBannedUntil - (iteration + 1);
    for (RuleStats s : stats.values()) {
      if (s.bannedUntil > iteration) {
        s.bannedUntil -= delta;
      }
    }
    return false;
  }

  @Override
  public List<SearchMatches<N>> searchRewrite(
      int iteration, EGraph<N, D> egraph, Rewrite<N, D> rewrite) {
    final RuleStats s = stats(rewrite.name);
    if (iteration < s.bannedUntil) {
      return ImmutableList.of();
    }
    final int threshold = shift(s.matchLimit, s.timesBanned);
    final int limit =
        threshold == Integer.MAX_VALUE ? threshold : threshold + 1;
    final List<SearchMatches<N>> matches =
        rewrite.searchWithLimit(egraph, limit);
    final int total = SearchMatches.count(matches);
    if (total > threshold) {
      final int banLength = shift(s.banLength, s.timesBanned);
      s.timesBanned++;
      s.bannedUntil =
          (int) Math.min(Integer.MAX_VALUE, (long) iteration + banLength);
      tracer.onBan(iteration, rewrite.name, total, threshold, s.bannedUntil);
      return ImmutableList.of();
    }
    s.timesApplied++;
    return matches;
  }

  /** Returns {@code value << shift}, saturating at the largest int. */
  static int shift(int value, int shift) {
    if (value == 0) {
      return 0;
    }
    if (shift >= 31 || value > (Integer.MAX_VALUE >> shift)) {
      return Integer.MAX_VALUE;
    }
    return value << shift;
  }

  @Override
  public String toString() {
    return "BackoffScheduler{matchLimit="
        + defaultMatchLimit
        + ", banLength="
        + defaultBanLength
        + "}";
  }

  /** Per-rule state. */
  private static class RuleStats {
    int timesApplied;
    int bannedUntil;
    int timesBanned;
    int matchLimit;
    int banLength;

    RuleStats(int matchLimit, int banLength) {
      this.matchLimit = matchLimit;
      this.banLength = banLength;
    }
  }
}

// End BackoffScheduler.java
