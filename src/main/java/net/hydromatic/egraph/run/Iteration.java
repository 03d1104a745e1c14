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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Map;

/** Statistics about one iteration of a {@link Runner}. */
public final class Iteration {
  /** Index of this iteration, starting at 0. */
  public final int index;

  /** Number of nodes in the e-graph at the end of the iteration. */
  public final int nodeCount;

  /** Number of classes in the e-graph at the end of the iteration. */
  public final int classCount;

  /**
   * For each rule that changed the graph, the number of unions it caused.
   * Rules that matched nothing, or whose matches were already true, are
   * absent.
   */
  public final ImmutableMap<String, Integer> applied;

  /** Number of unions that rebuild performed to restore congruence. */
  public final int rebuildUnions;

  public final Duration searchTime;
  public final Duration applyTime;
  public final Duration rebuildTime;
  public final Duration totalTime;

  Iteration(
      int index,
      int nodeCount,
      int classCount,
      Map<String, Integer> applied,
      int rebuildUnions,
      Duration searchTime,
      Duration applyTime,
      Duration rebuildTime,
      Duration totalTime) {
    this.index = index;
    this.nodeCount = nodeCount;
    this.classCount = classCount;
    this.applied = ImmutableMap.copyOf(applied);
    this.rebuildUnions = rebuildUnions;
    this.searchTime = requireNonNull(searchTime);
    this.applyTime = requireNonNull(applyTime);
    this.rebuildTime = requireNonNull(rebuildTime);
    this.totalTime = requireNonNull(totalTime);
  }

  /** Returns the total number of unions caused by rules. */
  public int appliedCount() {
    int n = 0;
    for (int count : applied.values()) {
      n += count;
    }
    return n;
  }

  @Override
  public String toString() {
    return "Iteration{index="
        + index
        + ", nodes="
        + nodeCount
        + ", classes="
        + classCount
        + ", applied="
        + applied
        + ", rebuildUnions="
        + rebuildUnions
        + "}";
  }
}

// End Iteration.java
