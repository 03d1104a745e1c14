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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solves an {@link ExtractionProblem}.
 *
 * <p>{@link ExhaustiveSolver} is built in. An integer-programming solver can
 * be plugged in by implementing this interface.
 */
public interface ExtractionSolver {
  /** Returns an optimal solution, or null if the problem has none. */
  @Nullable Solution solve(ExtractionProblem problem);

  /** Selected node of each class, and the total cost. */
  final class Solution {
    /** For each class, the ordinal of the selected node, or -1. */
    public final ImmutableList<Integer> choices;

    public final double cost;

    public Solution(List<Integer> choices, double cost) {
      this.choices = ImmutableList.copyOf(requireNonNull(choices));
      this.cost = cost;
    }

    @Override
    public String toString() {
      return "Solution{choices=" + choices + ", cost=" + cost + "}";
    }
  }
}

// End ExtractionSolver.java
