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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solves an extraction problem by trying every selection.
 *
 * <p>Starting from the roots, it chooses a node for each class that a
 * chosen node requires, cheapest node first, and abandons a partial
 * selection as soon as it costs at least as much as the best complete
 * selection found so far. Running time is exponential in the number of
 * classes, so it is only suitable for small e-graphs.
 */
public class ExhaustiveSolver implements ExtractionSolver {
  private final long stepLimit;

  /** Creates a solver without a step limit. */
  public ExhaustiveSolver() {
    this(Long.MAX_VALUE);
  }

  /**
   * Creates a solver that gives up after a given number of steps. When it
   * gives up, it returns the best selection found so far, which may not be
   * optimal.
   */
  public ExhaustiveSolver(long stepLimit) {
    this.stepLimit = stepLimit;
  }

  @Override
  public @Nullable Solution solve(ExtractionProblem problem) {
    final Search search = new Search(problem, stepLimit);
    for (int root : problem.roots) {
      search.require(root);
    }
    search.search(0, 0d);
    if (search.bestChoices == null) {
      return null;
    }
    final List<Integer> choices = new ArrayList<>();
    for (int choice : search.bestChoices) {
      choices.add(choice);
    }
    return new Solution(choices, search.bestCost);
  }

  /** State of a search. */
  private static class Search {
    final ExtractionProblem problem;
    final long stepLimit;
    /** For each class, its nodes, cheapest first. */
    final Integer[][] order;
    final int[] choices;
    final boolean[] required;
    /** Classes that must select a node, in the order they were required. */
    final List<Integer> pending = new ArrayList<>();
    long steps;
    double bestCost = Double.POSITIVE_INFINITY;
    int @Nullable [] bestChoices;

    Search(ExtractionProblem problem, long stepLimit) {
      this.problem = problem;
      this.stepLimit = stepLimit;
      final int n = problem.classCount();
      this.order = new Integer[n][];
      for (int c = 0; c < n; c++) {
        final List<Double> costs = problem.costs.get(c);
        final Integer[] nodes = new Integer[costs.size()];
        for (int i = 0; i < nodes.length; i++) {
          nodes[i] = i;
        }
        Arrays.sort(nodes, Comparator.comparingDouble(i -> costs.get(i)));
        order[c] = nodes;
      }
      this.choices = new int[n];
      Arrays.fill(choices, -1);
      this.required = new boolean[n];
    }

    /** Marks a class as required. Returns whether it was not already. */
    boolean require(int c) {
      if (required[c]) {
        return false;
      }
      required[c] = true;
      pending.add(c);
      return true;
    }

    void search(int position, double cost) {
      if (++steps > stepLimit) {
        return;
      }
      if (position == pending.size()) {
        final List<Integer> list = new ArrayList<>();
        for (int choice : choices) {
          list.add(choice);
        }
        // Every required class has a choice; reject selections with cycles.
        final double total = problem.evaluate(list);
        if (total < bestCost) {
          bestCost = total;
          bestChoices = choices.clone();
        }
        return;
      }
      final int c = pending.get(position);
      for (int node : order[c]) {
        final double nodeCost = problem.costs.get(c).get(node);
        if (cost + nodeCost >= bestCost) {
          // Nodes are sorted by cost, so later nodes are no better.
          break;
        }
        final List<Integer> kids = problem.children.get(c).get(node);
        if (kids.contains(c)) {
          continue;
        }
        final int pendingSize = pending.size();
        choices[c] = node;
        for (int kid : kids) {
          require(kid);
        }
        search(position + 1, cost + nodeCost);
        while (pending.size() > pendingSize) {
          required[pending.remove(pending.size() - 1)] = false;
        }
        choices[c] = -1;
      }
    }
  }
}

// End ExhaustiveSolver.java
