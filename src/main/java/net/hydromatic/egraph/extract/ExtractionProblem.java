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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.egraph.graph.EClass;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Extraction posed as a 0-1 integer program.
 *
 * <p>There is one variable per node. The constraints are:
 *
 * <ul>
 *   <li>each root class selects exactly one node;
 *   <li>if a node is selected, each of its child classes selects exactly
 *       one node;
 *   <li>the selected nodes, viewed as edges between classes, are acyclic.
 * </ul>
 *
 * <p>The objective is to minimize the total cost of the selected nodes.
 * Each selected node counts once, however many parents refer to it, so a
 * solution may be cheaper than the tree cost that {@link Extractor}
 * minimizes.
 *
 * <p>Classes are numbered 0, 1, ... in the order they are reached from the
 * roots; only reachable classes are included.
 */
public final class ExtractionProblem {
  /** Canonical id of each class. */
  public final ImmutableList<Id> classIds;

  /** For each class, the cost of each node. */
  public final ImmutableList<ImmutableList<Double>> costs;

  /** For each class and node, the classes of the node's children. */
  public final ImmutableList<ImmutableList<ImmutableList<Integer>>> children;

  /** Root classes. */
  public final ImmutableList<Integer> roots;

  private final ImmutableMap<Id, Integer> classOrdinals;

  private ExtractionProblem(
      ImmutableList<Id> classIds,
      ImmutableList<ImmutableList<Double>> costs,
      ImmutableList<ImmutableList<ImmutableList<Integer>>> children,
      ImmutableList<Integer> roots) {
    this.classIds = requireNonNull(classIds);
    this.costs = requireNonNull(costs);
    this.children = requireNonNull(children);
    this.roots = requireNonNull(roots);
    final ImmutableMap.Builder<Id, Integer> b = ImmutableMap.builder();
    for (int i = 0; i < classIds.size(); i++) {
      b.put(classIds.get(i), i);
    }
    this.classOrdinals = b.build();
  }

  /**
   * Creates a problem for the classes reachable from some roots. The
   * e-graph must be rebuilt.
   */
  public static <N extends Node<N>> ExtractionProblem create(
      EGraph<N, ?> egraph, NodeCost<N> nodeCost, List<Id> roots) {
    checkState(
        egraph.isClean(), "e-graph must be rebuilt before extraction");
    checkArgument(!roots.isEmpty(), "no roots");
    final Map<Id, Integer> ordinals = new LinkedHashMap<>();
    final Deque<Id> queue = new ArrayDeque<>();
    final List<Integer> rootOrdinals = new ArrayList<>();
    for (Id root : roots) {
      rootOrdinals.add(ordinal(egraph.find(root), ordinals, queue));
    }
    final List<ImmutableList<Double>> costs = new ArrayList<>();
    final List<ImmutableList<ImmutableList<Integer>>> children =
        new ArrayList<>();
    while (!queue.isEmpty()) {
      final EClass<N, ?> eclass = egraph.getClass(queue.remove());
      final ImmutableList.Builder<Double> classCosts = ImmutableList.builder();
      final ImmutableList.Builder<ImmutableList<Integer>> classChildren =
          ImmutableList.builder();
      for (N node : eclass.nodes()) {
        final double cost = nodeCost.cost(node);
        checkArgument(
            cost >= 0 && !Double.isInfinite(cost),
            "invalid cost %s for node %s",
            cost,
            node);
        classCosts.add(cost);
        final ImmutableList.Builder<Integer> nodeChildren =
            ImmutableList.builder();
        for (Id child : node.children()) {
          nodeChildren.add(ordinal(egraph.find(child), ordinals, queue));
        }
        classChildren.add(nodeChildren.build());
      }
      costs.add(classCosts.build());
      children.add(classChildren.build());
    }
    return new ExtractionProblem(
        ImmutableList.copyOf(ordinals.keySet()),
        ImmutableList.copyOf(costs),
        ImmutableList.copyOf(children),
        ImmutableList.copyOf(rootOrdinals));
  }

  private static int ordinal(
      Id id, Map<Id, Integer> ordinals, Deque<Id> queue) {
    final Integer ordinal = ordinals.get(id);
    if (ordinal != null) {
      return ordinal;
    }
    final int n = ordinals.size();
    ordinals.put(id, n);
    queue.add(id);
    return n;
  }

  /** Returns the number of classes. */
  public int classCount() {
    return classIds.size();
  }

  /** Returns the number of nodes in a class. */
  public int nodeCount(int classOrdinal) {
    return costs.get(classOrdinal).size();
  }

  /** Returns the ordinal of a class, given its canonical id. */
  public int classOrdinal(Id canonicalId) {
    final Integer ordinal = classOrdinals.get(canonicalId);
    checkArgument(ordinal != null, "class %s is not in problem", canonicalId);
    return ordinal;
  }

  /**
   * Returns the total cost of a selection, or {@link Double#POSITIVE_INFINITY}
   * if it violates a constraint.
   *
   * @param choices For each class, the selected node, or -1
   */
  public double evaluate(List<Integer> choices) {
    checkArgument(choices.size() == classCount(), "wrong number of choices");
    // 0 = unvisited, 1 = on current path, 2 = done
    final int[] state = new int[classCount()];
    double cost = 0;
    final Deque<int[]> stack = new ArrayDeque<>();
    for (int root : roots) {
      if (state[root] != 0) {
        continue;
      }
      if (choices.get(root) < 0) {
        return Double.POSITIVE_INFINITY;
      }
      state[root] = 1;
      stack.push(new int[] {root, 0});
      while (!stack.isEmpty()) {
        final int[] frame = stack.peek();
        final int c = frame[0];
        final List<Integer> kids = children.get(c).get(choices.get(c));
        if (frame[1] == kids.size()) {
          stack.pop();
          state[c] = 2;
          cost += costs.get(c).get(choices.get(c));
          continue;
        }
        final int child = kids.get(frame[1]++);
        if (state[child] == 1) {
          return Double.POSITIVE_INFINITY;
        }
        if (state[child] == 0) {
          if (choices.get(child) < 0) {
            return Double.POSITIVE_INFINITY;
          }
          state[child] = 1;
          stack.push(new int[] {child, 0});
        }
      }
    }
    return cost;
  }
}

// End ExtractionProblem.java
