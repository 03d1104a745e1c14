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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Proof forest that records why ids were merged.
 *
 * <p>Unlike the union-find, this forest is never compressed: each id points
 * to the id it was merged with, labelled with the justification of that
 * merge. Two ids are in the same tree if and only if they are in the same
 * e-class, so the path between them through their lowest common ancestor is
 * an explanation of their equality.
 *
 * <p>A congruence edge joins the ids of two nodes that have the same
 * operator and equal children. Its step is expanded into explanations of
 * why each pair of children is equal.
 *
 * @param <N> Node type
 */
class Explain<N extends Node<N>> {
  private final List<N> nodes = new ArrayList<>();
  private final List<Integer> parents = new ArrayList<>();
  private final List<@Nullable Justification> justifications =
      new ArrayList<>();

  /** Records the node that an id was created for. */
  void add(N node, Id id) {
    checkArgument(id.index == nodes.size(), "ids must be added in order");
    nodes.add(node);
    parents.add(id.index);
    justifications.add(null);
  }

  /** Records that two ids, currently in different trees, were merged. */
  void union(Id a, Id b, Justification justification) {
    makeRoot(a.index);
    parents.set(a.index, b.index);
    justifications.set(a.index, justification);
  }

  /** Reverses the edges on the path from {@code x} to its root. */
  private void makeRoot(int x) {
    int child = x;
    int parent = parents.get(x);
    Justification justification = justifications.get(x);
    parents.set(x, x);
    justifications.set(x, null);
    while (parent != child) {
      final int nextParent = parents.get(parent);
      final Justification nextJustification = justifications.get(parent);
      parents.set(parent, child);
      justifications.set(parent, justification);
      child = parent;
      parent = nextParent;
      justification = nextJustification;
    }
  }

  /** Returns the path from {@code x} to its root, starting with {@code x}. */
  private List<Integer> pathToRoot(int x) {
    final List<Integer> path = new ArrayList<>();
    path.add(x);
    while (parents.get(x) != x) {
      x = parents.get(x);
      path.add(x);
    }
    return path;
  }

  /** Explains why {@code a} and {@code b} are equal. */
  Explanation<N> explain(Id a, Id b) {
    return explain(a.index, b.index, new HashSet<>());
  }

  /**
   * Explains why two ids are equal. {@code active} holds the congruence
   * edges being expanded, so that an edge is not expanded inside itself.
   */
  private Explanation<N> explain(int a, int b, Set<List<Integer>> active) {
    final List<Integer> pathA = pathToRoot(a);
    final List<Integer> pathB = pathToRoot(b);
    final Map<Integer, Integer> positionsB = new HashMap<>();
    for (int i = 0; i < pathB.size(); i++) {
      positionsB.put(pathB.get(i), i);
    }
    int i = 0;
    while (i < pathA.size() && !positionsB.containsKey(pathA.get(i))) {
      ++i;
    }
    checkArgument(i < pathA.size(), "%s and %s are not equivalent", a, b);
    final int lcaB = positionsB.get(pathA.get(i));

    final List<Explanation.Step<N>> steps = new ArrayList<>();
    for (int j = 0; j < i; j++) {
      final int from = pathA.get(j);
      final int to = pathA.get(j + 1);
      steps.add(step(from, to, justifications.get(from), active));
    }
    for (int j = lcaB; j > 0; j--) {
      final int from = pathB.get(j);
      final int to = pathB.get(j - 1);
      steps.add(step(from, to, justifications.get(to), active));
    }
    return new Explanation<>(steps);
  }

  private Explanation.Step<N> step(
      int from,
      int to,
      @Nullable Justification justification,
      Set<List<Integer>> active) {
    if (justification == null) {
      throw new AssertionError("edge " + from + " - " + to + " has no reason");
    }
    final N fromNode = nodes.get(from);
    final N toNode = nodes.get(to);
    final List<Explanation<N>> children = new ArrayList<>();
    final List<Integer> edge = ImmutableList.of(from, to);
    if (justification.kind == Justification.Kind.CONGRUENCE
        && active.add(edge)) {
      final List<Id> fromChildren = fromNode.children();
      final List<Id> toChildren = toNode.children();
      if (fromChildren.size() != toChildren.size()) {
        throw new AssertionError(
            "congruent nodes " + fromNode + " and " + toNode
                + " differ in arity");
      }
      for (int i = 0; i < fromChildren.size(); i++) {
        final Id x = fromChildren.get(i);
        final Id y = toChildren.get(i);
        if (!x.equals(y)) {
          children.add(explain(x.index, y.index, active));
        }
      }
      active.remove(edge);
    }
    return new Explanation.Step<>(
        Id.of(from), fromNode, Id.of(to), toNode, justification, children);
  }
}

// End Explain.java
