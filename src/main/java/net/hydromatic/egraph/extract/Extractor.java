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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.egraph.graph.EClass;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the cheapest term in each class of an e-graph.
 *
 * <p>Classes may refer to each other in cycles, so costs cannot be computed
 * in one bottom-up pass. The constructor starts with every class at
 * infinite cost, then repeatedly relaxes: for each class, the cost of each
 * node whose children all have finite cost is computed, and the class takes
 * the cheapest. It stops when a pass improves no class. A class that still
 * has no cost contains no finite term.
 *
 * <p>The e-graph must be rebuilt, and must not change while the extractor
 * is in use.
 *
 * @param <N> Node type
 * @param <C> Cost type
 */
public class Extractor<N extends Node<N>, C extends Comparable<C>> {
  private final EGraph<N, ?> egraph;
  private final CostFunction<N, C> costFunction;
  /** Best node and its cost, keyed by canonical class id. */
  private final Map<Id, Best<N, C>> bestMap = new HashMap<>();

  public Extractor(EGraph<N, ?> egraph, CostFunction<N, C> costFunction) {
    this.egraph = requireNonNull(egraph);
    this.costFunction = requireNonNull(costFunction);
    checkState(
        egraph.isClean(), "e-graph must be rebuilt before extraction");
    findCosts();
  }

  private void findCosts() {
    boolean changed = true;
    while (changed) {
      changed = false;
      for (EClass<N, ?> eclass : egraph.classes()) {
        final Best<N, C> best = bestNode(eclass);
        if (best == null) {
          continue;
        }
        final Best<N, C> previous = bestMap.get(eclass.id());
        if (previous == null || best.cost.compareTo(previous.cost) < 0) {
          bestMap.put(eclass.id(), best);
          changed = true;
        }
      }
    }
  }

  /**
   * Returns the cheapest node in a class among those whose children all have
   * a cost, or null if there is none. Ties go to the earlier node.
   */
  private @Nullable Best<N, C> bestNode(EClass<N, ?> eclass) {
    Best<N, C> best = null;
    for (N node : eclass.nodes()) {
      if (!hasCosts(node)) {
        continue;
      }
      final C cost = costFunction.cost(node, this::cost);
      if (best == null || cost.compareTo(best.cost) < 0) {
        best = new Best<>(node, cost);
      }
    }
    return best;
  }

  private boolean hasCosts(N node) {
    for (Id child : node.children()) {
      if (!bestMap.containsKey(egraph.find(child))) {
        return false;
      }
    }
    return true;
  }

  private C cost(Id id) {
    final Best<N, C> best = bestMap.get(egraph.find(id));
    if (best == null) {
      throw new UnextractableException(egraph.find(id));
    }
    return best.cost;
  }

  private Best<N, C> best(Id id) {
    final Id canonical = egraph.find(id);
    final Best<N, C> best = bestMap.get(canonical);
    if (best == null) {
      throw new UnextractableException(canonical);
    }
    return best;
  }

  /** Returns whether a class contains a finite term. */
  public boolean isExtractable(Id id) {
    return bestMap.containsKey(egraph.find(id));
  }

  /**
   * Returns the cost of the cheapest term in a class.
   *
   * @throws UnextractableException if the class contains no finite term
   */
  public C findBestCost(Id id) {
    return best(id).cost;
  }

  /**
   * Returns the cheapest node in a class. Its children are class ids.
   *
   * @throws UnextractableException if the class contains no finite term
   */
  public N findBestNode(Id id) {
    return best(id).node;
  }

  /**
   * Returns the cheapest term in a class, and its cost.
   *
   * @throws UnextractableException if the class contains no finite term
   */
  public Result<N, C> findBest(Id id) {
    final Best<N, C> best = best(id);
    final Expr.Builder<N> builder = Expr.builder();
    build(builder, egraph.find(id), new HashMap<>(), new HashSet<>());
    return new Result<>(best.cost, builder.build());
  }

  /**
   * Adds the best term of a class to a builder, sharing subterms that occur
   * more than once. Returns the position of the term's root.
   */
  private Id build(
      Expr.Builder<N> builder, Id id, Map<Id, Id> positions, Set<Id> active) {
    final Id position = positions.get(id);
    if (position != null) {
      return position;
    }
    if (!active.add(id)) {
      throw new IllegalStateException(
          "best nodes form a cycle through class "
              + id
              + "; is the cost function monotone?");
    }
    final N node = best(id).node;
    final List<Id> children = new ArrayList<>();
    for (Id child : node.children()) {
      children.add(build(builder, egraph.find(child), positions, active));
    }
    active.remove(id);
    final Id p = builder.add(node.withChildren(children));
    positions.put(id, p);
    return p;
  }

  /**
   * Result of extraction: a term and its cost.
   *
   * @param <N> Node type
   * @param <C> Cost type
   */
  public static final class Result<N extends Node<N>, C> {
    public final C cost;
    public final Expr<N> expr;

    Result(C cost, Expr<N> expr) {
      this.cost = requireNonNull(cost);
      this.expr = requireNonNull(expr);
    }

    @Override
    public String toString() {
      return expr + " (cost " + cost + ")";
    }
  }

  /** Cheapest known node of a class. */
  private static final class Best<N, C> {
    final N node;
    final C cost;

    Best(N node, C cost) {
      this.node = node;
      this.cost = cost;
    }
  }
}

// End Extractor.java
