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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.egraph.graph.EClass;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Extracts terms whose total node cost is minimal, counting each shared
 * subterm once.
 *
 * <p>Where {@link Extractor} finds the cheapest tree for each class
 * independently, this extractor finds the cheapest DAG for a set of roots.
 * It builds an {@link ExtractionProblem} and passes it to an
 * {@link ExtractionSolver}.
 *
 * @param <N> Node type
 */
public class ExactExtractor<N extends Node<N>> {
  private final EGraph<N, ?> egraph;
  private final NodeCost<N> nodeCost;
  private final ExtractionSolver solver;

  /** Creates an extractor that uses an {@link ExhaustiveSolver}. */
  public ExactExtractor(EGraph<N, ?> egraph, NodeCost<N> nodeCost) {
    this(egraph, nodeCost, new ExhaustiveSolver());
  }

  public ExactExtractor(
      EGraph<N, ?> egraph, NodeCost<N> nodeCost, ExtractionSolver solver) {
    this.egraph = requireNonNull(egraph);
    this.nodeCost = requireNonNull(nodeCost);
    this.solver = requireNonNull(solver);
  }

  /**
   * Finds the cheapest selection for a single root.
   *
   * @throws UnextractableException if the root contains no finite term
   */
  public Result<N> solve(Id root) {
    return solve(ImmutableList.of(root));
  }

  /**
   * Finds the cheapest selection that covers all roots.
   *
   * @throws UnextractableException if a root contains no finite term
   */
  public Result<N> solve(List<Id> roots) {
    final ExtractionProblem problem =
        ExtractionProblem.create(egraph, nodeCost, roots);
    final ExtractionSolver.Solution solution = solver.solve(problem);
    if (solution == null) {
      throw new UnextractableException(egraph.find(roots.get(0)));
    }
    final Map<Id, N> selected = new HashMap<>();
    for (int c = 0; c < problem.classCount(); c++) {
      final int choice = solution.choices.get(c);
      if (choice >= 0) {
        final Id id = problem.classIds.get(c);
        final EClass<N, ?> eclass = egraph.getClass(id);
        selected.put(id, eclass.nodes().get(choice));
      }
    }
    return new Result<>(egraph, solution.cost, selected);
  }

  /**
   * Result of exact extraction.
   *
   * @param <N> Node type
   */
  public static final class Result<N extends Node<N>> {
    private final EGraph<N, ?> egraph;
    public final double cost;
    private final Map<Id, N> selected;

    Result(EGraph<N, ?> egraph, double cost, Map<Id, N> selected) {
      this.egraph = egraph;
      this.cost = cost;
      this.selected = selected;
    }

    /** Returns the number of selected nodes. */
    public int size() {
      return selected.size();
    }

    /** Returns the node selected for a class. */
    public N node(Id id) {
      final N node = selected.get(egraph.find(id));
      if (node == null) {
        throw new IllegalArgumentException("class " + id + " not selected");
      }
      return node;
    }

    /** Returns the term selected for a class. */
    public Expr<N> expr(Id id) {
      final Expr.Builder<N> builder = Expr.builder();
      build(builder, egraph.find(id), new HashMap<>());
      return builder.build();
    }

    private Id build(Expr.Builder<N> builder, Id id, Map<Id, Id> positions) {
      final Id position = positions.get(id);
      if (position != null) {
        return position;
      }
      final N node = node(id);
      final List<Id> children = new ArrayList<>();
      for (Id child : node.children()) {
        children.add(build(builder, egraph.find(child), positions));
      }
      final Id p = builder.add(node.withChildren(children));
      positions.put(id, p);
      return p;
    }

    @Override
    public String toString() {
      return "Result{cost=" + cost + ", nodes=" + selected.size() + "}";
    }
  }
}

// End ExactExtractor.java
