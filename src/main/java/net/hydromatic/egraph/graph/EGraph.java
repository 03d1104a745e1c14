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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.egraph.lang.Expr;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import net.hydromatic.egraph.pattern.PatternAst;
import net.hydromatic.egraph.pattern.Subst;
import net.hydromatic.egraph.util.UnionFind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Equality graph.
 *
 * <p>Partitions nodes into {@link EClass equivalence classes}. Combines a
 * union-find over class ids, a hashcons table from canonical node to class
 * id, and a list of parents per class that allows {@link #rebuild()} to
 * restore congruence by visiting only the neighborhood of merged classes.
 *
 * <p>After {@link #rebuild()}, the following hold:
 *
 * <ol>
 *   <li>{@code find(find(x)) == find(x)};
 *   <li>every canonical node maps, via the hashcons table, to the canonical
 *       id of its class;
 *   <li>two nodes that are equal after canonicalizing their children are in
 *       the same class;
 *   <li>the analysis value of a class is the merge of the values of its
 *       nodes.
 * </ol>
 *
 * <p>Between a call to {@link #union} and the next call to {@link #rebuild},
 * (2) to (4) may not hold. Searching and extraction require a rebuilt graph.
 *
 * <p>Not thread-safe. A graph that is no longer being modified may be read
 * concurrently.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public class EGraph<N extends Node<N>, D> {
  private final Analysis<N, D> analysis;
  private final UnionFind unionFind = new UnionFind();

  /** Classes, indexed by id. A merged class stays here, empty. */
  private final List<EClass<N, D>> classes = new ArrayList<>();

  /**
   * Hashcons table. The value is the id that a node was added as; resolve it
   * with {@link #find}. May contain stale keys, whose children are not
   * canonical; a lookup always canonicalizes, so never hits one.
   */
  private final Map<N, Id> memo = new HashMap<>();

  /** Classes that have absorbed another class since the last rebuild. */
  private final Set<Id> dirty = new LinkedHashSet<>();

  /** Parents whose analysis value must be recomputed. */
  private final ArrayDeque<EClass.Parent<N>> analysisPending =
      new ArrayDeque<>();

  private @Nullable Explain<N> explain;
  private int classCount;
  private int nodeCount;
  private int unionCount;

  /** Creates an empty e-graph with a given analysis. */
  public EGraph(Analysis<N, D> analysis) {
    this.analysis = requireNonNull(analysis);
  }

  /** Creates an empty e-graph without analysis. */
  public static <N extends Node<N>> EGraph<N, Unit> create() {
    return new EGraph<>(Analyses.<N>none());
  }

  /**
   * Enables explanations. Must be called before any node is added.
   *
   * @see #explainEquivalence(Id, Id)
   */
  public EGraph<N, D> withExplanationsEnabled() {
    checkState(
        classes.isEmpty(),
        "explanations must be enabled before adding nodes");
    explain = new Explain<>();
    return this;
  }

  /** Returns whether explanations are enabled. */
  public boolean areExplanationsEnabled() {
    return explain != null;
  }

  /** Returns the analysis. */
  public Analysis<N, D> analysis() {
    return analysis;
  }

  /**
   * Returns the canonical id of the class containing {@code id}.
   *
   * @throws InvalidIdException if this graph did not issue {@code id}
   */
  public Id find(Id id) {
    checkId(id);
    return Id.of(unionFind.find(id.index));
  }

  private void checkId(Id id) {
    if (!unionFind.contains(id.index)) {
      throw new InvalidIdException(id, unionFind.size());
    }
  }

  /** Returns a copy of a node whose children are canonical ids. */
  public N canonicalize(N node) {
    final ImmutableList<Id> children = node.children();
    if (children.isEmpty()) {
      return node;
    }
    final List<Id> canonical = new ArrayList<>(children.size());
    boolean changed = false;
    for (Id child : children) {
      final Id c = find(child);
      changed |= !c.equals(child);
      canonical.add(c);
    }
    return changed ? node.withChildren(canonical) : node;
  }

  /**
   * Adds a node, returning the id of its class.
   *
   * <p>If an equal node (after canonicalizing children) is already in the
   * graph, returns the canonical id of its class and does not modify the
   * graph.
   *
   * @throws InvalidIdException if a child id was not issued by this graph
   */
  public Id add(N node) {
    final N canonical = canonicalize(node);
    final Id existing = memo.get(canonical);
    if (existing != null) {
      return find(existing);
    }
    final D data = analysis.make(this, canonical);
    final Id id = Id.of(unionFind.makeSet());
    if (explain != null) {
      explain.add(canonical, id);
    }
    final EClass<N, D> eclass = new EClass<>(id, canonical, data);
    classes.add(eclass);
    if (classes.size() != unionFind.size()) {
      throw new AssertionError("class arena out of step with union-find");
    }
    final EClass.Parent<N> parent = new EClass.Parent<>(canonical, id);
    for (Id child : ImmutableSet.copyOf(canonical.children())) {
      classes.get(child.index).parents.add(parent);
    }
    memo.put(canonical, id);
    ++classCount;
    ++nodeCount;
    analysis.modify(this, id);
    return find(id);
  }

  /** Adds every node of an expression, and returns the id of its root. */
  public Id addExpr(Expr<N> expr) {
    final List<Id> ids = new ArrayList<>(expr.size());
    for (N node : expr.nodes()) {
      ids.add(add(node.withChildren(mapIds(node.children(), ids))));
    }
    return ids.get(ids.size() - 1);
  }

  /**
   * Adds a pattern, replacing each variable with the id it is bound to in a
   * substitution, and returns the id of the pattern's root.
   *
   * @throws IllegalArgumentException if a variable is not bound
   */
  public Id addInstantiation(PatternAst<N> ast, Subst subst) {
    return ast.accept(
        new PatternAst.Visitor<N, Id>() {
          @Override
          public Id visit(PatternAst.VarTerm<N> varTerm) {
            return find(subst.id(varTerm.var));
          }

          @Override
          public Id visit(PatternAst.NodeTerm<N> nodeTerm) {
            final List<Id> ids = new ArrayList<>(nodeTerm.args.size());
            for (PatternAst<N> arg : nodeTerm.args) {
              ids.add(arg.accept(this));
            }
            return add(nodeTerm.template.withChildren(ids));
          }
        });
  }

  /**
   * Returns the class of a node, or null if the node is not in the graph.
   * Does not modify the graph.
   */
  public @Nullable Id lookup(N node) {
    final Id id = memo.get(canonicalize(node));
    return id == null ? null : find(id);
  }

  /**
   * Returns the class of an expression's root, or null if some node of the
   * expression is not in the graph.
   */
  public @Nullable Id lookupExpr(Expr<N> expr) {
    final List<Id> ids = new ArrayList<>(expr.size());
    for (N node : expr.nodes()) {
      final Id id = lookup(node.withChildren(mapIds(node.children(), ids)));
      if (id == null) {
        return null;
      }
      ids.add(id);
    }
    return ids.get(ids.size() - 1);
  }

  private static List<Id> mapIds(List<Id> positions, List<Id> ids) {
    final List<Id> list = new ArrayList<>(positions.size());
    for (Id position : positions) {
      list.add(ids.get(position.index));
    }
    return list;
  }

  /**
   * Merges the classes of two ids, and returns the canonical id of the merged
   * class. The merge is recorded as if performed by a rule called "union".
   */
  public Id union(Id a, Id b) {
    union(a, b, Justification.rule("union"));
    return find(a);
  }

  /**
   * Merges the classes of two ids, for a given reason. Returns whether they
   * were previously in different classes.
   *
   * <p>The class with more members survives. Its id becomes the canonical id
   * of both, and it is marked dirty until the next {@link #rebuild()}.
   *
   * @throws MergeConflictException if the analysis cannot merge the values of
   *     the two classes; the graph is not modified
   */
  public boolean union(Id a, Id b, Justification justification) {
    final Id rootA = find(a);
    final Id rootB = find(b);
    if (rootA.equals(rootB)) {
      return false;
    }
    final boolean aWins =
        unionFind.setSize(rootA.index) >= unionFind.setSize(rootB.index);
    final EClass<N, D> winner = classes.get((aWins ? rootA : rootB).index);
    final EClass<N, D> loser = classes.get((aWins ? rootB : rootA).index);
    final D merged = analysis.merge(winner.data, loser.data);

    if (explain != null) {
      explain.union(a, b, justification);
    }
    final int root = unionFind.union(winner.id().index, loser.id().index);
    if (root != winner.id().index) {
      throw new AssertionError("union-find chose " + root);
    }
    if (!Objects.equals(merged, winner.data)) {
      analysisPending.addAll(winner.parents);
    }
    if (!Objects.equals(merged, loser.data)) {
      analysisPending.addAll(loser.parents);
    }
    winner.data = merged;

    // Append the shorter list to the longer one.
    if (winner.nodes.size() < loser.nodes.size()) {
      final List<N> t = winner.nodes;
      winner.nodes = loser.nodes;
      loser.nodes = t;
    }
    winner.nodes.addAll(loser.nodes);
    if (winner.parents.size() < loser.parents.size()) {
      final List<EClass.Parent<N>> t = winner.parents;
      winner.parents = loser.parents;
      loser.parents = t;
    }
    winner.parents.addAll(loser.parents);
    loser.nodes = new ArrayList<>(0);
    loser.parents = new ArrayList<>(0);
    loser.canonical = false;

    --classCount;
    ++unionCount;
    dirty.add(winner.id());
    return true;
  }

  /**
   * Restores the invariants after a batch of unions, and returns the number
   * of unions it performed to restore congruence.
   *
   * <p>Only the parents of merged classes are re-canonicalized. When two
   * parents become equal, their classes are merged, and the merged class is
   * processed in turn, until there is no more work.
   *
   * <p>Calling this method on a clean graph does nothing, and returns 0.
   */
  public int rebuild() {
    if (isClean()) {
      return 0;
    }
    int unions = 0;
    final Set<Id> touched = new LinkedHashSet<>();
    while (!isClean()) {
      while (!dirty.isEmpty()) {
        final Iterator<Id> iterator = dirty.iterator();
        final Id id = find(iterator.next());
        iterator.remove();
        touched.add(id);
        unions += repairParents(id, touched);
      }
      while (!analysisPending.isEmpty()) {
        final EClass.Parent<N> parent = analysisPending.poll();
        final Id id = find(parent.id);
        final EClass<N, D> eclass = classes.get(id.index);
        final D data = analysis.make(this, canonicalize(parent.node));
        final D merged = analysis.merge(eclass.data, data);
        if (!Objects.equals(merged, eclass.data)) {
          eclass.data = merged;
          analysisPending.addAll(eclass.parents);
          touched.add(id);
        }
      }
      if (isClean()) {
        final Set<Id> ids = new LinkedHashSet<>();
        for (Id id : touched) {
          ids.add(find(id));
        }
        touched.clear();
        for (Id id : ids) {
          unions += repairNodes(id);
        }
        for (Id id : ids) {
          if (classes.get(id.index).canonical) {
            analysis.modify(this, id);
          }
        }
      }
    }
    return unions;
  }

  /**
   * Re-canonicalizes the parents of a class, updates the hashcons table, and
   * merges parents that have become equal. Adds the classes that own the
   * parents to {@code touched}, because their node lists need repair too.
   *
   * <p>A congruence is recorded between the ids that the two colliding
   * nodes were added as, so that an explanation can justify it by the
   * equality of their children.
   */
  private int repairParents(Id id, Set<Id> touched) {
    final EClass<N, D> eclass = classes.get(id.index);
    final List<EClass.Parent<N>> parents = eclass.parents;
    eclass.parents = new ArrayList<>(parents.size());
    final Map<N, Id> repaired = new LinkedHashMap<>();
    int unions = 0;
    for (EClass.Parent<N> parent : parents) {
      final N node = canonicalize(parent.node);
      if (!node.equals(parent.node)) {
        memo.remove(parent.node);
      }
      final Id existing = memo.putIfAbsent(node, parent.id);
      if (existing != null
          && union(existing, parent.id, Justification.CONGRUENCE)) {
        ++unions;
      }
      repaired.putIfAbsent(node, parent.id);
      touched.add(find(parent.id));
    }
    final EClass<N, D> target = classes.get(find(id).index);
    repaired.forEach(
        (node, nodeId) ->
            target.parents.add(new EClass.Parent<>(node, nodeId)));
    return unions;
  }

  /**
   * Re-canonicalizes and deduplicates the nodes of a class, and points their
   * hashcons entries at the class's canonical id.
   */
  private int repairNodes(Id id) {
    final EClass<N, D> eclass = classes.get(id.index);
    final List<N> nodes = eclass.nodes;
    eclass.nodes = new ArrayList<>(nodes.size());
    final Set<N> distinct = new LinkedHashSet<>();
    int unions = 0;
    for (N node : nodes) {
      final N canonical = canonicalize(node);
      if (!canonical.equals(node)) {
        memo.remove(node);
      }
      // Parent repair has already entered every canonical node that has
      // children; only a leaf can be missing here.
      final Id existing = memo.putIfAbsent(canonical, id);
      if (existing != null
          && union(existing, id, Justification.CONGRUENCE)) {
        ++unions;
      }
      distinct.add(canonical);
    }
    nodeCount -= nodes.size() - distinct.size();
    classes.get(find(id).index).nodes.addAll(distinct);
    return unions;
  }

  /** Returns whether there are no pending unions to process. */
  public boolean isClean() {
    return dirty.isEmpty() && analysisPending.isEmpty();
  }

  /** Returns the class containing {@code id}. */
  public EClass<N, D> getClass(Id id) {
    return classes.get(find(id).index);
  }

  /** Returns the analysis value of the class containing {@code id}. */
  public D data(Id id) {
    return getClass(id).data;
  }

  /** Returns the canonical classes, in order of id. */
  public List<EClass<N, D>> classes() {
    final List<EClass<N, D>> list = new ArrayList<>(classCount);
    for (EClass<N, D> eclass : classes) {
      if (eclass.canonical) {
        list.add(eclass);
      }
    }
    return list;
  }

  /** Returns the number of canonical classes. */
  public int numberOfClasses() {
    return classCount;
  }

  /**
   * Returns the number of nodes in all classes. After a rebuild, this is the
   * number of distinct canonical nodes.
   */
  public int totalSize() {
    return nodeCount;
  }

  /** Returns the number of unions that have merged two classes. */
  public int unionCount() {
    return unionCount;
  }

  /**
   * Explains why two ids are in the same class.
   *
   * @throws IllegalStateException if explanations are not enabled
   * @throws IllegalArgumentException if the ids are not in the same class
   */
  public Explanation<N> explainEquivalence(Id a, Id b) {
    checkState(explain != null, "explanations are not enabled");
    if (!find(a).equals(find(b))) {
      throw new IllegalArgumentException(a + " and " + b + " are not equal");
    }
    return explain.explain(a, b);
  }

  /**
   * Checks the invariants, throwing {@link AssertionError} if one does not
   * hold. Expensive; for use in tests.
   *
   * @throws IllegalStateException if the graph needs to be rebuilt
   */
  public void checkInvariants() {
    checkState(isClean(), "graph must be rebuilt");
    final Map<N, Id> owners = new HashMap<>();
    int count = 0;
    for (EClass<N, D> eclass : classes()) {
      final Id id = eclass.id();
      if (!find(id).equals(id)) {
        throw new AssertionError("class " + id + " is not canonical");
      }
      for (N node : eclass.nodes) {
        ++count;
        if (!canonicalize(node).equals(node)) {
          throw new AssertionError("node " + node + " is not canonical");
        }
        final Id owner = owners.put(node, id);
        if (owner != null) {
          throw new AssertionError(
              "node " + node + " is in classes " + owner + " and " + id);
        }
        final Id memoId = memo.get(node);
        if (memoId == null || !find(memoId).equals(id)) {
          throw new AssertionError(
              "hashcons maps " + node + " to " + memoId + ", not " + id);
        }
        for (Id child : node.children()) {
          boolean found = false;
          for (EClass.Parent<N> parent : getClass(child).parents) {
            if (find(parent.id).equals(id)
                && canonicalize(parent.node).equals(node)) {
              found = true;
              break;
            }
          }
          if (!found) {
            throw new AssertionError(
                "class " + child + " does not list parent " + node);
          }
        }
        final D merged = analysis.merge(eclass.data, analysis.make(this, node));
        if (!Objects.equals(merged, eclass.data)) {
          throw new AssertionError(
              "analysis value " + eclass.data + " of class " + id
                  + " does not subsume node " + node);
        }
      }
    }
    if (count != nodeCount) {
      throw new AssertionError(
          "node count " + nodeCount + " but found " + count);
    }
  }

  /** Returns a multi-line description of every class. */
  public String dump() {
    final StringBuilder b = new StringBuilder();
    for (EClass<N, D> eclass : classes()) {
      b.append(eclass.id()).append(": ").append(eclass.nodes);
      if (!(eclass.data instanceof Unit)) {
        b.append(" ").append(eclass.data);
      }
      b.append('\n');
    }
    return b.toString();
  }

  @Override
  public String toString() {
    return "EGraph{classes=" + classCount + ", nodes=" + nodeCount + "}";
  }
}

// End EGraph.java
