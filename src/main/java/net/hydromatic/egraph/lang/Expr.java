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
package net.hydromatic.egraph.lang;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * A finite term, stored as a flat list of nodes.
 *
 * <p>The children of each node are ids that index earlier positions in the
 * list, so the list is in topological order and the root is the last node.
 * Common subterms may be shared.
 *
 * @param <N> Node type
 */
public final class Expr<N extends Node<N>> {
  private final ImmutableList<N> nodes;

  private Expr(ImmutableList<N> nodes) {
    this.nodes = nodes;
    checkArgument(!nodes.isEmpty(), "expression must have at least one node");
  }

  /** Creates a builder. */
  public static <N extends Node<N>> Builder<N> builder() {
    return new Builder<>();
  }

  /** Returns the nodes, root last. */
  public ImmutableList<N> nodes() {
    return nodes;
  }

  /** Returns the id of the root node. */
  public Id root() {
    return Id.of(nodes.size() - 1);
  }

  /** Returns the node at a given position. */
  public N get(Id id) {
    return nodes.get(id.index);
  }

  /** Returns the number of nodes. */
  public int size() {
    return nodes.size();
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Expr && nodes.equals(((Expr<?>) obj).nodes);
  }

  /** Prints in parenthesized-prefix syntax, for example "(+ 1 (* x 2))". */
  @Override
  public String toString() {
    return unparse(new StringBuilder(), root()).toString();
  }

  private StringBuilder unparse(StringBuilder buf, Id id) {
    final N node = get(id);
    if (node.isLeaf()) {
      return buf.append(node.operator());
    }
    buf.append('(').append(node.operator());
    for (Id child : node.children()) {
      unparse(buf.append(' '), child);
    }
    return buf.append(')');
  }

  /**
   * Builder for {@link Expr}.
   *
   * @param <N> Node type
   */
  public static class Builder<N extends Node<N>> {
    private final List<N> nodes = new ArrayList<>();

    /**
     * Adds a node and returns its position. Its children must refer to nodes
     * already added.
     */
    public Id add(N node) {
      for (Id child : node.children()) {
        checkArgument(
            child.index < nodes.size(),
            "child %s of %s refers to a node not yet added",
            child,
            node);
      }
      nodes.add(node);
      return Id.of(nodes.size() - 1);
    }

    /** Returns the number of nodes added so far. */
    public int size() {
      return nodes.size();
    }

    /** Creates the expression; the last node added is the root. */
    public Expr<N> build() {
      checkState(!nodes.isEmpty(), "empty expression");
      return new Expr<>(ImmutableList.copyOf(nodes));
    }
  }
}

// End Expr.java
