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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Equivalence class of nodes.
 *
 * <p>After {@link EGraph#rebuild()}, the nodes of a canonical class are
 * canonical and distinct. Once a class has been merged into another, it is
 * empty and is no longer returned by {@link EGraph#classes()}.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public final class EClass<N extends Node<N>, D> {
  private final Id id;
  List<N> nodes = new ArrayList<>(1);
  List<Parent<N>> parents = new ArrayList<>();
  D data;
  boolean canonical = true;

  EClass(Id id, N node, D data) {
    this.id = requireNonNull(id);
    this.nodes.add(node);
    this.data = data;
  }

  /** Returns the id of this class. Canonical unless the class was merged. */
  public Id id() {
    return id;
  }

  /** Returns the nodes in this class. */
  public List<N> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  /** Returns the number of nodes in this class. */
  public int size() {
    return nodes.size();
  }

  /** Returns the analysis value of this class. */
  public D data() {
    return data;
  }

  /** Returns the ids of classes containing a node that uses this class. */
  public List<Id> parentIds() {
    final List<Id> ids = new ArrayList<>(parents.size());
    for (Parent<N> parent : parents) {
      ids.add(parent.id);
    }
    return ids;
  }

  @Override
  public String toString() {
    return "EClass{id=" + id + ", nodes=" + nodes + ", data=" + data + "}";
  }

  /**
   * A node that uses a class as one of its children, and the id that the
   * node was added as. Resolve the id with {@link EGraph#find} to get the
   * node's class.
   *
   * @param <N> Node type
   */
  static final class Parent<N extends Node<N>> {
    final N node;
    final Id id;

    Parent(N node, Id id) {
      this.node = requireNonNull(node);
      this.id = requireNonNull(id);
    }

    @Override
    public String toString() {
      return node + "@" + id;
    }
  }
}

// End EClass.java
