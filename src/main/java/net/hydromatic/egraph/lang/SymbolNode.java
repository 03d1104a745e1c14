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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Node whose operator is a string.
 *
 * <p>Useful when the embedding application has no node type of its own, and
 * in tests. Leaves such as {@code 1} or {@code x} are symbol nodes with no
 * children.
 */
public final class SymbolNode implements Node<SymbolNode> {
  /** Factory that accepts any operator and any number of children. */
  public static final NodeFactory<SymbolNode> FACTORY = SymbolNode::new;

  public final String op;
  private final ImmutableList<Id> children;

  private SymbolNode(String op, List<Id> children) {
    this.op = requireNonNull(op);
    this.children = ImmutableList.copyOf(children);
  }

  /** Creates a leaf. */
  public static SymbolNode leaf(String op) {
    return new SymbolNode(op, ImmutableList.of());
  }

  /** Creates a node. */
  public static SymbolNode of(String op, Id... children) {
    return new SymbolNode(op, ImmutableList.copyOf(children));
  }

  /** Creates a node. */
  public static SymbolNode of(String op, List<Id> children) {
    return new SymbolNode(op, children);
  }

  @Override
  public String operator() {
    return op;
  }

  @Override
  public ImmutableList<Id> children() {
    return children;
  }

  @Override
  public SymbolNode withChildren(List<Id> children) {
    if (children.equals(this.children)) {
      return this;
    }
    return new SymbolNode(op, children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, children);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof SymbolNode
            && op.equals(((SymbolNode) obj).op)
            && children.equals(((SymbolNode) obj).children);
  }

  @Override
  public String toString() {
    return children.isEmpty() ? op : op + children;
  }
}

// End SymbolNode.java
