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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An operator applied to an ordered list of children.
 *
 * <p>This is the only capability that the e-graph requires of a term
 * representation. Two nodes are structurally equal (and must have equal
 * {@link Object#hashCode() hash codes}) if and only if they have the same
 * operator and equal children; the e-graph canonicalizes the children before
 * comparing.
 *
 * <p>Implementations must be immutable.
 *
 * @param <N> Node type
 */
public interface Node<N extends Node<N>> {
  /**
   * Returns the operator. Two nodes with equal operators and the same arity
   * are candidates for the same pattern.
   */
  Object operator();

  /** Returns the children. */
  ImmutableList<Id> children();

  /** Returns a copy of this node with different children. */
  N withChildren(List<Id> children);

  /** Returns the number of children. */
  default int arity() {
    return children().size();
  }

  /** Returns whether this node has no children. */
  default boolean isLeaf() {
    return children().isEmpty();
  }

  /**
   * Returns whether this node has the same operator and arity as another,
   * ignoring children.
   */
  default boolean matches(N node) {
    return operator().equals(node.operator()) && arity() == node.arity();
  }
}

// End Node.java
