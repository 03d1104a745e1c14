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

import java.util.List;

/**
 * Creates nodes from an operator name, as read by the parser.
 *
 * @param <N> Node type
 */
@FunctionalInterface
public interface NodeFactory<N extends Node<N>> {
  /**
   * Creates a node.
   *
   * @throws IllegalArgumentException if the operator is not valid for this
   *     language, or does not accept the given number of children
   */
  N create(String operator, List<Id> children);
}

// End NodeFactory.java
