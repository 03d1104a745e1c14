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
package net.hydromatic.egraph.pattern;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Guard that decides whether a conditional rewrite may apply to a match.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value that this condition reads
 * @see ConditionalApplier
 * @see Conditions
 */
@FunctionalInterface
public interface Condition<N extends Node<N>, D> {
  /**
   * Returns whether the rewrite may apply. May add to the e-graph, but should
   * not merge classes.
   */
  boolean check(EGraph<N, ? extends D> egraph, Id eclass, Subst subst);

  /** Returns the variables that this condition reads from a substitution. */
  default Set<Var> vars() {
    return ImmutableSet.of();
  }
}

// End Condition.java
