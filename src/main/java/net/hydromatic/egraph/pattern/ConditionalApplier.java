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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applier that applies only to matches that satisfy a condition.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
public class ConditionalApplier<N extends Node<N>, D>
    implements Applier<N, D> {
  private final Condition<N, ? super D> condition;
  private final Applier<N, ? super D> applier;

  public ConditionalApplier(
      Condition<N, ? super D> condition, Applier<N, ? super D> applier) {
    this.condition = requireNonNull(condition);
    this.applier = requireNonNull(applier);
  }

  @Override
  public List<Id> applyOne(
      EGraph<N, ? extends D> egraph,
      Id eclass,
      Subst subst,
      @Nullable PatternAst<N> searcherAst,
      String ruleName) {
    if (!condition.check(egraph, eclass, subst)) {
      return ImmutableList.of();
    }
    return applier.applyOne(egraph, eclass, subst, searcherAst, ruleName);
  }

  @Override
  public Set<Var> vars() {
    return ImmutableSet.<Var>builder()
        .addAll(condition.vars())
        .addAll(applier.vars())
        .build();
  }

  @Override
  public String toString() {
    return applier + " if " + condition;
  }
}

// End ConditionalApplier.java
