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

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/** Implementations of {@link Condition}. */
public abstract class Conditions {
  private Conditions() {}

  /**
   * Returns a condition that holds if two patterns, instantiated with the
   * match's substitution, are in the same class. Adds the instantiations to
   * the graph if they are not present.
   */
  public static <N extends Node<N>> Condition<N, Object> equal(
      Pattern<N> pattern1, Pattern<N> pattern2) {
    return new EqualCondition<>(pattern1, pattern2);
  }

  /**
   * Returns a condition that holds if two variables are bound to different
   * classes.
   */
  public static <N extends Node<N>> Condition<N, Object> notEqual(
      Var var1, Var var2) {
    return new Condition<N, Object>() {
      @Override
      public boolean check(EGraph<N, ?> egraph, Id eclass, Subst subst) {
        return !egraph
            .find(subst.id(var1))
            .equals(egraph.find(subst.id(var2)));
      }

      @Override
      public Set<Var> vars() {
        return ImmutableSet.of(var1, var2);
      }

      @Override
      public String toString() {
        return var1 + " != " + var2;
      }
    };
  }

  /** Returns a condition that holds if both conditions hold. */
  public static <N extends Node<N>, D> Condition<N, D> and(
      Condition<N, ? super D> condition1, Condition<N, ? super D> condition2) {
    return new Condition<N, D>() {
      @Override
      public boolean check(
          EGraph<N, ? extends D> egraph, Id eclass, Subst subst) {
        return condition1.check(egraph, eclass, subst)
            && condition2.check(egraph, eclass, subst);
      }

      @Override
      public Set<Var> vars() {
        return ImmutableSet.<Var>builder()
            .addAll(condition1.vars())
            .addAll(condition2.vars())
            .build();
      }

      @Override
      public String toString() {
        return condition1 + " and " + condition2;
      }
    };
  }

  /** Condition that two patterns are equal. */
  private static class EqualCondition<N extends Node<N>>
      implements Condition<N, Object> {
    private final Pattern<N> pattern1;
    private final Pattern<N> pattern2;

    EqualCondition(Pattern<N> pattern1, Pattern<N> pattern2) {
      this.pattern1 = requireNonNull(pattern1);
      this.pattern2 = requireNonNull(pattern2);
    }

    @Override
    public boolean check(EGraph<N, ?> egraph, Id eclass, Subst subst) {
      final Id id1 = egraph.addInstantiation(pattern1.ast, subst);
      final Id id2 = egraph.addInstantiation(pattern2.ast, subst);
      return egraph.find(id1).equals(egraph.find(id2));
    }

    @Override
    public Set<Var> vars() {
      return ImmutableSet.<Var>builder()
          .addAll(pattern1.vars())
          .addAll(pattern2.vars())
          .build();
    }

    @Override
    public String toString() {
      return pattern1 + " = " + pattern2;
    }
  }
}

// End Conditions.java
