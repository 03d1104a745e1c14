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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;

/**
 * Why two ids are in the same e-class: a chain of steps, each of which
 * merged two ids for a given reason.
 *
 * @param <N> Node type
 * @see EGraph#explainEquivalence(Id, Id)
 */
public final class Explanation<N extends Node<N>> {
  public final ImmutableList<Step<N>> steps;

  Explanation(List<Step<N>> steps) {
    this.steps = ImmutableList.copyOf(steps);
  }

  /**
   * Returns the names of the rules used, in order, including those that
   * justify congruence steps.
   */
  public List<String> ruleNames() {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    collectRuleNames(names);
    return names.build();
  }

  private void collectRuleNames(ImmutableList.Builder<String> names) {
    for (Step<N> step : steps) {
      final String name = step.justification.ruleName();
      if (name != null) {
        names.add(name);
      }
      for (Explanation<N> child : step.children) {
        child.collectRuleNames(names);
      }
    }
  }

  /**
   * Prints one step per line. The explanation of a congruence step's
   * children follows it, indented.
   */
  @Override
  public String toString() {
    return describeTo(new StringBuilder(), 0).toString();
  }

  private StringBuilder describeTo(StringBuilder b, int indent) {
    for (Step<N> step : steps) {
      b.append(Strings.repeat("  ", indent));
      step.describeTo(b).append('\n');
      for (Explanation<N> child : step.children) {
        child.describeTo(b, indent + 1);
      }
    }
    return b;
  }

  /**
   * One step of an explanation: the node first added as {@code from} equals
   * the node first added as {@code to}.
   *
   * @param <N> Node type
   */
  public static final class Step<N extends Node<N>> {
    public final Id from;
    public final Id to;
    public final N fromNode;
    public final N toNode;
    public final Justification justification;

    /**
     * For a congruence step, why each pair of differing children is equal;
     * otherwise empty.
     */
    public final ImmutableList<Explanation<N>> children;

    Step(
        Id from,
        N fromNode,
        Id to,
        N toNode,
        Justification justification,
        List<Explanation<N>> children) {
      this.from = requireNonNull(from);
      this.fromNode = requireNonNull(fromNode);
      this.to = requireNonNull(to);
      this.toNode = requireNonNull(toNode);
      this.justification = requireNonNull(justification);
      this.children = ImmutableList.copyOf(children);
    }

    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(fromNode)
          .append(" = ")
          .append(toNode)
          .append(" by ")
          .append(justification);
    }

    @Override
    public String toString() {
      return describeTo(new StringBuilder()).toString();
    }
  }
}

// End Explanation.java
