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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Reason why two e-classes were merged. */
public final class Justification {
  /** Merged because two nodes became structurally equal. */
  public static final Justification CONGRUENCE =
      new Justification(Kind.CONGRUENCE, null);

  public final Kind kind;
  private final @Nullable String rule;

  private Justification(Kind kind, @Nullable String rule) {
    this.kind = requireNonNull(kind);
    this.rule = rule;
  }

  /** Creates a justification that a rewrite rule (or the caller) merged. */
  public static Justification rule(String name) {
    return new Justification(Kind.RULE, requireNonNull(name));
  }

  /** Returns the name of the rule, or null if this is congruence. */
  public @Nullable String ruleName() {
    return rule;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + (rule == null ? 0 : rule.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Justification
            && kind == ((Justification) obj).kind
            && (rule == null
                ? ((Justification) obj).rule == null
                : rule.equals(((Justification) obj).rule));
  }

  @Override
  public String toString() {
    return kind == Kind.CONGRUENCE ? "congruence" : "rule " + rule;
  }

  /** Kind of justification. */
  public enum Kind {
    RULE,
    CONGRUENCE
  }
}

// End Justification.java
