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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A variable in a {@link Pattern} or {@link Subst}.
 *
 * <p>A variable is written with a leading question mark, for example
 * {@code ?x}. The form {@code ?#3} denotes a numbered variable; numbered
 * variables are convenient for generated patterns.
 */
public final class Var implements Comparable<Var> {
  private final @Nullable String name;
  private final int number;

  private Var(@Nullable String name, int number) {
    this.name = name;
    this.number = number;
  }

  /**
   * Parses a variable.
   *
   * @throws IllegalArgumentException if the string does not start with a
   *     question mark, or if a numbered variable is malformed
   */
  public static Var of(String s) {
    requireNonNull(s);
    if (s.startsWith("?#")) {
      final int number;
      try {
        number = Integer.parseInt(s.substring(2));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "number pattern variable " + s + " was malformed", e);
      }
      if (number < 0) {
        throw new IllegalArgumentException(
            "number pattern variable " + s + " was malformed");
      }
      return new Var(null, number);
    }
    if (s.startsWith("?") && s.length() > 1) {
      return new Var(s, -1);
    }
    throw new IllegalArgumentException(
        "pattern variable " + s + " should have a leading question mark");
  }

  /** Creates a numbered variable. */
  public static Var of(int number) {
    if (number < 0) {
      throw new IllegalArgumentException("negative variable number " + number);
    }
    return new Var(null, number);
  }

  /** Returns whether a string looks like a variable (has the leading sigil). */
  public static boolean isVar(String s) {
    return s.startsWith("?");
  }

  /** Returns the number of a numbered variable, or -1. */
  public int number() {
    return number;
  }

  @Override
  public int hashCode() {
    return name != null ? name.hashCode() : number;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Var)) {
      return false;
    }
    final Var that = (Var) obj;
    return number == that.number
        && (name == null ? that.name == null : name.equals(that.name));
  }

  /** Orders named variables before numbered variables. */
  @Override
  public int compareTo(Var o) {
    if (name != null) {
      return o.name != null ? name.compareTo(o.name) : -1;
    }
    return o.name != null ? 1 : Integer.compare(number, o.number);
  }

  @Override
  public String toString() {
    return name != null ? name : "?#" + number;
  }
}

// End Var.java
