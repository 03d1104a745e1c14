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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.egraph.lang.Id;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mapping from {@link Var variables} to e-class {@link Id ids}.
 *
 * <p>Substitutions are small (one entry per pattern variable), so they are
 * stored as parallel lists and searched linearly.
 */
public final class Subst {
  private final List<Var> vars;
  private final List<Id> ids;

  private Subst(List<Var> vars, List<Id> ids) {
    this.vars = vars;
    this.ids = ids;
  }

  /** Creates an empty substitution. */
  public Subst() {
    this(new ArrayList<>(4), new ArrayList<>(4));
  }

  /** Creates a substitution from a map. */
  public static Subst copyOf(Map<Var, Id> map) {
    final Subst subst = new Subst();
    map.forEach(subst::insert);
    return subst;
  }

  /**
   * Creates a substitution from alternating variable, id arguments. If a
   * variable occurs more than once, the first occurrence wins.
   */
  public static Subst of(Object... varIds) {
    if (varIds.length % 2 != 0) {
      throw new IllegalArgumentException("odd number of arguments");
    }
    final Subst subst = new Subst();
    for (int i = 0; i < varIds.length; i += 2) {
      final Var var = (Var) varIds[i];
      if (subst.get(var) == null) {
        subst.insert(var, (Id) varIds[i + 1]);
      }
    }
    return subst;
  }

  /** Returns a mutable copy of this substitution. */
  public Subst copy() {
    return new Subst(new ArrayList<>(vars), new ArrayList<>(ids));
  }

  /** Binds a variable, returning the id it was previously bound to, if any. */
  public @Nullable Id insert(Var var, Id id) {
    requireNonNull(var);
    requireNonNull(id);
    final int i = vars.indexOf(var);
    if (i >= 0) {
      return ids.set(i, id);
    }
    vars.add(var);
    ids.add(id);
    return null;
  }

  /** Returns the id a variable is bound to, or null. */
  public @Nullable Id get(Var var) {
    final int i = vars.indexOf(var);
    return i >= 0 ? ids.get(i) : null;
  }

  /**
   * Returns the id a variable is bound to.
   *
   * @throws IllegalArgumentException if the variable is not bound
   */
  public Id id(Var var) {
    final Id id = get(var);
    if (id == null) {
      throw new IllegalArgumentException(
          "Var '" + var + "' not found in " + this);
    }
    return id;
  }

  /** Returns the number of bound variables. */
  public int size() {
    return vars.size();
  }

  /** Returns whether no variables are bound. */
  public boolean isEmpty() {
    return vars.isEmpty();
  }

  /** Returns the bound variables, in the order they were bound. */
  public List<Var> vars() {
    return ImmutableList.copyOf(vars);
  }

  @Override
  public int hashCode() {
    int h = 0;
    for (int i = 0; i < vars.size(); i++) {
      h += vars.get(i).hashCode() ^ ids.get(i).hashCode();
    }
    return h;
  }

  /**
   * Two substitutions are equal if they bind the same variables to the same
   * ids, regardless of the order in which they were bound.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Subst)) {
      return false;
    }
    final Subst that = (Subst) obj;
    if (vars.size() != that.vars.size()) {
      return false;
    }
    for (int i = 0; i < vars.size(); i++) {
      if (!ids.get(i).equals(that.get(vars.get(i)))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (int i = 0; i < vars.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(vars.get(i)).append(": ").append(ids.get(i));
    }
    return b.append('}').toString();
  }
}

// End Subst.java
