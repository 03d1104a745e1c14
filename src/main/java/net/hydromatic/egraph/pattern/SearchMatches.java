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
import java.util.List;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The substitutions under which a searcher matched one e-class.
 *
 * @param <N> Node type
 */
public final class SearchMatches<N extends Node<N>> {
  public final Id eclass;
  public final ImmutableList<Subst> substs;

  /** The pattern that was matched, if the searcher is a pattern. */
  public final @Nullable PatternAst<N> ast;

  public SearchMatches(
      Id eclass, List<Subst> substs, @Nullable PatternAst<N> ast) {
    this.eclass = requireNonNull(eclass);
    this.substs = ImmutableList.copyOf(substs);
    this.ast = ast;
  }

  /** Returns the total number of substitutions in a list of matches. */
  public static int count(List<? extends SearchMatches<?>> matchesList) {
    int n = 0;
    for (SearchMatches<?> matches : matchesList) {
      n += matches.substs.size();
    }
    return n;
  }

  @Override
  public String toString() {
    return eclass + ": " + substs;
  }
}

// End SearchMatches.java
