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

import net.hydromatic.egraph.lang.Node;

/** Implementations of {@link Analysis}. */
public abstract class Analyses {
  private Analyses() {}

  /** Returns an analysis that attaches {@link Unit#INSTANCE} to every class. */
  @SuppressWarnings("unchecked")
  public static <N extends Node<N>> Analysis<N, Unit> none() {
    return (Analysis<N, Unit>) NoAnalysis.INSTANCE;
  }

  /** Analysis that does nothing. */
  @SuppressWarnings("rawtypes")
  private static class NoAnalysis implements Analysis {
    static final NoAnalysis INSTANCE = new NoAnalysis();

    @Override
    public Object make(EGraph egraph, Node node) {
      return Unit.INSTANCE;
    }

    @Override
    public Object merge(Object a, Object b) {
      return Unit.INSTANCE;
    }
  }
}

// End Analyses.java
