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
package net.hydromatic.egraph.run;

import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Called by a {@link Runner} at each iteration boundary. May inspect or
 * modify the e-graph, or ask the runner to stop.
 *
 * @param <N> Node type
 * @param <D> Type of analysis value
 */
@FunctionalInterface
public interface Hook<N extends Node<N>, D> {
  /**
   * Returns null to continue, or a message to stop the runner with
   * {@link StopReason.Kind#STOPPED}.
   */
  @Nullable String check(Runner<N, D> runner);
}

// End Hook.java
