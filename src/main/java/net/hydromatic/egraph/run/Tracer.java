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

/** Called on various events while a {@link Runner} saturates an e-graph. */
public interface Tracer {
  /** Called after a rule has searched, with the number of matches found. */
  void onSearch(int iteration, String ruleName, int matchCount);

  /**
   * Called when a scheduler bans a rule because it found more matches than
   * its threshold. The rule may search again at iteration {@code
   * bannedUntil}.
   */
  void onBan(
      int iteration,
      String ruleName,
      int matchCount,
      int threshold,
      int bannedUntil);

  /** Called at the end of each iteration. */
  void onIteration(Iteration iteration);

  /** Called once, when the runner stops. */
  void onStop(StopReason stopReason, int iterationCount);
}

// End Tracer.java
