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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Why a {@link Runner} stopped. */
public final class StopReason {
  /** No rule changed the e-graph in the last iteration. */
  public static final StopReason SATURATED =
      new StopReason(Kind.SATURATED, null);

  public final Kind kind;
  public final @Nullable String message;

  private StopReason(Kind kind, @Nullable String message) {
    this.kind = requireNonNull(kind);
    this.message = message;
  }

  /** The runner performed its maximum number of iterations. */
  public static StopReason iterationLimit(int limit) {
    return new StopReason(Kind.ITERATION_LIMIT, Integer.toString(limit));
  }

  /** The e-graph grew beyond its maximum number of nodes. */
  public static StopReason nodeLimit(int limit) {
    return new StopReason(Kind.NODE_LIMIT, Integer.toString(limit));
  }

  /** The runner ran for longer than its time limit, in milliseconds. */
  public static StopReason timeLimit(long millis) {
    return new StopReason(Kind.TIME_LIMIT, millis + "ms");
  }

  /** A hook, or the caller, asked the runner to stop. */
  public static StopReason stopped(String message) {
    return new StopReason(Kind.STOPPED, requireNonNull(message));
  }

  /** Returns whether the runner stopped because it reached a fixpoint. */
  public boolean isSaturated() {
    return kind == Kind.SATURATED;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof StopReason
            && kind == ((StopReason) obj).kind
            && Objects.equals(message, ((StopReason) obj).message);
  }

  @Override
  public String toString() {
    return message == null ? kind.toString() : kind + "(" + message + ")";
  }

  /** Kind of stop reason. */
  public enum Kind {
    SATURATED,
    ITERATION_LIMIT,
    NODE_LIMIT,
    TIME_LIMIT,
    STOPPED
  }
}

// End StopReason.java
