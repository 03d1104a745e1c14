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

import java.io.PrintWriter;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that writes a line for each ban, iteration and stop to
   * a writer, then calls the underlying tracer.
   */
  public static Tracer printTracer(Tracer tracer, PrintWriter pw) {
    requireNonNull(pw);
    return new DelegatingTracer(tracer) {
      @Override
      public void onBan(
          int iteration,
          String ruleName,
          int matchCount,
          int threshold,
          int bannedUntil) {
        pw.printf(
            "Banning %s (%d matches, threshold %d) until iteration %d%n",
            ruleName, matchCount, threshold, bannedUntil);
        pw.flush();
        super.onBan(iteration, ruleName, matchCount, threshold, bannedUntil);
      }

      @Override
      public void onIteration(Iteration iteration) {
        final StringBuilder b = new StringBuilder();
        b.append("Iteration ")
            .append(iteration.index)
            .append(": ")
            .append(iteration.nodeCount)
            .append(" nodes, ")
            .append(iteration.classCount)
            .append(" classes");
        if (!iteration.applied.isEmpty()) {
          b.append(", applied ").append(iteration.applied);
        }
        if (iteration.rebuildUnions > 0) {
          b.append(", ")
              .append(iteration.rebuildUnions)
              .append(" rebuild unions");
        }
        pw.println(b);
        pw.flush();
        super.onIteration(iteration);
      }

      @Override
      public void onStop(StopReason stopReason, int iterationCount) {
        pw.println(
            "Stopped after " + iterationCount + " iterations: " + stopReason);
        pw.flush();
        super.onStop(stopReason, iterationCount);
      }
    };
  }

  /** Returns a tracer that writes to a writer. */
  public static Tracer printTracer(PrintWriter pw) {
    return printTracer(empty(), pw);
  }

  /**
   * Returns a tracer that performs the given action on each iteration, then
   * calls the underlying tracer.
   */
  public static Tracer withOnIteration(
      Tracer tracer, Consumer<Iteration> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onIteration(Iteration iteration) {
        consumer.accept(iteration);
        super.onIteration(iteration);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the name of each
   * banned rule, then calls the underlying tracer.
   */
  public static Tracer withOnBan(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBan(
          int iteration,
          String ruleName,
          int matchCount,
          int threshold,
          int bannedUntil) {
        consumer.accept(ruleName);
        super.onBan(iteration, ruleName, matchCount, threshold, bannedUntil);
      }
    };
  }

  public static Tracer withOnStop(
      Tracer tracer, Consumer<StopReason> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStop(StopReason stopReason, int iterationCount) {
        consumer.accept(stopReason);
        super.onStop(stopReason, iterationCount);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onSearch(int iteration, String ruleName, int matchCount) {}

    @Override
    public void onBan(
        int iteration,
        String ruleName,
        int matchCount,
        int threshold,
        int bannedUntil) {}

    @Override
    public void onIteration(Iteration iteration) {}

    @Override
    public void onStop(StopReason stopReason, int iterationCount) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onSearch(int iteration, String ruleName, int matchCount) {
      tracer.onSearch(iteration, ruleName, matchCount);
    }

    @Override
    public void onBan(
        int iteration,
        String ruleName,
        int matchCount,
        int threshold,
        int bannedUntil) {
      tracer.onBan(iteration, ruleName, matchCount, threshold, bannedUntil);
    }

    @Override
    public void onIteration(Iteration iteration) {
      tracer.onIteration(iteration);
    }

    @Override
    public void onStop(StopReason stopReason, int iterationCount) {
      tracer.onStop(stopReason, iterationCount);
    }
  }
}

// End Tracers.java
