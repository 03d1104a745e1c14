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
package net.hydromatic.egraph.lang;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Handle to an e-class, or to a position within an {@link Expr}.
 *
 * <p>An id is never dereferenced directly; an e-graph always resolves it
 * through {@code find} to the canonical id of its class.
 */
public final class Id implements Comparable<Id> {
  private static final Id[] CACHE = new Id[1024];

  static {
    for (int i = 0; i < CACHE.length; i++) {
      CACHE[i] = new Id(i);
    }
  }

  /** Position in the arena. */
  public final int index;

  private Id(int index) {
    this.index = index;
  }

  /** Returns the id with a given index. */
  public static Id of(int index) {
    checkArgument(index >= 0, "negative id %s", index);
    return index < CACHE.length ? CACHE[index] : new Id(index);
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || obj instanceof Id && index == ((Id) obj).index;
  }

  @Override
  public int compareTo(Id o) {
    return Integer.compare(index, o.index);
  }

  @Override
  public String toString() {
    return Integer.toString(index);
  }
}

// End Id.java
