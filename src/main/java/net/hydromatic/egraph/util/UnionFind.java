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
package net.hydromatic.egraph.util;

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;

/**
 * Disjoint sets of integers, with union-by-size and path compression.
 *
 * <p>Elements are allocated densely by {@link #makeSet()}, starting at 0.
 * {@link #find} is idempotent: {@code find(find(x)) == find(x)}.
 */
public class UnionFind {
  private int[] parents = new int[16];
  private int[] sizes = new int[16];
  private int count;

  /** Returns the number of elements. */
  public int size() {
    return count;
  }

  /** Creates a new singleton set and returns its element. */
  public int makeSet() {
    if (count == parents.length) {
      parents = Arrays.copyOf(parents, count * 2);
      sizes = Arrays.copyOf(sizes, count * 2);
    }
    final int e = count++;
    parents[e] = e;
    sizes[e] = 1;
    return e;
  }

  /** Returns whether an element has been allocated by this union-find. */
  public boolean contains(int e) {
    return e >= 0 && e < count;
  }

  /** Returns the representative of the set containing {@code e}. */
  public int find(int e) {
    checkElementIndex(e, count);
    int root = e;
    while (parents[root] != root) {
      root = parents[root];
    }
    // Compress: point every element on the path directly at the root.
    while (parents[e] != root) {
      final int next = parents[e];
      parents[e] = root;
      e = next;
    }
    return root;
  }

  /** Returns the representative of {@code e} without compressing paths. */
  public int findNoCompress(int e) {
    checkElementIndex(e, count);
    while (parents[e] != e) {
      e = parents[e];
    }
    return e;
  }

  /** Returns the number of elements in the set containing {@code e}. */
  public int setSize(int e) {
    return sizes[find(e)];
  }

  /**
   * Merges the sets containing {@code a} and {@code b}, and returns the
   * representative of the merged set. The representative of the larger set
   * survives; on a tie, the representative of {@code a}.
   */
  public int union(int a, int b) {
    int rootA = find(a);
    int rootB = find(b);
    if (rootA == rootB) {
      return rootA;
    }
    if (sizes[rootA] < sizes[rootB]) {
      final int t = rootA;
      rootA = rootB;
      rootB = t;
    }
    parents[rootB] = rootA;
    sizes[rootA] += sizes[rootB];
    return rootA;
  }
}

// End UnionFind.java
