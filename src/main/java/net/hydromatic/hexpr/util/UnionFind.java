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
package net.hydromatic.hexpr.util;

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint-set forest over the integers {@code 0 .. size() - 1}.
 *
 * <p>Elements are added one at a time by {@link #add()} and are never
 * removed. Each element starts in its own class; {@link #union(int, int)}
 * merges two classes. The forest is stored as an arena of parent links, and
 * {@link #find(int)} compresses the path it walks.
 *
 * <p>The root of a class is always its smallest element, so that {@link
 * #find(int)} is a canonical representative that does not depend on the
 * order in which classes were merged.
 */
public class UnionFind {
  private int[] parents = new int[8];
  private int size;

  /** Creates an empty UnionFind. */
  public UnionFind() {}

  /** Creates a copy of a UnionFind. */
  public UnionFind(UnionFind unionFind) {
    this.parents = unionFind.parents.clone();
    this.size = unionFind.size;
  }

  /** Returns the number of elements. */
  public int size() {
    return size;
  }

  /** Adds an element in a class of its own, and returns its ordinal. */
  public int add() {
    if (size == parents.length) {
      parents = Arrays.copyOf(parents, size * 2);
    }
    final int i = size++;
    parents[i] = i;
    return i;
  }

  /** Returns the representative of the class that contains {@code i}. */
  public int find(int i) {
    checkElementIndex(i, size);
    int root = i;
    while (parents[root] != root) {
      root = parents[root];
    }
    // Compress the path, so that each element on it points to the root.
    while (parents[i] != root) {
      final int next = parents[i];
      parents[i] = root;
      i = next;
    }
    return root;
  }

  /**
   * Merges the classes that contain {@code i} and {@code j}. Returns whether
   * they were previously distinct.
   */
  public boolean union(int i, int j) {
    final int rootI = find(i);
    final int rootJ = find(j);
    if (rootI == rootJ) {
      return false;
    }
    if (rootI < rootJ) {
      parents[rootJ] = rootI;
    } else {
      parents[rootI] = rootJ;
    }
    return true;
  }

  /** Returns whether {@code i} and {@code j} are in the same class. */
  public boolean equivalent(int i, int j) {
    return find(i) == find(j);
  }

  /**
   * Returns an array that maps each element to the representative of its
   * class.
   */
  public int[] representatives() {
    final int[] reps = new int[size];
    for (int i = 0; i < size; i++) {
      reps[i] = find(i);
    }
    return reps;
  }

  /**
   * Returns the classes, each as an ascending list of elements. Classes are
   * ordered by their representative.
   */
  public List<List<Integer>> classes() {
    final Map<Integer, List<Integer>> map = new LinkedHashMap<>();
    for (int i = 0; i < size; i++) {
      map.computeIfAbsent(find(i), k -> new ArrayList<>()).add(i);
    }
    final ImmutableList.Builder<List<Integer>> b = ImmutableList.builder();
    map.values().forEach(list -> b.add(ImmutableList.copyOf(list)));
    return b.build();
  }

  /** Returns the number of classes. */
  public int classCount() {
    int n = 0;
    for (int i = 0; i < size; i++) {
      if (find(i) == i) {
        ++n;
      }
    }
    return n;
  }

  @Override
  public String toString() {
    return classes().toString();
  }
}

// End UnionFind.java
