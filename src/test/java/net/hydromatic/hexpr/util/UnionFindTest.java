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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link UnionFind}. */
public class UnionFindTest {
  /** Creates a UnionFind with {@code n} elements. */
  private static UnionFind create(int n) {
    final UnionFind unionFind = new UnionFind();
    for (int i = 0; i < n; i++) {
      assertThat(unionFind.add(), is(i));
    }
    return unionFind;
  }

  @Test void testEmpty() {
    final UnionFind unionFind = new UnionFind();
    assertThat(unionFind.size(), is(0));
    assertThat(unionFind.classCount(), is(0));
    assertThat(unionFind.toString(), is("[]"));
  }

  @Test void testSingletons() {
    final UnionFind unionFind = create(3);
    assertThat(unionFind.find(2), is(2));
    assertThat(unionFind.equivalent(0, 1), is(false));
    assertThat(unionFind.classCount(), is(3));
    assertThat(unionFind.toString(), is("[[0], [1], [2]]"));
  }

  @Test void testUnion() {
    final UnionFind unionFind = create(6);
    assertThat(unionFind.union(3, 1), is(true));
    assertThat(unionFind.union(4, 2), is(true));
    assertThat(unionFind.union(1, 3), is(false));
    assertThat(unionFind.union(5, 5), is(false));
    assertThat(unionFind.equivalent(1, 3), is(true));
    assertThat(unionFind.equivalent(1, 2), is(false));
    assertThat(unionFind.classCount(), is(4));
    assertThat(unionFind.toString(), is("[[0], [1, 3], [2, 4], [5]]"));
  }

  /** The representative is the smallest element of its class. */
  @Test void testRepresentativeIsSmallest() {
    final UnionFind unionFind = create(5);
    unionFind.union(4, 3);
    unionFind.union(3, 2);
    unionFind.union(2, 4);
    assertThat(unionFind.find(4), is(2));
    unionFind.union(4, 0);
    for (int i = 0; i < 5; i++) {
      final int expected = i == 1 ? 1 : 0;
      assertThat(unionFind.find(i), is(expected));
    }
    assertThat(unionFind.representatives(), is(new int[] {0, 1, 0, 0, 0}));
  }

  /** Unions are transitive, and grow past the initial capacity. */
  @Test void testChain() {
    final UnionFind unionFind = create(100);
    for (int i = 99; i > 0; i--) {
      unionFind.union(i, i - 1);
    }
    assertThat(unionFind.classCount(), is(1));
    assertThat(unionFind.find(99), is(0));
    assertThat(unionFind.classes().get(0).size(), is(100));
  }

  @Test void testCopy() {
    final UnionFind unionFind = create(3);
    unionFind.union(0, 1);
    final UnionFind copy = new UnionFind(unionFind);
    copy.union(1, 2);
    copy.add();
    assertThat(copy.toString(), is("[[0, 1, 2], [3]]"));
    assertThat(unionFind.toString(), is("[[0, 1], [2]]"));
  }

  @Test void testOutOfRange() {
    final UnionFind unionFind = create(2);
    assertThrows(IndexOutOfBoundsException.class, () -> unionFind.find(2));
    assertThrows(IndexOutOfBoundsException.class,
        () -> unionFind.union(0, -1));
  }
}

// End UnionFindTest.java
