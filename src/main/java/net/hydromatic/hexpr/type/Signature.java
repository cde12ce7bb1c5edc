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
package net.hydromatic.hexpr.type;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table of operations, mapping each operation name to its signature.
 *
 * <p>The table may be empty, and may be extended before it is used. It
 * iterates in the order that operations were added.
 */
public class Signature {
  private final Map<String, OperationSignature> map;

  private Signature(Map<String, OperationSignature> map) {
    this.map = map;
  }

  /** Creates an empty table. */
  public static Signature empty() {
    return new Signature(new LinkedHashMap<>());
  }

  /** Creates a table that contains the given operations. */
  public static Signature of(Map<String, OperationSignature> map) {
    return new Signature(new LinkedHashMap<>(map));
  }

  /** Returns a copy of this table. */
  public Signature copy() {
    return of(map);
  }

  /**
   * Adds an operation, replacing any existing operation of the same name.
   * Returns this table.
   */
  @CanIgnoreReturnValue
  public Signature add(String name, OperationSignature signature) {
    map.put(requireNonNull(name), requireNonNull(signature));
    return this;
  }

  /**
   * Adds an operation whose signature is given as a string, for example
   * {@code add("+", "R R -> R")}.
   */
  @CanIgnoreReturnValue
  public Signature add(String name, String signature) {
    return add(name, OperationSignature.parse(signature));
  }

  /** Returns the signature of an operation, or null if it is not known. */
  public @Nullable OperationSignature get(String name) {
    return map.get(name);
  }

  /** Returns whether an operation is known. */
  public boolean contains(String name) {
    return map.containsKey(name);
  }

  /** Returns the names of the operations, in the order they were added. */
  public Set<String> names() {
    return ImmutableSet.copyOf(map.keySet());
  }

  public int size() {
    return map.size();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End Signature.java
