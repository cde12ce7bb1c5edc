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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Type of an operation: the ordered labels of its inputs and of its outputs.
 *
 * <p>The number of inputs and outputs is the operation's arity. For example,
 * addition of reals has signature "{@code ℝ ℝ -> ℝ}".
 */
public class OperationSignature {
  static final String ARROW = "->";

  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  public final List<ObjectLabel> inputs;
  public final List<ObjectLabel> outputs;

  private OperationSignature(ImmutableList<ObjectLabel> inputs,
      ImmutableList<ObjectLabel> outputs) {
    this.inputs = requireNonNull(inputs);
    this.outputs = requireNonNull(outputs);
  }

  /** Creates a signature. */
  public static OperationSignature of(List<ObjectLabel> inputs,
      List<ObjectLabel> outputs) {
    return new OperationSignature(ImmutableList.copyOf(inputs),
        ImmutableList.copyOf(outputs));
  }

  /**
   * Parses a signature such as "{@code R R -> R}". Type names are separated by
   * white space; "{@code ?}" is an unresolved label. Either side may be empty.
   *
   * @throws IllegalArgumentException if there is not exactly one arrow
   */
  public static OperationSignature parse(String s) {
    final List<String> sides = Splitter.on(ARROW).splitToList(s);
    if (sides.size() != 2) {
      throw new IllegalArgumentException("expected exactly one '" + ARROW
          + "' in signature '" + s + "'");
    }
    return new OperationSignature(labels(sides.get(0)), labels(sides.get(1)));
  }

  private static ImmutableList<ObjectLabel> labels(String s) {
    final ImmutableList.Builder<ObjectLabel> b = ImmutableList.builder();
    WHITESPACE.split(s).forEach(name -> b.add(ObjectLabel.parse(name)));
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(inputs, outputs);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof OperationSignature
            && inputs.equals(((OperationSignature) o).inputs)
            && outputs.equals(((OperationSignature) o).outputs);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    Joiner.on(' ').appendTo(b, inputs);
    b.append(inputs.isEmpty() ? ARROW : " " + ARROW);
    if (!outputs.isEmpty()) {
      Joiner.on(' ').appendTo(b.append(' '), outputs);
    }
    return b.toString();
  }
}

// End OperationSignature.java
