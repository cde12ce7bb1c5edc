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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Label of a wire: either a resolved type name, or unresolved.
 *
 * <p>Wires created by frobenius expressions start unresolved; wires created
 * by operations take their labels from the operation's signature. Type
 * inference replaces unresolved labels, and finalization requires that none
 * remain.
 */
public abstract class ObjectLabel {
  /** Text of the unresolved label, in signatures and in output. */
  public static final String UNRESOLVED_NAME = "?";

  private ObjectLabel() {}

  /** Returns the unresolved label. */
  public static ObjectLabel unresolved() {
    return Unresolved.INSTANCE;
  }

  /** Returns a resolved label with the given type name. */
  public static ObjectLabel of(String name) {
    return new Resolved(name);
  }

  /**
   * Converts a string to a label; "{@code ?}" is the unresolved label, any
   * other string is a type name.
   */
  public static ObjectLabel parse(String s) {
    return s.equals(UNRESOLVED_NAME) ? unresolved() : of(s);
  }

  /** Returns whether this label is a type name. */
  public abstract boolean isResolved();

  /**
   * Returns the type name.
   *
   * @throws IllegalStateException if this label is unresolved
   */
  public abstract String name();

  /** Label whose type is not yet known. */
  private static class Unresolved extends ObjectLabel {
    static final ObjectLabel INSTANCE = new Unresolved();

    @Override
    public boolean isResolved() {
      return false;
    }

    @Override
    public String name() {
      throw new IllegalStateException("label is unresolved");
    }

    @Override
    public String toString() {
      return UNRESOLVED_NAME;
    }
  }

  /** Label that is a type name. */
  private static class Resolved extends ObjectLabel {
    private final String name;

    Resolved(String name) {
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty() && !name.equals(UNRESOLVED_NAME),
          "invalid type name '%s'", name);
    }

    @Override
    public boolean isResolved() {
      return true;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Resolved && name.equals(((Resolved) o).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}

// End ObjectLabel.java
