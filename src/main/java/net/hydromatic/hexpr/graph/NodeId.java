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
package net.hydromatic.hexpr.graph;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Handle to a wire (node) of a {@link Hypergraph}.
 *
 * <p>Handles are allocated in ascending order starting at 0, and are never
 * reused.
 */
public final class NodeId implements Comparable<NodeId> {
  public final int ordinal;

  private NodeId(int ordinal) {
    checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
    this.ordinal = ordinal;
  }

  public static NodeId of(int ordinal) {
    return new NodeId(ordinal);
  }

  @Override
  public int hashCode() {
    return ordinal;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof NodeId && ordinal == ((NodeId) o).ordinal;
  }

  @Override
  public int compareTo(NodeId o) {
    return Integer.compare(ordinal, o.ordinal);
  }

  @Override
  public String toString() {
    return Integer.toString(ordinal);
  }
}

// End NodeId.java
