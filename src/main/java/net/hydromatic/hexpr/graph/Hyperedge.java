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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Application of an operation: a labeled edge from an ordered list of source
 * wires to an ordered list of target wires.
 *
 * @param <A> Type of edge label
 */
public class Hyperedge<A> {
  public final A label;
  public final List<NodeId> sources;
  public final List<NodeId> targets;

  Hyperedge(A label, List<NodeId> sources, List<NodeId> targets) {
    this.label = requireNonNull(label);
    this.sources = ImmutableList.copyOf(sources);
    this.targets = ImmutableList.copyOf(targets);
  }

  @Override
  public int hashCode() {
    return Objects.hash(label, sources, targets);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Hyperedge
            && label.equals(((Hyperedge<?>) o).label)
            && sources.equals(((Hyperedge<?>) o).sources)
            && targets.equals(((Hyperedge<?>) o).targets);
  }

  @Override
  public String toString() {
    return label + " : " + sources + " -> " + targets;
  }
}

// End Hyperedge.java
