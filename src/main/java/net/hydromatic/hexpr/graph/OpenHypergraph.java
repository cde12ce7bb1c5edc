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
import java.util.function.Function;

/**
 * Hypergraph with an interface: ordered lists of source and target wires.
 *
 * <p>This is the result of translating a diagram. The sources are the
 * diagram's inputs, and the targets are its outputs.
 *
 * @param <O> Type of node (object) label
 * @param <A> Type of edge (arrow) label
 */
public class OpenHypergraph<O, A> {
  public final Hypergraph<O, A> hypergraph;
  public final List<NodeId> sources;
  public final List<NodeId> targets;

  private OpenHypergraph(Hypergraph<O, A> hypergraph, List<NodeId> sources,
      List<NodeId> targets) {
    this.hypergraph = requireNonNull(hypergraph);
    this.sources = ImmutableList.copyOf(sources);
    this.targets = ImmutableList.copyOf(targets);
    // Validates that each interface node exists.
    this.sources.forEach(hypergraph::label);
    this.targets.forEach(hypergraph::label);
  }

  /** Creates an OpenHypergraph. */
  public static <O, A> OpenHypergraph<O, A> of(Hypergraph<O, A> hypergraph,
      List<NodeId> sources, List<NodeId> targets) {
    return new OpenHypergraph<>(hypergraph, sources, targets);
  }

  /**
   * Returns a copy of this graph with each node label transformed by a
   * function.
   */
  public <P> OpenHypergraph<P, A> mapLabels(
      Function<? super O, ? extends P> fn) {
    return new OpenHypergraph<>(hypergraph.mapLabels(fn), sources, targets);
  }

  /**
   * Returns a graph in which each class of wires is collapsed into a single
   * node, with the interface remapped accordingly.
   *
   * @see Hypergraph#quotient()
   */
  public OpenHypergraph<O, A> quotient() {
    final int[] newOrdinals = hypergraph.collapse();
    return new OpenHypergraph<>(hypergraph.quotient(newOrdinals),
        Hypergraph.remap(sources, newOrdinals),
        Hypergraph.remap(targets, newOrdinals));
  }

  @Override
  public String toString() {
    return HypergraphWriter.text(this);
  }
}

// End OpenHypergraph.java
