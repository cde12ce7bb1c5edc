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

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.hexpr.util.UnionFind;

/**
 * Hypergraph whose nodes are wires and whose edges are operations, with a
 * quotient that records which wires have been declared identical.
 *
 * <p>Nodes and edges are only ever added. Unifying two nodes does not
 * renumber or remove anything; it merges their classes in the quotient.
 * {@link #quotient()} produces a graph in which each class is one node.
 *
 * <p>This class is not thread-safe.
 *
 * @param <O> Type of node (object) label
 * @param <A> Type of edge (arrow) label
 */
public class Hypergraph<O, A> {
  private final List<O> nodes;
  private final List<Hyperedge<A>> edges;
  private final UnionFind unionFind;

  private Hypergraph(List<O> nodes, List<Hyperedge<A>> edges,
      UnionFind unionFind) {
    this.nodes = nodes;
    this.edges = edges;
    this.unionFind = unionFind;
  }

  /** Creates an empty hypergraph. */
  public static <O, A> Hypergraph<O, A> empty() {
    return new Hypergraph<>(new ArrayList<>(), new ArrayList<>(),
        new UnionFind());
  }

  /** Adds a node in a class of its own, and returns its handle. */
  public NodeId newNode(O label) {
    final int i = unionFind.add();
    nodes.add(requireNonNull(label));
    return NodeId.of(i);
  }

  /** Adds an edge between existing nodes. */
  @CanIgnoreReturnValue
  public Hyperedge<A> newEdge(A label, List<NodeId> sources,
      List<NodeId> targets) {
    sources.forEach(this::check);
    targets.forEach(this::check);
    final Hyperedge<A> edge = new Hyperedge<>(label, sources, targets);
    edges.add(edge);
    return edge;
  }

  /**
   * Declares that two nodes are the same wire, merging their classes.
   * Commutative and idempotent; a node may be unified with itself.
   */
  public void unify(NodeId a, NodeId b) {
    unionFind.union(check(a).ordinal, check(b).ordinal);
  }

  /** Returns whether two nodes are in the same class. */
  public boolean equivalent(NodeId a, NodeId b) {
    return unionFind.equivalent(check(a).ordinal, check(b).ordinal);
  }

  /**
   * Returns the representative of a node's class; it is the member with the
   * lowest ordinal.
   */
  public NodeId representative(NodeId node) {
    return NodeId.of(unionFind.find(check(node).ordinal));
  }

  /**
   * Returns the coequalizer of all unifications so far: a list that maps
   * each node (by ordinal) to the representative of its class.
   */
  public List<NodeId> coequalizer() {
    final ImmutableList.Builder<NodeId> b = ImmutableList.builder();
    for (int rep : unionFind.representatives()) {
      b.add(NodeId.of(rep));
    }
    return b.build();
  }

  /**
   * Returns the classes of nodes. Each class is in ascending order, and
   * classes are ordered by their representative.
   */
  public List<List<NodeId>> classes() {
    final ImmutableList.Builder<List<NodeId>> b = ImmutableList.builder();
    for (List<Integer> ordinals : unionFind.classes()) {
      final ImmutableList.Builder<NodeId> b2 = ImmutableList.builder();
      ordinals.forEach(i -> b2.add(NodeId.of(i)));
      b.add(b2.build());
    }
    return b.build();
  }

  /** Returns the number of classes. */
  public int classCount() {
    return unionFind.classCount();
  }

  /** Returns the number of nodes. */
  public int nodeCount() {
    return nodes.size();
  }

  /** Returns the handles of all nodes, in ascending order. */
  public List<NodeId> nodeIds() {
    final ImmutableList.Builder<NodeId> b = ImmutableList.builder();
    for (int i = 0; i < nodes.size(); i++) {
      b.add(NodeId.of(i));
    }
    return b.build();
  }

  /** Returns the labels of all nodes, indexed by ordinal. */
  public List<O> labels() {
    return ImmutableList.copyOf(nodes);
  }

  /** Returns the label of a node. */
  public O label(NodeId node) {
    return nodes.get(check(node).ordinal);
  }

  /**
   * Replaces the label of a node. The node's identity and its membership of
   * a class are unchanged.
   */
  public void setLabel(NodeId node, O label) {
    nodes.set(check(node).ordinal, requireNonNull(label));
  }

  /** Returns the edges, in the order that they were added. */
  public List<Hyperedge<A>> edges() {
    return ImmutableList.copyOf(edges);
  }

  /**
   * Returns a copy of this graph with each node label transformed by a
   * function. Node handles, edges and the quotient are the same.
   */
  public <P> Hypergraph<P, A> mapLabels(Function<? super O, ? extends P> fn) {
    final List<P> nodes2 = new ArrayList<>(nodes.size());
    for (O node : nodes) {
      nodes2.add(requireNonNull(fn.apply(node)));
    }
    return new Hypergraph<>(nodes2, new ArrayList<>(edges),
        new UnionFind(unionFind));
  }

  /**
   * Returns a graph in which each class of this graph's quotient is a single
   * node.
   *
   * <p>Nodes are numbered in order of their class's representative, and take
   * the representative's label. Edge endpoints are remapped. The quotient of
   * the result is trivial: no two nodes are unified. This graph is not
   * modified.
   */
  public Hypergraph<O, A> quotient() {
    return quotient(collapse());
  }

  /**
   * Returns an array mapping each node ordinal to the ordinal of its class's
   * node in the {@link #quotient()}.
   */
  int[] collapse() {
    final int[] reps = unionFind.representatives();
    final int[] newOrdinals = new int[reps.length];
    int n = 0;
    for (int i = 0; i < reps.length; i++) {
      // The representative is the lowest member, so it is seen first.
      newOrdinals[i] = reps[i] == i ? n++ : newOrdinals[reps[i]];
    }
    return newOrdinals;
  }

  Hypergraph<O, A> quotient(int[] newOrdinals) {
    final Hypergraph<O, A> g = empty();
    for (int i = 0; i < nodes.size(); i++) {
      if (newOrdinals[i] == g.nodeCount()) {
        g.newNode(nodes.get(i));
      }
    }
    for (Hyperedge<A> edge : edges) {
      g.newEdge(edge.label, remap(edge.sources, newOrdinals),
          remap(edge.targets, newOrdinals));
    }
    return g;
  }

  static List<NodeId> remap(List<NodeId> nodeIds, int[] newOrdinals) {
    final ImmutableList.Builder<NodeId> b = ImmutableList.builder();
    nodeIds.forEach(node -> b.add(NodeId.of(newOrdinals[node.ordinal])));
    return b.build();
  }

  @CanIgnoreReturnValue
  private NodeId check(NodeId node) {
    checkElementIndex(node.ordinal, nodes.size(), "node");
    return node;
  }

  @Override
  public String toString() {
    return "nodes " + nodes + ", edges " + edges + ", classes " + unionFind;
  }
}

// End Hypergraph.java
