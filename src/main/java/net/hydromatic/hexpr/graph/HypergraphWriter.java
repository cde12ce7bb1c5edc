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

import java.util.List;

/**
 * Writes an {@link OpenHypergraph} as text, or as a Graphviz DOT graph.
 *
 * <p>In DOT output, each wire is a point annotated with its label, each
 * operation is a box, and wires in the same class are joined by dotted
 * lines.
 */
public abstract class HypergraphWriter {
  private HypergraphWriter() {}

  /** Direction in which a DOT graph flows. */
  public enum Orientation {
    /** Left to right. */
    LR,
    /** Top to bottom. */
    TB
  }

  /** Writes a graph as a plain listing. */
  public static String text(OpenHypergraph<?, ?> g) {
    final StringBuilder b = new StringBuilder();
    final Hypergraph<?, ?> h = g.hypergraph;
    b.append("nodes:\n");
    for (NodeId node : h.nodeIds()) {
      b.append("  ").append(node).append(" : ").append(h.label(node))
          .append('\n');
    }
    b.append("edges:\n");
    for (Hyperedge<?> edge : h.edges()) {
      b.append("  ").append(edge).append('\n');
    }
    for (List<NodeId> nodes : h.classes()) {
      if (nodes.size() > 1) {
        b.append("class: ").append(nodes).append('\n');
      }
    }
    b.append("sources: ").append(g.sources).append('\n');
    b.append("targets: ").append(g.targets).append('\n');
    return b.toString();
  }

  /** Writes a graph in Graphviz DOT format. */
  public static String dot(OpenHypergraph<?, ?> g, Orientation orientation) {
    final StringBuilder b = new StringBuilder();
    final Hypergraph<?, ?> h = g.hypergraph;
    b.append("digraph {\n")
        .append("  rankdir=")
        .append(orientation.name())
        .append(";\n");
    for (NodeId node : h.nodeIds()) {
      b.append("  n").append(node)
          .append(" [shape=point, xlabel=")
          .append(quote(String.valueOf(h.label(node))))
          .append("];\n");
    }
    final List<? extends Hyperedge<?>> edges = h.edges();
    for (int i = 0; i < edges.size(); i++) {
      final Hyperedge<?> edge = edges.get(i);
      b.append("  e").append(i)
          .append(" [shape=box, label=")
          .append(quote(String.valueOf(edge.label)))
          .append("];\n");
      for (NodeId source : edge.sources) {
        b.append("  n").append(source).append(" -> e").append(i)
            .append(";\n");
      }
      for (NodeId target : edge.targets) {
        b.append("  e").append(i).append(" -> n").append(target)
            .append(";\n");
      }
    }
    for (List<NodeId> nodes : h.classes()) {
      for (NodeId node : nodes.subList(1, nodes.size())) {
        b.append("  n").append(nodes.get(0)).append(" -> n").append(node)
            .append(" [style=dotted, dir=none];\n");
      }
    }
    interfaceNodes(b, "sources", g.sources, true);
    interfaceNodes(b, "targets", g.targets, false);
    return b.append("}\n").toString();
  }

  private static void interfaceNodes(StringBuilder b, String name,
      List<NodeId> nodes, boolean outgoing) {
    if (nodes.isEmpty()) {
      return;
    }
    b.append("  ").append(name).append(" [shape=plaintext, label=\"\"];\n");
    for (NodeId node : nodes) {
      b.append("  ");
      if (outgoing) {
        b.append(name).append(" -> n").append(node);
      } else {
        b.append('n').append(node).append(" -> ").append(name);
      }
      b.append(" [style=dashed];\n");
    }
  }

  /** Quotes a string for use as a DOT identifier. */
  static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}

// End HypergraphWriter.java
