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
package net.hydromatic.hexpr.compile;

import static java.lang.String.format;

import java.util.List;
import net.hydromatic.hexpr.ast.Pos;
import net.hydromatic.hexpr.graph.Hypergraph;
import net.hydromatic.hexpr.graph.NodeId;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.type.ObjectLabel;

/**
 * Resolves the labels of wires.
 *
 * <p>Every class of unified wires must carry at most one type name. If it
 * carries one, every wire in the class gets that type; if it carries none,
 * the class remains unresolved. If it carries two different names, the
 * diagram is ill-typed.
 *
 * <p>Resolution only rewrites labels; it never unifies wires, so running it
 * a second time changes nothing.
 */
public abstract class TypeInference {
  private TypeInference() {}

  /**
   * Resolves the labels of an open hypergraph in place.
   *
   * @throws TypeConflictException if a class contains two different types
   */
  public static void resolve(OpenHypergraph<ObjectLabel, ?> graph) {
    resolve(graph.hypergraph);
  }

  /**
   * Resolves the labels of a hypergraph in place.
   *
   * @throws TypeConflictException if a class contains two different types
   */
  public static void resolve(Hypergraph<ObjectLabel, ?> hypergraph) {
    for (List<NodeId> nodes : hypergraph.classes()) {
      final ObjectLabel label = classLabel(hypergraph, nodes);
      for (NodeId node : nodes) {
        hypergraph.setLabel(node, label);
      }
    }
  }

  /**
   * Returns the label of a class: its only type, or unresolved if it has no
   * type.
   */
  private static ObjectLabel classLabel(Hypergraph<ObjectLabel, ?> hypergraph,
      List<NodeId> nodes) {
    ObjectLabel found = ObjectLabel.unresolved();
    for (NodeId node : nodes) {
      final ObjectLabel label = hypergraph.label(node);
      if (!label.isResolved()) {
        continue;
      }
      if (!found.isResolved()) {
        found = label;
      } else if (!found.equals(label)) {
        throw new TypeConflictException(found.name(), label.name());
      }
    }
    return found;
  }

  /** Error found while checking the types of a diagram. */
  public static class TypeException extends CompileException {
    public TypeException(String message, Pos pos) {
      super(message, pos);
    }
  }

  /** Error when a class of unified wires has two different types. */
  public static class TypeConflictException extends TypeException {
    public final String typeA;
    public final String typeB;

    TypeConflictException(String typeA, String typeB) {
      super(format("type conflict: cannot unify %s with %s", typeA, typeB),
          Pos.ZERO);
      this.typeA = typeA;
      this.typeB = typeB;
    }
  }
}

// End TypeInference.java
