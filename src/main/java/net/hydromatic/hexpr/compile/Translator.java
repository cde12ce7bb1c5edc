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

import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.ast.Pos;
import net.hydromatic.hexpr.graph.Hypergraph;
import net.hydromatic.hexpr.graph.NodeId;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.type.ObjectLabel;
import net.hydromatic.hexpr.type.OperationSignature;
import net.hydromatic.hexpr.type.Signature;

/**
 * Translates an expression into an open hypergraph.
 *
 * <p>Operations become hyperedges whose wires are labeled from the operation's
 * signature. Composition unifies the outputs of each diagram with the inputs
 * of the next; tensor places diagrams side by side; frobenius expressions
 * create wires for variables, and unify every occurrence of a named variable
 * with its first occurrence anywhere in the expression.
 *
 * <p>Because variables are scoped to the whole expression, a translator
 * translates exactly one expression. Create a new translator for each.
 */
public class Translator {
  private final Signature signature;
  private final Hypergraph<ObjectLabel, String> graph = Hypergraph.empty();

  /** Node that each named variable is bound to. */
  private final Map<String, NodeId> variables = new HashMap<>();

  private boolean used;

  /**
   * Creates a Translator.
   *
   * @param signature Table of operations; copied, so that later changes to it
   *     do not affect this translator
   */
  public Translator(Signature signature) {
    this.signature = signature.copy();
  }

  /**
   * Translates an expression using a given table of operations.
   *
   * <p>The resulting graph's labels may be unresolved; call {@link
   * TypeInference#resolve} to resolve them.
   */
  public static OpenHypergraph<ObjectLabel, String> translate(Ast.Exp exp,
      Signature signature) {
    return new Translator(signature).translate(exp);
  }

  /** Adds an operation, or replaces an existing one, before translation. */
  @CanIgnoreReturnValue
  public Translator addOperation(String name,
      OperationSignature operationSignature) {
    checkState(!used, "cannot add operation after translation");
    signature.add(name, operationSignature);
    return this;
  }

  /**
   * Translates an expression.
   *
   * @throws UnknownOperationException if an operation is not in the table
   * @throws EmptyCompositionException if a composition has no elements
   * @throws ArityMismatchException if adjacent diagrams in a composition do
   *     not have matching numbers of outputs and inputs
   * @throws IllegalStateException if this translator has already been used
   */
  public OpenHypergraph<ObjectLabel, String> translate(Ast.Exp exp) {
    checkState(!used, "translator has already been used");
    used = true;
    final Ports ports = translateExp(requireNonNull(exp));
    return OpenHypergraph.of(graph, ports.inputs, ports.outputs);
  }

  private Ports translateExp(Ast.Exp exp) {
    switch (exp.op) {
      case OPERATION:
        return translateOperation((Ast.Operation) exp);

      case FROBENIUS:
        return translateFrobenius((Ast.Frobenius) exp);

      case COMPOSITION:
        return translateComposition((Ast.Composition) exp);

      case TENSOR:
        return translateTensor((Ast.Tensor) exp);

      default:
        throw new AssertionError(
            "cannot translate " + exp.op + " [" + exp + "]");
    }
  }

  private Ports translateOperation(Ast.Operation operation) {
    final OperationSignature operationSignature =
        signature.get(operation.name);
    if (operationSignature == null) {
      throw new UnknownOperationException(operation.name, operation.pos);
    }
    final List<NodeId> inputs = newNodes(operationSignature.inputs);
    final List<NodeId> outputs = newNodes(operationSignature.outputs);
    graph.newEdge(operation.name, inputs, outputs);
    return new Ports(inputs, outputs);
  }

  private List<NodeId> newNodes(List<ObjectLabel> labels) {
    final ImmutableList.Builder<NodeId> nodes = ImmutableList.builder();
    labels.forEach(label -> nodes.add(graph.newNode(label)));
    return nodes.build();
  }

  /** Creates wires for variables; no edge is created. */
  private Ports translateFrobenius(Ast.Frobenius frobenius) {
    return new Ports(bindAll(frobenius.inputs), bindAll(frobenius.outputs));
  }

  private List<NodeId> bindAll(List<Ast.Variable> vars) {
    final ImmutableList.Builder<NodeId> nodes = ImmutableList.builder();
    vars.forEach(v -> nodes.add(bind(v)));
    return nodes.build();
  }

  /**
   * Creates a wire for an occurrence of a variable. If the variable is named
   * and has occurred before, the new wire is unified with the wire of its
   * first occurrence.
   */
  private NodeId bind(Ast.Variable v) {
    final NodeId node = graph.newNode(ObjectLabel.unresolved());
    switch (v.op) {
      case ANONYMOUS_VARIABLE:
        return node;

      case NAMED_VARIABLE:
        final NodeId bound =
            variables.putIfAbsent(((Ast.NamedVariable) v).name, node);
        if (bound != null) {
          graph.unify(bound, node);
        }
        return node;

      default:
        throw new AssertionError("not a variable: " + v.op);
    }
  }

  private Ports translateComposition(Ast.Composition composition) {
    if (composition.args.isEmpty()) {
      throw new EmptyCompositionException(composition.pos);
    }
    final Ports first = translateExp(composition.args.get(0));
    List<NodeId> outputs = first.outputs;
    for (Ast.Exp arg : composition.args.subList(1, composition.args.size())) {
      final Ports next = translateExp(arg);
      if (outputs.size() != next.inputs.size()) {
        throw new ArityMismatchException(outputs.size(), next.inputs.size(),
            arg.pos);
      }
      for (int i = 0; i < outputs.size(); i++) {
        graph.unify(outputs.get(i), next.inputs.get(i));
      }
      outputs = next.outputs;
    }
    return new Ports(first.inputs, outputs);
  }

  private Ports translateTensor(Ast.Tensor tensor) {
    final ImmutableList.Builder<NodeId> inputs = ImmutableList.builder();
    final ImmutableList.Builder<NodeId> outputs = ImmutableList.builder();
    for (Ast.Exp arg : tensor.args) {
      final Ports ports = translateExp(arg);
      inputs.addAll(ports.inputs);
      outputs.addAll(ports.outputs);
    }
    return new Ports(inputs.build(), outputs.build());
  }

  /** Input and output wires of a translated sub-expression. */
  private static class Ports {
    final List<NodeId> inputs;
    final List<NodeId> outputs;

    Ports(List<NodeId> inputs, List<NodeId> outputs) {
      this.inputs = inputs;
      this.outputs = outputs;
    }
  }

  /** Error when an expression uses an operation that is not in the table. */
  public static class UnknownOperationException extends CompileException {
    public final String name;

    UnknownOperationException(String name, Pos pos) {
      super(format("unknown operation '%s'", name), pos);
      this.name = name;
    }
  }

  /** Error when a composition has no elements. */
  public static class EmptyCompositionException extends CompileException {
    EmptyCompositionException(Pos pos) {
      super("empty composition", pos);
    }
  }

  /**
   * Error when the number of outputs of a diagram in a composition is not
   * equal to the number of inputs of the diagram that follows it.
   */
  public static class ArityMismatchException extends CompileException {
    /** Number of outputs of the diagrams composed so far. */
    public final int expected;
    /** Number of inputs of the next diagram. */
    public final int actual;

    ArityMismatchException(int expected, int actual, Pos pos) {
      super(format("composition mismatch: %d outputs to %d inputs",
          expected, actual), pos);
      this.expected = expected;
      this.actual = actual;
    }
  }
}

// End Translator.java
