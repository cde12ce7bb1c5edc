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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.ast.Pos;
import net.hydromatic.hexpr.graph.Hypergraph;
import net.hydromatic.hexpr.graph.NodeId;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.parse.HexprParseException;
import net.hydromatic.hexpr.parse.HexprParser;
import net.hydromatic.hexpr.type.ObjectLabel;
import net.hydromatic.hexpr.type.Signature;

/**
 * Helpers for compiling H-expressions.
 *
 * <p>Compilation parses the text, translates the expression to an open
 * hypergraph, resolves its labels, and checks that every wire has a type.
 * The first error aborts compilation; no partial graph is returned.
 */
public abstract class Compiles {
  private Compiles() {}

  /** Compiles an H-expression with default properties. */
  public static OpenHypergraph<String, String> compile(String text,
      Signature signature) {
    return compile(text, signature, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Compiles an H-expression.
   *
   * @param text Text of the expression
   * @param signature Table of operations
   * @param propMap Property values
   * @param tracer Receives intermediate results and errors
   * @return Graph in which every wire has a type name
   */
  public static OpenHypergraph<String, String> compile(String text,
      Signature signature, Map<Prop, Object> propMap, Tracer tracer) {
    final Ast.Exp exp;
    try {
      exp = HexprParser.parse(text);
    } catch (HexprParseException e) {
      tracer.onException(e);
      throw e;
    }
    return compile(exp, signature, propMap, tracer);
  }

  /** Compiles a parsed expression. */
  public static OpenHypergraph<String, String> compile(Ast.Exp exp,
      Signature signature, Map<Prop, Object> propMap, Tracer tracer) {
    try {
      tracer.onAst(exp);
      final OpenHypergraph<ObjectLabel, String> graph =
          new Translator(signature).translate(exp);
      tracer.onTranslate(graph);
      TypeInference.resolve(graph);
      tracer.onInference(graph);
      OpenHypergraph<String, String> result = finalizeLabels(graph);
      if (Prop.MINIMIZE.booleanValue(propMap)) {
        result = result.quotient();
      }
      tracer.onResult(result);
      return result;
    } catch (CompileException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /**
   * Converts a graph whose labels have been resolved to a graph whose labels
   * are type names.
   *
   * @throws UnresolvedTypeException if any wire is still unresolved
   */
  public static OpenHypergraph<String, String> finalizeLabels(
      OpenHypergraph<ObjectLabel, String> graph) {
    final Hypergraph<ObjectLabel, String> hypergraph = graph.hypergraph;
    for (NodeId node : hypergraph.nodeIds()) {
      if (!hypergraph.label(node).isResolved()) {
        throw new UnresolvedTypeException(node);
      }
    }
    return graph.mapLabels(ObjectLabel::name);
  }

  /** Error when a wire has no type after inference. */
  public static class UnresolvedTypeException
      extends TypeInference.TypeException {
    public final NodeId node;

    UnresolvedTypeException(NodeId node) {
      super(format("unresolved type for node %s", node), Pos.ZERO);
      this.node = node;
    }
  }
}

// End Compiles.java
