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

import static net.hydromatic.hexpr.Hx.hx;
import static net.hydromatic.hexpr.Matchers.describedAs;
import static net.hydromatic.hexpr.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.hexpr.graph.NodeId;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.parse.HexprParseException;
import net.hydromatic.hexpr.type.Signature;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles}, which runs the whole pipeline. */
public class CompilesTest {
  private static final Signature ARITHMETIC =
      Signature.empty()
          .add("copy", "ℝ -> ℝ ℝ")
          .add("+", "ℝ ℝ -> ℝ")
          .add("neg", "ℝ -> ℝ");

  @Test void testCompile() {
    final OpenHypergraph<String, String> g =
        Compiles.compile("(copy +)", ARITHMETIC);
    assertThat(g.hypergraph.labels(),
        is(ImmutableList.of("ℝ", "ℝ", "ℝ", "ℝ", "ℝ", "ℝ")));
    assertThat(g.hypergraph.classCount(), is(4));
    assertThat(g.sources.toString(), is("[0]"));
    assertThat(g.targets.toString(), is("[5]"));
  }

  @Test void testMinimize() {
    hx("(copy +)").withArithmetic()
        .withProp(Prop.MINIMIZE, true)
        .assertCompile(
            is("nodes:\n"
                + "  0 : ℝ\n"
                + "  1 : ℝ\n"
                + "  2 : ℝ\n"
                + "  3 : ℝ\n"
                + "edges:\n"
                + "  copy : [0] -> [1, 2]\n"
                + "  + : [1, 2] -> [3]\n"
                + "sources: [0]\n"
                + "targets: [3]\n"));
  }

  @Test void testImperative() {
    final String s =
        "([a b.] { ([.a b] add [acc.]) ([.a acc] mul [result.]) })";
    hx(s).withArithmetic()
        .assertCompile(g -> {
          assertThat(g.hypergraph.nodeCount(), is(14));
          assertThat(g.sources.toString(), is("[0, 1]"));
          assertThat(g.targets.isEmpty(), is(true));
        })
        .withProp(Prop.MINIMIZE, true)
        .assertCompile(g -> {
          assertThat(g.hypergraph.nodeCount(), is(4));
          assertThat(g.hypergraph.edges().toString(),
              is("[add : [0, 1] -> [2], mul : [0, 2] -> [3]]"));
        });
  }

  @Test void testEmptyDiagram() {
    hx("{}").assertCompile(
        is("nodes:\nedges:\nsources: []\ntargets: []\n"));
  }

  @Test void testUnresolved() {
    hx("[x x . x]")
        .assertCompileThrows(
            throwsA(Compiles.UnresolvedTypeException.class,
                "unresolved type for node 0"))
        .assertCompileThrows(
            describedAs("Error: unresolved type for node 0"));
    final Compiles.UnresolvedTypeException e =
        assertThrows(Compiles.UnresolvedTypeException.class,
            () -> hx("{neg [x .] [. y]}").withArithmetic().compile());
    assertThat(e.node, is(NodeId.of(2)));
  }

  @Test void testErrors() {
    hx("({copy neg} +)").withArithmetic()
        .assertCompileThrows(
            describedAs("1.13 Error: "
                + "composition mismatch: 3 outputs to 2 inputs"));
    hx("(copy").assertCompileThrows(
        throwsA(HexprParseException.class,
            "unexpected end of input, expected ')'"));
    hx("sqrt").withArithmetic()
        .assertCompileThrows(
            throwsA(Translator.UnknownOperationException.class,
                "unknown operation 'sqrt'"));
    hx("(zero neg)")
        .withOperation("zero", "-> ℕ")
        .withOperation("neg", "ℝ -> ℝ")
        .assertCompileThrows(
            throwsA(TypeInference.TypeConflictException.class,
                "type conflict: cannot unify ℕ with ℝ"));
  }

  /** Records the events that a compilation sends to its tracer. */
  private static List<String> trace(String text) {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnAst(tracer, exp -> events.add("ast " + exp));
    tracer = Tracers.withOnTranslate(tracer, g ->
        events.add("translate " + g.hypergraph.nodeCount()));
    tracer = Tracers.withOnInference(tracer, g ->
        events.add("inference " + g.hypergraph.labels()));
    tracer = Tracers.withOnResult(tracer, g ->
        events.add("result " + g.hypergraph.nodeCount()));
    tracer = Tracers.withOnException(tracer, e ->
        events.add("exception " + ((Exception) e).getMessage()));
    try {
      Compiles.compile(text, ARITHMETIC, ImmutableMap.of(), tracer);
    } catch (RuntimeException e) {
      events.add("thrown " + e.getClass().getSimpleName());
    }
    return events;
  }

  @Test void testTracer() {
    assertThat(trace("(neg [x . x])"),
        is(ImmutableList.of("ast (neg [x . x])",
            "translate 4",
            "inference [ℝ, ℝ, ℝ, ℝ]",
            "result 4")));
    assertThat(trace("[x . x]"),
        is(ImmutableList.of("ast [x . x]",
            "translate 2",
            "inference [?, ?]",
            "exception unresolved type for node 0",
            "thrown UnresolvedTypeException")));
    assertThat(trace("(neg"),
        is(ImmutableList.of("exception unexpected end of input, "
                + "expected ')'",
            "thrown HexprParseException")));
    assertThat(trace("(neg sqrt)"),
        is(ImmutableList.of("ast (neg sqrt)",
            "exception unknown operation 'sqrt'",
            "thrown UnknownOperationException")));
  }
}

// End CompilesTest.java
