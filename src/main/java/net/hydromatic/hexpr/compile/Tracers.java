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

import java.util.function.Consumer;
import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.type.ObjectLabel;
import net.hydromatic.hexpr.util.HexprException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a parsed expression,
   * then calls the underlying tracer.
   */
  public static Tracer withOnAst(Tracer tracer, Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onAst(Ast.Exp exp) {
        consumer.accept(exp);
        super.onAst(exp);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a graph that has just
   * been translated, then calls the underlying tracer.
   */
  public static Tracer withOnTranslate(Tracer tracer,
      Consumer<OpenHypergraph<ObjectLabel, String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTranslate(OpenHypergraph<ObjectLabel, String> graph) {
        consumer.accept(graph);
        super.onTranslate(graph);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a graph after type
   * inference, then calls the underlying tracer.
   */
  public static Tracer withOnInference(Tracer tracer,
      Consumer<OpenHypergraph<ObjectLabel, String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInference(OpenHypergraph<ObjectLabel, String> graph) {
        consumer.accept(graph);
        super.onInference(graph);
      }
    };
  }

  public static Tracer withOnResult(Tracer tracer,
      Consumer<OpenHypergraph<String, String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(OpenHypergraph<String, String> graph) {
        consumer.accept(graph);
        super.onResult(graph);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<HexprException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(HexprException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onAst(Ast.Exp exp) {}

    @Override
    public void onTranslate(OpenHypergraph<ObjectLabel, String> graph) {}

    @Override
    public void onInference(OpenHypergraph<ObjectLabel, String> graph) {}

    @Override
    public void onResult(OpenHypergraph<String, String> graph) {}

    @Override
    public void onException(HexprException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onAst(Ast.Exp exp) {
      tracer.onAst(exp);
    }

    @Override
    public void onTranslate(OpenHypergraph<ObjectLabel, String> graph) {
      tracer.onTranslate(graph);
    }

    @Override
    public void onInference(OpenHypergraph<ObjectLabel, String> graph) {
      tracer.onInference(graph);
    }

    @Override
    public void onResult(OpenHypergraph<String, String> graph) {
      tracer.onResult(graph);
    }

    @Override
    public void onException(HexprException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
