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
package net.hydromatic.hexpr;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.ast.Op;
import net.hydromatic.hexpr.compile.Compiles;
import net.hydromatic.hexpr.compile.Prop;
import net.hydromatic.hexpr.compile.Tracer;
import net.hydromatic.hexpr.compile.Tracers;
import net.hydromatic.hexpr.graph.HypergraphWriter;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.parse.HexprParser;
import net.hydromatic.hexpr.type.Signature;
import net.hydromatic.hexpr.type.Signatures;
import net.hydromatic.hexpr.util.HexprException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line tool that compiles an H-expression and prints the resulting
 * graph.
 *
 * <p>Usage: {@code hexpr [options] EXPR}; if {@code EXPR} is "-", the
 * expression is read from standard input.
 */
public class Main {
  static final String USAGE =
      "usage: hexpr [options] EXPR\n"
          + "  EXPR                 H-expression, or '-' to read stdin\n"
          + "  -s, --signature=FILE operation signatures (JSON)\n"
          + "  -p, --pretty         print the parsed expression\n"
          + "  -d, --debug          print the AST and intermediate graphs\n"
          + "  --dot                print the graph in Graphviz DOT format\n"
          + "  --minimize           collapse unified wires\n"
          + "  --PROP=VALUE         set a property (minimize, orientation,"
          + " output)\n";

  /** Exit status on success. */
  static final int OK = 0;
  /** Exit status if the expression is invalid or ill-typed. */
  static final int ERROR = 1;
  /** Exit status if the command-line arguments are invalid. */
  static final int USAGE_ERROR = 2;

  private final List<String> argList;
  private final Reader in;
  private final PrintWriter out;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new InputStreamReader(System.in, StandardCharsets.UTF_8),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out) {
    this.argList = ImmutableList.copyOf(argList);
    this.in = in;
    this.out = buffer(out);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  /** Runs the command, and returns the exit status. */
  public int run() {
    try {
      return run2();
    } finally {
      out.flush();
    }
  }

  private int run2() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    @Nullable String expr = null;
    @Nullable String signatureFile = null;
    boolean pretty = false;
    boolean debug = false;
    for (int i = 0; i < argList.size(); i++) {
      final String arg = argList.get(i);
      try {
        if (arg.equals("-s") || arg.equals("--signature")) {
          if (++i >= argList.size()) {
            return usage("missing value for " + arg);
          }
          signatureFile = argList.get(i);
        } else if (arg.startsWith("--signature=")) {
          signatureFile = arg.substring("--signature=".length());
        } else if (arg.equals("-p") || arg.equals("--pretty")) {
          pretty = true;
        } else if (arg.equals("-d") || arg.equals("--debug")) {
          debug = true;
        } else if (arg.equals("--dot")) {
          Prop.OUTPUT.set(propMap, Prop.Output.DOT);
        } else if (arg.equals("--minimize")) {
          Prop.MINIMIZE.set(propMap, true);
        } else if (arg.startsWith("--") && arg.contains("=")) {
          final int eq = arg.indexOf('=');
          Prop.lookup(arg.substring(2, eq))
              .setLenient(propMap, arg.substring(eq + 1));
        } else if (arg.startsWith("-") && !arg.equals("-")) {
          return usage("unknown option " + arg);
        } else if (expr == null) {
          expr = arg.equals("-") ? readAll(in) : arg;
        } else {
          return usage("more than one expression");
        }
      } catch (IllegalArgumentException e) {
        return usage(e.getMessage());
      }
    }
    if (expr == null) {
      return usage("missing expression");
    }

    final Signature signature;
    try {
      signature = signatureFile == null
          ? Signature.empty()
          : Signatures.read(new File(signatureFile));
    } catch (IOException e) {
      out.println("cannot read signature file: " + e.getMessage());
      return USAGE_ERROR;
    } catch (IllegalArgumentException e) {
      out.println(signatureFile + ": " + e.getMessage());
      return USAGE_ERROR;
    }

    try {
      final Ast.Exp exp = HexprParser.parse(expr);
      if (pretty) {
        out.println("Parsed: " + exp);
      }
      final Tracer tracer = debug ? debugTracer() : Tracers.empty();
      final OpenHypergraph<String, String> graph =
          Compiles.compile(exp, signature, propMap, tracer);
      out.print(write(graph, propMap));
      return OK;
    } catch (RuntimeException e) {
      if (!(e instanceof HexprException)) {
        throw e;
      }
      final StringBuilder buf = new StringBuilder();
      ((HexprException) e).describeTo(buf);
      out.println(buf);
      return ERROR;
    }
  }

  /** Creates a tracer that prints the AST and intermediate graphs. */
  private Tracer debugTracer() {
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnAst(tracer, exp -> {
      final StringBuilder buf = new StringBuilder();
      describe(buf, exp, 0);
      out.print("AST:\n" + buf);
    });
    tracer = Tracers.withOnTranslate(tracer, graph ->
        out.print("Translated:\n" + graph));
    tracer = Tracers.withOnInference(tracer, graph ->
        out.print("Inferred:\n" + graph));
    return tracer;
  }

  /** Writes a nested description of an expression, one node per line. */
  static void describe(StringBuilder buf, Ast.Exp exp, int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append("  ");
    }
    switch (exp.op) {
      case COMPOSITION:
      case TENSOR:
        buf.append(exp.op == Op.COMPOSITION ? "Composition" : "Tensor")
            .append('\n');
        for (Ast.Exp arg : ((Ast.ListExp) exp).args) {
          describe(buf, arg, indent + 1);
        }
        break;
      case FROBENIUS:
        final Ast.Frobenius frobenius = (Ast.Frobenius) exp;
        buf.append("Frobenius inputs=").append(frobenius.inputs)
            .append(" outputs=").append(frobenius.outputs).append('\n');
        break;
      default:
        buf.append("Operation ").append(((Ast.Operation) exp).name)
            .append('\n');
    }
  }

  private static String write(OpenHypergraph<String, String> graph,
      Map<Prop, Object> propMap) {
    switch (Prop.OUTPUT.enumValue(propMap, Prop.Output.class)) {
      case DOT:
        return HypergraphWriter.dot(graph,
            Prop.ORIENTATION.enumValue(propMap,
                HypergraphWriter.Orientation.class));
      default:
        return HypergraphWriter.text(graph);
    }
  }

  private int usage(String message) {
    out.println(message);
    out.print(USAGE);
    return USAGE_ERROR;
  }

  private static String readAll(Reader in) {
    try {
      return CharStreams.toString(in);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}

// End Main.java
