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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.List;
import java.util.Objects;
import net.hydromatic.hexpr.parse.HexprParser;
import org.junit.jupiter.api.Test;

/** Tests for the command-line tool, {@link Main}. */
public class MainTest {
  /** Result of running the tool. */
  private static class Run {
    final int status;
    final String out;

    Run(int status, String out) {
      this.status = status;
      this.out = out;
    }
  }

  private static String signatureFile() {
    final URL url =
        Objects.requireNonNull(MainTest.class.getResource("/signature.json"));
    try {
      return new File(url.toURI()).getPath();
    } catch (URISyntaxException e) {
      throw new RuntimeException(e);
    }
  }

  private static Run runWithInput(String stdin, String... args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final StringWriter sw = new StringWriter();
    final Main main = new Main(argList, new StringReader(stdin), sw);
    final int status = main.run();
    return new Run(status, sw.toString());
  }

  private static Run run(String... args) {
    return runWithInput("", args);
  }

  @Test void testCompile() {
    final Run run = run("-s", signatureFile(), "add");
    assertThat(run.status, is(Main.OK));
    assertThat(run.out,
        is("nodes:\n"
            + "  0 : ℝ\n"
            + "  1 : ℝ\n"
            + "  2 : ℝ\n"
            + "edges:\n"
            + "  add : [0, 1] -> [2]\n"
            + "sources: [0, 1]\n"
            + "targets: [2]\n"));
  }

  @Test void testMinimize() {
    final Run run =
        run("--signature=" + signatureFile(), "--minimize", "(copy +)");
    assertThat(run.status, is(Main.OK));
    assertThat(run.out, containsString("  + : [1, 2] -> [3]\n"));
    assertThat(run.out, containsString("targets: [3]\n"));
  }

  @Test void testDot() {
    final Run run = run("-s", signatureFile(), "--dot", "neg");
    assertThat(run.status, is(Main.OK));
    assertThat(run.out, startsWith("digraph {\n  rankdir=LR;\n"));
    assertThat(run.out, containsString("  e0 [shape=box, label=\"neg\"];\n"));

    final Run run2 =
        run("-s", signatureFile(), "--output=dot", "--orientation=tb", "neg");
    assertThat(run2.out, startsWith("digraph {\n  rankdir=TB;\n"));
  }

  @Test void testStdin() {
    final Run run = runWithInput("(neg neg)", "-s", signatureFile(), "-");
    assertThat(run.status, is(Main.OK));
    assertThat(run.out, containsString("class: [1, 2]\n"));
  }

  @Test void testPretty() {
    final Run run = run("-p", "-s", signatureFile(), "( neg\n[x.x] )");
    assertThat(run.status, is(Main.OK));
    assertThat(run.out, startsWith("Parsed: (neg [x . x])\nnodes:\n"));
  }

  @Test void testDebug() {
    final Run run = run("-d", "-s", signatureFile(), "(copy +)");
    assertThat(run.status, is(Main.OK));
    assertThat(run.out,
        startsWith("AST:\n"
            + "Composition\n"
            + "  Operation copy\n"
            + "  Operation +\n"
            + "Translated:\n"
            + "nodes:\n"));
    assertThat(run.out, containsString("Inferred:\n"));
  }

  @Test void testDescribe() {
    final StringBuilder buf = new StringBuilder();
    Main.describe(buf, HexprParser.parse("{[x . x x] (f {})}"), 0);
    assertThat(buf.toString(),
        is("Tensor\n"
            + "  Frobenius inputs=[x] outputs=[x, x]\n"
            + "  Composition\n"
            + "    Operation f\n"
            + "    Tensor\n"));
  }

  @Test void testCompileErrors() {
    final Run run = run("[x x . x]");
    assertThat(run.status, is(Main.ERROR));
    assertThat(run.out, is("Error: unresolved type for node 0\n"));

    final Run run2 = run(")");
    assertThat(run2.status, is(Main.ERROR));
    assertThat(run2.out, is("1.1 Error: unexpected ')'\n"));

    final Run run3 = run("-s", signatureFile(), "(zero neg)");
    assertThat(run3.status, is(Main.ERROR));
    assertThat(run3.out,
        is("Error: type conflict: cannot unify ℕ with ℝ\n"));
  }

  @Test void testUsageErrors() {
    final Run run = run();
    assertThat(run.status, is(Main.USAGE_ERROR));
    assertThat(run.out, is("missing expression\n" + Main.USAGE));

    assertThat(run("-x", "add").out, startsWith("unknown option -x\n"));
    assertThat(run("a", "b").out, startsWith("more than one expression\n"));
    assertThat(run("-s").out, startsWith("missing value for -s\n"));
    assertThat(run("--color=red", "add").out,
        startsWith("property color not found\n"));
    assertThat(run("--orientation=up", "add").out,
        startsWith("value must be one of: 'LR', 'TB'\n"));

    final Run run2 = run("-s", "no/such/file.json", "add");
    assertThat(run2.status, is(Main.USAGE_ERROR));
    assertThat(run2.out, startsWith("cannot read signature file: "));
  }
}

// End MainTest.java
