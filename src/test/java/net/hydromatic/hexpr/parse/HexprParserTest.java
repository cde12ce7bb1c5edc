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
package net.hydromatic.hexpr.parse;

import static net.hydromatic.hexpr.Hx.hx;
import static net.hydromatic.hexpr.Matchers.describedAs;
import static net.hydromatic.hexpr.Matchers.throwsA;
import static net.hydromatic.hexpr.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.ast.Op;
import net.hydromatic.hexpr.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link HexprParser}. */
public class HexprParserTest {
  @Test void testOperation() {
    hx("add").assertParse("add")
        .assertParse(ast.operation("add"));
    hx("  neg\n").assertParse("neg");
    // Names may contain any character other than white space and delimiters.
    hx("my-op_2").assertParse("my-op_2");
    hx("+").assertParse("+");
    hx("ℝ→ℝ").assertParse("ℝ→ℝ");
  }

  @Test void testComposition() {
    hx("(copy +)").assertParse("(copy +)")
        .assertParse(
            ast.composition(ast.operation("copy"), ast.operation("+")));
    hx("(  f\n\tg   h )").assertParse("(f g h)");
    hx("()").assertParse("()");
    hx("(f)").assertParse("(f)");
    hx("((f g) h)").assertParse("((f g) h)");
  }

  @Test void testTensor() {
    hx("{f g}").assertParse("{f g}")
        .assertParse(ast.tensor(ast.operation("f"), ast.operation("g")));
    hx("{}").assertParse("{}");
    hx("({copy neg} +)").assertParse("({copy neg} +)");
  }

  @Test void testFrobenius() {
    hx("[x y . z]").assertParse("[x y . z]")
        .assertParse(ast.frobenius("x y", "z"));
    hx("[x . x x]").assertParse("[x . x x]");
    hx("[.]").assertParse("[.]");
    hx("[ . x]").assertParse("[. x]");
    hx("[x . ]").assertParse("[x .]");
    hx("[x.y]").assertParse("[x . y]");
    hx("[_ x . _]").assertParse("[_ x . _]")
        .assertParse(ast.frobenius("_ x", "_"));
    // A name that merely starts with an underscore is not anonymous.
    hx("[_x . _x]").assertParse(ast.frobenius("_x", "_x"));
  }

  /** "[x y]" is shorthand for "[x y . x y]". */
  @Test void testIdentityShorthand() {
    hx("[x y]").assertParse("[x y . x y]")
        .assertParse(ast.frobenius("x y", "x y"));
    hx("[]").assertParse("[.]");
  }

  @Test void testNested() {
    final String s =
        "([a b.] { ([.a b] add [acc.]) ([.a acc] mul [result.]) })";
    hx(s).assertParse("([a b .] {([. a b] add [acc .]) "
        + "([. a acc] mul [result .])})");
    final Ast.Exp exp = hx(s).parse();
    assertThat(exp.op, is(Op.COMPOSITION));
    final Ast.Exp tensor = ((Ast.Composition) exp).args.get(1);
    assertThat(tensor, instanceOf(Ast.Tensor.class));
    assertThat(((Ast.Tensor) tensor).args.size(), is(2));
  }

  @Test void testPositions() {
    final Ast.Exp exp = HexprParser.parse("(\n  add neg)");
    assertThat(exp.pos.toString(), is("1.1-2.11"));
    final Ast.Exp add = ((Ast.Composition) exp).args.get(0);
    assertThat(add.pos.toString(), is("2.3-2.6"));
    assertThat(HexprParser.parse("f", "x.hx").pos.toString(), is("x.hx:1.1"));
    // Positions do not take part in equality.
    assertThat(add, is(ast.operation(Pos.ZERO, "add")));
  }

  @Test void testEmpty() {
    hx("").assertParseThrows(
        throwsA(HexprParseException.class, "empty expression"));
    hx(" \n ").assertParseThrows(
        throwsA(HexprParseException.class, "empty expression"));
  }

  @Test void testUnclosed() {
    hx("(").assertParseThrows(
        throwsA(HexprParseException.class,
            "unexpected end of input, expected ')'"));
    hx("{f (g").assertParseThrows(
        throwsA(HexprParseException.class,
            "unexpected end of input, expected ')'"));
    hx("{f").assertParseThrows(
        throwsA(HexprParseException.class,
            "unexpected end of input, expected '}'"));
    hx("[x . y").assertParseThrows(
        throwsA(HexprParseException.class,
            "unexpected end of input, expected ']'"));
  }

  /** An error at end of input points at the last character, or at 1.1 if
   * there is none. */
  @Test void testEndOfInputPosition() {
    hx("").assertParseThrows(describedAs("1.1 Error: empty expression"));
    hx(" \n ").assertParseThrows(describedAs("2.1 Error: empty expression"));
    hx("(").assertParseThrows(
        describedAs("1.1 Error: unexpected end of input, expected ')'"));
    hx("(f").assertParseThrows(
        describedAs("1.2 Error: unexpected end of input, expected ')'"));
    hx("{f ").assertParseThrows(
        describedAs("1.3 Error: unexpected end of input, expected '}'"));
  }

  @Test void testUnexpected() {
    hx(")").assertParseThrows(describedAs("1.1 Error: unexpected ')'"));
    hx("(f))").assertParseThrows(describedAs("1.4 Error: unexpected ')'"));
    hx("(f}").assertParseThrows(describedAs("1.3 Error: unexpected '}'"));
    hx("(f ])").assertParseThrows(describedAs("1.4 Error: unexpected ']'"));
    hx("f g").assertParseThrows(describedAs("1.3 Error: unexpected 'g'"));
    hx(".").assertParseThrows(
        throwsA(HexprParseException.class, "unexpected '.'"));
    hx("[x (f)]").assertParseThrows(
        throwsA(HexprParseException.class, "unexpected '('"));
  }

  @Test void testTwoDots() {
    hx("[x . y . z]").assertParseThrows(
        describedAs("1.8 Error: unexpected '.'"));
  }

  @Test void testAnonymousOutsideFrobenius() {
    hx("_").assertParseThrows(
        throwsA(HexprParseException.class,
            "anonymous variable outside of frobenius"));
    hx("(f _)").assertParseThrows(
        describedAs("1.4 Error: anonymous variable outside of frobenius"));
  }
}

// End HexprParserTest.java
