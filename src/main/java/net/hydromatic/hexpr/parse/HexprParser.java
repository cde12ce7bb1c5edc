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

import java.io.StringReader;
import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.ast.Pos;

/**
 * Parses H-expressions.
 *
 * <p>The grammar, in {@code HexprParser.jj}, is as follows:
 *
 * <pre>
 * program     ::= expr EOF
 * expr        ::= composition | tensor | frobenius | operation
 * composition ::= '(' expr* ')'
 * tensor      ::= '{' expr* '}'
 * frobenius   ::= '[' variable* '.' variable* ']'
 *               | '[' variable* ']'
 * variable    ::= '_' | name
 * operation   ::= name
 * </pre>
 *
 * <p>A name is a run of characters other than white space and the
 * delimiters {@code ( ) { } [ ] .}; so "{@code my-op_2}", "{@code +}" and
 * "{@code ℝ}" are all names. The form "{@code [x y]}" is shorthand for
 * "{@code [x y . x y]}".
 *
 * <p>Errors from the generated parser, {@link HexprParserImpl}, are
 * converted to {@link HexprParseException}.
 */
public abstract class HexprParser {
  private HexprParser() {}

  /** Parses an H-expression. */
  public static Ast.Exp parse(String text) {
    return parse(text, "");
  }

  /**
   * Parses an H-expression, using a given file name in the positions of
   * nodes and errors.
   */
  public static Ast.Exp parse(String text, String file) {
    final HexprParserImpl parser =
        new HexprParserImpl(new StringReader(text));
    parser.setSource(text, file);
    try {
      return parser.program();
    } catch (ParseException e) {
      throw convert(e, text, file);
    }
  }

  /** Converts an error from the generated parser. */
  private static HexprParseException convert(ParseException e, String text,
      String file) {
    final Token token = e.currentToken.next;
    if (token.kind == HexprParserImplConstants.EOF) {
      return new HexprParseException(
          "unexpected end of input" + expectedClosing(e),
          endPos(text, file), e);
    }
    return new HexprParseException("unexpected '" + token.image + "'",
        new Pos(file, token.beginLine, token.beginColumn, token.endLine,
            token.endColumn + 1), e);
  }

  /**
   * Returns ", expected ')'" if the parser was expecting a closing
   * delimiter, otherwise the empty string.
   */
  private static String expectedClosing(ParseException e) {
    for (int[] sequence : e.expectedTokenSequences) {
      switch (sequence[0]) {
        case HexprParserImplConstants.RPAREN:
          return ", expected ')'";
        case HexprParserImplConstants.RBRACE:
          return ", expected '}'";
        case HexprParserImplConstants.RBRACKET:
          return ", expected ']'";
        default:
          break;
      }
    }
    return "";
  }

  /**
   * Returns the position of the last character of a piece of text, or of
   * the first column if the text is empty. Errors at end of input are
   * reported there.
   */
  static Pos endPos(String text, String file) {
    if (text.isEmpty()) {
      return new Pos(file, 1, 1, 1, 2);
    }
    final int end = text.length();
    return Pos.of(text, file, end - 1, end);
  }
}

// End HexprParser.java
