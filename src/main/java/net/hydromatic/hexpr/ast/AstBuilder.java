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
package net.hydromatic.hexpr.ast;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /** Creates a sequential composition. */
  public Ast.Composition composition(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Composition(pos, ImmutableList.copyOf(args));
  }

  /** Creates a sequential composition, without position. */
  public Ast.Composition composition(Ast.Exp... args) {
    return composition(Pos.ZERO, ImmutableList.copyOf(args));
  }

  /** Creates a parallel placement. */
  public Ast.Tensor tensor(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Tensor(pos, ImmutableList.copyOf(args));
  }

  /** Creates a parallel placement, without position. */
  public Ast.Tensor tensor(Ast.Exp... args) {
    return tensor(Pos.ZERO, ImmutableList.copyOf(args));
  }

  /** Creates a frobenius expression, "{@code [inputs . outputs]}". */
  public Ast.Frobenius frobenius(Pos pos, List<? extends Ast.Variable> inputs,
      List<? extends Ast.Variable> outputs) {
    return new Ast.Frobenius(pos, ImmutableList.copyOf(inputs),
        ImmutableList.copyOf(outputs));
  }

  /**
   * Creates a frobenius expression from two space-separated lists of variable
   * names, without position; for example {@code frobenius("x", "x x")}.
   */
  public Ast.Frobenius frobenius(String inputs, String outputs) {
    return frobenius(Pos.ZERO, variables(inputs), variables(outputs));
  }

  /**
   * Creates the identity shorthand "{@code [x y]}", whose outputs are the same
   * as its inputs.
   */
  public Ast.Frobenius identity(Pos pos, List<? extends Ast.Variable> vars) {
    return frobenius(pos, vars, vars);
  }

  /** Creates an operation. */
  public Ast.Operation operation(Pos pos, String name) {
    return new Ast.Operation(pos, name);
  }

  /** Creates an operation, without position. */
  public Ast.Operation operation(String name) {
    return operation(Pos.ZERO, name);
  }

  /**
   * Creates a variable; "{@code _}" is the anonymous variable, any other name
   * is a named variable.
   */
  public Ast.Variable variable(Pos pos, String name) {
    return name.equals("_")
        ? anonymousVariable(pos)
        : namedVariable(pos, name);
  }

  public Ast.NamedVariable namedVariable(Pos pos, String name) {
    return new Ast.NamedVariable(pos, name);
  }

  public Ast.AnonymousVariable anonymousVariable(Pos pos) {
    return new Ast.AnonymousVariable(pos);
  }

  /** Converts a space-separated list of names to a list of variables. */
  private List<Ast.Variable> variables(String names) {
    final ImmutableList.Builder<Ast.Variable> b = ImmutableList.builder();
    for (String name : WHITESPACE.split(names)) {
      b.add(variable(Pos.ZERO, name));
    }
    return b.build();
  }
}

// End AstBuilder.java
