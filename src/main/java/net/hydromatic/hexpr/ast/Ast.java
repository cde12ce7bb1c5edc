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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /**
   * Base class for an expression, which describes a string diagram.
   *
   * <p>Equality is structural and ignores positions.
   */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Base class of {@link Composition} and {@link Tensor}. */
  public abstract static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, Op op, ImmutableList<Exp> args) {
      super(pos, op);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp
              && op == ((ListExp) o).op
              && args.equals(((ListExp) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(op.opening).spaced(args).append(op.closing);
    }
  }

  /**
   * Sequential composition of diagrams, written "{@code (f g h)}". The outputs
   * of each diagram are wired to the inputs of the next.
   */
  public static class Composition extends ListExp {
    Composition(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.COMPOSITION, args);
    }
  }

  /**
   * Parallel placement of diagrams, written "{@code {f g h}}". The diagrams
   * do not interact.
   */
  public static class Tensor extends ListExp {
    Tensor(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TENSOR, args);
    }
  }

  /**
   * Wiring by variable names, written "{@code [x y . y x]}".
   *
   * <p>Each variable becomes a wire; repeated names are the same wire, so
   * this one construct expresses copy, merge, discard, create and swap.
   */
  public static class Frobenius extends Exp {
    public final List<Variable> inputs;
    public final List<Variable> outputs;

    Frobenius(Pos pos, ImmutableList<Variable> inputs,
        ImmutableList<Variable> outputs) {
      super(pos, Op.FROBENIUS);
      this.inputs = requireNonNull(inputs);
      this.outputs = requireNonNull(outputs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(inputs, outputs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Frobenius
              && inputs.equals(((Frobenius) o).inputs)
              && outputs.equals(((Frobenius) o).outputs);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(op.opening).spaced(inputs);
      w.append(inputs.isEmpty() ? "." : " .");
      if (!outputs.isEmpty()) {
        w.append(" ").spaced(outputs);
      }
      return w.append(op.closing);
    }
  }

  /** Application of a named primitive operation, for example "{@code add}". */
  public static class Operation extends Exp {
    public final String name;

    Operation(Pos pos, String name) {
      super(pos, Op.OPERATION);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty operation name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Operation && name.equals(((Operation) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name);
    }
  }

  /** Variable in a {@link Frobenius} expression. */
  public abstract static class Variable extends AstNode {
    Variable(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Named variable, for example "x" in "{@code [x . x x]}". */
  public static class NamedVariable extends Variable {
    public final String name;

    NamedVariable(Pos pos, String name) {
      super(pos, Op.NAMED_VARIABLE);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty() && !name.equals("_"),
          "invalid variable name '%s'", name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NamedVariable
              && name.equals(((NamedVariable) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name);
    }
  }

  /**
   * Anonymous variable, written "{@code _}". Each occurrence is a distinct
   * wire.
   */
  public static class AnonymousVariable extends Variable {
    AnonymousVariable(Pos pos) {
      super(pos, Op.ANONYMOUS_VARIABLE);
    }

    @Override
    public int hashCode() {
      return "_".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof AnonymousVariable;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("_");
    }
  }
}

// End Ast.java
