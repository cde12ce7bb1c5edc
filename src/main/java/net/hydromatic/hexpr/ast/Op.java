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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // expressions
  COMPOSITION("(", ")"),
  TENSOR("{", "}"),
  FROBENIUS("[", "]"),
  OPERATION,

  // variables
  NAMED_VARIABLE,
  ANONYMOUS_VARIABLE;

  /** Text that precedes the arguments, for example "(" for composition. */
  public final String opening;

  /** Text that follows the arguments, for example ")" for composition. */
  public final String closing;

  Op() {
    this("", "");
  }

  Op(String opening, String closing) {
    this.opening = opening;
    this.closing = closing;
  }
}

// End Op.java
