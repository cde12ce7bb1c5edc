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

import net.hydromatic.hexpr.ast.Ast;
import net.hydromatic.hexpr.graph.OpenHypergraph;
import net.hydromatic.hexpr.type.ObjectLabel;
import net.hydromatic.hexpr.util.HexprException;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when an expression has been parsed. */
  void onAst(Ast.Exp exp);

  /** Called when an expression has been translated to a graph. */
  void onTranslate(OpenHypergraph<ObjectLabel, String> graph);

  /** Called when type inference has rewritten the labels of a graph. */
  void onInference(OpenHypergraph<ObjectLabel, String> graph);

  /** Called with the final, fully resolved graph. */
  void onResult(OpenHypergraph<String, String> graph);

  /**
   * Called with an exception thrown during parsing, translation or type
   * inference. The exception is re-thrown after this method returns.
   */
  void onException(HexprException e);
}

// End Tracer.java
