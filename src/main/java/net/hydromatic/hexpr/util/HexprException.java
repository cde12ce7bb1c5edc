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
package net.hydromatic.hexpr.util;

import net.hydromatic.hexpr.ast.Pos;

/**
 * Exception that has a source position and can describe itself.
 *
 * <p>Every error that the parser, translator or type inference can raise
 * implements this interface.
 */
public interface HexprException {
  /** Returns the position of the expression that caused the error. */
  Pos pos();

  /** Appends a description of this exception to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End HexprException.java
