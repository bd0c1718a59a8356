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
package net.hydromatic.stager.compile;

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.stage.RefinementContext;
import net.hydromatic.stager.stage.SEnv;
import net.hydromatic.stager.stage.SValue;

/** What a staged built-in function may see of the staging engine.
 *
 * @see BuiltIn#handler */
public interface StagedBuiltInContext {
  /** Environment at the call site. */
  SEnv env();

  /** Refinements in force at the call site. */
  RefinementContext refinements();

  /** Calls a function value (a closure or a built-in) with staged
   * arguments. */
  SValue invoke(SValue fn, List<SValue> args);

  /** Converts a value that is known now to an expression. */
  Expr valueToExpr(Object value);

  /** Returns the expression that computes a staged value. */
  Expr residualOf(SValue value);

  SValue.Now now(Object value, Constraint constraint);

  SValue.Later later(Constraint constraint, Expr residual);

  /** Where "print" writes. */
  Consumer<String> out();
}

// End StagedBuiltInContext.java
