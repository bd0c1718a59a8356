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

import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.stage.SValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during staging. */
public interface Tracer {
  /** Called when an expression has been staged. */
  void onStage(Expr e, SValue value);

  /** Called when a binding is materialized as a "let" in residual
   * code. */
  void onMaterialize(String name, Expr residual);

  /** Called when a call to a recursive function is residualized instead of
   * being unfolded again. */
  void onRecursion(String name);

  /** Called when a function is specialized for a call site. */
  void onSpecialize(String name, String specializedName, Expr body);

  /** Called on the result of staging. */
  void onResult(SValue value);

  /**
   * Called with the exception thrown during staging, or null if no exception
   * was thrown. Returns whether a handler was found.
   */
  boolean onException(@Nullable Throwable e);
}

// End Tracer.java
