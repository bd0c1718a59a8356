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
package net.hydromatic.stager.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.function.Supplier;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.stage.SEnv;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Value that is a function literal plus the environment it captured.
 *
 * <p>The body is not staged when the closure is created, only when it is
 * called or residualized.
 *
 * <p>Two closures are equal only if they are the same object. */
public class Closure {
  public final Expr.Fn fn;
  private final Supplier<SEnv> envSupplier;
  /** Names of the other functions in the same recursive group; empty unless
   * the closure was created by "let rec". */
  public final ImmutableList<String> siblings;

  /** Creates a closure over a known environment. */
  public Closure(Expr.Fn fn, SEnv env) {
    this(fn, Suppliers.ofInstance(env), ImmutableList.of());
  }

  /** Creates a closure whose environment is computed on first use; this
   * allows the environment of a recursive group to contain the group's own
   * closures. */
  public Closure(Expr.Fn fn, Supplier<SEnv> envSupplier,
      ImmutableList<String> siblings) {
    this.fn = requireNonNull(fn);
    this.envSupplier = requireNonNull(envSupplier);
    this.siblings = requireNonNull(siblings);
  }

  /** Returns the environment captured when the closure was created. */
  public SEnv env() {
    return envSupplier.get();
  }

  public @Nullable String name() {
    return fn.name;
  }

  public ImmutableList<String> params() {
    return fn.params;
  }

  public ImmutableSet<String> comptimeParams() {
    return fn.comptimeParams;
  }

  @Override public String toString() {
    return "<fn" + (fn.name == null ? "" : " " + fn.name)
        + "(" + String.join(", ", fn.params) + ")>";
  }
}

// End Closure.java
