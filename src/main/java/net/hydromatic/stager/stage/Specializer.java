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
package net.hydromatic.stager.stage;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.stager.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.compile.FreeFinder;
import net.hydromatic.stager.compile.NameGenerator;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.Closure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Specializes functions for the values of their compile-time parameters.
 *
 * <p>A function's compile-time parameters are those that its body uses in
 * {@code comptime} or {@code typeOf}. When such a function is called with
 * arguments that are not all known now, its body is staged with each
 * compile-time parameter bound to its argument, if the argument is known
 * now, and each other parameter unknown. The result is a new function,
 * named after the original ({@code f$0}, {@code f$1}, ...), that takes
 * the remaining parameters; the call becomes a call to it.
 *
 * <p>Calls with the same arguments share a specialization, and so do
 * calls whose specialized bodies print the same. */
class Specializer {
  private final Stager stager;

  Specializer(Stager stager) {
    this.stager = stager;
  }

  SValue specialize(SValue.StagedClosure fn, List<SValue> args) {
    final Closure closure = fn.closure();
    final StagingSession session = stager.session;
    final String base = closure.name() != null ? closure.name() : "fn";

    // Values of compile-time parameters, and constraints of the others
    final List<Object> key = new ArrayList<>();
    final Map<String, SValue> bindings = new LinkedHashMap<>();
    final List<String> params = new ArrayList<>();
    final List<SValue> remainingArgs = new ArrayList<>();
    if (closure.name() != null) {
      bindings.put(closure.name(),
          SValue.now(closure, Constraints.FUNCTION));
    }
    for (int i = 0; i < args.size(); i++) {
      final String param = closure.params().get(i);
      final SValue arg = args.get(i);
      if (closure.comptimeParams().contains(param) && arg.isNow()) {
        key.add(arg.asNow().value);
        bindings.put(param, SValue.now(arg.asNow().value, arg.constraint));
      } else {
        final Constraint c = Constraints.widen(arg.constraint);
        key.add(c);
        bindings.put(param, SValue.later(c, expr.id(param)));
        params.add(param);
        remainingArgs.add(arg);
      }
    }

    final Map<List<Object>, Pending> pendings =
        session.pendingSpecializations.computeIfAbsent(closure,
            c -> new HashMap<>());
    final Pending pending = pendings.get(key);
    if (pending != null) {
      // Recursive call with the same arguments
      final String name = pending.name(session.nameGenerator);
      session.tracer.onRecursion(name);
      return SValue.later(Constraints.ANY,
          expr.call(expr.id(name), stager.residuals(remainingArgs)));
    }
    final List<Specialization> specializations =
        session.specializations.computeIfAbsent(closure,
            c -> new ArrayList<>());
    for (Specialization specialization : specializations) {
      if (specialization.key.equals(key)) {
        return call(specialization.name, specialization.result,
            remainingArgs);
      }
    }

    final Pending newPending = new Pending(base);
    pendings.put(key, newPending);
    final SValue body;
    try {
      body = stageBody(closure, bindings);
    } finally {
      pendings.remove(key);
    }
    if (body.isNow()
        && body.asNow().residual == null
        && newPending.name == null) {
      // Computed entirely now; no function is needed
      return SValue.now(body.asNow().value, body.constraint);
    }

    final Expr residual = stager.residualOf(body);
    final String shape = expr.fn(params, residual).toString();
    String name = newPending.name;
    if (name == null) {
      for (Specialization specialization : specializations) {
        if (specialization.shape().equals(shape)) {
          name = specialization.name;
          break;
        }
      }
    }
    final boolean isNew = name == null;
    if (name == null) {
      name = newPending.name(session.nameGenerator);
    }
    specializations.add(
        new Specialization(name, key, params, residual, body.constraint));
    if (isNew) {
      session.tracer.onSpecialize(base, name, residual);
    }
    return call(name, body.constraint, remainingArgs);
  }

  private SValue stageBody(Closure closure, Map<String, SValue> bindings) {
    final StagingSession session = stager.session;
    SEnv env = closure.env();
    final Map<String, SValue> free = new LinkedHashMap<>();
    for (String v : FreeFinder.freeVars(closure.fn)) {
      if (!env.has(v)) {
        free.put(v, SValue.later(Constraints.ANY, expr.id(v)));
      }
    }
    env = env.setAll(free).setAll(bindings);
    session.enter();
    try {
      return stager.stage(closure.fn.body, env, RefinementContext.EMPTY);
    } finally {
      session.exit();
    }
  }

  private SValue call(String name, Constraint result, List<SValue> args) {
    return SValue.later(result,
        expr.call(expr.id(name), stager.residuals(args)));
  }

  /** A function specialized for particular values of the compile-time
   * parameters of a closure. */
  static class Specialization {
    final String name;
    /** Values of the compile-time parameters, and constraints of the
     * other parameters. */
    final List<Object> key;
    final ImmutableList<String> params;
    final Expr body;
    /** Constraint of the result. */
    final Constraint result;

    Specialization(String name, List<Object> key, List<String> params,
        Expr body, Constraint result) {
      this.name = requireNonNull(name);
      this.key = ImmutableList.copyOf(key);
      this.params = ImmutableList.copyOf(params);
      this.body = requireNonNull(body);
      this.result = requireNonNull(result);
    }

    @Override public String toString() {
      return name + " = " + shape();
    }

    /** Returns the declaration of the specialized function. */
    Expr.Fn fn() {
      return expr.fn(name, params, body);
    }

    /** Returns the text of the function, without its name. Two
     * specializations with the same shape are the same function. */
    String shape() {
      return expr.fn(params, body).toString();
    }
  }

  /** A specialization whose body is being staged. Its name is allocated
   * when a recursive call first needs it. */
  static class Pending {
    final String base;
    @Nullable String name;

    Pending(String base) {
      this.base = base;
    }

    String name(NameGenerator nameGenerator) {
      if (name == null) {
        name = nameGenerator.get(base + "$");
      }
      return name;
    }
  }
}

// End Specializer.java
