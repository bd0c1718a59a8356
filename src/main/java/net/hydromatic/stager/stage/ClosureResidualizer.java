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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.compile.FreeFinder;
import net.hydromatic.stager.compile.TypeException;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.Closure;

/** Converts a closure to a function literal in residual code.
 *
 * <p>The body is staged with each parameter bound to a value that is not
 * known now, constrained by the arguments of the calls seen so far.
 * Free variables of the function that the closure's environment does not
 * bind are assumed to be defined where the residual code runs.
 *
 * <p>If a parameter has never received an argument and staging the body
 * fails with a type error, the body is emitted as written. */
class ClosureResidualizer {
  private final Stager stager;

  ClosureResidualizer(Stager stager) {
    this.stager = stager;
  }

  Expr.Fn residualize(SValue.StagedClosure fn) {
    final Closure closure = fn.closure();
    final StagingSession session = stager.session;
    final Map<String, SValue> bindings = new LinkedHashMap<>();
    final String name =
        closure.name() == null ? null : session.reference(fn);
    if (closure.name() != null) {
      bindings.put(closure.name(),
          SValue.now(closure, Constraints.FUNCTION));
    }
    final List<String> params = closure.params();
    boolean unconstrained = false;
    for (int i = 0; i < params.size(); i++) {
      final Constraint c = session.paramConstraint(closure, i);
      unconstrained |= c.equals(Constraints.ANY);
      bindings.put(params.get(i), SValue.later(c, expr.id(params.get(i))));
    }
    SEnv env = closure.env();
    for (String v : FreeFinder.freeVars(closure.fn)) {
      if (!env.has(v)) {
        bindings.put(v, SValue.later(Constraints.ANY, expr.id(v)));
      }
    }
    env = env.setAll(bindings);

    // Calls from the body to the function itself are not unfolded
    final boolean mark = name != null && !session.inProgress.containsKey(name);
    if (mark) {
      session.inProgress.put(name, Constraints.ANY);
    }
    session.enter();
    try {
      final SValue body =
          stager.stage(closure.fn.body, env, RefinementContext.EMPTY);
      return expr.fn(name, params, stager.residualOf(body));
    } catch (TypeException e) {
      if (!unconstrained) {
        throw e;
      }
      // A parameter about which nothing is known; emit the source body
      Expr body = closure.fn.body;
      if (name != null && !name.equals(closure.name())) {
        body = expr.let(requireNonNull(closure.name()), expr.id(name), body);
      }
      return expr.fn(name, params, body);
    } finally {
      session.exit();
      if (mark) {
        session.inProgress.remove(name);
      }
    }
  }
}

// End ClosureResidualizer.java
