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

import java.util.List;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;

/** Stages calls to named functions whose arguments are not all known.
 *
 * <p>Unfolding such a call could go on forever, because the body calls
 * the function again with arguments that are still not known. So the body
 * is staged once, to learn the constraint of the result, while the
 * function's name is marked as in progress; a nested call to a function
 * in progress becomes a residual call, with an unknown result. Every such
 * call, outer and nested, is residual; the body is emitted once, as a
 * declaration of the function. */
class RecursionCoordinator {
  private final Stager stager;

  RecursionCoordinator(Stager stager) {
    this.stager = stager;
  }

  SValue call(SValue.StagedClosure fn, List<SValue> args) {
    final StagingSession session = stager.session;
    requireNonNull(fn.name());
    final String name =
        session.reference(fn.residual == null ? fn
            : (SValue.StagedClosure) fn.withResidual(null));
    final Expr call = expr.call(expr.id(name), stager.residuals(args));
    final Constraint assumed = session.inProgress.get(name);
    if (assumed != null) {
      session.tracer.onRecursion(name);
      return SValue.later(assumed, call);
    }
    session.inProgress.put(name, Constraints.ANY);
    try {
      final SValue result = stager.stageBody(fn, args);
      return result.isNow()
          ? SValue.now(result.asNow().value, result.constraint, call)
          : SValue.later(result.constraint, call);
    } finally {
      session.inProgress.remove(name);
    }
  }
}

// End RecursionCoordinator.java
