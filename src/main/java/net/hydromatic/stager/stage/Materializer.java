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

import static net.hydromatic.stager.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.compile.FreeFinder;
import net.hydromatic.stager.eval.Values;

/** Decides whether a binding is copied into each use or becomes a "let"
 * in residual code.
 *
 * <p>A value that is not known now is bound once and used by name, so
 * that the code that computes it runs once. A compound value that is
 * known now (an object, array or function) is bound once and used by
 * name, so that it is not copied. A scalar that is known now is copied.
 *
 * <p>While the body of a binding is staged, the bound name is mapped to a
 * value whose residual is the name; see {@link #bindable}. After the body
 * is staged, {@link #wrap} adds the "let" if the body's residual code
 * needs it. */
class Materializer {
  private final Stager stager;

  Materializer(Stager stager) {
    this.stager = stager;
  }

  /** Returns the value to which {@code name} is bound while the body of its
   * binding is staged. */
  static SValue bindable(String name, SValue value) {
    final Expr id = expr.id(name);
    if (value instanceof SValue.Later) {
      return ((SValue.Later) value).residual.equals(id)
          ? value
          : SValue.later(value.constraint, id);
    }
    if (value instanceof SValue.LaterArray) {
      // Elements that are expensive to copy are read from the array
      final List<SValue> elements = new ArrayList<>();
      boolean changed = false;
      int i = 0;
      for (SValue element : ((SValue.LaterArray) value).elements) {
        final Expr index = expr.index(id, expr.numberLiteral(i++));
        if (isCheap(element)) {
          elements.add(element);
        } else {
          elements.add(element instanceof SValue.Later
              ? SValue.later(element.constraint, index)
              : element.asNow().withResidual(index));
          changed = true;
        }
      }
      return changed
          ? new SValue.LaterArray(ImmutableList.copyOf(elements),
              value.constraint)
          : value;
    }
    final SValue.Now now = value.asNow();
    if (isNamedClosure(now) || isCheap(now)) {
      return now;
    }
    return now.withResidual(id);
  }

  /** Returns whether a value can be copied into each use. */
  private static boolean isCheap(SValue value) {
    if (value instanceof SValue.Later) {
      return ((SValue.Later) value).residual.isSimple();
    }
    if (value instanceof SValue.LaterArray) {
      return false;
    }
    final SValue.Now now = value.asNow();
    if (now.residual != null) {
      return now.residual.isSimple();
    }
    return !Values.isCompound(now.value);
  }

  /** Returns whether a value is a named function. Named functions are
   * declared at the top of the residual program, not bound by "let". */
  private static boolean isNamedClosure(SValue.Now now) {
    return now instanceof SValue.StagedClosure
        && ((SValue.StagedClosure) now).name() != null
        && now.residual == null;
  }

  /** Returns whether a binding must appear in residual code.
   *
   * @param name Bound name
   * @param value Value, as staged before binding
   * @param body Body of the binding, as written
   * @param residual Residual code of the staged body */
  static boolean isRequired(String name, SValue value, Expr body,
      Expr residual) {
    if (value instanceof SValue.Later) {
      // Code that computes the value must run once, if at all, whether or
      // not staging removed the uses
      return !((SValue.Later) value).residual.equals(expr.id(name))
          && FreeFinder.usesVar(body, name);
    }
    if (value instanceof SValue.LaterArray) {
      return bindable(name, value) != value
          && FreeFinder.usesVar(body, name);
    }
    final SValue.Now now = value.asNow();
    if (isNamedClosure(now) || isCheap(now)) {
      return false;
    }
    return FreeFinder.usesVar(residual, name);
  }

  /** Wraps the residual code of the body of a binding in a "let" for each
   * name that must be bound. If more than one name is bound, binds them
   * simultaneously with an array pattern, as the parameters of a function
   * are bound.
   *
   * @param names Bound names
   * @param values Values, as staged before binding
   * @param body Body of the binding, as written
   * @param result Staged body */
  SValue wrap(List<String> names, List<SValue> values, Expr body,
      SValue result) {
    if (result.isNow()) {
      // The body does not need the bindings
      return escape(result.asNow(), names);
    }
    final Expr residual = stager.residualOf(result);
    final List<String> boundNames = new ArrayList<>();
    final List<Expr> boundValues = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      final String name = names.get(i);
      final SValue value = values.get(i);
      if (isRequired(name, value, body, residual)) {
        final Expr valueResidual = stager.residualOf(value);
        stager.session.tracer.onMaterialize(name, valueResidual);
        boundNames.add(name);
        boundValues.add(valueResidual);
      }
    }
    switch (boundNames.size()) {
    case 0:
      return result;
    case 1:
      return SValue.later(result.constraint,
          expr.let(boundNames.get(0), boundValues.get(0), residual));
    default:
      final List<Expr.Pat> pats = new ArrayList<>();
      boundNames.forEach(name -> pats.add(expr.varPat(name)));
      return SValue.later(result.constraint,
          expr.letPattern(expr.arrayPat(pats), expr.array(boundValues),
              residual));
    }
  }

  /** Returns a value that is known now and is leaving the scope of some
   * bindings. If its residual refers to any of them, the residual is
   * dropped, and the value will be copied where it is used. */
  static SValue.Now escape(SValue.Now value, Collection<String> names) {
    if (value.residual != null
        && FreeFinder.usesAny(value.residual, names)) {
      return value.withResidual(null);
    }
    return value;
  }
}

// End Materializer.java
