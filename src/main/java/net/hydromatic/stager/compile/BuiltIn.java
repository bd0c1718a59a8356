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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.stager.ast.ExprBuilder.expr;
import static net.hydromatic.stager.constraint.Constraints.ANY;
import static net.hydromatic.stager.constraint.Constraints.ARRAY;
import static net.hydromatic.stager.constraint.Constraints.BOOL;
import static net.hydromatic.stager.constraint.Constraints.FUNCTION;
import static net.hydromatic.stager.constraint.Constraints.NULL;
import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static net.hydromatic.stager.constraint.Constraints.OBJECT;
import static net.hydromatic.stager.constraint.Constraints.STRING;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.Null;
import net.hydromatic.stager.eval.TypeValue;
import net.hydromatic.stager.eval.Values;
import net.hydromatic.stager.stage.SValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in functions.
 *
 * <p>Each built-in has constraints on its parameters, a function that
 * computes the constraint of its result from the constraints of its
 * arguments, and either a pure implementation, which is applied to values
 * when all arguments are known now, or a staged {@link #handler}, which is
 * applied to staged values and decides for itself what to compute now and
 * what to leave for later. */
public enum BuiltIn {
  /** Function "typeOf", which returns the type of its argument as a value.
   * The result is known now even if the argument is not. */
  TYPE_OF("typeOf", ImmutableList.of(ANY), false, false,
      a -> Constraints.TYPE, null, BuiltIn::typeOf),

  /** Function "print", which writes its arguments, separated by spaces. */
  PRINT("print", ImmutableList.of(ANY), true, false,
      a -> NULL, null, BuiltIn::print),

  /** Method "startsWith", of type "string, string &rarr; boolean". */
  STARTS_WITH("startsWith", ImmutableList.of(STRING, STRING), false, true,
      a -> BOOL, a -> str(a, 0).startsWith(str(a, 1)), null),

  ENDS_WITH("endsWith", ImmutableList.of(STRING, STRING), false, true,
      a -> BOOL, a -> str(a, 0).endsWith(str(a, 1)), null),

  CONTAINS("contains", ImmutableList.of(STRING, STRING), false, true,
      a -> BOOL, a -> str(a, 0).contains(str(a, 1)), null),

  /** Method "map", which applies a function to each element of an
   * array. */
  MAP("map", ImmutableList.of(ARRAY, FUNCTION), false, true,
      a -> Constraints.arrayOf(ANY), null, BuiltIn::map),

  /** Method "filter", which returns the elements of an array for which a
   * function returns true. */
  FILTER("filter", ImmutableList.of(ARRAY, FUNCTION), false, true,
      a -> Constraints.arrayOf(Constraints.elementsConstraint(a.get(0))),
      null, BuiltIn::filter),

  IS_NUMBER("isNumber", NUMBER),
  IS_STRING("isString", STRING),
  IS_BOOL("isBool", BOOL),
  IS_NULL("isNull", NULL),
  IS_OBJECT("isObject", OBJECT),
  IS_ARRAY("isArray", ARRAY),
  IS_FUNCTION("isFunction", FUNCTION);

  /** Name by which the function is bound in the initial environment. */
  public final String fnName;
  public final ImmutableList<Constraint> params;
  /** Whether the last parameter may occur any number of times. */
  public final boolean variadic;
  /** Whether the function may be called as a method of its first
   * argument. */
  public final boolean isMethod;
  /** Computes the constraint of the result from the constraints of the
   * arguments. */
  public final Function<List<Constraint>, Constraint> resultType;
  private final @Nullable Function<List<Object>, Object> impl;
  /** Handler for a built-in whose staging needs more than the values of
   * its arguments; null for a pure built-in. */
  public final @Nullable Handler handler;
  /** For a type guard, the classification it tests; otherwise null. */
  public final @Nullable Constraint guard;

  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.fnName, builtIn);
    }
    BY_NAME = b.build();
  }

  BuiltIn(String fnName, ImmutableList<Constraint> params, boolean variadic,
      boolean isMethod, Function<List<Constraint>, Constraint> resultType,
      @Nullable Function<List<Object>, Object> impl,
      @Nullable Handler handler) {
    this.fnName = requireNonNull(fnName, "fnName");
    this.params = requireNonNull(params, "params");
    this.variadic = variadic;
    this.isMethod = isMethod;
    this.resultType = requireNonNull(resultType, "resultType");
    this.impl = impl;
    this.handler = handler;
    this.guard = null;
    if ((impl == null) == (handler == null)) {
      throw new IllegalArgumentException("need one of impl and handler");
    }
  }

  /** Creates a type guard. */
  BuiltIn(String fnName, Constraint guard) {
    this.fnName = fnName;
    this.params = ImmutableList.of(ANY);
    this.variadic = false;
    this.isMethod = false;
    this.resultType = a -> guardResult(guard, a.get(0));
    this.impl = a -> Values.satisfies(a.get(0), guard);
    this.handler = null;
    this.guard = guard;
  }

  /** Returns the built-in with a given name, or null. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }

  /** Returns the type guard with a given name, or null. */
  public static @Nullable BuiltIn guardFor(String name) {
    final BuiltIn builtIn = BY_NAME.get(name);
    return builtIn != null && builtIn.guard != null ? builtIn : null;
  }

  /** Returns whether this built-in is staged (has a handler) rather than
   * pure. */
  public boolean isStaged() {
    return handler != null;
  }

  /** Checks the number of arguments and their constraints.
   *
   * @throws TypeException if an argument does not satisfy its parameter's
   * constraint, or if there are too few or too many arguments */
  public void checkArgs(List<? extends SValue> args) {
    final int n = args.size();
    if (variadic ? n < params.size() - 1 : n != params.size()) {
      throw new TypeException(
          Constraints.length(Constraints.equalTo(params.size())),
          Constraints.length(Constraints.equalTo(n)),
          "call to " + fnName + "()");
    }
    for (int i = 0; i < n; i++) {
      final Constraint param = params.get(Math.min(i, params.size() - 1));
      final Constraint actual = args.get(i).constraint;
      if (!Constraints.implies(actual, param)) {
        throw new TypeException(param, actual,
            "argument " + i + " of " + fnName + "()");
      }
    }
  }

  /** Applies a pure built-in to values. */
  public Object apply(List<Object> args) {
    if (impl == null) {
      throw new IllegalStateException(fnName + " is staged");
    }
    return impl.apply(args);
  }

  /** Computes the constraint of the result of a call. */
  public Constraint result(List<Constraint> args) {
    return resultType.apply(args);
  }

  @Override public String toString() {
    return "<builtin " + fnName + ">";
  }

  private static Constraint guardResult(Constraint guard, Constraint c) {
    if (Constraints.implies(c, guard)) {
      return Values.constraintOf(true);
    }
    if (Constraints.unify(c, guard).isNever()) {
      return Values.constraintOf(false);
    }
    return BOOL;
  }

  private static String str(List<Object> args, int i) {
    return (String) args.get(i);
  }

  private static SValue typeOf(StagedBuiltInContext cx, List<SValue> args) {
    final Constraint c = args.get(0).constraint;
    return cx.now(new TypeValue(c), Constraints.isType(c));
  }

  private static SValue print(StagedBuiltInContext cx, List<SValue> args) {
    if (SValue.allNow(args)) {
      cx.out().accept(
          args.stream()
              .map(arg -> Values.toDisplayString(arg.asNow().value))
              .collect(Collectors.joining(" ")));
      return cx.now(Null.INSTANCE, NULL);
    }
    return cx.later(NULL,
        expr.call(expr.id(PRINT.fnName), residuals(cx, args)));
  }

  private static SValue map(StagedBuiltInContext cx, List<SValue> args) {
    final SValue array = args.get(0);
    final SValue fn = args.get(1);
    if (array.isNow() && fn.isNow()) {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (Object element : Values.asArray(array.asNow().value)) {
        b.add(invokeNow(cx, fn, element, MAP));
      }
      final List<Object> list = b.build();
      return cx.now(list, Values.constraintOf(list));
    }
    return cx.later(MAP.result(constraints(args)),
        expr.methodCall(cx.residualOf(array), MAP.fnName,
            ImmutableList.of(cx.residualOf(fn))));
  }

  private static SValue filter(StagedBuiltInContext cx, List<SValue> args) {
    final SValue array = args.get(0);
    final SValue fn = args.get(1);
    if (array.isNow() && fn.isNow()) {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (Object element : Values.asArray(array.asNow().value)) {
        final Object keep = invokeNow(cx, fn, element, FILTER);
        if (!(keep instanceof Boolean)) {
          throw new TypeException(BOOL, Values.constraintOf(keep),
              "result of function passed to filter()");
        }
        if ((Boolean) keep) {
          b.add(element);
        }
      }
      final List<Object> list = b.build();
      return cx.now(list, Values.constraintOf(list));
    }
    return cx.later(FILTER.result(constraints(args)),
        expr.methodCall(cx.residualOf(array), FILTER.fnName,
            ImmutableList.of(cx.residualOf(fn))));
  }

  /** Calls a function on an element and requires the result to be known
   * now. */
  private static Object invokeNow(StagedBuiltInContext cx, SValue fn,
      Object element, BuiltIn builtIn) {
    final SValue result =
        cx.invoke(fn,
            ImmutableList.of(cx.now(element, Values.constraintOf(element))));
    if (!result.isNow()) {
      throw new StagingException("function passed to " + builtIn.fnName
          + "() returned a value that is not known at staging time",
          cx.residualOf(result).toString(), result.constraint);
    }
    return result.asNow().value;
  }

  private static List<Expr> residuals(StagedBuiltInContext cx,
      List<SValue> args) {
    final ImmutableList.Builder<Expr> b = ImmutableList.builder();
    args.forEach(arg -> b.add(cx.residualOf(arg)));
    return b.build();
  }

  private static List<Constraint> constraints(List<SValue> args) {
    final ImmutableList.Builder<Constraint> b = ImmutableList.builder();
    args.forEach(arg -> b.add(arg.constraint));
    return b.build();
  }

  /** Implementation of a staged built-in. */
  @FunctionalInterface
  public interface Handler {
    SValue apply(StagedBuiltInContext cx, List<SValue> args);
  }
}

// End BuiltIn.java
