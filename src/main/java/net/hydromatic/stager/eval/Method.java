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

import static net.hydromatic.stager.constraint.Constraints.ANY;
import static net.hydromatic.stager.constraint.Constraints.ARRAY;
import static net.hydromatic.stager.constraint.Constraints.BOOL;
import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static net.hydromatic.stager.constraint.Constraints.STRING;
import static net.hydromatic.stager.constraint.Constraints.arrayOf;
import static net.hydromatic.stager.constraint.Constraints.elementsConstraint;
import static net.hydromatic.stager.constraint.Constraints.implies;
import static net.hydromatic.stager.constraint.Constraints.or;
import static net.hydromatic.stager.constraint.Constraints.simplify;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import net.hydromatic.stager.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in methods of strings, arrays and numbers.
 *
 * <p>A method is chosen by the constraint of its receiver and by name; see
 * {@link #lookup}. Trailing parameters beyond {@link #required} are
 * optional. */
public enum Method {
  // string methods
  STRING_STARTS_WITH(STRING, "startsWith", ImmutableList.of(STRING), BOOL,
      (s, a) -> str(s).startsWith(str(a.get(0)))),
  STRING_ENDS_WITH(STRING, "endsWith", ImmutableList.of(STRING), BOOL,
      (s, a) -> str(s).endsWith(str(a.get(0)))),
  STRING_INCLUDES(STRING, "includes", ImmutableList.of(STRING), BOOL,
      (s, a) -> str(s).contains(str(a.get(0)))),
  STRING_TO_UPPER_CASE(STRING, "toUpperCase", ImmutableList.of(), STRING,
      (s, a) -> str(s).toUpperCase(Locale.ROOT)),
  STRING_TO_LOWER_CASE(STRING, "toLowerCase", ImmutableList.of(), STRING,
      (s, a) -> str(s).toLowerCase(Locale.ROOT)),
  STRING_TRIM(STRING, "trim", ImmutableList.of(), STRING,
      (s, a) -> str(s).trim()),
  STRING_SLICE(STRING, "slice", ImmutableList.of(NUMBER, NUMBER), 1, STRING,
      (s, a) -> {
        final String string = str(s);
        final int start = clampIndex(a.get(0), string.length());
        final int end = a.size() > 1
            ? clampIndex(a.get(1), string.length())
            : string.length();
        return start < end ? string.substring(start, end) : "";
      }),
  STRING_CHAR_AT(STRING, "charAt", ImmutableList.of(NUMBER), STRING,
      (s, a) -> {
        final double i = num(a.get(0));
        return Values.isIndex(i) && i < str(s).length()
            ? String.valueOf(str(s).charAt((int) i))
            : "";
      }),
  STRING_INDEX_OF(STRING, "indexOf", ImmutableList.of(STRING), NUMBER,
      (s, a) -> (double) str(s).indexOf(str(a.get(0)))),
  STRING_SPLIT(STRING, "split", ImmutableList.of(STRING), arrayOf(STRING),
      (s, a) -> {
        final String separator = str(a.get(0));
        if (separator.isEmpty()) {
          final ImmutableList.Builder<Object> chars = ImmutableList.builder();
          str(s).chars().forEach(c -> chars.add(String.valueOf((char) c)));
          return chars.build();
        }
        return ImmutableList.<Object>copyOf(
            Splitter.on(separator).split(str(s)));
      }),
  STRING_REPLACE(STRING, "replace", ImmutableList.of(STRING, STRING), STRING,
      (s, a) -> {
        final String string = str(s);
        final String search = str(a.get(0));
        final int i = string.indexOf(search);
        return i < 0 ? string
            : string.substring(0, i) + str(a.get(1))
                + string.substring(i + search.length());
      }),
  STRING_REPEAT(STRING, "repeat", ImmutableList.of(NUMBER), STRING,
      (s, a) -> Strings.repeat(str(s), (int) num(a.get(0)))),
  STRING_CONCAT(STRING, "concat", ImmutableList.of(STRING), STRING,
      (s, a) -> str(s) + str(a.get(0))),

  // array methods
  ARRAY_INCLUDES(ARRAY, "includes", ImmutableList.of(ANY), BOOL,
      (s, a) -> indexOf(s, a.get(0)) >= 0),
  ARRAY_JOIN(ARRAY, "join", ImmutableList.of(STRING), 0, STRING,
      (s, a) -> Values.asArray(s).stream()
          .map(Values::toDisplayString)
          .collect(Collectors.joining(a.isEmpty() ? "," : str(a.get(0))))),
  ARRAY_SLICE(ARRAY, "slice", ImmutableList.of(NUMBER, NUMBER), 1, null,
      (s, a) -> {
        final List<Object> list = Values.asArray(s);
        final int start = clampIndex(a.get(0), list.size());
        final int end = a.size() > 1
            ? clampIndex(a.get(1), list.size())
            : list.size();
        return start < end
            ? ImmutableList.copyOf(list.subList(start, end))
            : ImmutableList.of();
      }),
  ARRAY_INDEX_OF(ARRAY, "indexOf", ImmutableList.of(ANY), NUMBER,
      (s, a) -> (double) indexOf(s, a.get(0))),
  ARRAY_REVERSE(ARRAY, "reverse", ImmutableList.of(), null,
      (s, a) -> ImmutableList.copyOf(Values.asArray(s)).reverse()),
  ARRAY_CONCAT(ARRAY, "concat", ImmutableList.of(ARRAY), null,
      (s, a) -> ImmutableList.builder()
          .addAll(Values.asArray(s))
          .addAll(Values.asArray(a.get(0)))
          .build()),

  // number methods
  NUMBER_TO_STRING(NUMBER, "toString", ImmutableList.of(), STRING,
      (s, a) -> Values.numberToString(num(s))),
  NUMBER_TO_FIXED(NUMBER, "toFixed", ImmutableList.of(NUMBER), 0, STRING,
      (s, a) -> BigDecimal.valueOf(num(s))
          .setScale(a.isEmpty() ? 0 : (int) num(a.get(0)),
              RoundingMode.HALF_UP)
          .toPlainString());

  /** Constraint that the receiver must satisfy. */
  public final Constraint receiverType;
  public final String methodName;
  public final ImmutableList<Constraint> params;
  /** Number of required parameters. */
  public final int required;
  private final @Nullable Constraint resultType;
  private final BiFunction<Object, List<Object>, Object> impl;

  Method(Constraint receiverType, String methodName,
      ImmutableList<Constraint> params, @Nullable Constraint resultType,
      BiFunction<Object, List<Object>, Object> impl) {
    this(receiverType, methodName, params, params.size(), resultType, impl);
  }

  /** Creates a method.
   *
   * @param resultType Constraint of the result, or null if the result is
   *   an array whose elements come from the receiver and arguments */
  Method(Constraint receiverType, String methodName,
      ImmutableList<Constraint> params, int required,
      @Nullable Constraint resultType,
      BiFunction<Object, List<Object>, Object> impl) {
    this.receiverType = receiverType;
    this.methodName = methodName;
    this.params = params;
    this.required = required;
    this.resultType = resultType;
    this.impl = impl;
  }

  /** Looks up a method by the constraint of its receiver and its name.
   * Returns null if there is no such method. If nothing is known about
   * the receiver, returns the first method with the name. */
  public static @Nullable Method lookup(Constraint receiver, String name) {
    for (Method method : values()) {
      if (method.methodName.equals(name)
          && implies(receiver, method.receiverType)) {
        return method;
      }
    }
    if (receiver.isAny()) {
      for (Method method : values()) {
        if (method.methodName.equals(name)) {
          return method;
        }
      }
    }
    return null;
  }

  /** Returns whether this method accepts a given number of arguments. */
  public boolean acceptsArity(int argCount) {
    return argCount >= required && argCount <= params.size();
  }

  /** Computes the constraint of the result from the constraints of the
   * receiver and the arguments. */
  public Constraint result(Constraint receiver, List<Constraint> args) {
    if (resultType != null) {
      return resultType;
    }
    // Array methods that rearrange elements of the receiver and arguments
    Constraint element = elementsConstraint(receiver);
    if (this == ARRAY_CONCAT && !args.isEmpty()) {
      element = simplify(or(element, elementsConstraint(args.get(0))));
    }
    return arrayOf(element);
  }

  /** Invokes this method. */
  public Object apply(Object receiver, List<Object> args) {
    return impl.apply(receiver, args);
  }

  private static String str(Object o) {
    return (String) o;
  }

  private static double num(Object o) {
    return (Double) o;
  }

  private static int indexOf(Object array, Object e) {
    final List<Object> list = Values.asArray(array);
    for (int i = 0; i < list.size(); i++) {
      if (Values.equal(list.get(i), e)) {
        return i;
      }
    }
    return -1;
  }

  /** Converts a possibly negative index to an offset in
   * {@code [0, length]}, as {@code slice} does. */
  private static int clampIndex(Object index, int length) {
    final double d = num(index);
    final double i = d < 0 ? Math.max(length + d, 0) : Math.min(d, length);
    return (int) i;
  }
}

// End Method.java
