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

import static net.hydromatic.stager.constraint.Constraints.and;
import static net.hydromatic.stager.constraint.Constraints.elementAt;
import static net.hydromatic.stager.constraint.Constraints.elements;
import static net.hydromatic.stager.constraint.Constraints.equalTo;
import static net.hydromatic.stager.constraint.Constraints.hasField;
import static net.hydromatic.stager.constraint.Constraints.isType;
import static net.hydromatic.stager.constraint.Constraints.length;
import static net.hydromatic.stager.constraint.Constraints.or;
import static net.hydromatic.stager.constraint.Constraints.simplify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import net.hydromatic.stager.compile.BuiltIn;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraint.Compound;
import net.hydromatic.stager.constraint.Constraint.ElementAt;
import net.hydromatic.stager.constraint.Constraint.Equals;
import net.hydromatic.stager.constraint.Constraint.HasField;
import net.hydromatic.stager.constraint.Constraint.Wrapper;
import net.hydromatic.stager.constraint.Constraints;

/**
 * Utilities for values.
 *
 * <p>A value is one of the following:
 *
 * <ul>
 *   <li>a number, {@link Double};
 *   <li>a string, {@link String};
 *   <li>a boolean, {@link Boolean};
 *   <li>null, {@link Null#INSTANCE};
 *   <li>an object, {@link ImmutableMap} from field name to value;
 *   <li>an array, {@link ImmutableList} of values;
 *   <li>a function, {@link Closure} or {@link BuiltIn};
 *   <li>a type, {@link TypeValue}.
 * </ul>
 */
public abstract class Values {
  private Values() {}

  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  /** Returns the most precise constraint that a value satisfies. */
  public static Constraint constraintOf(Object value) {
    if (value instanceof Double
        || value instanceof String
        || value instanceof Boolean) {
      return and(Constraints.classificationOfLiteral(value), equalTo(value));
    }
    if (value == Null.INSTANCE) {
      return Constraints.NULL;
    }
    if (value instanceof Map) {
      final List<Constraint> list = new ArrayList<>();
      list.add(Constraints.OBJECT);
      asObject(value).forEach((name, v) ->
          list.add(hasField(name, constraintOf(v))));
      return and(list);
    }
    if (value instanceof List) {
      final List<Object> list = asArray(value);
      return arrayConstraint(
          list.stream().map(Values::constraintOf)
              .collect(Collectors.toList()));
    }
    if (value instanceof Closure || value instanceof BuiltIn) {
      return Constraints.FUNCTION;
    }
    if (value instanceof TypeValue) {
      return isType(((TypeValue) value).constraint);
    }
    throw new IllegalArgumentException("not a value: " + value);
  }

  /** Returns the constraint of an array whose elements have given
   * constraints: its length, each position, and the union of the element
   * constraints. */
  public static Constraint arrayConstraint(List<Constraint> constraints) {
    final List<Constraint> list = new ArrayList<>();
    list.add(Constraints.ARRAY);
    list.add(length(and(Constraints.NUMBER, equalTo(constraints.size()))));
    for (int i = 0; i < constraints.size(); i++) {
      list.add(elementAt(i, constraints.get(i)));
    }
    if (!constraints.isEmpty()) {
      final Set<Constraint> distinct = new LinkedHashSet<>(constraints);
      list.add(elements(simplify(or(ImmutableList.copyOf(distinct)))));
    }
    return and(list);
  }

  /** Returns whether a value satisfies a constraint. */
  public static boolean satisfies(Object value, Constraint c) {
    switch (c.kind) {
    case ANY:
      return true;
    case NEVER:
      return false;
    case IS_NUMBER:
      return value instanceof Double;
    case IS_STRING:
      return value instanceof String;
    case IS_BOOL:
      return value instanceof Boolean;
    case IS_NULL:
      return value == Null.INSTANCE;
    case IS_UNDEFINED:
      return false;
    case IS_OBJECT:
      // Arrays and functions are objects too
      return value instanceof Map
          || value instanceof List
          || isFunction(value);
    case IS_ARRAY:
      return value instanceof List;
    case IS_FUNCTION:
      return isFunction(value);
    case EQUALS:
      return ((Equals) c).value.equals(value);
    case GT:
    case GTE:
    case LT:
    case LTE:
      return value instanceof Double
          && Constraints.implies(equalTo(value), c);
    case HAS_FIELD:
      final HasField hasField = (HasField) c;
      if (!(value instanceof Map)) {
        return false;
      }
      final Object fieldValue = asObject(value).get(hasField.name);
      return fieldValue != null
          && satisfies(fieldValue, hasField.constraint);
    case ELEMENTS:
      return value instanceof List
          && asArray(value).stream()
              .allMatch(e -> satisfies(e, ((Wrapper) c).constraint));
    case LENGTH:
      if (value instanceof List) {
        return satisfies((double) asArray(value).size(),
            ((Wrapper) c).constraint);
      }
      if (value instanceof String) {
        return satisfies((double) ((String) value).length(),
            ((Wrapper) c).constraint);
      }
      return false;
    case ELEMENT_AT:
      final ElementAt elementAt = (ElementAt) c;
      if (!(value instanceof List)) {
        return false;
      }
      final List<Object> list = asArray(value);
      return elementAt.index < list.size()
          && satisfies(list.get(elementAt.index), elementAt.constraint);
    case INDEX:
      // An index signature describes the static shape of an object; every
      // object value conforms to the shape it was built with.
      return value instanceof Map;
    case IS_TYPE:
      return value instanceof TypeValue
          && Constraints.implies(((TypeValue) value).constraint,
              ((Wrapper) c).constraint);
    case AND:
      return ((Compound) c).constraints.stream()
          .allMatch(c2 -> satisfies(value, c2));
    case OR:
      return ((Compound) c).constraints.stream()
          .anyMatch(c2 -> satisfies(value, c2));
    case NOT:
      return !satisfies(value, ((Wrapper) c).constraint);
    default:
      throw new AssertionError(c.kind);
    }
  }

  /** Returns whether a value is a function. */
  public static boolean isFunction(Object value) {
    return value instanceof Closure || value instanceof BuiltIn;
  }

  /** Returns whether a value is an object, array or function. Such values
   * are not duplicated in generated code. */
  public static boolean isCompound(Object value) {
    return value instanceof Map
        || value instanceof List
        || value instanceof Closure;
  }

  /** Returns whether two values are equal, as the "==" operator sees them.
   * Numbers, strings, booleans and null compare by value, types by
   * constraint, and everything else by identity. */
  public static boolean equal(Object v0, Object v1) {
    if (v0 instanceof Double && v1 instanceof Double) {
      return ((Double) v0).doubleValue() == (Double) v1;
    }
    if (v0 instanceof String || v0 instanceof Boolean) {
      return v0.equals(v1);
    }
    if (v0 instanceof TypeValue) {
      return v0.equals(v1);
    }
    return v0 == v1;
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value) {
    return (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  public static List<Object> asArray(Object value) {
    return (List<Object>) value;
  }

  /** Returns whether a number is an integer that fits in an {@code int}. */
  public static boolean isIndex(double d) {
    return d == Math.rint(d) && d >= 0 && d <= Integer.MAX_VALUE;
  }

  /** Converts a value to a string, in the same syntax as literals in
   * source code. For example, "{ a: 1, b: [\"x\"] }". */
  public static String toString(Object value) {
    if (value instanceof Double) {
      return numberToString((Double) value);
    }
    if (value instanceof String) {
      return quote((String) value);
    }
    if (value instanceof Map) {
      final Map<String, Object> map = asObject(value);
      if (map.isEmpty()) {
        return "{}";
      }
      return map.entrySet().stream()
          .map(e -> e.getKey() + ": " + toString(e.getValue()))
          .collect(Collectors.joining(", ", "{ ", " }"));
    }
    if (value instanceof List) {
      return asArray(value).stream()
          .map(Values::toString)
          .collect(Collectors.joining(", ", "[", "]"));
    }
    if (value instanceof BuiltIn) {
      return "<builtin " + ((BuiltIn) value).fnName + ">";
    }
    return value.toString();
  }

  /** Converts a value to the string that the {@code print} builtin
   * writes: strings are unquoted. */
  public static String toDisplayString(Object value) {
    return value instanceof String ? (String) value : toString(value);
  }

  /** Converts a number to a string; integers have no trailing ".0". */
  public static String numberToString(double d) {
    if (Double.isNaN(d)) {
      return "NaN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  /** Converts a string to a double-quoted literal. */
  public static String quote(String s) {
    return "\"" + STRING_ESCAPER.escape(s) + "\"";
  }
}

// End Values.java
