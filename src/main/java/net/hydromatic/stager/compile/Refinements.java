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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Op;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Extracts flow refinements from the condition of an "if".
 *
 * <p>A refinement is a constraint on a variable that holds in the branch
 * where the condition is true. For example, in the "then" branch of
 * {@code if x > 0 then a else b}, {@code x} satisfies {@code > 0}, and in
 * the "else" branch it satisfies {@code <= 0}.
 *
 * <p>Extraction only looks at the shape of the condition; it does not
 * stage it. */
public abstract class Refinements {
  private Refinements() {}

  /** Returns the refinements that hold when {@code condition} is true. */
  public static ImmutableMap<String, Constraint> extract(Expr condition) {
    switch (condition.op) {
    case LT:
    case LE:
    case GT:
    case GE:
      return comparison((Expr.Binary) condition);

    case EQ:
    case NE:
      return equality((Expr.Binary) condition);

    case ANDALSO:
      final Expr.Binary and = (Expr.Binary) condition;
      return merge(extract(and.a0), extract(and.a1));

    case ORELSE:
      final Expr.Binary or = (Expr.Binary) condition;
      final Map<String, Constraint> left = extract(or.a0);
      final Map<String, Constraint> right = extract(or.a1);
      // Sound only if both sides refine the same, single variable
      if (left.size() == 1 && left.keySet().equals(right.keySet())) {
        final String name = left.keySet().iterator().next();
        return ImmutableMap.of(name,
            Constraints.or(left.get(name), right.get(name)));
      }
      return ImmutableMap.of();

    case NOT:
      return negate(extract(((Expr.Unary) condition).a));

    case APPLY:
      return guard((Expr.Call) condition);

    default:
      return ImmutableMap.of();
    }
  }

  /** Returns the refinements that hold when a condition whose refinements
   * are {@code refinements} is false.
   *
   * <p>If the condition refines more than one variable, we do not know
   * which of them failed, so nothing can be said. */
  public static ImmutableMap<String, Constraint> negate(
      Map<String, Constraint> refinements) {
    if (refinements.size() != 1) {
      return ImmutableMap.of();
    }
    final Map.Entry<String, Constraint> entry =
        refinements.entrySet().iterator().next();
    return ImmutableMap.of(entry.getKey(), negate(entry.getValue()));
  }

  /** Negates a single refinement. */
  public static Constraint negate(Constraint c) {
    switch (c.kind) {
    case GT:
      return Constraints.lte(((Constraint.Bound) c).bound);
    case GTE:
      return Constraints.lt(((Constraint.Bound) c).bound);
    case LT:
      return Constraints.gte(((Constraint.Bound) c).bound);
    case LTE:
      return Constraints.gt(((Constraint.Bound) c).bound);
    case NOT:
      return ((Constraint.Wrapper) c).constraint;
    default:
      return Constraints.not(c);
    }
  }

  /** Merges two sets of refinements; where both refine a variable, the
   * result is the conjunction. */
  public static ImmutableMap<String, Constraint> merge(
      Map<String, Constraint> m0, Map<String, Constraint> m1) {
    final Map<String, Constraint> map = new LinkedHashMap<>(m0);
    m1.forEach((name, c) ->
        map.merge(name, c, (c0, c1) -> Constraints.and(c0, c1)));
    return ImmutableMap.copyOf(map);
  }

  /** Handles "x &lt; 5" and "5 &lt; x". */
  private static ImmutableMap<String, Constraint> comparison(
      Expr.Binary binary) {
    if (binary.a0 instanceof Expr.Id) {
      final Double bound = number(binary.a1);
      if (bound != null) {
        return ImmutableMap.of(((Expr.Id) binary.a0).name,
            bound(binary.op, bound));
      }
    } else if (binary.a1 instanceof Expr.Id) {
      final Double bound = number(binary.a0);
      if (bound != null) {
        return ImmutableMap.of(((Expr.Id) binary.a1).name,
            bound(flip(binary.op), bound));
      }
    }
    return ImmutableMap.of();
  }

  /** Handles "x == v", "x.f == v" and their negations, with the literal on
   * either side. */
  private static ImmutableMap<String, Constraint> equality(
      Expr.Binary binary) {
    Expr e = binary.a0;
    Expr other = binary.a1;
    if (!(other instanceof Expr.Literal)) {
      e = binary.a1;
      other = binary.a0;
    }
    if (!(other instanceof Expr.Literal)) {
      return ImmutableMap.of();
    }
    final Object value = ((Expr.Literal) other).value;
    final Constraint equals = Constraints.equalTo(value);
    final String name;
    final Constraint c;
    if (e instanceof Expr.Id) {
      name = ((Expr.Id) e).name;
      c = equals;
    } else if (e instanceof Expr.Field
        && ((Expr.Field) e).receiver instanceof Expr.Id) {
      final Expr.Field field = (Expr.Field) e;
      name = ((Expr.Id) field.receiver).name;
      c = Constraints.hasField(field.name, equals);
    } else {
      return ImmutableMap.of();
    }
    return ImmutableMap.of(name,
        binary.op == Op.EQ ? c : Constraints.not(c));
  }

  /** Handles a call to a type guard, "isNumber(x)". */
  private static ImmutableMap<String, Constraint> guard(Expr.Call call) {
    if (call.fn instanceof Expr.Id
        && call.args.size() == 1
        && call.args.get(0) instanceof Expr.Id) {
      final BuiltIn builtIn = BuiltIn.guardFor(((Expr.Id) call.fn).name);
      if (builtIn != null && builtIn.guard != null) {
        return ImmutableMap.of(((Expr.Id) call.args.get(0)).name,
            builtIn.guard);
      }
    }
    return ImmutableMap.of();
  }

  private static @Nullable Double number(Expr e) {
    if (e instanceof Expr.Literal
        && ((Expr.Literal) e).value instanceof Double) {
      return (Double) ((Expr.Literal) e).value;
    }
    if (e.op == Op.NEGATE) {
      final Double d = number(((Expr.Unary) e).a);
      return d == null ? null : -d;
    }
    return null;
  }

  private static Constraint bound(Op op, double bound) {
    switch (op) {
    case LT:
      return Constraints.lt(bound);
    case LE:
      return Constraints.lte(bound);
    case GT:
      return Constraints.gt(bound);
    case GE:
      return Constraints.gte(bound);
    default:
      throw new AssertionError(op);
    }
  }

  /** Returns the operator R such that "a op b" iff "b R a". */
  private static Op flip(Op op) {
    switch (op) {
    case LT:
      return Op.GT;
    case LE:
      return Op.GE;
    case GT:
      return Op.LT;
    case GE:
      return Op.LE;
    default:
      throw new AssertionError(op);
    }
  }
}

// End Refinements.java
