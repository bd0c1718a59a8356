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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.stager.constraint.Constraints.ANY;
import static net.hydromatic.stager.constraint.Constraints.BOOL;
import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static net.hydromatic.stager.constraint.Constraints.STRING;
import static net.hydromatic.stager.constraint.Constraints.literalValue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.stager.ast.Op;
import net.hydromatic.stager.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Semantics of the unary and binary operators.
 *
 * <p>Each operator has constraints on its operands, a function that
 * computes the constraint of its result from the constraints of its
 * operands (folding literals), and an implementation. */
public enum Operator {
  TIMES(Op.TIMES, NUMBER, NUMBER, NUMBER,
      a -> num(a, 0) * num(a, 1)),
  DIVIDE(Op.DIVIDE, NUMBER, NUMBER, NUMBER,
      a -> num(a, 0) / num(a, 1)),
  MOD(Op.MOD, NUMBER, NUMBER, NUMBER,
      a -> num(a, 0) % num(a, 1)),
  PLUS(Op.PLUS, NUMBER, NUMBER, NUMBER,
      a -> num(a, 0) + num(a, 1)),
  /** String concatenation, the meaning of "+" when either operand is a
   * string. */
  STRING_CONCAT(Op.PLUS, STRING, STRING, STRING,
      a -> (String) a.get(0) + a.get(1)),
  MINUS(Op.MINUS, NUMBER, NUMBER, NUMBER,
      a -> num(a, 0) - num(a, 1)),
  LT(Op.LT, NUMBER, NUMBER, BOOL,
      a -> num(a, 0) < num(a, 1)),
  LE(Op.LE, NUMBER, NUMBER, BOOL,
      a -> num(a, 0) <= num(a, 1)),
  GT(Op.GT, NUMBER, NUMBER, BOOL,
      a -> num(a, 0) > num(a, 1)),
  GE(Op.GE, NUMBER, NUMBER, BOOL,
      a -> num(a, 0) >= num(a, 1)),
  EQ(Op.EQ, ANY, ANY, BOOL,
      a -> Values.equal(a.get(0), a.get(1))),
  NE(Op.NE, ANY, ANY, BOOL,
      a -> !Values.equal(a.get(0), a.get(1))),
  ANDALSO(Op.ANDALSO, BOOL, BOOL, BOOL,
      a -> bool(a, 0) && bool(a, 1)),
  ORELSE(Op.ORELSE, BOOL, BOOL, BOOL,
      a -> bool(a, 0) || bool(a, 1)),
  NEGATE(Op.NEGATE, NUMBER, null, NUMBER,
      a -> -num(a, 0)),
  NOT(Op.NOT, BOOL, null, BOOL,
      a -> !bool(a, 0));

  public final Op op;
  /** Constraints that the operands must satisfy. */
  public final ImmutableList<Constraint> params;
  /** Constraint of the result, when operands are not literals. */
  public final Constraint resultType;
  private final Function<List<Object>, Object> impl;

  Operator(Op op, Constraint param0, @Nullable Constraint param1,
      Constraint resultType, Function<List<Object>, Object> impl) {
    this.op = op;
    this.params = param1 == null
        ? ImmutableList.of(param0)
        : ImmutableList.of(param0, param1);
    this.resultType = resultType;
    this.impl = impl;
  }

  /** Returns the operator for an {@link Op}. For "+", returns the numeric
   * operator; see {@link #STRING_CONCAT}. */
  public static Operator of(Op op) {
    for (Operator operator : values()) {
      if (operator.op == op) {
        return operator;
      }
    }
    throw new IllegalArgumentException("not an operator: " + op);
  }

  /** Applies this operator to values. */
  public Object apply(List<Object> args) {
    checkArgument(args.size() == params.size(), "wrong arity");
    return impl.apply(args);
  }

  /** Computes the constraint of the result, given the constraints of the
   * operands. If the operands are literals, folds them. */
  public Constraint result(List<Constraint> args) {
    final List<@Nullable Object> literals = new ArrayList<>();
    for (Constraint arg : args) {
      literals.add(literalValue(arg));
    }
    switch (this) {
    case DIVIDE:
    case MOD:
      // Do not fold division by zero
      if (Double.valueOf(0d).equals(literals.get(1))
          || Double.valueOf(-0d).equals(literals.get(1))) {
        return resultType;
      }
      break;
    case ANDALSO:
      // "false && x" and "x && false" are false
      if (Boolean.FALSE.equals(literals.get(0))
          || Boolean.FALSE.equals(literals.get(1))) {
        return Values.constraintOf(false);
      }
      break;
    case ORELSE:
      if (Boolean.TRUE.equals(literals.get(0))
          || Boolean.TRUE.equals(literals.get(1))) {
        return Values.constraintOf(true);
      }
      break;
    default:
      break;
    }
    for (int i = 0; i < literals.size(); i++) {
      final Object literal = literals.get(i);
      if (literal == null || !Values.satisfies(literal, params.get(i))) {
        return resultType;
      }
    }
    return Values.constraintOf(apply(literals));
  }

  private static double num(List<Object> args, int i) {
    return (Double) args.get(i);
  }

  private static boolean bool(List<Object> args, int i) {
    return (Boolean) args.get(i);
  }
}

// End Operator.java
