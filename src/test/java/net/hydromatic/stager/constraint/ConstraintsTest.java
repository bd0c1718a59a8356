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
package net.hydromatic.stager.constraint;

import static net.hydromatic.stager.constraint.Constraints.ANY;
import static net.hydromatic.stager.constraint.Constraints.ARRAY;
import static net.hydromatic.stager.constraint.Constraints.BOOL;
import static net.hydromatic.stager.constraint.Constraints.FUNCTION;
import static net.hydromatic.stager.constraint.Constraints.NEVER;
import static net.hydromatic.stager.constraint.Constraints.NULL;
import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static net.hydromatic.stager.constraint.Constraints.OBJECT;
import static net.hydromatic.stager.constraint.Constraints.STRING;
import static net.hydromatic.stager.constraint.Constraints.and;
import static net.hydromatic.stager.constraint.Constraints.equalTo;
import static net.hydromatic.stager.constraint.Constraints.gt;
import static net.hydromatic.stager.constraint.Constraints.gte;
import static net.hydromatic.stager.constraint.Constraints.hasField;
import static net.hydromatic.stager.constraint.Constraints.implies;
import static net.hydromatic.stager.constraint.Constraints.index;
import static net.hydromatic.stager.constraint.Constraints.lt;
import static net.hydromatic.stager.constraint.Constraints.lte;
import static net.hydromatic.stager.constraint.Constraints.not;
import static net.hydromatic.stager.constraint.Constraints.or;
import static net.hydromatic.stager.constraint.Constraints.simplify;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link Constraints}. */
public class ConstraintsTest {
  /** Constraint of the number literal {@code d}. */
  private static Constraint num(double d) {
    return and(NUMBER, equalTo(d));
  }

  /** Constraint of the string literal {@code s}. */
  private static Constraint str(String s) {
    return and(STRING, equalTo(s));
  }

  /** Closed object with fields "a" and "b". */
  private static Constraint ab(Constraint a, Constraint b) {
    return and(OBJECT, hasField("a", a), hasField("b", b), index(NEVER));
  }

  @Test void testDescribe() {
    assertThat(num(5), hasToString("5"));
    assertThat(num(2.5), hasToString("2.5"));
    assertThat(str("x"), hasToString("\"x\""));
    assertThat(and(NUMBER, gte(0)), hasToString("number & >= 0"));
    assertThat(or(NUMBER, STRING), hasToString("number | string"));
    assertThat(ab(NUMBER, STRING), hasToString("{ a: number, b: string }"));
    assertThat(and(OBJECT, hasField("a", NUMBER)),
        hasToString("{ a: number }"));
    assertThat(and(OBJECT, hasField("a", NUMBER), index(STRING)),
        hasToString("{ a: number, [string]: string }"));
    assertThat(and(OBJECT, index(NEVER)), hasToString("{ }"));
    assertThat(Constraints.tuple(ImmutableList.of(NUMBER, STRING)),
        hasToString("array & [0]: number & [1]: string & length(2)"));
    assertThat(Constraints.arrayOf(NUMBER), hasToString("array & number[]"));
    assertThat(Constraints.isType(NUMBER), hasToString("Type<number>"));
    assertThat(not(NULL), hasToString("not(null)"));
    assertThat(ANY, hasToString("any"));
    assertThat(NEVER, hasToString("never"));
    assertThat(BOOL, hasToString("boolean"));
  }

  @Test void testSimplify() {
    assertThat(simplify(and(NUMBER, STRING)), is(NEVER));
    assertThat(simplify(and(NUMBER, ANY)), is(NUMBER));
    assertThat(simplify(or(NUMBER, NEVER)), is(NUMBER));
    assertThat(simplify(or(NUMBER, ANY)), is(ANY));
    assertThat(simplify(not(not(NUMBER))), is(NUMBER));
    assertThat(simplify(not(ANY)), is(NEVER));
    assertThat(simplify(and(NUMBER, and(NUMBER, gte(0)))),
        hasToString("number & >= 0"));
    assertThat(simplify(or(NUMBER, or(STRING, NUMBER))),
        hasToString("number | string"));
    // Arrays are objects
    assertThat(simplify(and(OBJECT, ARRAY)), hasToString("object & array"));
  }

  @Test void testSimplifyContradiction() {
    assertThat(simplify(and(gt(5), lt(3))), is(NEVER));
    assertThat(simplify(and(gte(5), lte(5))), hasToString(">= 5 & <= 5"));
    assertThat(simplify(and(gt(5), lte(5))), is(NEVER));
    assertThat(simplify(and(num(5), lt(3))), is(NEVER));
    assertThat(simplify(and(num(5), equalTo(6))), is(NEVER));
    assertThat(simplify(and(str("a"), NUMBER)), is(NEVER));
    assertThat(
        simplify(and(hasField("a", NUMBER), hasField("a", STRING))),
        is(NEVER));
  }

  @Test void testImplies() {
    assertThat(implies(num(5), NUMBER), is(true));
    assertThat(implies(NUMBER, num(5)), is(false));
    assertThat(implies(NEVER, STRING), is(true));
    assertThat(implies(ANY, NUMBER), is(false));
    assertThat(implies(NUMBER, ANY), is(true));
    assertThat(implies(ARRAY, OBJECT), is(true));
    assertThat(implies(FUNCTION, OBJECT), is(true));
    assertThat(implies(OBJECT, ARRAY), is(false));
    assertThat(implies(or(num(1), num(2)), NUMBER), is(true));
    assertThat(implies(or(num(1), STRING), NUMBER), is(false));
    assertThat(implies(NUMBER, or(NUMBER, STRING)), is(true));
    assertThat(implies(num(3), and(NUMBER, gte(0), lt(4))), is(true));
    assertThat(
        implies(ab(num(1), str("x")), and(OBJECT, hasField("a", NUMBER))),
        is(true));
    assertThat(
        implies(ab(num(1), str("x")), and(OBJECT, hasField("b", NUMBER))),
        is(false));
  }

  @Test void testImpliesBounds() {
    assertThat(implies(gt(5), gt(3)), is(true));
    assertThat(implies(gt(5), gte(5)), is(true));
    assertThat(implies(gte(5), gt(5)), is(false));
    assertThat(implies(lt(3), lte(3)), is(true));
    assertThat(implies(lte(3), lt(3)), is(false));
    assertThat(implies(and(NUMBER, gte(5), lte(5)), equalTo(5)), is(true));
  }

  @Test void testUnify() {
    assertThat(Constraints.unify(NUMBER, gte(0)),
        hasToString("number & >= 0"));
    assertThat(Constraints.unify(num(5), lte(1)), is(NEVER));
    assertThat(Constraints.unify(ANY, STRING), is(STRING));
  }

  @Test void testNarrow() {
    assertThat(Constraints.narrow(NUMBER, not(NUMBER)), is(NEVER));
    assertThat(Constraints.narrow(STRING, not(NUMBER)), is(STRING));
    assertThat(Constraints.narrow(NUMBER, gt(0)), hasToString("number & > 0"));
    assertThat(Constraints.narrowOr(or(NUMBER, STRING), NUMBER), is(NUMBER));
    assertThat(Constraints.narrowOr(or(NUMBER, STRING, NULL), not(NULL)),
        hasToString("number | string"));
  }

  @Test void testWiden() {
    assertThat(Constraints.widen(num(5)), is(NUMBER));
    assertThat(Constraints.widen(str("a")), is(STRING));
    assertThat(Constraints.widen(and(NUMBER, gte(0))), is(NUMBER));
    assertThat(Constraints.widen(ab(num(1), str("x"))),
        hasToString("{ a: number, b: string }"));
  }

  @Test void testFieldConstraint() {
    final Constraint closed = ab(num(1), STRING);
    assertThat(Constraints.fieldConstraint(closed, "a"), is(num(1)));
    assertThat(Constraints.fieldConstraint(closed, "c"), nullValue());
    assertThat(Constraints.fieldConstraint(OBJECT, "c"), is(ANY));
    assertThat(
        Constraints.fieldConstraint(or(closed, ab(num(2), NUMBER)), "a"),
        hasToString("1 | 2"));
    assertThat(Constraints.fieldNames(closed), hasToString("[a, b]"));
  }

  @Test void testElements() {
    final Constraint tuple =
        Constraints.tuple(ImmutableList.of(NUMBER, STRING));
    assertThat(Constraints.elementConstraint(tuple, 1), is(STRING));
    assertThat(Constraints.elementConstraint(tuple, 2), is(ANY));
    assertThat(Constraints.knownLength(tuple), is(2));
    assertThat(Constraints.knownLength(ARRAY), is(-1));
    assertThat(
        Constraints.elementConstraint(Constraints.arrayOf(BOOL), 7),
        is(BOOL));
  }

  @Test void testLiteralValue() {
    assertThat(Constraints.literalValue(num(5)), is(5d));
    assertThat(Constraints.literalValue(NUMBER), nullValue());
    assertThat(Constraints.classificationOfLiteral("x"), is(STRING));
  }
}

// End ConstraintsTest.java
