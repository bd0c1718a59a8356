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

import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static net.hydromatic.stager.constraint.Constraints.OBJECT;
import static net.hydromatic.stager.constraint.Constraints.STRING;
import static net.hydromatic.stager.constraint.Constraints.and;
import static net.hydromatic.stager.constraint.Constraints.gt;
import static net.hydromatic.stager.constraint.Constraints.hasField;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.stager.constraint.Constraints;
import org.junit.jupiter.api.Test;

/** Tests for {@link Values}. */
public class ValuesTest {
  @Test void testToString() {
    assertThat(Values.toString(5d), is("5"));
    assertThat(Values.toString(-0.25d), is("-0.25"));
    assertThat(Values.toString(1e20), is("1.0E20"));
    assertThat(Values.toString(Double.NaN), is("NaN"));
    assertThat(Values.toString("a\nb"), is("\"a\\nb\""));
    assertThat(Values.toString(true), is("true"));
    assertThat(Values.toString(Null.INSTANCE), is("null"));
    assertThat(Values.toString(ImmutableMap.of()), is("{}"));
    assertThat(
        Values.toString(
            ImmutableMap.of("a", 1d, "b", ImmutableList.of("x", false))),
        is("{ a: 1, b: [\"x\", false] }"));
    assertThat(Values.toDisplayString("hi"), is("hi"));
    assertThat(Values.toDisplayString(ImmutableList.of("hi")),
        is("[\"hi\"]"));
  }

  @Test void testConstraintOf() {
    assertThat(Values.constraintOf(5d), hasToString("5"));
    assertThat(Values.constraintOf(Null.INSTANCE), hasToString("null"));
    assertThat(Values.constraintOf(ImmutableMap.of("a", "x")),
        hasToString("{ a: \"x\" }"));
    assertThat(Values.constraintOf(ImmutableList.of(1d, 2d)),
        hasToString("array & length(2) & [0]: 1 & [1]: 2 & 1 | 2[]"));
    assertThat(Values.constraintOf(ImmutableList.of()),
        hasToString("array & length(0)"));
  }

  @Test void testSatisfies() {
    assertThat(Values.satisfies(5d, NUMBER), is(true));
    assertThat(Values.satisfies(5d, STRING), is(false));
    assertThat(Values.satisfies(5d, and(NUMBER, gt(4))), is(true));
    assertThat(Values.satisfies(5d, gt(5)), is(false));
    assertThat(Values.satisfies(ImmutableList.of(), OBJECT), is(true));
    assertThat(
        Values.satisfies(ImmutableMap.of("a", 1d), hasField("a", NUMBER)),
        is(true));
    assertThat(
        Values.satisfies(ImmutableMap.of("a", 1d), hasField("b", NUMBER)),
        is(false));
    assertThat(
        Values.satisfies("abc", Constraints.length(Constraints.equalTo(3))),
        is(true));
    assertThat(Values.satisfies(Null.INSTANCE, Constraints.not(NUMBER)),
        is(true));
    assertThat(Values.satisfies(new TypeValue(NUMBER), Constraints.TYPE),
        is(true));
  }

  @Test void testEqual() {
    assertThat(Values.equal(1d, 1d), is(true));
    assertThat(Values.equal("a", "a"), is(true));
    assertThat(Values.equal(1d, "1"), is(false));
    assertThat(Values.equal(Null.INSTANCE, Null.INSTANCE), is(true));
    assertThat(
        Values.equal(new TypeValue(NUMBER), new TypeValue(NUMBER)),
        is(true));
    // Objects compare by identity
    assertThat(Values.equal(ImmutableMap.of(), ImmutableMap.of("a", 1d)),
        is(false));
  }

  @Test void testIsIndex() {
    assertThat(Values.isIndex(0), is(true));
    assertThat(Values.isIndex(2.5), is(false));
    assertThat(Values.isIndex(-1), is(false));
  }
}

// End ValuesTest.java
