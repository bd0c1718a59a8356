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

import static net.hydromatic.stager.constraint.Constraints.BOOL;
import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stager.ast.Op;
import net.hydromatic.stager.constraint.Constraint;
import org.junit.jupiter.api.Test;

/** Tests for {@link Operator}. */
public class OperatorTest {
  private static Constraint c(Object value) {
    return Values.constraintOf(value);
  }

  @Test void testApply() {
    assertThat(Operator.PLUS.apply(ImmutableList.of(1d, 2d)), is(3d));
    assertThat(Operator.STRING_CONCAT.apply(ImmutableList.of("a", "b")),
        is("ab"));
    assertThat(Operator.MOD.apply(ImmutableList.of(7d, 3d)), is(1d));
    assertThat(Operator.EQ.apply(ImmutableList.of("a", "a")), is(true));
    assertThat(Operator.NE.apply(ImmutableList.of(1d, "1")), is(true));
    assertThat(Operator.NOT.apply(ImmutableList.of(true)), is(false));
    assertThat(Operator.NEGATE.apply(ImmutableList.of(4d)), is(-4d));
  }

  @Test void testOf() {
    assertThat(Operator.of(Op.PLUS), is(Operator.PLUS));
    assertThat(Operator.of(Op.LE), is(Operator.LE));
    assertThat(Operator.of(Op.NOT).params.size(), is(1));
  }

  /** If the operands are literals, the result constraint is the literal
   * that the operator computes. */
  @Test void testResultFolds() {
    assertThat(Operator.PLUS.result(ImmutableList.of(c(5d), c(3d))),
        hasToString("8"));
    assertThat(Operator.LT.result(ImmutableList.of(c(5d), c(3d))),
        hasToString("false"));
    assertThat(
        Operator.STRING_CONCAT.result(ImmutableList.of(c("a"), c("b"))),
        hasToString("\"ab\""));
  }

  @Test void testResultNotFolded() {
    assertThat(Operator.PLUS.result(ImmutableList.of(NUMBER, c(3d))),
        is(NUMBER));
    assertThat(Operator.LT.result(ImmutableList.of(NUMBER, NUMBER)),
        is(BOOL));
    // Division by zero is not folded
    assertThat(Operator.DIVIDE.result(ImmutableList.of(c(1d), c(0d))),
        is(NUMBER));
  }

  /** "false && x" is false whatever x is. */
  @Test void testResultShortCircuit() {
    assertThat(Operator.ANDALSO.result(ImmutableList.of(c(false), BOOL)),
        hasToString("false"));
    assertThat(Operator.ORELSE.result(ImmutableList.of(BOOL, c(true))),
        hasToString("true"));
    assertThat(Operator.ORELSE.result(ImmutableList.of(BOOL, c(false))),
        is(BOOL));
  }
}

// End OperatorTest.java
