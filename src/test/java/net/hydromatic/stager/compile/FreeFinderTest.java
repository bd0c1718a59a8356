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

import static net.hydromatic.stager.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.stager.ast.Expr;
import org.junit.jupiter.api.Test;

/** Tests for {@link FreeFinder}. */
public class FreeFinderTest {
  private static Expr id(String name) {
    return expr.id(name);
  }

  @Test void testSimple() {
    final Expr e = expr.plus(id("x"), expr.times(id("y"), id("x")));
    assertThat(FreeFinder.freeVars(e), hasToString("[x, y]"));
    assertThat(FreeFinder.freeVars(expr.numberLiteral(1)),
        hasToString("[]"));
  }

  @Test void testLet() {
    final Expr e =
        expr.let("x", id("a"), expr.plus(id("x"), id("b")));
    assertThat(FreeFinder.freeVars(e), hasToString("[a, b]"));

    // The value of a "let" is outside the scope of its name
    final Expr e2 = expr.let("x", id("x"), id("x"));
    assertThat(FreeFinder.freeVars(e2), hasToString("[x]"));
  }

  @Test void testFn() {
    final Expr e =
        expr.fn(ImmutableList.of("x"), expr.plus(id("x"), id("y")));
    assertThat(FreeFinder.freeVars(e), hasToString("[y]"));

    // A named function may refer to itself
    final Expr e2 =
        expr.fn("f", ImmutableList.of("n"),
            expr.call(id("f"), expr.minus(id("n"), id("k"))));
    assertThat(FreeFinder.freeVars(e2), hasToString("[k]"));
  }

  @Test void testLetRec() {
    final Expr.Fn even =
        expr.fn("even", ImmutableList.of("n"),
            expr.call(id("odd"), id("n")));
    final Expr.Fn odd =
        expr.fn("odd", ImmutableList.of("n"),
            expr.call(id("even"), id("m")));
    final Expr e =
        expr.letRec(ImmutableList.of(even, odd),
            expr.call(id("even"), id("k")));
    assertThat(FreeFinder.freeVars(e), hasToString("[m, k]"));
  }

  @Test void testPatternAndImport() {
    final Expr e =
        expr.letPattern(
            expr.objectPat(
                ImmutableMap.of("a", expr.varPat("a"),
                    "b", expr.arrayPat(expr.varPat("c")))),
            id("p"),
            expr.plus(expr.plus(id("a"), id("c")), id("d")));
    assertThat(FreeFinder.freeVars(e), hasToString("[p, d]"));

    final Expr e2 =
        expr.importFrom(ImmutableList.of("f"), "m",
            expr.call(id("f"), id("z")));
    assertThat(FreeFinder.freeVars(e2), hasToString("[z]"));
  }

  @Test void testUses() {
    final Expr e =
        expr.let("x", id("a"), expr.plus(id("x"), id("b")));
    assertThat(FreeFinder.usesVar(e, "a"), is(true));
    assertThat(FreeFinder.usesVar(e, "x"), is(false));
    assertThat(FreeFinder.usesAny(e, ImmutableList.of("x", "b")), is(true));
    assertThat(FreeFinder.usesAny(e, ImmutableList.of("x", "y")), is(false));
  }
}

// End FreeFinderTest.java
