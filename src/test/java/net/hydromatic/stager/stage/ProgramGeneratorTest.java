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

import static net.hydromatic.stager.Staging.staging;
import static net.hydromatic.stager.ast.ExprBuilder.expr;
import static net.hydromatic.stager.stage.StagerTest.call;
import static net.hydromatic.stager.stage.StagerTest.id;
import static net.hydromatic.stager.stage.StagerTest.num;
import static net.hydromatic.stager.stage.StagerTest.rt;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stager.ast.Expr;
import org.junit.jupiter.api.Test;

/** Tests for {@link ProgramGenerator} and {@link ResidualProgram}. */
public class ProgramGeneratorTest {
  /** "let rec isEven = ..., isOdd = ... in isEven(runtime(4))". */
  private static Expr evenOdd() {
    final Expr.Fn isEven =
        expr.fn("isEven", ImmutableList.of("n"),
            expr.ifThenElse(expr.eq(id("n"), num(0)),
                expr.boolLiteral(true),
                call("isOdd", expr.minus(id("n"), num(1)))));
    final Expr.Fn isOdd =
        expr.fn("isOdd", ImmutableList.of("n"),
            expr.ifThenElse(expr.eq(id("n"), num(0)),
                expr.boolLiteral(false),
                call("isEven", expr.minus(id("n"), num(1)))));
    return expr.letRec(ImmutableList.of(isEven, isOdd),
        call("isEven", rt(num(4))));
  }

  @Test void testNoRuntime() {
    staging(expr.plus(num(1), num(2)))
        .assertProgram(is("3"))
        .withProgram(program -> {
          assertThat(program.groups.isEmpty(), is(true));
          assertThat(program.runtimeNames.isEmpty(), is(true));
        });
  }

  @Test void testMutualRecursion() {
    staging(evenOdd())
        .assertResidual(is("isEven(rt0)"))
        .assertProgram(
            is("let rec isEven = fn(n) => "
                + "if n == 0 then true else isOdd(n - 1), "
                + "isOdd = fn(n) => "
                + "if n == 0 then false else isEven(n - 1);\n"
                + "fn(rt0) => isEven(rt0)"))
        .withProgram(program -> {
          assertThat(program.groups.size(), is(1));
          assertThat(program.groups.get(0).recursive, is(true));
          assertThat(program.declaration("isOdd"), notNullValue());
          assertThat(program.declaration("isThree"), nullValue());
          assertThat(program.runtimeNames, hasToString("[rt0]"));
        });
  }

  @Test void testToExpr() {
    staging(evenOdd())
        .withProgram(program ->
            assertThat(program.toExpr(),
                hasToString("let rec isEven = fn(n) => "
                    + "if n == 0 then true else isOdd(n - 1), "
                    + "isOdd = fn(n) => "
                    + "if n == 0 then false else isEven(n - 1) "
                    + "in fn(rt0) => isEven(rt0)")));
  }

  /** A function is declared before the function that calls it. */
  @Test void testDependencyOrder() {
    final Expr.Fn g =
        expr.fn("g", ImmutableList.of("x"), expr.plus(id("x"), num(1)));
    final Expr.Fn f =
        expr.fn("f", ImmutableList.of("x"),
            expr.times(call("g", id("x")), num(2)));
    final Expr e =
        expr.letRec(ImmutableList.of(g),
            expr.letRec(ImmutableList.of(f), call("f", rt(num(1)))));
    staging(e)
        .assertProgram(
            is("let g = fn(x) => x + 1;\n"
                + "let f = fn(x) => g(x) * 2;\n"
                + "fn(rt0) => f(rt0)"))
        .withProgram(program ->
            assertThat(program.toExpr(),
                hasToString("let g = fn(x) => x + 1 in "
                    + "let f = fn(x) => g(x) * 2 in "
                    + "fn(rt0) => f(rt0)")));
  }

  /** A function that is called from several places is declared once. */
  @Test void testSharedDeclaration() {
    final Expr.Fn sq =
        expr.fn("sq", ImmutableList.of("x"), expr.times(id("x"), id("x")));
    final Expr e =
        expr.letRec(ImmutableList.of(sq),
            expr.plus(call("sq", rt(num(3))), call("sq", rt(num(4)))));
    staging(e)
        .assertProgram(
            is("let sq = fn(x) => x * x;\n"
                + "fn(rt0, rt1) => sq(rt0) + sq(rt1)"));
  }

  /** Two functions in different scopes have the same name; the second is
   * declared under a fresh name. */
  @Test void testSameNameInTwoScopes() {
    final Expr.Fn g1 =
        expr.fn("g", ImmutableList.of("x"), expr.plus(id("x"), num(1)));
    final Expr.Fn g2 =
        expr.fn("g", ImmutableList.of("x"), expr.times(id("x"), num(2)));
    final Expr e =
        expr.plus(
            expr.letRec(ImmutableList.of(g1), call("g", rt(num(1)))),
            expr.letRec(ImmutableList.of(g2), call("g", rt(num(2)))));
    staging(e)
        .assertResidual(is("g(rt0) + g_0(rt1)"))
        .assertProgram(
            is("let g = fn(x) => x + 1;\n"
                + "let g_0 = fn(x) => x * 2;\n"
                + "fn(rt0, rt1) => g(rt0) + g_0(rt1)"));
  }

  /** A function that uses a variable bound in the main expression is
   * declared with an extra parameter, and each call passes the
   * variable. */
  @Test void testCapturedVariable() {
    final Expr.Fn f =
        expr.fn("f", ImmutableList.of("x"), expr.plus(id("x"), id("y")));
    final Expr e =
        expr.let("y", expr.plus(rt(num(1)), num(1)),
            expr.letRec(ImmutableList.of(f), call("f", rt(num(2)))));
    staging(e)
        .assertProgram(
            is("let f = fn(x, y) => x + y;\n"
                + "fn(rt0, rt1) => let y = rt0 + 1 in f(rt1, y)"));
  }

  /** A function that calls a function that captures a variable also
   * receives the variable. */
  @Test void testCapturedVariableInCallee() {
    final Expr.Fn g =
        expr.fn("g", ImmutableList.of("x"), expr.plus(id("x"), id("y")));
    final Expr.Fn f =
        expr.fn("f", ImmutableList.of("x"),
            expr.times(call("g", id("x")), num(2)));
    final Expr e =
        expr.let("y", expr.plus(rt(num(1)), num(1)),
            expr.letRec(ImmutableList.of(g),
                expr.letRec(ImmutableList.of(f), call("f", rt(num(2))))));
    staging(e)
        .assertProgram(
            is("let g = fn(x, y) => x + y;\n"
                + "let f = fn(x, y) => g(x, y) * 2;\n"
                + "fn(rt0, rt1) => let y = rt0 + 1 in f(rt1, y)"));
  }

  /** A function that is never called is emitted as written, because
   * nothing is known about its parameter. */
  @Test void testUncalledFunction() {
    staging(expr.fn(ImmutableList.of("x"), expr.plus(id("x"), num(1))))
        .assertProgram(is("fn(x) => x + 1"));
  }
}

// End ProgramGeneratorTest.java
