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
import static net.hydromatic.stager.stage.StagerTest.str;
import static org.hamcrest.CoreMatchers.everyItem;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Op;
import net.hydromatic.stager.compile.Tracers;
import net.hydromatic.stager.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests for {@link Specializer}. */
public class SpecializerTest {
  /** "fn(t, x) => if comptime(t) == "num" then x * 2 else x + "!"". */
  private static final Expr.Fn BY_TAG =
      expr.fn(ImmutableList.of("t", "x"),
          expr.ifThenElse(expr.eq(expr.comptime(id("t")), str("num")),
              expr.times(id("x"), num(2)),
              expr.plus(id("x"), str("!"))));

  /** "fn(k, x) => x * comptime(k)". */
  private static final Expr.Fn SCALE =
      expr.fn(ImmutableList.of("k", "x"),
          expr.times(id("x"), expr.comptime(id("k"))));

  @Test void testComptimeParams() {
    assertThat(BY_TAG.comptimeParams, is(ImmutableSet.of("t")));
    assertThat(SCALE.comptimeParams, is(ImmutableSet.of("k")));
    final Expr.Fn typeOf =
        expr.fn(ImmutableList.of("a", "b"),
            expr.block(expr.typeOf(id("b")), id("a")));
    assertThat(typeOf.comptimeParams, is(ImmutableSet.of("b")));
  }

  @Test void testSpecializeByTag() {
    final Expr e =
        expr.let("f", BY_TAG,
            expr.array(call("f", str("num"), rt(num(1))),
                call("f", str("str"), rt(str("a")))));
    staging(e)
        .assertResidual(is("[fn$0(rt0), fn$1(rt1)]"))
        .assertProgram(
            is("let fn$0 = fn(x) => x * 2;\n"
                + "let fn$1 = fn(x) => x + \"!\";\n"
                + "fn(rt0, rt1) => [fn$0(rt0), fn$1(rt1)]"));
  }

  /** Specializations that differ only in a literal are merged into one
   * function that takes the literal as a parameter. */
  @Test void testCluster() {
    final Expr e =
        expr.let("scale", SCALE,
            expr.array(call("scale", num(2), rt(num(1))),
                call("scale", num(3), rt(num(2)))));
    staging(e)
        .assertProgram(
            is("let fn$0 = fn(p$0, x) => x * p$0;\n"
                + "fn(rt0, rt1) => [fn$0(2, rt0), fn$0(3, rt1)]"));
    staging(e)
        .withProp(Prop.CLUSTER, false)
        .assertProgram(
            is("let fn$0 = fn(x) => x * 2;\n"
                + "let fn$1 = fn(x) => x * 3;\n"
                + "fn(rt0, rt1) => [fn$0(rt0), fn$1(rt1)]"));
  }

  /** A second call with the same compile-time arguments reuses the
   * specialization. */
  @Test void testSameKey() {
    final List<String> specialized = new ArrayList<>();
    final Expr e =
        expr.let("scale", SCALE,
            expr.array(call("scale", num(2), rt(num(1))),
                call("scale", num(2), rt(num(5)))));
    staging(e)
        .withTracer(
            Tracers.withOnSpecialize(Tracers.empty(),
                (name, name2) -> specialized.add(name + " -> " + name2)))
        .assertResidual(is("[fn$0(rt0), fn$0(rt1)]"));
    assertThat(specialized, is(ImmutableList.of("fn -> fn$0")));
  }

  /** Different compile-time arguments that produce the same body share a
   * specialization. */
  @Test void testSameShape() {
    final List<String> specialized = new ArrayList<>();
    final Expr.Fn g =
        expr.fn(ImmutableList.of("k", "x"),
            expr.block(expr.comptime(id("k")), id("x")));
    final Expr e =
        expr.let("g", g,
            expr.array(call("g", num(1), rt(num(1))),
                call("g", num(2), rt(num(2)))));
    staging(e)
        .withTracer(
            Tracers.withOnSpecialize(Tracers.empty(),
                (name, name2) -> specialized.add(name2)))
        .assertResidual(is("[fn$0(rt0), fn$0(rt1)]"));
    assertThat(specialized, is(ImmutableList.of("fn$0")));
  }

  /** If the specialized body is known now, no function is generated. */
  @Test void testBodyKnownNow() {
    final Expr.Fn f =
        expr.fn(ImmutableList.of("k", "x"),
            expr.plus(expr.comptime(id("k")), num(1)));
    staging(expr.let("f", f, call("f", num(1), rt(num(2)))))
        .assertValue(is("2"));
  }

  /** Each level of recursion on a compile-time argument is a separate
   * function. */
  @Test void testUnrollRecursion() {
    final Expr.Fn pow =
        expr.fn("pow", ImmutableList.of("n", "x"),
            expr.ifThenElse(expr.eq(expr.comptime(id("n")), num(0)),
                num(1),
                expr.times(id("x"),
                    call("pow", expr.minus(id("n"), num(1)), id("x")))));
    final Expr e =
        expr.letRec(ImmutableList.of(pow), call("pow", num(3), rt(num(2))));
    staging(e)
        .assertResidual(is("pow$2(rt0)"))
        .assertProgram(
            is("let pow$0 = fn(x) => x * 1;\n"
                + "let pow$1 = fn(x) => x * pow$0(x);\n"
                + "let pow$2 = fn(x) => x * pow$1(x);\n"
                + "fn(rt0) => pow$2(rt0)"));
  }

  /** A recursive call with the same compile-time arguments calls the
   * specialization that is being generated. */
  @Test void testRecursiveSpecialization() {
    final Expr.Fn loop =
        expr.fn("loop", ImmutableList.of("k", "x"),
            expr.ifThenElse(expr.binary(Op.LE, id("x"), num(0)),
                expr.comptime(id("k")),
                call("loop", id("k"), expr.minus(id("x"), num(1)))));
    final Expr e =
        expr.letRec(ImmutableList.of(loop),
            call("loop", num(7), rt(num(3))));
    final List<String> recursions = new ArrayList<>();
    staging(e)
        .withTracer(
            Tracers.withOnRecursion(Tracers.empty(), recursions::add))
        .assertResidual(is("loop$0(rt0)"))
        .assertProgram(
            is("let rec loop$0 = fn(x) => "
                + "if x <= 0 then 7 else loop$0(x - 1);\n"
                + "fn(rt0) => loop$0(rt0)"));
    // Each staging of the program detects the recursion once
    assertThat(recursions, hasItem("loop$0"));
    assertThat(recursions, everyItem(is("loop$0")));

    // Without specialization, the call is residual and the function is
    // called with its compile-time argument
    staging(e)
        .withProp(Prop.SPECIALIZE, false)
        .assertResidual(is("loop(7, rt0)"));
  }
}

// End SpecializerTest.java
