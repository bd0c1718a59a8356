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

import static net.hydromatic.stager.Matchers.throwsA;
import static net.hydromatic.stager.Staging.staging;
import static net.hydromatic.stager.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Op;
import net.hydromatic.stager.compile.AssertionFailedException;
import net.hydromatic.stager.compile.StagingException;
import net.hydromatic.stager.compile.Tracers;
import net.hydromatic.stager.compile.TypeException;
import net.hydromatic.stager.compile.UnboundVariableException;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.Prop;
import net.hydromatic.stager.eval.Session;
import net.hydromatic.stager.foreign.MapDeclarationLoader;
import net.hydromatic.stager.foreign.Signature;
import org.junit.jupiter.api.Test;

/** Tests for {@link Stager}. */
public class StagerTest {
  static Expr num(double d) {
    return expr.numberLiteral(d);
  }

  static Expr str(String s) {
    return expr.stringLiteral(s);
  }

  static Expr id(String name) {
    return expr.id(name);
  }

  static Expr rt(Expr e) {
    return expr.runtime(e);
  }

  static Expr call(String fn, Expr... args) {
    return expr.call(id(fn), args);
  }

  /** Module "m" exports "v", a number or a string, and "id", a generic
   * function of one argument. */
  static final MapDeclarationLoader LOADER =
      MapDeclarationLoader.builder()
          .add("m", "v",
              Signature.value(
                  Constraints.or(Constraints.NUMBER, Constraints.STRING)))
          .add("m", "id", Signature.genericFunction(1, 1))
          .add("lib", "version", Signature.value(Constraints.STRING))
          .build();

  @Test void testLiteral() {
    staging(num(5))
        .assertValue(is("5"))
        .assertConstraint(is("5"));
    staging(str("a\"b"))
        .assertValue(is("\"a\\\"b\""));
    staging(expr.nullLiteral())
        .assertValue(is("null"));
  }

  @Test void testArithmeticFolds() {
    staging(expr.plus(num(1), expr.times(num(2), num(3))))
        .assertValue(is("7"))
        .assertConstraint(is("7"));
    staging(expr.plus(str("a"), str("b")))
        .assertValue(is("\"ab\""));
    staging(expr.binary(Op.DIVIDE, num(7), num(2)))
        .assertValue(is("3.5"));
    staging(expr.unary(Op.NEGATE, num(2)))
        .assertValue(is("-2"));
  }

  @Test void testRuntime() {
    staging(expr.plus(rt(num(5)), num(3)))
        .assertLater()
        .assertResidual(is("rt0 + 3"))
        .assertConstraint(is("8"));
    staging(expr.plus(expr.runtime("x", num(5)), num(3)))
        .assertResidual(is("x + 3"));
    staging(expr.plus(rt(num(1)), rt(num(2))))
        .assertResidual(is("rt0 + rt1"));
  }

  /** Each call to {@link Stager#stage(Expr)} forgets names generated by
   * the previous call. */
  @Test void testStageTwice() {
    final Stager stager =
        new Stager(new Session(), Tracers.empty(),
            MapDeclarationLoader.empty());
    final Expr e = expr.plus(rt(num(1)), num(1));
    assertThat(stager.residualOf(stager.stage(e)).toString(),
        is("rt0 + 1"));
    assertThat(stager.residualOf(stager.stage(e)).toString(),
        is("rt0 + 1"));
  }

  @Test void testComptime() {
    staging(expr.comptime(expr.plus(num(1), num(2))))
        .assertValue(is("3"));
    final String message = "comptime expression evaluated to runtime "
        + "value. Expression: runtime(5) + 3, Constraint: 8";
    staging(expr.comptime(expr.plus(rt(num(5)), num(3))))
        .assertStageThrows(throwsA(StagingException.class, is(message)));
  }

  /** The branch not taken is not staged, so its {@code comptime} does not
   * fail. */
  @Test void testDeadBranch() {
    staging(
        expr.ifThenElse(expr.boolLiteral(true), num(1),
            expr.comptime(rt(num(1)))))
        .assertValue(is("1"));
    staging(
        expr.binary(Op.ANDALSO, expr.boolLiteral(false),
            expr.comptime(rt(expr.boolLiteral(true)))))
        .assertValue(is("false"));
    staging(
        expr.binary(Op.ORELSE, expr.boolLiteral(true),
            expr.comptime(rt(expr.boolLiteral(true)))))
        .assertValue(is("true"));

    // An unbound variable in the branch not taken is not an error
    staging(
        expr.ifThenElse(expr.boolLiteral(true), num(42),
            id("undefinedName")))
        .assertValue(is("42"));
  }

  @Test void testIfLater() {
    staging(expr.ifThenElse(rt(expr.boolLiteral(true)), num(1), num(2)))
        .assertResidual(is("if rt0 then 1 else 2"))
        .assertConstraint(is("1 | 2"));
    staging(expr.ifThenElse(num(1), num(1), num(2)))
        .assertStageThrows(
            throwsA(TypeException.class,
                is("Type error in if condition: expected boolean, got 1")));
  }

  @Test void testLet() {
    staging(expr.let("x", num(5), expr.times(id("x"), num(2))))
        .assertValue(is("10"));
    staging(
        expr.let("x", rt(num(5)), expr.plus(id("x"), id("x"))))
        .assertResidual(is("let x = rt0 in x + x"));
    // Unused, so the binding is dropped
    staging(expr.let("x", rt(num(1)), num(2)))
        .assertValue(is("2"));
  }

  /** A binding whose residual is a bare variable is kept, so that an
   * inner binding of the same name does not capture the use. */
  @Test void testLetOfVariableNotCopied() {
    final Expr e =
        expr.let("a", expr.runtime("x", num(1)),
            expr.let("x", expr.plus(rt(num(2)), num(1)),
                expr.plus(id("a"), id("x"))));
    staging(e)
        .assertResidual(is("let a = x in let x = rt0 + 1 in a + x"));
  }

  @Test void testLetMaterializeTrace() {
    final List<String> names = new ArrayList<>();
    staging(expr.let("x", rt(num(5)), expr.plus(id("x"), id("x"))))
        .withTracer(
            Tracers.withOnMaterialize(Tracers.empty(),
                (name, residual) -> names.add(name + " = " + residual)))
        .assertLater();
    assertThat(names, is(ImmutableList.of("x = rt0")));
  }

  @Test void testLetCompound() {
    final Expr o = expr.object(ImmutableMap.of("a", num(1)));
    staging(
        expr.let("o", o, expr.array(id("o"), rt(num(2)))))
        .assertResidual(is("let o = { a: 1 } in [o, rt0]"));
    // Only a field is used; the object is not needed at run time
    staging(
        expr.let("o", o,
            expr.array(expr.field(id("o"), "a"), rt(num(2)))))
        .assertResidual(is("[1, rt0]"));
  }

  @Test void testLaterArray() {
    final Expr a = expr.array(rt(num(1)), num(2));
    staging(expr.let("a", a, expr.index(id("a"), num(1))))
        .assertValue(is("2"));
    staging(expr.let("a", a, expr.index(id("a"), num(0))))
        .assertResidual(is("rt0"));
    staging(expr.field(a, "length"))
        .assertValue(is("2"));
  }

  /** An element that is expensive to compute is computed once, in the
   * array, and read from the array where it is used. */
  @Test void testLaterArrayElementMaterialized() {
    final Expr a = expr.array(expr.plus(rt(num(1)), num(1)), num(2));
    final Expr a0 = expr.index(id("a"), num(0));
    staging(expr.let("a", a, expr.times(a0, a0)))
        .assertResidual(is("let a = [rt0 + 1, 2] in a[0] * a[0]"))
        .assertConstraint(is("4"));
  }

  @Test void testIndex() {
    staging(expr.index(expr.array(num(1), num(2)), num(1)))
        .assertValue(is("2"));
    staging(expr.index(expr.array(num(1), num(2)), num(5)))
        .assertStageThrows(
            throwsA(TypeException.class,
                is("Type error in array index: expected "
                    + "number & >= 0 & < 2, got 5")));
    staging(expr.index(expr.array(num(1), num(2)), rt(num(0))))
        .assertResidual(is("[1, 2][rt0]"));
  }

  @Test void testField() {
    final Expr o =
        expr.object(ImmutableMap.of("a", num(1), "b", str("x")));
    staging(expr.field(o, "b"))
        .assertValue(is("\"x\""));
    staging(expr.field(expr.object(ImmutableMap.of("a", num(1))), "c"))
        .assertStageThrows(
            throwsA(TypeException.class,
                is("Type error in field access .c: expected { c: any }, "
                    + "got { a: 1 }")));
    staging(expr.field(rt(expr.object(ImmutableMap.of("a", num(1)))), "a"))
        .assertLater()
        .assertResidual(is("rt0.a"))
        .assertConstraint(is("1"));
  }

  @Test void testLength() {
    staging(expr.field(str("abc"), "length"))
        .assertValue(is("3"));
    staging(expr.field(rt(str("abc")), "length"))
        .assertResidual(is("rt0.length"))
        .assertConstraint(is("number & >= 0"));
  }

  @Test void testMethodCall() {
    staging(expr.methodCall(str("abc"), "toUpperCase", ImmutableList.of()))
        .assertValue(is("\"ABC\""));
    staging(
        expr.methodCall(rt(str("abc")), "toUpperCase", ImmutableList.of()))
        .assertResidual(is("rt0.toUpperCase()"));
    staging(expr.methodCall(num(5), "foo", ImmutableList.of()))
        .assertStageThrows(
            throwsA(TypeException.class,
                is("Type error in method call .foo(): "
                    + "expected { foo: function }, got 5")));
  }

  @Test void testMap() {
    final Expr times10 =
        expr.fn(ImmutableList.of("x"), expr.times(id("x"), num(10)));
    staging(
        expr.methodCall(expr.array(num(1), num(2)), "map",
            ImmutableList.of(times10)))
        .assertValue(is("[10, 20]"));
    final Expr odd =
        expr.fn(ImmutableList.of("x"),
            expr.eq(expr.binary(Op.MOD, id("x"), num(2)), num(1)));
    staging(
        expr.methodCall(expr.array(num(1), num(2), num(3)), "filter",
            ImmutableList.of(odd)))
        .assertValue(is("[1, 3]"));
  }

  /** In the branch where {@code isNumber(v)} holds, "v" is a number; in the
   * other branch it is a string. */
  @Test void testRefinement() {
    final Expr e =
        expr.ifThenElse(call("isNumber", id("v")),
            expr.plus(id("v"), num(1)),
            expr.field(id("v"), "length"));
    staging(expr.importFrom(ImmutableList.of("v"), "m", e))
        .withLoader(LOADER)
        .assertResidual(
            is("import { v } from \"m\" in "
                + "if isNumber(v) then v + 1 else v.length"));
    staging(
        expr.importFrom(ImmutableList.of("v"), "m",
            expr.plus(id("v"), num(1))))
        .withLoader(LOADER)
        .assertStageThrows(
            throwsA(TypeException.class,
                is("Type error in left of +: expected number, "
                    + "got number | string")));
  }

  /** In the branch where {@code x <= 1} holds, a variable known to be 5
   * has no possible value. */
  @Test void testRefinementContradiction() {
    final Expr e =
        expr.let("x", rt(num(5)),
            expr.ifThenElse(expr.binary(Op.LE, id("x"), num(1)),
                id("x"), num(0)));
    staging(e)
        .assertResidual(is("let x = rt0 in if x <= 1 then x else 0"));
  }

  @Test void testInlineClosure() {
    final Expr f =
        expr.fn(ImmutableList.of("x"), expr.times(id("x"), num(2)));
    staging(expr.let("f", f, call("f", num(3))))
        .assertValue(is("6"));
    staging(expr.let("f", f, call("f", rt(num(3)))))
        .assertResidual(is("let f = fn(x) => x * 2 in f(rt0)"))
        .assertConstraint(is("6"));
    staging(expr.let("f", f, call("f", num(1), num(2))))
        .assertStageThrows(
            throwsA(TypeException.class,
                is("Type error in call to <fn(x)>: "
                    + "expected length(1), got length(2)")));
  }

  @Test void testUnboundVariable() {
    staging(expr.plus(id("y"), num(1)))
        .assertStageThrows(
            throwsA(UnboundVariableException.class,
                is("Unbound variable: y")));
  }

  /** A recursive call while the function is being staged is not unfolded;
   * its result is trusted to be a number. */
  @Test void testRecursion() {
    final Expr body =
        expr.ifThenElse(expr.binary(Op.LE, id("n"), num(1)),
            num(1),
            expr.times(id("n"),
                expr.trust(call("fact", expr.minus(id("n"), num(1))),
                    id("number"))));
    final Expr.Fn fact = expr.fn("fact", ImmutableList.of("n"), body);
    staging(expr.letRec(ImmutableList.of(fact), call("fact", num(5))))
        .assertValue(is("120"));

    final List<String> recursions = new ArrayList<>();
    staging(expr.letRec(ImmutableList.of(fact), call("fact", rt(num(5)))))
        .withTracer(
            Tracers.withOnRecursion(Tracers.empty(), recursions::add))
        .assertResidual(is("fact(rt0)"))
        .assertProgram(
            is("let rec fact = fn(n) => "
                + "if n <= 1 then 1 else n * fact(n - 1);\n"
                + "fn(rt0) => fact(rt0)"));
    assertThat(recursions, hasItem("fact"));

    staging(expr.letRec(ImmutableList.of(fact), call("fact", num(20))))
        .withProp(Prop.MAX_RECURSION_DEPTH, 10)
        .assertStageThrows(
            throwsA(StagingException.class,
                is("maximum recursion depth 10 exceeded while staging")));
  }

  /** With the default maximum depth, a program that recurses moderately
   * deeply at compile time stages, and one that recurses too deeply fails
   * with an error rather than overflowing the stack. */
  @Test void testDefaultRecursionDepth() {
    final Expr.Fn count =
        expr.fn("count", ImmutableList.of("n"),
            expr.ifThenElse(expr.binary(Op.LE, id("n"), num(0)),
                num(0),
                expr.plus(num(1),
                    call("count", expr.minus(id("n"), num(1))))));
    staging(expr.letRec(ImmutableList.of(count), call("count", num(50))))
        .assertValue(is("50"));
    staging(expr.letRec(ImmutableList.of(count), call("count", num(500))))
        .assertStageThrows(
            throwsA(StagingException.class,
                is("maximum recursion depth 100 exceeded while staging")));
  }

  /** After a run fails in the middle of staging a function body, no
   * function is left in progress, and the next run starts afresh. */
  @Test void testStateAfterFailure() {
    final Stager stager =
        new Stager(new Session(), Tracers.empty(),
            MapDeclarationLoader.empty());
    final Expr.Fn f =
        expr.fn("f", ImmutableList.of("n"),
            expr.plus(id("n"), id("undefinedName")));
    final Expr e =
        expr.letRec(ImmutableList.of(f),
            expr.plus(rt(num(1)), call("f", rt(num(2)))));
    final UnboundVariableException ex =
        assertThrows(UnboundVariableException.class, () -> stager.stage(e));
    assertThat(ex.getMessage(), is("Unbound variable: undefinedName"));
    assertThat(stager.session.inProgress.isEmpty(), is(true));
    assertThat(stager.session.depth(), is(0));

    // A function with a compile-time parameter fails while specialized
    final Expr.Fn g =
        expr.fn("g", ImmutableList.of("n"), expr.comptime(id("n")));
    final Expr e2 =
        expr.letRec(ImmutableList.of(g), call("g", rt(num(3))));
    assertThrows(StagingException.class, () -> stager.stage(e2));
    assertThat(stager.session.inProgress.isEmpty(), is(true));
    assertThat(stager.session.depth(), is(0));
    stager.session.pendingSpecializations.values()
        .forEach(pending -> assertThat(pending.isEmpty(), is(true)));

    final Expr e3 = expr.plus(rt(num(1)), num(1));
    assertThat(stager.residualOf(stager.stage(e3)).toString(),
        is("rt0 + 1"));
  }

  @Test void testLetPattern() {
    final Expr e =
        expr.letPattern(expr.arrayPat(expr.varPat("a"), expr.varPat("b")),
            expr.array(num(1), rt(num(2))),
            expr.plus(id("a"), id("b")));
    staging(e)
        .assertResidual(is("let [a, b] = [1, rt0] in 1 + b"))
        .assertConstraint(is("3"));
    final Expr e2 =
        expr.letPattern(
            expr.objectPat(ImmutableMap.of("x", expr.varPat("x"))),
            expr.object(ImmutableMap.of("x", num(3))),
            expr.plus(id("x"), num(1)));
    staging(e2)
        .assertValue(is("4"));
    final Expr e3 =
        expr.letPattern(
            expr.arrayPat(expr.varPat("a"), expr.varPat("b"),
                expr.varPat("c")),
            expr.array(num(1), num(2)),
            id("a"));
    staging(e3)
        .assertStageThrows(
            throwsA(TypeException.class, containsString("array pattern")));
  }

  @Test void testAssert() {
    staging(expr.assertType(num(5), id("number"), null))
        .assertValue(is("5"));
    staging(expr.assertType(str("s"), id("number"), null))
        .assertStageThrows(
            throwsA(AssertionFailedException.class,
                is("Assertion failed: value \"s\" does not satisfy "
                    + "number")));
    staging(expr.assertType(str("s"), id("number"), "need a number"))
        .assertStageThrows(
            throwsA(AssertionFailedException.class, is("need a number")));
    staging(expr.assertType(rt(num(5)), id("number"), null))
        .assertLater()
        .assertResidual(is("assert(rt0, number)"));
  }

  @Test void testAssertCondition() {
    staging(expr.assertCond(expr.lt(num(1), num(2)), null))
        .assertValue(is("true"));
    staging(expr.assertCond(expr.lt(num(2), num(1)), null))
        .assertStageThrows(
            throwsA(AssertionFailedException.class,
                is("Assertion failed: condition is false")));
    staging(expr.assertCond(expr.lt(rt(num(1)), num(2)), null))
        .assertResidual(is("assert(rt0 < 2)"));
  }

  @Test void testTrust() {
    final Expr e =
        expr.importFrom(ImmutableList.of("v"), "m",
            expr.plus(expr.trust(id("v"), id("number")), num(1)));
    staging(e)
        .withLoader(LOADER)
        .assertResidual(is("import { v } from \"m\" in v + 1"))
        .assertConstraint(is("number"));
  }

  @Test void testTypeOf() {
    staging(expr.typeOf(rt(num(5))))
        .assertConstraint(is("Type<5>"));
    staging(call("typeOf", str("a")))
        .assertConstraint(is("Type<\"a\">"));
  }

  @Test void testBlock() {
    staging(expr.block())
        .assertValue(is("null"));
    staging(expr.block(call("print", rt(str("hi"))), num(1)))
        .assertResidual(is("(print(rt0); 1)"));
    staging(expr.block(call("print", str("a"), num(1)), num(2)))
        .assertValue(is("2"))
        .assertOutput(is(ImmutableList.of("a 1")));
  }

  @Test void testImport() {
    staging(
        expr.importFrom(ImmutableList.of("version"), "lib",
            expr.plus(id("version"), str("!"))))
        .withLoader(LOADER)
        .assertResidual(is("import { version } from \"lib\" in "
            + "version + \"!\""))
        .assertConstraint(is("string"));
    staging(expr.importFrom(ImmutableList.of("nope"), "lib", num(1)))
        .withLoader(LOADER)
        .assertStageThrows(
            throwsA(StagingException.class,
                is("Module \"lib\" has no export named \"nope\"")));
    // The body does not use the import
    staging(expr.importFrom(ImmutableList.of("version"), "lib", num(1)))
        .withLoader(LOADER)
        .assertValue(is("1"));
  }

  @Test void testImportGenericFunction() {
    staging(
        expr.importFrom(ImmutableList.of("id"), "m",
            call("id", rt(num(5)))))
        .withLoader(LOADER)
        .assertResidual(is("import { id } from \"m\" in id(rt0)"));
  }
}

// End StagerTest.java
