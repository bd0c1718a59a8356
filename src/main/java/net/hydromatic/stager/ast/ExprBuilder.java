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
package net.hydromatic.stager.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.stager.eval.Null;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum ExprBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  expr;

  // literals

  public Expr.Literal numberLiteral(double value) {
    return new Expr.Literal(value);
  }

  public Expr.Literal stringLiteral(String value) {
    return new Expr.Literal(value);
  }

  public Expr.Literal boolLiteral(boolean value) {
    return new Expr.Literal(value);
  }

  public Expr.Literal nullLiteral() {
    return new Expr.Literal(Null.INSTANCE);
  }

  /** Creates a literal from a {@link Double}, {@link String},
   * {@link Boolean} or {@link Null}. */
  public Expr.Literal literal(Object value) {
    return new Expr.Literal(value);
  }

  public Expr.Id id(String name) {
    return new Expr.Id(name);
  }

  // operators

  public Expr.Binary binary(Op op, Expr a0, Expr a1) {
    return new Expr.Binary(op, a0, a1);
  }

  public Expr.Binary plus(Expr a0, Expr a1) {
    return binary(Op.PLUS, a0, a1);
  }

  public Expr.Binary minus(Expr a0, Expr a1) {
    return binary(Op.MINUS, a0, a1);
  }

  public Expr.Binary times(Expr a0, Expr a1) {
    return binary(Op.TIMES, a0, a1);
  }

  public Expr.Binary lt(Expr a0, Expr a1) {
    return binary(Op.LT, a0, a1);
  }

  public Expr.Binary eq(Expr a0, Expr a1) {
    return binary(Op.EQ, a0, a1);
  }

  public Expr.Unary unary(Op op, Expr a) {
    return new Expr.Unary(op, a);
  }

  public Expr.Unary not(Expr a) {
    return unary(Op.NOT, a);
  }

  // control

  public Expr.If ifThenElse(Expr condition, Expr ifTrue, Expr ifFalse) {
    return new Expr.If(condition, ifTrue, ifFalse);
  }

  public Expr.Let let(String name, Expr value, Expr body) {
    return new Expr.Let(name, value, body);
  }

  public Expr.LetPattern letPattern(Expr.Pat pat, Expr value, Expr body) {
    return new Expr.LetPattern(pat, value, body);
  }

  public Expr.LetRec letRec(List<Expr.Fn> fns, Expr body) {
    return new Expr.LetRec(ImmutableList.copyOf(fns), body);
  }

  public Expr.Block block(List<Expr> exprs) {
    return new Expr.Block(ImmutableList.copyOf(exprs));
  }

  public Expr.Block block(Expr... exprs) {
    return block(ImmutableList.copyOf(exprs));
  }

  // functions

  /** Creates an anonymous function. */
  public Expr.Fn fn(List<String> params, Expr body) {
    return fn(null, params, body);
  }

  /** Creates a function, named if {@code name} is not null. */
  public Expr.Fn fn(@Nullable String name, List<String> params, Expr body) {
    final ImmutableList<String> paramList = ImmutableList.copyOf(params);
    return new Expr.Fn(name, paramList, body,
        comptimeParams(paramList, body));
  }

  public Expr.Call call(Expr fn, List<Expr> args) {
    return new Expr.Call(fn, ImmutableList.copyOf(args));
  }

  public Expr.Call call(Expr fn, Expr... args) {
    return call(fn, ImmutableList.copyOf(args));
  }

  public Expr.MethodCall methodCall(Expr receiver, String method,
      List<Expr> args) {
    return new Expr.MethodCall(receiver, method, ImmutableList.copyOf(args));
  }

  // data

  public Expr.ObjectLit object(Map<String, Expr> fields) {
    return new Expr.ObjectLit(ImmutableMap.copyOf(fields));
  }

  public Expr.Field field(Expr receiver, String name) {
    return new Expr.Field(receiver, name);
  }

  public Expr.ArrayLit array(List<Expr> elements) {
    return new Expr.ArrayLit(ImmutableList.copyOf(elements));
  }

  public Expr.ArrayLit array(Expr... elements) {
    return array(ImmutableList.copyOf(elements));
  }

  public Expr.Index index(Expr array, Expr index) {
    return new Expr.Index(array, index);
  }

  // staging annotations

  public Expr.Comptime comptime(Expr e) {
    return new Expr.Comptime(e);
  }

  public Expr.Runtime runtime(Expr e) {
    return new Expr.Runtime(e, null);
  }

  public Expr.Runtime runtime(@Nullable String name, Expr e) {
    return new Expr.Runtime(e, name);
  }

  public Expr.Assert assertType(Expr value, Expr type,
      @Nullable String message) {
    return new Expr.Assert(value, type, message);
  }

  public Expr.AssertCond assertCond(Expr condition,
      @Nullable String message) {
    return new Expr.AssertCond(condition, message);
  }

  public Expr.Trust trust(Expr value, @Nullable Expr type) {
    return new Expr.Trust(value, type);
  }

  public Expr.TypeOf typeOf(Expr e) {
    return new Expr.TypeOf(e);
  }

  public Expr.Import importFrom(List<String> names, String module,
      Expr body) {
    return new Expr.Import(ImmutableList.copyOf(names), module, body);
  }

  // patterns

  public Expr.VarPat varPat(String name) {
    return new Expr.VarPat(name);
  }

  public Expr.ArrayPat arrayPat(List<Expr.Pat> elements) {
    return new Expr.ArrayPat(ImmutableList.copyOf(elements));
  }

  public Expr.ArrayPat arrayPat(Expr.Pat... elements) {
    return arrayPat(ImmutableList.copyOf(elements));
  }

  public Expr.ObjectPat objectPat(Map<String, Expr.Pat> fields) {
    return new Expr.ObjectPat(ImmutableMap.copyOf(fields));
  }

  /** Returns the parameters that occur inside a {@code comptime} or
   * {@code typeOf} in a function body. */
  private static ImmutableSet<String> comptimeParams(List<String> params,
      Expr body) {
    final Set<String> found = new LinkedHashSet<>();
    body.accept(
        new Visitor() {
          int depth = 0;

          @Override protected void visit(Expr.Id id) {
            if (depth > 0 && params.contains(id.name)) {
              found.add(id.name);
            }
          }

          @Override protected void visit(Expr.Comptime comptime) {
            ++depth;
            super.visit(comptime);
            --depth;
          }

          @Override protected void visit(Expr.TypeOf typeOf) {
            ++depth;
            super.visit(typeOf);
            --depth;
          }
        });
    // Preserve declaration order
    return params.stream()
        .filter(found::contains)
        .collect(ImmutableSet.toImmutableSet());
  }
}

// End ExprBuilder.java
