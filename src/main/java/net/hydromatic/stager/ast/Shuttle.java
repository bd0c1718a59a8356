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
import java.util.List;
import java.util.Map;

/** Visits and transforms syntax trees. */
public class Shuttle {
  protected ImmutableList<Expr> visitList(List<Expr> nodes) {
    final ImmutableList.Builder<Expr> list = ImmutableList.builder();
    for (Expr node : nodes) {
      list.add(node.accept(this));
    }
    return list.build();
  }

  protected <K> ImmutableMap<K, Expr> visitMap(Map<K, Expr> nodes) {
    final ImmutableMap.Builder<K, Expr> map = ImmutableMap.builder();
    nodes.forEach((k, v) -> map.put(k, v.accept(this)));
    return map.build();
  }

  // expressions

  protected Expr visit(Expr.Literal literal) {
    return literal;
  }

  protected Expr visit(Expr.Id id) {
    return id;
  }

  protected Expr visit(Expr.Binary binary) {
    return binary.copy(binary.a0.accept(this), binary.a1.accept(this));
  }

  protected Expr visit(Expr.Unary unary) {
    return unary.copy(unary.a.accept(this));
  }

  protected Expr visit(Expr.If anIf) {
    return anIf.copy(anIf.condition.accept(this), anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  protected Expr visit(Expr.Let let) {
    return let.copy(let.value.accept(this), let.body.accept(this));
  }

  protected Expr visit(Expr.LetPattern letPattern) {
    return letPattern.copy(letPattern.value.accept(this),
        letPattern.body.accept(this));
  }

  protected Expr visit(Expr.LetRec letRec) {
    final ImmutableList.Builder<Expr.Fn> fns = ImmutableList.builder();
    letRec.fns.forEach(fn -> fns.add((Expr.Fn) fn.accept(this)));
    return letRec.copy(fns.build(), letRec.body.accept(this));
  }

  protected Expr visit(Expr.Fn fn) {
    return fn.copy(fn.body.accept(this));
  }

  protected Expr visit(Expr.Call call) {
    return call.copy(call.fn.accept(this), visitList(call.args));
  }

  protected Expr visit(Expr.MethodCall methodCall) {
    return methodCall.copy(methodCall.receiver.accept(this),
        visitList(methodCall.args));
  }

  protected Expr visit(Expr.ObjectLit objectLit) {
    return objectLit.copy(visitMap(objectLit.fields));
  }

  protected Expr visit(Expr.Field field) {
    return field.copy(field.receiver.accept(this));
  }

  protected Expr visit(Expr.ArrayLit arrayLit) {
    return arrayLit.copy(visitList(arrayLit.elements));
  }

  protected Expr visit(Expr.Index index) {
    return index.copy(index.array.accept(this), index.index.accept(this));
  }

  protected Expr visit(Expr.Block block) {
    return block.copy(visitList(block.exprs));
  }

  // staging annotations

  protected Expr visit(Expr.Comptime comptime) {
    return comptime.copy(comptime.expr.accept(this));
  }

  protected Expr visit(Expr.Runtime runtime) {
    return runtime.copy(runtime.expr.accept(this));
  }

  protected Expr visit(Expr.Assert anAssert) {
    return anAssert.copy(anAssert.value.accept(this),
        anAssert.type.accept(this));
  }

  protected Expr visit(Expr.AssertCond assertCond) {
    return assertCond.copy(assertCond.condition.accept(this));
  }

  protected Expr visit(Expr.Trust trust) {
    return trust.copy(trust.value.accept(this),
        trust.type == null ? null : trust.type.accept(this));
  }

  protected Expr visit(Expr.TypeOf typeOf) {
    return typeOf.copy(typeOf.expr.accept(this));
  }

  protected Expr visit(Expr.Import anImport) {
    return anImport.copy(anImport.body.accept(this));
  }
}

// End Shuttle.java
