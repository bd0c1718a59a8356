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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Expr.Literal literal) {}

  protected void visit(Expr.Id id) {}

  protected void visit(Expr.Binary binary) {
    binary.a0.accept(this);
    binary.a1.accept(this);
  }

  protected void visit(Expr.Unary unary) {
    unary.a.accept(this);
  }

  protected void visit(Expr.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Expr.Let let) {
    let.value.accept(this);
    let.body.accept(this);
  }

  protected void visit(Expr.LetPattern letPattern) {
    letPattern.pat.accept(this);
    letPattern.value.accept(this);
    letPattern.body.accept(this);
  }

  protected void visit(Expr.LetRec letRec) {
    letRec.fns.forEach(this::accept);
    letRec.body.accept(this);
  }

  protected void visit(Expr.Fn fn) {
    fn.body.accept(this);
  }

  protected void visit(Expr.Call call) {
    call.fn.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Expr.MethodCall methodCall) {
    methodCall.receiver.accept(this);
    methodCall.args.forEach(this::accept);
  }

  protected void visit(Expr.ObjectLit objectLit) {
    objectLit.fields.values().forEach(this::accept);
  }

  protected void visit(Expr.Field field) {
    field.receiver.accept(this);
  }

  protected void visit(Expr.ArrayLit arrayLit) {
    arrayLit.elements.forEach(this::accept);
  }

  protected void visit(Expr.Index index) {
    index.array.accept(this);
    index.index.accept(this);
  }

  protected void visit(Expr.Block block) {
    block.exprs.forEach(this::accept);
  }

  // staging annotations

  protected void visit(Expr.Comptime comptime) {
    comptime.expr.accept(this);
  }

  protected void visit(Expr.Runtime runtime) {
    runtime.expr.accept(this);
  }

  protected void visit(Expr.Assert anAssert) {
    anAssert.value.accept(this);
    anAssert.type.accept(this);
  }

  protected void visit(Expr.AssertCond assertCond) {
    assertCond.condition.accept(this);
  }

  protected void visit(Expr.Trust trust) {
    trust.value.accept(this);
    if (trust.type != null) {
      trust.type.accept(this);
    }
  }

  protected void visit(Expr.TypeOf typeOf) {
    typeOf.expr.accept(this);
  }

  protected void visit(Expr.Import anImport) {
    anImport.body.accept(this);
  }

  // patterns

  protected void visit(Expr.VarPat varPat) {}

  protected void visit(Expr.ArrayPat arrayPat) {
    arrayPat.elements.forEach(this::accept);
  }

  protected void visit(Expr.ObjectPat objectPat) {
    objectPat.fields.values().forEach(this::accept);
  }
}

// End Visitor.java
