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

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.function.Consumer;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Visitor;

/** Finds free variables in an expression. */
public class FreeFinder extends Visitor {
  final ImmutableSet<String> bound;
  final Consumer<String> consumer;

  protected FreeFinder(ImmutableSet<String> bound,
      Consumer<String> consumer) {
    this.bound = bound;
    this.consumer = consumer;
  }

  /** Finds the free variables in an expression, in order of first
   * occurrence. */
  public static ImmutableSet<String> freeVars(Expr e) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    e.accept(new FreeFinder(ImmutableSet.of(), set::add));
    return set.build();
  }

  /** Returns whether {@code name} occurs free in an expression. */
  public static boolean usesVar(Expr e, String name) {
    return freeVars(e).contains(name);
  }

  /** Returns whether any of {@code names} occurs free in an expression. */
  public static boolean usesAny(Expr e, Collection<String> names) {
    final ImmutableSet<String> freeVars = freeVars(e);
    return names.stream().anyMatch(freeVars::contains);
  }

  /** Returns a finder in which {@code names} are bound. */
  protected FreeFinder push(Iterable<String> names) {
    final ImmutableSet<String> bound2 =
        ImmutableSet.<String>builder().addAll(bound).addAll(names).build();
    return new FreeFinder(bound2, consumer);
  }

  @Override protected void visit(Expr.Id id) {
    if (!bound.contains(id.name)) {
      consumer.accept(id.name);
    }
  }

  @Override protected void visit(Expr.Let let) {
    let.value.accept(this);
    let.body.accept(push(ImmutableSet.of(let.name)));
  }

  @Override protected void visit(Expr.LetPattern letPattern) {
    letPattern.value.accept(this);
    letPattern.body.accept(push(letPattern.pat.vars()));
  }

  @Override protected void visit(Expr.LetRec letRec) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    letRec.fns.forEach(fn -> names.add(fn.name));
    final FreeFinder finder = push(names.build());
    letRec.fns.forEach(fn -> fn.accept(finder));
    letRec.body.accept(finder);
  }

  @Override protected void visit(Expr.Fn fn) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    names.addAll(fn.params);
    if (fn.name != null) {
      names.add(fn.name);
    }
    fn.body.accept(push(names.build()));
  }

  @Override protected void visit(Expr.Import anImport) {
    anImport.body.accept(push(anImport.names));
  }
}

// End FreeFinder.java
