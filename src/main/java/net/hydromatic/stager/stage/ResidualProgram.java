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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.stager.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.stager.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Program produced by staging: declarations of the functions that the
 * residual code calls, followed by the main expression.
 *
 * <p>Declarations are in groups; a group comes after every group it
 * refers to. A group is recursive if it has more than one function or
 * its only function calls itself.
 *
 * <p>If the program created runtime placeholders, the main expression is
 * a function whose parameters are the placeholders. */
public class ResidualProgram {
  public final ImmutableList<Group> groups;
  public final Expr main;
  public final ImmutableList<String> runtimeNames;

  ResidualProgram(List<Group> groups, Expr main, List<String> runtimeNames) {
    this.groups = ImmutableList.copyOf(groups);
    this.main = requireNonNull(main);
    this.runtimeNames = ImmutableList.copyOf(runtimeNames);
  }

  /** Returns the main expression, as a function of the runtime
   * placeholders if there are any. */
  public Expr body() {
    return runtimeNames.isEmpty() ? main : expr.fn(runtimeNames, main);
  }

  /** Returns the declarations, by name, in the order they are emitted. */
  public ImmutableMap<String, Expr.Fn> declarations() {
    final ImmutableMap.Builder<String, Expr.Fn> map = ImmutableMap.builder();
    groups.forEach(group ->
        group.fns.forEach(fn -> map.put(requireNonNull(fn.name), fn)));
    return map.build();
  }

  /** Returns the declaration of a function, or null. */
  public Expr.@Nullable Fn declaration(String name) {
    return declarations().get(name);
  }

  /** Converts the program to a single expression, each group of
   * declarations a "let" or "let rec" around the groups that follow. */
  public Expr toExpr() {
    Expr e = body();
    for (Group group : groups.reverse()) {
      if (group.recursive) {
        e = expr.letRec(group.fns, e);
      } else {
        final Expr.Fn fn = group.fns.get(0);
        e = expr.let(requireNonNull(fn.name), expr.fn(fn.params, fn.body), e);
      }
    }
    return e;
  }

  /** Prints the program, one declaration group per line, followed by the
   * main expression. */
  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Group group : groups) {
      b.append(group).append(";\n");
    }
    return b.append(body()).toString();
  }

  /** A group of function declarations. */
  public static class Group {
    public final ImmutableList<Expr.Fn> fns;
    public final boolean recursive;

    Group(List<Expr.Fn> fns, boolean recursive) {
      this.fns = ImmutableList.copyOf(fns);
      this.recursive = recursive;
    }

    @Override public String toString() {
      final StringBuilder b =
          new StringBuilder(recursive ? "let rec " : "let ");
      for (int i = 0; i < fns.size(); i++) {
        final Expr.Fn fn = fns.get(i);
        b.append(i == 0 ? "" : ", ")
            .append(fn.name)
            .append(" = ")
            .append(expr.fn(fn.params, fn.body));
      }
      return b.toString();
    }
  }
}

// End ResidualProgram.java
