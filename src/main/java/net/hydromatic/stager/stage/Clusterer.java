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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Shuttle;
import net.hydromatic.stager.compile.NameGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Merges specialized functions whose bodies differ only in literals.
 *
 * <p>Bodies that are the same once every literal is replaced by a
 * placeholder are grouped. The positions at which the literals of a group
 * differ are its holes. The group becomes one function, which has a
 * parameter for each hole, followed by the original parameters, and is
 * named after the first member of the group; holes whose values are the
 * same in every member share a parameter. A call to a member becomes a
 * call to the merged function, passing the member's literals for the
 * holes. */
class Clusterer {
  /** Placeholder for a literal in the shape of a body. */
  private static final Expr.Id HOLE = expr.id("?");

  private final NameGenerator nameGenerator;

  Clusterer(NameGenerator nameGenerator) {
    this.nameGenerator = requireNonNull(nameGenerator);
  }

  /** Clusters the specializations of one closure. Each specialization
   * belongs to exactly one cluster. */
  List<Cluster> cluster(List<Specializer.Specialization> specializations) {
    final Map<String, List<Specializer.Specialization>> groups =
        new LinkedHashMap<>();
    for (Specializer.Specialization specialization : specializations) {
      final String shape =
          expr.fn(specialization.params,
              specialization.body.accept(new LiteralReplacer(i -> HOLE)))
              .toString();
      groups.computeIfAbsent(shape, k -> new ArrayList<>())
          .add(specialization);
    }
    final ImmutableList.Builder<Cluster> clusters = ImmutableList.builder();
    groups.values().forEach(group -> clusters.add(merge(group)));
    return clusters.build();
  }

  private Cluster merge(List<Specializer.Specialization> group) {
    final Specializer.Specialization first = group.get(0);

    // Literals of each member, in the same order
    final List<List<Object>> literals = new ArrayList<>();
    for (Specializer.Specialization specialization : group) {
      final LiteralReplacer replacer = new LiteralReplacer(i -> null);
      specialization.body.accept(replacer);
      literals.add(replacer.literals);
    }

    // Holes, and the parameter for each. Holes with the same values in
    // every member share a parameter.
    final int literalCount = literals.get(0).size();
    final Map<List<Object>, String> paramsByValues = new LinkedHashMap<>();
    final Map<Integer, String> holeParams = new LinkedHashMap<>();
    for (int i = 0; i < literalCount; i++) {
      final List<Object> values = new ArrayList<>();
      for (List<Object> memberLiterals : literals) {
        values.add(memberLiterals.get(i));
      }
      if (values.stream().distinct().count() > 1) {
        holeParams.put(i,
            paramsByValues.computeIfAbsent(values,
                v -> nameGenerator.get("p$")));
      }
    }

    final List<String> params = new ArrayList<>(paramsByValues.values());
    params.addAll(first.params);
    final Expr body = first.body.accept(
        new LiteralReplacer(i -> {
          final String param = holeParams.get(i);
          return param == null ? null : expr.id(param);
        }));

    // For each member, the value passed to each hole parameter
    final ImmutableMap.Builder<String, ImmutableList<Object>> args =
        ImmutableMap.builder();
    for (int j = 0; j < group.size(); j++) {
      final ImmutableList.Builder<Object> memberArgs = ImmutableList.builder();
      for (List<Object> values : paramsByValues.keySet()) {
        memberArgs.add(values.get(j));
      }
      args.put(group.get(j).name, memberArgs.build());
    }
    return new Cluster(first.name, params, body, args.build());
  }

  /** Shuttle that replaces the {@code i}th literal with the expression
   * returned by a function, or leaves it alone if the function returns
   * null; and records the value of each literal. */
  private static class LiteralReplacer extends Shuttle {
    private final IntFunction<@Nullable Expr> replacement;
    final List<Object> literals = new ArrayList<>();

    LiteralReplacer(IntFunction<@Nullable Expr> replacement) {
      this.replacement = replacement;
    }

    @Override protected Expr visit(Expr.Literal literal) {
      final Expr e = replacement.apply(literals.size());
      literals.add(literal.value);
      return e != null ? e : literal;
    }
  }

  /** A group of specializations merged into one function. */
  static class Cluster {
    final String name;
    final ImmutableList<String> params;
    final Expr body;
    /** For each member, by name, the arguments of the parameters that
     * replace holes. */
    final ImmutableMap<String, ImmutableList<Object>> holeArgs;

    Cluster(String name, List<String> params, Expr body,
        ImmutableMap<String, ImmutableList<Object>> holeArgs) {
      this.name = requireNonNull(name);
      this.params = ImmutableList.copyOf(params);
      this.body = requireNonNull(body);
      this.holeArgs = requireNonNull(holeArgs);
    }

    @Override public String toString() {
      return fn().toString();
    }

    Expr.Fn fn() {
      return expr.fn(name, params, body);
    }
  }
}

// End Clusterer.java
