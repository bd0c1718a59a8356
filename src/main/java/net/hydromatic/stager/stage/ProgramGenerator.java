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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Shuttle;
import net.hydromatic.stager.ast.Visitor;
import net.hydromatic.stager.compile.FreeFinder;
import net.hydromatic.stager.eval.Closure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds a {@link ResidualProgram} from the result of staging.
 *
 * <p>Starting from the free variables of the main expression, declares
 * each named closure and each specialization that residual code refers
 * to, and then those that the declarations refer to. Specializations
 * that differ only in literals are merged by {@link Clusterer}. The
 * declarations are ordered by {@link ClosureGraph}. */
class ProgramGenerator {
  private final Stager stager;
  private final StagingSession session;

  ProgramGenerator(Stager stager) {
    this.stager = stager;
    this.session = stager.session;
  }

  ResidualProgram generate(SValue result) {
    Expr main = stager.residualOf(result);

    // Declarations reachable from the main expression
    final Map<String, Expr.Fn> decls = new LinkedHashMap<>();
    final Map<String, Closure> closures = new HashMap<>();
    final Deque<String> queue = new ArrayDeque<>(FreeFinder.freeVars(main));
    while (!queue.isEmpty()) {
      final String name = queue.pop();
      if (decls.containsKey(name)) {
        continue;
      }
      final Expr.Fn fn;
      final SValue.StagedClosure closure =
          session.referencedClosures.get(name);
      if (closure != null) {
        fn = stager.residualizer.residualize(closure);
        closures.put(name, closure.closure());
      } else {
        final Specializer.Specialization specialization =
            specialization(name);
        if (specialization == null) {
          // a runtime placeholder, builtin or imported name
          continue;
        }
        fn = specialization.fn();
      }
      decls.put(name, fn);
      queue.addAll(FreeFinder.freeVars(fn));
    }

    if (session.cluster()) {
      final Map<String, Clusterer.Cluster> clusterOf = new HashMap<>();
      final Clusterer clusterer = new Clusterer(session.nameGenerator);
      session.specializations.values().forEach(list -> {
        final List<Specializer.Specialization> declared = new ArrayList<>();
        for (Specializer.Specialization s : list) {
          if (decls.containsKey(s.name)
              && declared.stream().noneMatch(s2 -> s2.name.equals(s.name))) {
            declared.add(s);
          }
        }
        for (Clusterer.Cluster cluster : clusterer.cluster(declared)) {
          if (cluster.holeArgs.size() > 1) {
            cluster.holeArgs.keySet().forEach(name -> {
              decls.remove(name);
              clusterOf.put(name, cluster);
            });
            decls.put(cluster.name, cluster.fn());
          }
        }
      });
      if (!clusterOf.isEmpty()) {
        final CallRewriter rewriter = new CallRewriter(clusterOf);
        main = main.accept(rewriter);
        decls.replaceAll((name, fn) -> (Expr.Fn) fn.accept(rewriter));
      }
    }

    // Variables bound inside main are not in scope in the declarations;
    // pass those a declaration uses as extra arguments
    final Map<String, List<String>> captured = captures(main, decls);
    if (!captured.isEmpty()) {
      final CaptureRewriter rewriter = new CaptureRewriter(decls, captured);
      main = main.accept(rewriter);
      decls.replaceAll((name, fn) -> {
        final List<String> params = new ArrayList<>(fn.params);
        params.addAll(captured.getOrDefault(name, ImmutableList.of()));
        return expr.fn(fn.name, params, fn.body.accept(rewriter));
      });
    }

    // Order the declarations so that each group follows its dependencies
    final ClosureGraph graph = new ClosureGraph();
    decls.keySet().forEach(graph::add);
    decls.forEach((name, fn) -> {
      for (String v : FreeFinder.freeVars(fn.body)) {
        if (decls.containsKey(v)) {
          graph.addEdge(name, v);
        }
      }
      final Closure closure = closures.get(name);
      if (closure != null) {
        for (String sibling : closure.siblings) {
          final String declared = declaredName(closure, sibling);
          if (declared != null && decls.containsKey(declared)) {
            graph.addEdge(name, declared);
          }
        }
      }
    });
    final List<ResidualProgram.Group> groups = new ArrayList<>();
    for (ImmutableList<String> names : graph.order()) {
      final List<Expr.Fn> fns = new ArrayList<>();
      names.forEach(name -> fns.add(decls.get(name)));
      final boolean recursive =
          names.size() > 1 || graph.isSelfLoop(names.get(0));
      groups.add(new ResidualProgram.Group(fns, recursive));
    }
    return new ResidualProgram(groups, main,
        ImmutableList.copyOf(session.runtimeNames.keySet()));
  }

  /** Returns the name under which a sibling of a closure is declared,
   * or null if it is not declared. */
  private @Nullable String declaredName(Closure closure, String sibling) {
    final SValue value = closure.env().getOpt(sibling);
    if (value instanceof SValue.StagedClosure) {
      return session.declaredName(((SValue.StagedClosure) value).closure());
    }
    return null;
  }

  /** Returns, for each declaration that uses variables bound inside the
   * main expression (directly or via the declarations it calls), the list
   * of those variables. */
  private Map<String, List<String>> captures(Expr main,
      Map<String, Expr.Fn> decls) {
    final Set<String> local = new HashSet<>(session.runtimeNames.keySet());
    main.accept(new BinderFinder(local));
    final Map<String, Set<String>> captured = new LinkedHashMap<>();
    decls.forEach((name, fn) -> {
      final Set<String> names = new LinkedHashSet<>();
      for (String v : FreeFinder.freeVars(fn)) {
        if (local.contains(v) && !decls.containsKey(v)) {
          names.add(v);
        }
      }
      captured.put(name, names);
    });
    // A declaration also needs what its callees need
    for (boolean changed = true; changed;) {
      changed = false;
      for (Map.Entry<String, Expr.Fn> e : decls.entrySet()) {
        final Set<String> names = captured.get(e.getKey());
        for (String v : FreeFinder.freeVars(e.getValue())) {
          final Set<String> callee = captured.get(v);
          if (callee != null && !v.equals(e.getKey())) {
            changed |= names.addAll(callee);
          }
        }
      }
    }
    final Map<String, List<String>> result = new LinkedHashMap<>();
    captured.forEach((name, names) -> {
      if (!names.isEmpty()) {
        result.put(name, ImmutableList.copyOf(names));
      }
    });
    return result;
  }

  /** Returns the specialization with a given name, or null. */
  private Specializer.@Nullable Specialization specialization(String name) {
    for (List<Specializer.Specialization> list
        : session.specializations.values()) {
      for (Specializer.Specialization specialization : list) {
        if (specialization.name.equals(name)) {
          return specialization;
        }
      }
    }
    return null;
  }

  /** Collects the names bound anywhere in an expression. */
  private static class BinderFinder extends Visitor {
    private final Set<String> names;

    BinderFinder(Set<String> names) {
      this.names = names;
    }

    @Override protected void visit(Expr.Let let) {
      names.add(let.name);
      super.visit(let);
    }

    @Override protected void visit(Expr.LetPattern letPattern) {
      names.addAll(letPattern.pat.vars());
      super.visit(letPattern);
    }

    @Override protected void visit(Expr.LetRec letRec) {
      letRec.fns.forEach(fn -> names.add(requireNonNull(fn.name)));
      super.visit(letRec);
    }

    @Override protected void visit(Expr.Fn fn) {
      names.addAll(fn.params);
      if (fn.name != null) {
        names.add(fn.name);
      }
      super.visit(fn);
    }

    @Override protected void visit(Expr.Import anImport) {
      names.addAll(anImport.names);
      super.visit(anImport);
    }
  }

  /** Appends captured variables to the arguments of each call to a
   * declaration that captures them. A declaration used other than by a
   * call becomes a function that makes the call. */
  private static class CaptureRewriter extends Shuttle {
    private final Map<String, ImmutableList<String>> params =
        new HashMap<>();
    private final Map<String, List<String>> captured;

    CaptureRewriter(Map<String, Expr.Fn> decls,
        Map<String, List<String>> captured) {
      decls.forEach((name, fn) -> params.put(name, fn.params));
      this.captured = captured;
    }

    private List<Expr> withCaptures(String name, List<Expr> args) {
      final List<Expr> args2 = new ArrayList<>(args);
      captured.get(name).forEach(v -> args2.add(expr.id(v)));
      return args2;
    }

    @Override protected Expr visit(Expr.Call call) {
      if (call.fn instanceof Expr.Id) {
        final String name = ((Expr.Id) call.fn).name;
        if (captured.containsKey(name)) {
          return expr.call(call.fn, withCaptures(name, visitList(call.args)));
        }
      }
      return super.visit(call);
    }

    @Override protected Expr visit(Expr.Id id) {
      if (!captured.containsKey(id.name)) {
        return id;
      }
      final List<String> fnParams = params.get(id.name);
      final List<Expr> args = new ArrayList<>();
      fnParams.forEach(p -> args.add(expr.id(p)));
      return expr.fn(fnParams, expr.call(id, withCaptures(id.name, args)));
    }
  }

  /** Rewrites calls to members of a cluster into calls to the cluster's
   * function, passing the member's literals as leading arguments. */
  private static class CallRewriter extends Shuttle {
    private final Map<String, Clusterer.Cluster> clusterOf;

    CallRewriter(Map<String, Clusterer.Cluster> clusterOf) {
      this.clusterOf = clusterOf;
    }

    @Override protected Expr visit(Expr.Call call) {
      final Expr.Call call2 = (Expr.Call) super.visit(call);
      if (call2.fn instanceof Expr.Id) {
        final String name = ((Expr.Id) call2.fn).name;
        final Clusterer.Cluster cluster = clusterOf.get(name);
        if (cluster != null) {
          final List<Expr> newArgs = new ArrayList<>();
          for (Object arg : cluster.holeArgs.get(name)) {
            newArgs.add(expr.literal(arg));
          }
          newArgs.addAll(call2.args);
          return expr.call(expr.id(cluster.name), newArgs);
        }
      }
      return call2;
    }
  }
}

// End ProgramGenerator.java
