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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stager.compile.NameGenerator;
import net.hydromatic.stager.compile.StagingException;
import net.hydromatic.stager.compile.Tracer;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.Closure;
import net.hydromatic.stager.eval.Prop;
import net.hydromatic.stager.eval.Session;
import net.hydromatic.stager.foreign.DeclarationLoader;
import net.hydromatic.stager.foreign.Signature;
import org.checkerframework.checker.nullness.qual.Nullable;

/** State of one staging run.
 *
 * <p>Everything that staging remembers between expressions, other than
 * environments and staged values (which are immutable), lives here:
 * generated names, recursive calls in progress, constraints of the
 * arguments seen by each closure, runtime placeholders, specializations,
 * closures referenced by residual code, and loaded declarations.
 *
 * <p>{@link #reset()} is called at the start of each top-level run, so two
 * runs never see each other's state. Not thread-safe. */
public class StagingSession {
  public final Session session;
  public final Tracer tracer;
  final DeclarationLoader loader;
  final NameGenerator nameGenerator = new NameGenerator();

  /** Named functions whose bodies are being staged with arguments that are
   * not all known, and the constraint assumed for the result of a nested
   * call. */
  final Map<String, Constraint> inProgress = new HashMap<>();

  /** For each closure, the widened constraints of the arguments of each
   * call so far; one list per parameter. */
  private final Map<Closure, List<Constraint>> argConstraints =
      new IdentityHashMap<>();

  /** Names of the placeholders created by "runtime", in order of creation,
   * with their constraints. */
  final Map<String, Constraint> runtimeNames = new LinkedHashMap<>();

  /** Named closures referenced by name in residual code, keyed by the
   * name under which each is declared. */
  final Map<String, SValue.StagedClosure> referencedClosures =
      new LinkedHashMap<>();

  /** Name under which each referenced closure is declared; usually its own
   * name, but unique even if two closures have the same name. */
  private final Map<Closure, String> declaredNames = new IdentityHashMap<>();

  /** Specializations of each closure, in order of creation. */
  final Map<Closure, List<Specializer.Specialization>> specializations =
      new IdentityHashMap<>();

  /** For each closure, specializations whose bodies are being staged,
   * keyed by their arguments; a nested call with the same arguments calls
   * the pending function. */
  final Map<Closure, Map<List<Object>, Specializer.Pending>>
      pendingSpecializations = new IdentityHashMap<>();

  /** Signatures of imported names, keyed by "module:name". */
  private final Map<String, Signature> imports = new HashMap<>();

  /** Depth of nested inlined function bodies. */
  private int depth;

  public StagingSession(Session session, Tracer tracer,
      DeclarationLoader loader) {
    this.session = requireNonNull(session);
    this.tracer = requireNonNull(tracer);
    this.loader = requireNonNull(loader);
  }

  /** Forgets everything learned in previous runs. */
  public void reset() {
    nameGenerator.reset();
    inProgress.clear();
    argConstraints.clear();
    runtimeNames.clear();
    referencedClosures.clear();
    declaredNames.clear();
    specializations.clear();
    pendingSpecializations.clear();
    imports.clear();
    depth = 0;
  }

  boolean specialize() {
    return Prop.SPECIALIZE.booleanValue(session.map);
  }

  boolean cluster() {
    return Prop.CLUSTER.booleanValue(session.map);
  }

  /** Records the constraints of the arguments of a call to a closure. */
  void recordArgs(Closure closure, List<SValue> args) {
    final List<Constraint> widened = new ArrayList<>();
    args.forEach(arg -> widened.add(Constraints.widen(arg.constraint)));
    argConstraints.merge(closure, widened, (list0, list1) -> {
      final List<Constraint> list = new ArrayList<>();
      for (int i = 0; i < list0.size(); i++) {
        list.add(
            list0.get(i).equals(list1.get(i))
                ? list0.get(i)
                : Constraints.simplify(
                    Constraints.or(list0.get(i), list1.get(i))));
      }
      return list;
    });
  }

  /** Returns the constraint of a closure's parameter, from the arguments
   * seen so far; {@link Constraints#ANY} if the closure has not been
   * called. */
  Constraint paramConstraint(Closure closure, int i) {
    final List<Constraint> list = argConstraints.get(closure);
    return list == null || i >= list.size() ? Constraints.ANY : list.get(i);
  }

  /** Records that residual code refers to a named closure, and returns the
   * name by which it is declared.
   *
   * <p>A closure keeps its own name unless another closure of the same
   * name has already been declared, as happens when two scopes each
   * define a function "g"; then it gets a fresh name such as "g_0". */
  String reference(SValue.StagedClosure closure) {
    final String declared = declaredNames.get(closure.closure());
    if (declared != null) {
      return declared;
    }
    final String base = requireNonNull(closure.name());
    String name = base;
    while (referencedClosures.containsKey(name)) {
      name = nameGenerator.get(base + "_");
    }
    declaredNames.put(closure.closure(), name);
    referencedClosures.put(name, closure);
    return name;
  }

  /** Returns the name under which a closure is declared, or null if
   * residual code does not refer to it by name. */
  @Nullable String declaredName(Closure closure) {
    return declaredNames.get(closure);
  }

  /** Records a runtime placeholder. */
  void runtime(String name, Constraint constraint) {
    runtimeNames.put(name, constraint);
  }

  /** Returns the signature of an imported name that has been loaded by
   * {@link #loadImports}, or null if the module has no such export. */
  @Nullable Signature importSignature(String module, String name) {
    return imports.get(module + ":" + name);
  }

  /** Loads signatures for names not yet cached. */
  void loadImports(String module, List<String> names) {
    final List<String> missing = new ArrayList<>();
    for (String name : names) {
      if (!imports.containsKey(module + ":" + name)) {
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      loader.load(module, missing).forEach((name, signature) ->
          imports.put(module + ":" + name, signature));
    }
  }

  /** Enters a function body; throws if nested too deeply. */
  void enter() {
    final int maxDepth = Prop.MAX_RECURSION_DEPTH.intValue(session.map);
    if (++depth > maxDepth) {
      --depth;
      throw new StagingException("maximum recursion depth " + maxDepth
          + " exceeded while staging");
    }
  }

  void exit() {
    --depth;
  }

  /** Returns the depth of nested function bodies being staged. */
  int depth() {
    return depth;
  }

  /** Returns the runtime placeholders created so far. */
  public ImmutableMap<String, Constraint> runtimeNames() {
    return ImmutableMap.copyOf(runtimeNames);
  }
}

// End StagingSession.java
