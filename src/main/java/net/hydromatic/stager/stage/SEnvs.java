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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import net.hydromatic.stager.compile.BuiltIn;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.TypeValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link SEnv}. */
public abstract class SEnvs {
  private SEnvs() {}

  /** Names of the type values bound in the initial environment. */
  static final ImmutableMap<String, Constraint> TYPES =
      ImmutableMap.<String, Constraint>builder()
          .put("number", Constraints.NUMBER)
          .put("string", Constraints.STRING)
          .put("boolean", Constraints.BOOL)
          .put("null", Constraints.NULL)
          .put("object", Constraints.OBJECT)
          .put("array", Constraints.ARRAY)
          .put("function", Constraints.FUNCTION)
          .build();

  /** Creates an empty environment. */
  public static SEnv empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment containing the type values and built-in
   * functions. */
  public static SEnv initial() {
    final ImmutableMap.Builder<String, SValue> b = ImmutableMap.builder();
    TYPES.forEach((name, constraint) ->
        b.put(name,
            SValue.now(new TypeValue(constraint),
                Constraints.isType(constraint))));
    for (BuiltIn builtIn : BuiltIn.values()) {
      b.put(builtIn.fnName, SValue.now(builtIn, Constraints.FUNCTION));
    }
    return bind(empty(), b.build());
  }

  /** Returns the name of the type bound in the initial environment whose
   * constraint is {@code constraint}, or null. */
  public static @Nullable String typeName(Constraint constraint) {
    for (Map.Entry<String, Constraint> entry : TYPES.entrySet()) {
      if (entry.getValue().equals(constraint)) {
        return entry.getKey();
      }
    }
    return null;
  }

  /** Creates an environment that is a given environment plus bindings. */
  static SEnv bind(SEnv env, Map<String, SValue> bindings) {
    if (bindings.size() < 5) {
      for (Map.Entry<String, SValue> entry : bindings.entrySet()) {
        env = env.bind(entry.getKey(), entry.getValue());
      }
      return env;
    } else {
      final ImmutableMap<String, SValue> map = ImmutableMap.copyOf(bindings);
      env = env.nearestAncestorNotObscuredBy(map.keySet());
      return new MapEnvironment(env, map);
    }
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends SEnv {
    private final SEnv parent;
    private final String name;
    private final SValue value;

    SubEnvironment(SEnv parent, String name, SValue value) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override public String toString() {
      return name + ", ...";
    }

    @Override public @Nullable SValue getOpt(String name) {
      if (name.equals(this.name)) {
        return value;
      }
      return parent.getOpt(name);
    }

    @Override protected SEnv bind(String name, SValue value) {
      SEnv env;
      if (this.name.equals(name)) {
        // The new binding obscures this environment's binding. Bind the
        // parent instead, so that chains stay short and obscured values
        // can be garbage-collected.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).name.equals(name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, name, value);
    }

    @Override void visit(BiConsumer<String, SValue> consumer) {
      consumer.accept(name, value);
      parent.visit(consumer);
    }

    @Override SEnv parent() {
      return parent;
    }

    @Override Iterator<Map.Entry<String, SValue>> localEntries() {
      return Iterators.singletonIterator(entry(name, value));
    }

    @Override SEnv nearestAncestorNotObscuredBy(Set<String> names) {
      return names.contains(name)
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends SEnv {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override void visit(BiConsumer<String, SValue> consumer) {}

    @Override public @Nullable SValue getOpt(String name) {
      return null;
    }

    @Override @Nullable SEnv parent() {
      return null;
    }

    @Override Iterator<Map.Entry<String, SValue>> localEntries() {
      return ImmutableList.<Map.Entry<String, SValue>>of().iterator();
    }

    @Override SEnv nearestAncestorNotObscuredBy(Set<String> names) {
      return this;
    }
  }

  /** Environment that keeps bindings in a map. */
  static class MapEnvironment extends SEnv {
    private final SEnv parent;
    private final ImmutableMap<String, SValue> map;

    MapEnvironment(SEnv parent, ImmutableMap<String, SValue> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override void visit(BiConsumer<String, SValue> consumer) {
      map.forEach(consumer);
      parent.visit(consumer);
    }

    @Override public @Nullable SValue getOpt(String name) {
      final SValue value = map.get(name);
      return value != null ? value : parent.getOpt(name);
    }

    @Override SEnv parent() {
      return parent;
    }

    @Override Iterator<Map.Entry<String, SValue>> localEntries() {
      return map.entrySet().iterator();
    }

    @Override SEnv nearestAncestorNotObscuredBy(Set<String> names) {
      return names.containsAll(map.keySet())
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }
  }
}

// End SEnvs.java
