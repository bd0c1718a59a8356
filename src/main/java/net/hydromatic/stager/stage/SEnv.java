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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Maps;
import com.google.common.collect.Streams;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.stream.Stream;
import net.hydromatic.stager.compile.UnboundVariableException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for staging; maps names to staged values.
 *
 * <p>Every environment is immutable; when you call {@link #set}, a new
 * environment is created that inherits from the previous environment. The
 * new environment may obscure bindings in the old environment, but neither
 * the new nor the old will ever change. So the two branches of an
 * unresolved conditional may extend the same environment without seeing
 * each other's bindings.
 *
 * <p>To create an empty environment, call {@link SEnvs#empty()}; for an
 * environment containing the built-ins, call {@link SEnvs#initial()}.
 */
public abstract class SEnv {
  /**
   * Visits every binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name
   * are visited, but after the more obscuring bindings.
   */
  abstract void visit(BiConsumer<String, SValue> consumer);

  /** Returns the parent environment, or null if this is the root. */
  abstract @Nullable SEnv parent();

  /** Returns the bindings made by this environment but not its
   * parent. */
  abstract Iterator<Map.Entry<String, SValue>> localEntries();

  /** Returns the nearest ancestor that has a binding that is not obscured
   * by one of {@code names}. */
  abstract SEnv nearestAncestorNotObscuredBy(Set<String> names);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we
   * did, debuggers would invoke it automatically, burning lots of CPU and
   * memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    entries().forEach(e ->
        b.append(e.getKey()).append(": ").append(e.getValue()).append("\n"));
    return b.toString();
  }

  /** Returns the value bound to {@code name}, or null if not bound. */
  public abstract @Nullable SValue getOpt(String name);

  /** Returns the value bound to {@code name}.
   *
   * @throws UnboundVariableException if not bound */
  public SValue get(String name) {
    final SValue value = getOpt(name);
    if (value == null) {
      throw new UnboundVariableException(name);
    }
    return value;
  }

  /** Returns whether {@code name} is bound. */
  public boolean has(String name) {
    return getOpt(name) != null;
  }

  /** Creates an environment that is the same as this, plus one more
   * binding. */
  public SEnv set(String name, SValue value) {
    return bind(name, value);
  }

  protected SEnv bind(String name, SValue value) {
    return new SEnvs.SubEnvironment(this, name, value);
  }

  /** Creates an environment that is the same as this, plus the given
   * bindings. */
  public final SEnv setAll(Map<String, SValue> bindings) {
    return SEnvs.bind(this, bindings);
  }

  /** Returns the visible bindings, most recent first.
   *
   * <p>The stream is lazy; it walks the chain of environments only as far
   * as it is consumed. Like any stream, it can be consumed only once. */
  public Stream<Map.Entry<String, SValue>> entries() {
    final Iterator<Map.Entry<String, SValue>> iterator =
        new AbstractIterator<Map.Entry<String, SValue>>() {
          final Set<String> names = new HashSet<>();
          @Nullable SEnv env = SEnv.this;
          Iterator<Map.Entry<String, SValue>> local = env.localEntries();

          @Override protected Map.Entry<String, SValue> computeNext() {
            for (;;) {
              while (local.hasNext()) {
                final Map.Entry<String, SValue> entry = local.next();
                if (names.add(entry.getKey())) {
                  return entry;
                }
              }
              env = env.parent();
              if (env == null) {
                return endOfData();
              }
              local = env.localEntries();
            }
          }
        };
    return Streams.stream(iterator);
  }

  /** Returns a map of the visible bindings. */
  public final Map<String, SValue> getValueMap() {
    final Map<String, SValue> valueMap = new HashMap<>();
    visit(valueMap::putIfAbsent);
    return valueMap;
  }

  static Map.Entry<String, SValue> entry(String name, SValue value) {
    return Maps.immutableEntry(name, value);
  }
}

// End SEnv.java
