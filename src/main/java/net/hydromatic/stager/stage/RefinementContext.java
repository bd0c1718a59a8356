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
import com.google.common.collect.Maps;
import java.util.Collection;
import java.util.Map;
import net.hydromatic.stager.compile.Refinements;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Flow-sensitive constraints on variables, learned from the conditions of
 * enclosing "if" expressions.
 *
 * <p>Immutable. Nested scopes combine refinements of the same variable by
 * conjunction. */
public class RefinementContext {
  public static final RefinementContext EMPTY =
      new RefinementContext(ImmutableMap.of());

  private final ImmutableMap<String, Constraint> map;

  private RefinementContext(ImmutableMap<String, Constraint> map) {
    this.map = requireNonNull(map);
  }

  @Override public String toString() {
    return map.toString();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns the refinement of a variable, or null. */
  public @Nullable Constraint get(String name) {
    return map.get(name);
  }

  /** Returns a context with additional refinements. */
  public RefinementContext refine(Map<String, Constraint> refinements) {
    if (refinements.isEmpty()) {
      return this;
    }
    return new RefinementContext(Refinements.merge(map, refinements));
  }

  /** Returns a context without refinements of {@code names}; called when
   * the names are rebound in an inner scope. */
  public RefinementContext without(Collection<String> names) {
    if (names.stream().noneMatch(map::containsKey)) {
      return this;
    }
    return new RefinementContext(
        ImmutableMap.copyOf(
            Maps.filterKeys(map, name -> !names.contains(name))));
  }

  /** Narrows the constraint of a variable by its refinements, if any. */
  public Constraint narrow(String name, Constraint c) {
    final Constraint refinement = map.get(name);
    if (refinement == null) {
      return c;
    }
    for (Constraint conjunct : Constraints.conjuncts(refinement)) {
      c = Constraints.narrowOr(c, conjunct);
    }
    return c;
  }
}

// End RefinementContext.java
