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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.eval.Closure;
import net.hydromatic.stager.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Staged value.
 *
 * <p>A staged value says how much is known about a value while a program
 * is being staged. It is one of:
 *
 * <ul>
 *   <li>{@link Now}, a value that is known now;
 *   <li>{@link Later}, a value that will be known only when the residual
 *   program runs, plus the code that computes it;
 *   <li>{@link LaterArray}, an array whose length is known but whose
 *   elements are staged individually;
 *   <li>{@link StagedClosure}, a function value whose body has not been
 *   staged yet.
 * </ul>
 *
 * <p>Every value that a staged value can produce satisfies its
 * {@link #constraint}. */
public abstract class SValue {
  public final Constraint constraint;

  SValue(Constraint constraint) {
    this.constraint = requireNonNull(constraint);
  }

  /** Creates a value that is known now. */
  public static Now now(Object value, Constraint constraint) {
    if (value instanceof Closure) {
      return new StagedClosure((Closure) value, constraint, null);
    }
    return new Now(value, constraint, null);
  }

  /** Creates a value that is known now and may be referenced in residual
   * code by {@code residual}. */
  public static Now now(Object value, Constraint constraint,
      @Nullable Expr residual) {
    if (value instanceof Closure) {
      return new StagedClosure((Closure) value, constraint, residual);
    }
    return new Now(value, constraint, residual);
  }

  /** Creates a value that is known now, with its exact constraint. */
  public static Now of(Object value) {
    return now(value, Values.constraintOf(value));
  }

  /** Creates a value that will be computed by {@code residual}. */
  public static Later later(Constraint constraint, Expr residual) {
    return new Later(constraint, residual);
  }

  /** Creates an array whose elements are staged individually. */
  public static LaterArray laterArray(List<? extends SValue> elements) {
    final ImmutableList<SValue> list = ImmutableList.copyOf(elements);
    final ImmutableList.Builder<Constraint> constraints =
        ImmutableList.builder();
    list.forEach(e -> constraints.add(e.constraint));
    return new LaterArray(list, Values.arrayConstraint(constraints.build()));
  }

  /** Returns whether every element of {@code values} is known now. */
  public static boolean allNow(Iterable<? extends SValue> values) {
    for (SValue value : values) {
      if (!value.isNow()) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether this value is known now; true for a staged
   * closure. */
  public boolean isNow() {
    return false;
  }

  public boolean isLater() {
    return false;
  }

  public boolean isLaterArray() {
    return false;
  }

  public boolean isStagedClosure() {
    return false;
  }

  /** Casts to {@link Now}. */
  public Now asNow() {
    return (Now) this;
  }

  /** Returns a copy of this value with a different constraint. */
  public abstract SValue withConstraint(Constraint constraint);

  /** Value that is known now. */
  public static class Now extends SValue {
    public final Object value;
    /** Cheap way to refer to the value in residual code, such as the name
     * of the variable it is bound to; or null. */
    public final @Nullable Expr residual;

    Now(Object value, Constraint constraint, @Nullable Expr residual) {
      super(constraint);
      this.value = requireNonNull(value);
      this.residual = residual;
    }

    @Override public boolean isNow() {
      return true;
    }

    @Override public Now withConstraint(Constraint constraint) {
      return now(value, constraint, residual);
    }

    /** Returns a copy of this value that is referenced by
     * {@code residual}. */
    public Now withResidual(@Nullable Expr residual) {
      return now(value, constraint, residual);
    }

    @Override public String toString() {
      return "Now(" + Values.toString(value) + ", " + constraint + ")";
    }
  }

  /** Value that is a function, with the environment it captured. Its body
   * is staged when it is called or residualized. */
  public static class StagedClosure extends Now {
    StagedClosure(Closure closure, Constraint constraint,
        @Nullable Expr residual) {
      super(closure, constraint, residual);
    }

    @Override public boolean isStagedClosure() {
      return true;
    }

    public Closure closure() {
      return (Closure) value;
    }

    public Expr body() {
      return closure().fn.body;
    }

    public SEnv capturedEnv() {
      return closure().env();
    }

    public @Nullable String name() {
      return closure().name();
    }

    public ImmutableSet<String> comptimeParams() {
      return closure().comptimeParams();
    }
  }

  /** Value that will be known only when the residual program runs. */
  public static class Later extends SValue {
    public final Expr residual;

    Later(Constraint constraint, Expr residual) {
      super(constraint);
      this.residual = requireNonNull(residual);
    }

    @Override public boolean isLater() {
      return true;
    }

    @Override public Later withConstraint(Constraint constraint) {
      return new Later(constraint, residual);
    }

    @Override public String toString() {
      return "Later(" + constraint + ", " + residual + ")";
    }
  }

  /** Array whose length is known but whose elements are staged
   * individually. At least one element is not known now. */
  public static class LaterArray extends SValue {
    public final ImmutableList<SValue> elements;

    LaterArray(ImmutableList<SValue> elements, Constraint constraint) {
      super(constraint);
      this.elements = requireNonNull(elements);
    }

    @Override public boolean isLaterArray() {
      return true;
    }

    @Override public LaterArray withConstraint(Constraint constraint) {
      return new LaterArray(elements, constraint);
    }

    /** Returns the element at {@code i}, or null if out of range. */
    public @Nullable SValue get(int i) {
      return i >= 0 && i < elements.size() ? elements.get(i) : null;
    }

    @Override public String toString() {
      return "LaterArray(" + elements + ", " + constraint + ")";
    }
  }
}

// End SValue.java
