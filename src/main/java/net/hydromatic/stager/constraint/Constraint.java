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
package net.hydromatic.stager.constraint;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.stager.eval.Null;

/**
 * Refinement type.
 *
 * <p>A constraint is a predicate over values. Classifications such as
 * {@code isNumber} play the role of traditional types; the other kinds
 * refine them ({@code x > 0}, {@code x == 5}, {@code {a: string}}).
 *
 * <p>Constraints are immutable and compare structurally. Create them using
 * the factory methods in {@link Constraints}.
 */
public abstract class Constraint {
  public final Kind kind;

  Constraint(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns a description of this constraint, such as "number" or
   * "{ a: 1, b: string }". */
  @Override public final String toString() {
    return Constraints.describe(this);
  }

  /** Returns whether this constraint is {@code never}. */
  public boolean isNever() {
    return kind == Kind.NEVER;
  }

  /** Returns whether this constraint is {@code any}. */
  public boolean isAny() {
    return kind == Kind.ANY;
  }

  /** Kind of constraint. */
  public enum Kind {
    IS_NUMBER("number"),
    IS_STRING("string"),
    IS_BOOL("boolean"),
    IS_NULL("null"),
    IS_UNDEFINED("undefined"),
    IS_OBJECT("object"),
    IS_ARRAY("array"),
    IS_FUNCTION("function"),
    EQUALS,
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    HAS_FIELD,
    ELEMENTS,
    LENGTH,
    ELEMENT_AT,
    INDEX,
    IS_TYPE,
    AND(" & "),
    OR(" | "),
    NOT,
    NEVER("never"),
    ANY("any");

    /** Name, for classifications; operator, for bounds and compounds. */
    public final String symbol;

    Kind() {
      this("");
    }

    Kind(String symbol) {
      this.symbol = symbol;
    }

    /** Returns whether this is a classification, the constraint analog of a
     * traditional type. */
    public boolean isClassification() {
      return ordinal() <= IS_FUNCTION.ordinal();
    }

    /** Returns whether this is a numeric bound. */
    public boolean isBound() {
      return this == GT || this == GTE || this == LT || this == LTE;
    }
  }

  /** Constraint without arguments: a classification, {@code never} or
   * {@code any}. */
  public static final class Atom extends Constraint {
    Atom(Kind kind) {
      super(kind);
    }

    @Override public int hashCode() {
      return kind.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
          && kind == ((Atom) o).kind;
    }
  }

  /** Constraint that a value equals a given literal.
   *
   * <p>The literal is a {@link Double}, {@link String}, {@link Boolean} or
   * {@link Null#INSTANCE}. */
  public static final class Equals extends Constraint {
    public final Object value;

    Equals(Object value) {
      super(Kind.EQUALS);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Equals
          && value.equals(((Equals) o).value);
    }
  }

  /** Numeric bound, such as "{@code > 3}". */
  public static final class Bound extends Constraint {
    public final double bound;

    Bound(Kind kind, double bound) {
      super(kind);
      this.bound = bound;
    }

    @Override public int hashCode() {
      return Objects.hash(kind, bound);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Bound
          && kind == ((Bound) o).kind
          && Double.compare(bound, ((Bound) o).bound) == 0;
    }
  }

  /** Constraint that an object has a field whose value satisfies a given
   * constraint. */
  public static final class HasField extends Constraint {
    public final String name;
    public final Constraint constraint;

    HasField(String name, Constraint constraint) {
      super(Kind.HAS_FIELD);
      this.name = requireNonNull(name);
      this.constraint = requireNonNull(constraint);
    }

    @Override public int hashCode() {
      return Objects.hash(name, constraint);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof HasField
          && name.equals(((HasField) o).name)
          && constraint.equals(((HasField) o).constraint);
    }
  }

  /** Constraint that wraps one other constraint: {@code elements},
   * {@code length}, {@code index}, {@code isType} or {@code not}. */
  public static final class Wrapper extends Constraint {
    public final Constraint constraint;

    Wrapper(Kind kind, Constraint constraint) {
      super(kind);
      this.constraint = requireNonNull(constraint);
    }

    @Override public int hashCode() {
      return Objects.hash(kind, constraint);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Wrapper
          && kind == ((Wrapper) o).kind
          && constraint.equals(((Wrapper) o).constraint);
    }
  }

  /** Constraint on the element at a given position of a tuple. */
  public static final class ElementAt extends Constraint {
    public final int index;
    public final Constraint constraint;

    ElementAt(int index, Constraint constraint) {
      super(Kind.ELEMENT_AT);
      this.index = index;
      this.constraint = requireNonNull(constraint);
    }

    @Override public int hashCode() {
      return Objects.hash(index, constraint);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ElementAt
          && index == ((ElementAt) o).index
          && constraint.equals(((ElementAt) o).constraint);
    }
  }

  /** Conjunction or disjunction of constraints. */
  public static final class Compound extends Constraint {
    public final ImmutableList<Constraint> constraints;

    Compound(Kind kind, ImmutableList<Constraint> constraints) {
      super(kind);
      this.constraints = requireNonNull(constraints);
    }

    @Override public int hashCode() {
      return Objects.hash(kind, constraints);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Compound
          && kind == ((Compound) o).kind
          && constraints.equals(((Compound) o).constraints);
    }
  }
}

// End Constraint.java
