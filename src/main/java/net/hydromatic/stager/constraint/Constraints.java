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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import net.hydromatic.stager.constraint.Constraint.Atom;
import net.hydromatic.stager.constraint.Constraint.Bound;
import net.hydromatic.stager.constraint.Constraint.Compound;
import net.hydromatic.stager.constraint.Constraint.ElementAt;
import net.hydromatic.stager.constraint.Constraint.Equals;
import net.hydromatic.stager.constraint.Constraint.HasField;
import net.hydromatic.stager.constraint.Constraint.Kind;
import net.hydromatic.stager.constraint.Constraint.Wrapper;
import net.hydromatic.stager.eval.Null;
import net.hydromatic.stager.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factory methods and algebra for {@link Constraint}.
 *
 * <p>The algebra is a lattice: {@link #ANY} is the top, {@link #NEVER} the
 * bottom, {@link #implies} the ordering, {@link #unify} the meet. Every
 * operation here is pure.
 */
public abstract class Constraints {
  private Constraints() {}

  public static final Constraint NUMBER = new Atom(Kind.IS_NUMBER);
  public static final Constraint STRING = new Atom(Kind.IS_STRING);
  public static final Constraint BOOL = new Atom(Kind.IS_BOOL);
  public static final Constraint NULL = new Atom(Kind.IS_NULL);
  public static final Constraint UNDEFINED = new Atom(Kind.IS_UNDEFINED);
  public static final Constraint OBJECT = new Atom(Kind.IS_OBJECT);
  public static final Constraint ARRAY = new Atom(Kind.IS_ARRAY);
  public static final Constraint FUNCTION = new Atom(Kind.IS_FUNCTION);
  public static final Constraint NEVER = new Atom(Kind.NEVER);
  public static final Constraint ANY = new Atom(Kind.ANY);

  /** Constraint satisfied by every type value. */
  public static final Constraint TYPE = isType(ANY);

  /** Returns the classification with a given kind. */
  public static Constraint classification(Kind kind) {
    switch (kind) {
    case IS_NUMBER:
      return NUMBER;
    case IS_STRING:
      return STRING;
    case IS_BOOL:
      return BOOL;
    case IS_NULL:
      return NULL;
    case IS_UNDEFINED:
      return UNDEFINED;
    case IS_OBJECT:
      return OBJECT;
    case IS_ARRAY:
      return ARRAY;
    case IS_FUNCTION:
      return FUNCTION;
    default:
      throw new IllegalArgumentException("not a classification: " + kind);
    }
  }

  /** Creates a constraint that a value equals a literal. */
  public static Constraint equalTo(Object value) {
    checkArgument(isLiteral(value), "not a literal: %s", value);
    return new Equals(value);
  }

  public static Constraint equalTo(double value) {
    return new Equals(value);
  }

  /** Returns whether a value can appear in an {@code equals} constraint. */
  public static boolean isLiteral(Object value) {
    return value instanceof Double
        || value instanceof String
        || value instanceof Boolean
        || value == Null.INSTANCE;
  }

  public static Constraint gt(double bound) {
    return new Bound(Kind.GT, bound);
  }

  public static Constraint gte(double bound) {
    return new Bound(Kind.GTE, bound);
  }

  public static Constraint lt(double bound) {
    return new Bound(Kind.LT, bound);
  }

  public static Constraint lte(double bound) {
    return new Bound(Kind.LTE, bound);
  }

  public static Constraint hasField(String name, Constraint constraint) {
    return new HasField(name, constraint);
  }

  /** Creates a constraint that every element of an array satisfies a
   * constraint. */
  public static Constraint elements(Constraint constraint) {
    return new Wrapper(Kind.ELEMENTS, constraint);
  }

  /** Creates a constraint on the length of an array or string. */
  public static Constraint length(Constraint constraint) {
    return new Wrapper(Kind.LENGTH, constraint);
  }

  public static Constraint elementAt(int index, Constraint constraint) {
    return new ElementAt(index, constraint);
  }

  /** Creates an index signature: the constraint on fields that are not
   * listed. {@code index(never)} marks an object as closed. */
  public static Constraint index(Constraint constraint) {
    return new Wrapper(Kind.INDEX, constraint);
  }

  /** Creates a constraint satisfied by type values whose constraint
   * implies {@code constraint}. */
  public static Constraint isType(Constraint constraint) {
    return new Wrapper(Kind.IS_TYPE, constraint);
  }

  public static Constraint not(Constraint constraint) {
    return new Wrapper(Kind.NOT, constraint);
  }

  public static Constraint and(Constraint... constraints) {
    return and(ImmutableList.copyOf(constraints));
  }

  /** Creates a conjunction; returns {@link #ANY} if the list is empty and
   * the sole element if it has one element. Does not simplify. */
  public static Constraint and(List<Constraint> constraints) {
    switch (constraints.size()) {
    case 0:
      return ANY;
    case 1:
      return constraints.get(0);
    default:
      return new Compound(Kind.AND, ImmutableList.copyOf(constraints));
    }
  }

  public static Constraint or(Constraint... constraints) {
    return or(ImmutableList.copyOf(constraints));
  }

  /** Creates a disjunction; returns {@link #NEVER} if the list is empty and
   * the sole element if it has one element. Does not simplify. */
  public static Constraint or(List<Constraint> constraints) {
    switch (constraints.size()) {
    case 0:
      return NEVER;
    case 1:
      return constraints.get(0);
    default:
      return new Compound(Kind.OR, ImmutableList.copyOf(constraints));
    }
  }

  /** Creates the constraint of a tuple: an array with a known length and a
   * constraint per position. */
  public static Constraint tuple(List<Constraint> elementConstraints) {
    final List<Constraint> list = new ArrayList<>();
    list.add(ARRAY);
    for (int i = 0; i < elementConstraints.size(); i++) {
      list.add(elementAt(i, elementConstraints.get(i)));
    }
    list.add(length(equalTo(elementConstraints.size())));
    return and(list);
  }

  /** Creates the constraint of an array whose elements satisfy a given
   * constraint. */
  public static Constraint arrayOf(Constraint elementConstraint) {
    return and(ARRAY, elements(elementConstraint));
  }

  // Lattice operations

  /** Flattens nested conjunctions and disjunctions, removes duplicates and
   * identities, and reduces contradictions to {@link #NEVER}. */
  public static Constraint simplify(Constraint c) {
    switch (c.kind) {
    case HAS_FIELD:
      final HasField hasField = (HasField) c;
      return hasField(hasField.name, simplify(hasField.constraint));
    case ELEMENT_AT:
      final ElementAt elementAt = (ElementAt) c;
      return elementAt(elementAt.index, simplify(elementAt.constraint));
    case ELEMENTS:
    case LENGTH:
    case INDEX:
    case IS_TYPE:
      return new Wrapper(c.kind, simplify(((Wrapper) c).constraint));
    case NOT:
      final Constraint inner = simplify(((Wrapper) c).constraint);
      switch (inner.kind) {
      case NEVER:
        return ANY;
      case ANY:
        return NEVER;
      case NOT:
        return ((Wrapper) inner).constraint;
      default:
        return not(inner);
      }
    case AND:
      final List<Constraint> conjuncts = new ArrayList<>();
      for (Constraint e : flatten(Kind.AND, c)) {
        flatten(Kind.AND, simplify(e)).forEach(conjuncts::add);
      }
      conjuncts.removeIf(Constraint::isAny);
      if (conjuncts.stream().anyMatch(Constraint::isNever)) {
        return NEVER;
      }
      final List<Constraint> distinctConjuncts = dedupe(conjuncts);
      if (hasContradiction(distinctConjuncts)) {
        return NEVER;
      }
      return and(distinctConjuncts);
    case OR:
      final List<Constraint> branches = new ArrayList<>();
      for (Constraint e : flatten(Kind.OR, c)) {
        flatten(Kind.OR, simplify(e)).forEach(branches::add);
      }
      branches.removeIf(Constraint::isNever);
      if (branches.stream().anyMatch(Constraint::isAny)) {
        return ANY;
      }
      return or(dedupe(branches));
    default:
      return c;
    }
  }

  private static List<Constraint> flatten(Kind kind, Constraint c) {
    if (c.kind != kind) {
      return ImmutableList.of(c);
    }
    final List<Constraint> list = new ArrayList<>();
    for (Constraint e : ((Compound) c).constraints) {
      list.addAll(flatten(kind, e));
    }
    return list;
  }

  private static List<Constraint> dedupe(List<Constraint> constraints) {
    return ImmutableList.copyOf(new LinkedHashSet<>(constraints));
  }

  /** Returns whether a list of conjuncts cannot all hold. */
  private static boolean hasContradiction(List<Constraint> constraints) {
    final List<Kind> classifications = new ArrayList<>();
    final List<Object> literals = new ArrayList<>();
    Double gt = null;
    Double gte = null;
    Double lt = null;
    Double lte = null;
    final Map<String, List<Constraint>> fieldConstraints =
        new LinkedHashMap<>();
    for (Constraint c : constraints) {
      if (c.isNever()) {
        return true;
      }
      if (c.kind.isClassification()) {
        for (Kind existing : classifications) {
          if (areDisjoint(existing, c.kind)) {
            return true;
          }
        }
        for (Object literal : literals) {
          if (!literalMatches(literal, c.kind)) {
            return true;
          }
        }
        classifications.add(c.kind);
      }
      switch (c.kind) {
      case EQUALS:
        final Object value = ((Equals) c).value;
        for (Object literal : literals) {
          if (!literal.equals(value)) {
            return true;
          }
        }
        for (Kind classification : classifications) {
          if (!literalMatches(value, classification)) {
            return true;
          }
        }
        literals.add(value);
        break;
      case GT:
        gt = max(gt, ((Bound) c).bound);
        break;
      case GTE:
        gte = max(gte, ((Bound) c).bound);
        break;
      case LT:
        lt = min(lt, ((Bound) c).bound);
        break;
      case LTE:
        lte = min(lte, ((Bound) c).bound);
        break;
      case HAS_FIELD:
        final HasField hasField = (HasField) c;
        fieldConstraints.computeIfAbsent(hasField.name, k -> new ArrayList<>())
            .add(hasField.constraint);
        break;
      default:
        break;
      }
    }

    // Empty interval
    if (gt != null && lt != null && gt >= lt
        || gt != null && lte != null && gt >= lte
        || gte != null && lt != null && gte >= lt
        || gte != null && lte != null && gte > lte) {
      return true;
    }

    // Literal outside the interval
    for (Object literal : literals) {
      if (literal instanceof Double) {
        final double d = (Double) literal;
        if (gt != null && d <= gt
            || gte != null && d < gte
            || lt != null && d >= lt
            || lte != null && d > lte) {
          return true;
        }
      }
    }

    // Same field with contradictory constraints
    for (List<Constraint> list : fieldConstraints.values()) {
      if (list.size() > 1 && simplify(and(list)).isNever()) {
        return true;
      }
    }
    return false;
  }

  private static Double max(@Nullable Double d0, double d1) {
    return d0 == null ? d1 : Math.max(d0, d1);
  }

  private static Double min(@Nullable Double d0, double d1) {
    return d0 == null ? d1 : Math.min(d0, d1);
  }

  /** Returns whether no value can satisfy both classifications.
   * Arrays and functions are objects, so {@code isObject} overlaps with
   * both of them. */
  static boolean areDisjoint(Kind a, Kind b) {
    if (a == b) {
      return false;
    }
    if (a == Kind.IS_OBJECT) {
      return b != Kind.IS_ARRAY && b != Kind.IS_FUNCTION;
    }
    if (b == Kind.IS_OBJECT) {
      return a != Kind.IS_ARRAY && a != Kind.IS_FUNCTION;
    }
    return true;
  }

  /** Returns whether a literal belongs to a classification. */
  static boolean literalMatches(Object literal, Kind classification) {
    switch (classification) {
    case IS_NUMBER:
      return literal instanceof Double;
    case IS_STRING:
      return literal instanceof String;
    case IS_BOOL:
      return literal instanceof Boolean;
    case IS_NULL:
      return literal == Null.INSTANCE;
    default:
      return false;
    }
  }

  /**
   * Returns whether constraint {@code a} implies constraint {@code b}.
   *
   * <p>This is the subtyping relation: every value that satisfies {@code a}
   * also satisfies {@code b}. The check is conservative; a {@code false}
   * result means "could not prove", not "disproved".
   */
  public static boolean implies(Constraint a, Constraint b) {
    final Constraint sa = simplify(a);
    final Constraint sb = simplify(b);
    if (sa.isNever() || sb.isAny()) {
      return true;
    }
    if (sa.isAny() || sb.isNever()) {
      return false;
    }
    return impliesSimple(sa, sb);
  }

  private static boolean impliesSimple(Constraint a, Constraint b) {
    if (a.equals(b)) {
      return true;
    }
    if (b.kind == Kind.IS_OBJECT
        && (a.kind == Kind.IS_ARRAY || a.kind == Kind.IS_FUNCTION)) {
      return true;
    }
    if (a.kind == Kind.EQUALS) {
      final Object value = ((Equals) a).value;
      if (b.kind.isClassification()) {
        return literalMatches(value, b.kind);
      }
      if (b.kind.isBound() && value instanceof Double) {
        return satisfiesBound((Double) value, (Bound) b);
      }
    }
    if (a.kind.isBound() && b.kind.isBound()) {
      return boundImplies((Bound) a, (Bound) b);
    }
    if (a.kind == Kind.OR) {
      return ((Compound) a).constraints.stream()
          .allMatch(c -> implies(c, b));
    }
    if (a.kind == Kind.AND) {
      final List<Constraint> conjuncts = ((Compound) a).constraints;
      if (conjuncts.stream().anyMatch(c -> implies(c, b))) {
        return true;
      }
      if (b.kind == Kind.EQUALS && ((Equals) b).value instanceof Double) {
        // "x >= 5 && x <= 5" implies "x == 5"
        final double d = (Double) ((Equals) b).value;
        if (conjuncts.contains(gte(d)) && conjuncts.contains(lte(d))) {
          return true;
        }
      }
    }
    if (b.kind == Kind.AND) {
      return ((Compound) b).constraints.stream()
          .allMatch(c -> implies(a, c));
    }
    if (b.kind == Kind.OR) {
      return ((Compound) b).constraints.stream()
          .anyMatch(c -> implies(a, c));
    }
    if (a.kind != b.kind) {
      return false;
    }
    switch (a.kind) {
    case HAS_FIELD:
      return ((HasField) a).name.equals(((HasField) b).name)
          && implies(((HasField) a).constraint, ((HasField) b).constraint);
    case ELEMENT_AT:
      return ((ElementAt) a).index == ((ElementAt) b).index
          && implies(((ElementAt) a).constraint, ((ElementAt) b).constraint);
    case ELEMENTS:
    case LENGTH:
    case INDEX:
    case IS_TYPE:
      return implies(((Wrapper) a).constraint, ((Wrapper) b).constraint);
    default:
      return false;
    }
  }

  private static boolean satisfiesBound(double d, Bound bound) {
    switch (bound.kind) {
    case GT:
      return d > bound.bound;
    case GTE:
      return d >= bound.bound;
    case LT:
      return d < bound.bound;
    case LTE:
      return d <= bound.bound;
    default:
      throw new AssertionError(bound.kind);
    }
  }

  private static boolean boundImplies(Bound a, Bound b) {
    switch (a.kind) {
    case GT:
      return (b.kind == Kind.GT || b.kind == Kind.GTE) && a.bound >= b.bound;
    case GTE:
      return b.kind == Kind.GTE && a.bound >= b.bound
          || b.kind == Kind.GT && a.bound > b.bound;
    case LT:
      return (b.kind == Kind.LT || b.kind == Kind.LTE) && a.bound <= b.bound;
    case LTE:
      return b.kind == Kind.LTE && a.bound <= b.bound
          || b.kind == Kind.LT && a.bound < b.bound;
    default:
      throw new AssertionError(a.kind);
    }
  }

  /** Returns the conjunction of two constraints, simplified; {@link #NEVER}
   * if they contradict. */
  public static Constraint unify(Constraint a, Constraint b) {
    return simplify(and(a, b));
  }

  /** Narrows a constraint with a flow refinement.
   *
   * <p>A negative refinement {@code not(c)} cannot be intersected
   * structurally; the result is {@link #NEVER} if {@code base} implies
   * {@code c}, otherwise {@code base} unchanged. */
  public static Constraint narrow(Constraint base, Constraint refinement) {
    if (refinement.kind == Kind.NOT) {
      return implies(base, ((Wrapper) refinement).constraint)
          ? NEVER
          : base;
    }
    return unify(base, refinement);
  }

  /** Narrows each branch of a disjunction with a refinement, dropping the
   * branches that become {@link #NEVER}. */
  public static Constraint narrowOr(Constraint c, Constraint refinement) {
    if (c.kind != Kind.OR) {
      return narrow(c, refinement);
    }
    final List<Constraint> surviving = new ArrayList<>();
    for (Constraint branch : ((Compound) c).constraints) {
      final Constraint narrowed = narrow(branch, refinement);
      if (!narrowed.isNever()) {
        surviving.add(narrowed);
      }
    }
    return simplify(or(surviving));
  }

  /** Removes literal facts from a constraint, so that it describes every
   * value of the same shape. For example, {@code widen(5)} is
   * {@code number}. */
  public static Constraint widen(Constraint c) {
    switch (c.kind) {
    case EQUALS:
      return classificationOfLiteral(((Equals) c).value);
    case GT:
    case GTE:
    case LT:
    case LTE:
      return ANY;
    case HAS_FIELD:
      final HasField hasField = (HasField) c;
      return hasField(hasField.name, widen(hasField.constraint));
    case ELEMENT_AT:
      final ElementAt elementAt = (ElementAt) c;
      return elementAt(elementAt.index, widen(elementAt.constraint));
    case ELEMENTS:
    case INDEX:
      return new Wrapper(c.kind, widen(((Wrapper) c).constraint));
    case LENGTH:
      return length(NUMBER);
    case AND:
    case OR:
      return simplify(
          new Compound(c.kind,
              ((Compound) c).constraints.stream()
                  .map(Constraints::widen)
                  .collect(ImmutableList.toImmutableList())));
    default:
      return c;
    }
  }

  /** Returns the classification of a literal. */
  public static Constraint classificationOfLiteral(Object literal) {
    if (literal instanceof Double) {
      return NUMBER;
    } else if (literal instanceof String) {
      return STRING;
    } else if (literal instanceof Boolean) {
      return BOOL;
    } else if (literal == Null.INSTANCE) {
      return NULL;
    }
    throw new IllegalArgumentException("not a literal: " + literal);
  }

  // Structural queries

  /** Returns the literal that a constraint pins a value to, or null. */
  public static @Nullable Object literalValue(Constraint c) {
    if (c.kind == Kind.EQUALS) {
      return ((Equals) c).value;
    }
    if (c.kind == Kind.AND) {
      for (Constraint e : ((Compound) c).constraints) {
        if (e.kind == Kind.EQUALS) {
          return ((Equals) e).value;
        }
      }
    }
    return null;
  }

  /** Returns the constraint of field {@code name} of an object constraint.
   *
   * <p>Looks for a {@code hasField}, then an index signature. Returns null
   * if the object is closed and does not list the field, and {@link #ANY}
   * if the object is open. For a disjunction, returns the disjunction of the
   * branches' field constraints, or null if any branch lacks the field. */
  public static @Nullable Constraint fieldConstraint(Constraint c,
      String name) {
    if (c.kind == Kind.OR) {
      final List<Constraint> list = new ArrayList<>();
      for (Constraint branch : ((Compound) c).constraints) {
        final Constraint f = fieldConstraint(branch, name);
        if (f == null) {
          return null;
        }
        list.add(f);
      }
      return simplify(or(list));
    }
    for (Constraint e : conjuncts(c)) {
      if (e.kind == Kind.HAS_FIELD && ((HasField) e).name.equals(name)) {
        return ((HasField) e).constraint;
      }
    }
    for (Constraint e : conjuncts(c)) {
      if (e.kind == Kind.INDEX) {
        final Constraint indexConstraint = ((Wrapper) e).constraint;
        return indexConstraint.isNever() ? null : indexConstraint;
      }
    }
    return ANY;
  }

  /** Returns the names of the fields listed in an object constraint; for a
   * disjunction, the fields that any branch lists. */
  public static List<String> fieldNames(Constraint c) {
    final Set<String> names = new LinkedHashSet<>();
    collectFieldNames(c, names);
    return ImmutableList.copyOf(names);
  }

  private static void collectFieldNames(Constraint c, Set<String> names) {
    switch (c.kind) {
    case HAS_FIELD:
      names.add(((HasField) c).name);
      break;
    case AND:
    case OR:
      ((Compound) c).constraints.forEach(e -> collectFieldNames(e, names));
      break;
    default:
      break;
    }
  }

  /** Returns the constraint of the element at position {@code i} of an
   * array constraint: its {@code elementAt}, else its {@code elements},
   * else {@link #ANY}. */
  public static Constraint elementConstraint(Constraint c, int i) {
    if (c.kind == Kind.OR) {
      return simplify(
          or(((Compound) c).constraints.stream()
              .map(branch -> elementConstraint(branch, i))
              .collect(Collectors.toList())));
    }
    for (Constraint e : conjuncts(c)) {
      if (e.kind == Kind.ELEMENT_AT && ((ElementAt) e).index == i) {
        return ((ElementAt) e).constraint;
      }
    }
    return elementsConstraint(c);
  }

  /** Returns the constraint that every element of an array constraint
   * satisfies, or {@link #ANY}. */
  public static Constraint elementsConstraint(Constraint c) {
    if (c.kind == Kind.OR) {
      return simplify(
          or(((Compound) c).constraints.stream()
              .map(Constraints::elementsConstraint)
              .collect(Collectors.toList())));
    }
    for (Constraint e : conjuncts(c)) {
      if (e.kind == Kind.ELEMENTS) {
        return ((Wrapper) e).constraint;
      }
    }
    return ANY;
  }

  /** Returns the known length of an array constraint, or -1. */
  public static int knownLength(Constraint c) {
    for (Constraint e : conjuncts(c)) {
      if (e.kind == Kind.LENGTH) {
        final Object literal = literalValue(((Wrapper) e).constraint);
        if (literal instanceof Double) {
          return ((Double) literal).intValue();
        }
      }
    }
    return -1;
  }

  /** Returns the constraint wrapped by an {@code isType}, or null. */
  public static @Nullable Constraint typeConstraint(Constraint c) {
    for (Constraint e : conjuncts(c)) {
      if (e.kind == Kind.IS_TYPE) {
        return ((Wrapper) e).constraint;
      }
    }
    return null;
  }

  /** Returns the conjuncts of a constraint; a singleton list if it is not a
   * conjunction. */
  public static List<Constraint> conjuncts(Constraint c) {
    return c.kind == Kind.AND
        ? ((Compound) c).constraints
        : ImmutableList.of(c);
  }

  // Printing

  /** Describes a constraint in a syntax similar to TypeScript types. */
  static String describe(Constraint c) {
    switch (c.kind) {
    case EQUALS:
      return Values.toString(((Equals) c).value);
    case GT:
    case GTE:
    case LT:
    case LTE:
      return c.kind.symbol + " " + Values.numberToString(((Bound) c).bound);
    case HAS_FIELD:
      return "{ " + ((HasField) c).name + ": "
          + describe(((HasField) c).constraint) + " }";
    case ELEMENTS:
      return describe(((Wrapper) c).constraint) + "[]";
    case LENGTH:
      return "length(" + describe(((Wrapper) c).constraint) + ")";
    case ELEMENT_AT:
      return "[" + ((ElementAt) c).index + "]: "
          + describe(((ElementAt) c).constraint);
    case INDEX:
      return "[string]: " + describe(((Wrapper) c).constraint);
    case IS_TYPE:
      return "Type<" + describe(((Wrapper) c).constraint) + ">";
    case NOT:
      return "not(" + describe(((Wrapper) c).constraint) + ")";
    case AND:
      return describeAnd(((Compound) c).constraints);
    case OR:
      return ((Compound) c).constraints.stream()
          .map(Constraints::describe)
          .collect(Collectors.joining(" | "));
    default:
      return c.kind.symbol;
    }
  }

  private static String describeAnd(List<Constraint> parts) {
    // A literal type, such as "5" for "number & equals(5)"
    if (parts.size() == 2) {
      final Constraint classification =
          parts.get(0).kind.isClassification() ? parts.get(0)
              : parts.get(1).kind.isClassification() ? parts.get(1)
              : null;
      final Constraint equals =
          parts.get(0).kind == Kind.EQUALS ? parts.get(0)
              : parts.get(1).kind == Kind.EQUALS ? parts.get(1)
              : null;
      if (classification != null && equals != null) {
        return describe(equals);
      }
    }

    // An object type, such as "{ a: number, b: string }"
    final boolean isObject = parts.contains(OBJECT);
    final List<HasField> fields = new ArrayList<>();
    Wrapper indexSignature = null;
    for (Constraint part : parts) {
      if (part.kind == Kind.HAS_FIELD) {
        fields.add((HasField) part);
      } else if (part.kind == Kind.INDEX) {
        indexSignature = (Wrapper) part;
      }
    }
    final boolean closed =
        indexSignature != null && indexSignature.constraint.isNever();
    final int expected =
        1 + fields.size() + (indexSignature != null ? 1 : 0);
    if (isObject && !fields.isEmpty() && parts.size() == expected) {
      final List<String> fieldStrings = new ArrayList<>();
      fields.forEach(f ->
          fieldStrings.add(f.name + ": " + describe(f.constraint)));
      if (indexSignature != null && !closed) {
        fieldStrings.add("[string]: " + describe(indexSignature.constraint));
      }
      return "{ " + String.join(", ", fieldStrings) + " }";
    }
    if (isObject && fields.isEmpty() && closed && parts.size() == 2) {
      return "{ }";
    }
    return parts.stream()
        .map(Constraints::describe)
        .collect(Collectors.joining(" & "));
  }
}

// End Constraints.java
