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
import static net.hydromatic.stager.constraint.Constraints.ANY;
import static net.hydromatic.stager.constraint.Constraints.ARRAY;
import static net.hydromatic.stager.constraint.Constraints.BOOL;
import static net.hydromatic.stager.constraint.Constraints.FUNCTION;
import static net.hydromatic.stager.constraint.Constraints.NEVER;
import static net.hydromatic.stager.constraint.Constraints.NUMBER;
import static net.hydromatic.stager.constraint.Constraints.OBJECT;
import static net.hydromatic.stager.constraint.Constraints.STRING;
import static net.hydromatic.stager.constraint.Constraints.implies;
import static net.hydromatic.stager.constraint.Constraints.simplify;
import static net.hydromatic.stager.constraint.Constraints.unify;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.ast.Op;
import net.hydromatic.stager.compile.AssertionFailedException;
import net.hydromatic.stager.compile.BuiltIn;
import net.hydromatic.stager.compile.FreeFinder;
import net.hydromatic.stager.compile.Refinements;
import net.hydromatic.stager.compile.StagedBuiltInContext;
import net.hydromatic.stager.compile.StagerException;
import net.hydromatic.stager.compile.StagingException;
import net.hydromatic.stager.compile.Tracer;
import net.hydromatic.stager.compile.TypeException;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;
import net.hydromatic.stager.eval.Closure;
import net.hydromatic.stager.eval.Method;
import net.hydromatic.stager.eval.Null;
import net.hydromatic.stager.eval.Operator;
import net.hydromatic.stager.eval.Session;
import net.hydromatic.stager.eval.TypeValue;
import net.hydromatic.stager.eval.Values;
import net.hydromatic.stager.foreign.DeclarationLoader;
import net.hydromatic.stager.foreign.Signature;

/** Staging engine.
 *
 * <p>Evaluates an expression as far as it can, given what is known now.
 * The result is a {@link SValue}: either a value that is known now, or
 * the residual code that will compute the value when the program runs.
 *
 * <p>Each kind of expression has a rule, selected by
 * {@link #stage(Expr, SEnv, RefinementContext)}. The rules for bindings
 * defer to {@link Materializer}, calls to recursive functions to
 * {@link RecursionCoordinator}, and calls to functions whose parameters
 * must be known at staging time to {@link Specializer}.
 *
 * <p>A stager is not thread-safe. */
public class Stager {
  final StagingSession session;
  final Materializer materializer;
  final RecursionCoordinator recursion;
  final ClosureResidualizer residualizer;
  final Specializer specializer;

  /** Creates a Stager. */
  public Stager(Session session, Tracer tracer, DeclarationLoader loader) {
    this(new StagingSession(session, tracer, loader));
  }

  /** Creates a Stager that uses an existing staging session. */
  public Stager(StagingSession session) {
    this.session = requireNonNull(session);
    this.materializer = new Materializer(this);
    this.recursion = new RecursionCoordinator(this);
    this.residualizer = new ClosureResidualizer(this);
    this.specializer = new Specializer(this);
  }

  public StagingSession session() {
    return session;
  }

  /** Stages a program in the initial environment.
   *
   * <p>Forgets the state left by previous runs. */
  public SValue stage(Expr e) {
    session.reset();
    final SValue result;
    try {
      result = stage(e, SEnvs.initial(), RefinementContext.EMPTY);
    } catch (StagerException ex) {
      session.tracer.onException(ex);
      throw ex;
    }
    session.tracer.onException(null);
    session.tracer.onResult(result);
    return result;
  }

  /** Stages a program and generates the residual program: declarations of
   * the functions it calls, followed by the main expression. */
  public ResidualProgram compile(Expr e) {
    final SValue result = stage(e);
    return new ProgramGenerator(this).generate(result);
  }

  /** Stages an expression in an environment. */
  public SValue stage(Expr e, SEnv env) {
    return stage(e, env, RefinementContext.EMPTY);
  }

  /** Stages an expression in an environment, with refinements learned from
   * enclosing conditions. */
  public SValue stage(Expr e, SEnv env, RefinementContext cx) {
    final SValue value = stage2(e, env, cx);
    session.tracer.onStage(e, value);
    return value;
  }

  private SValue stage2(Expr e, SEnv env, RefinementContext cx) {
    switch (e.op) {
    case LITERAL:
      return SValue.of(((Expr.Literal) e).value);
    case ID:
      return stageId((Expr.Id) e, env, cx);
    case TIMES:
    case DIVIDE:
    case MOD:
    case PLUS:
    case MINUS:
    case LT:
    case LE:
    case GT:
    case GE:
    case EQ:
    case NE:
      return stageBinary((Expr.Binary) e, env, cx);
    case ANDALSO:
    case ORELSE:
      return stageLogical((Expr.Binary) e, env, cx);
    case NEGATE:
    case NOT:
      return stageUnary((Expr.Unary) e, env, cx);
    case IF:
      return stageIf((Expr.If) e, env, cx);
    case LET:
      return stageLet((Expr.Let) e, env, cx);
    case LET_PATTERN:
      return stageLetPattern((Expr.LetPattern) e, env, cx);
    case LET_REC:
      return stageLetRec((Expr.LetRec) e, env, cx);
    case FN:
      // Known as soon as it is defined; the body is staged when called
      return SValue.now(new Closure((Expr.Fn) e, env), FUNCTION);
    case APPLY:
      return stageCall((Expr.Call) e, env, cx);
    case METHOD_CALL:
      return stageMethodCall((Expr.MethodCall) e, env, cx);
    case OBJECT:
      return stageObject((Expr.ObjectLit) e, env, cx);
    case FIELD:
      return stageField((Expr.Field) e, env, cx);
    case ARRAY:
      return stageArray((Expr.ArrayLit) e, env, cx);
    case INDEX:
      return stageIndex((Expr.Index) e, env, cx);
    case BLOCK:
      return stageBlock((Expr.Block) e, env, cx);
    case COMPTIME:
      return stageComptime((Expr.Comptime) e, env, cx);
    case RUNTIME:
      return stageRuntime((Expr.Runtime) e, env, cx);
    case ASSERT:
      return stageAssert((Expr.Assert) e, env, cx);
    case ASSERT_COND:
      return stageAssertCond((Expr.AssertCond) e, env, cx);
    case TRUST:
      return stageTrust((Expr.Trust) e, env, cx);
    case TYPE_OF:
      final Constraint c = stage(((Expr.TypeOf) e).expr, env, cx).constraint;
      return SValue.now(new TypeValue(c), Constraints.isType(c));
    case IMPORT:
      return stageImport((Expr.Import) e, env, cx);
    default:
      throw new AssertionError("unknown op " + e.op);
    }
  }

  private SValue stageId(Expr.Id id, SEnv env, RefinementContext cx) {
    final SValue value = env.get(id.name);
    final Constraint c = cx.narrow(id.name, value.constraint);
    if (value instanceof SValue.StagedClosure
        && ((SValue.StagedClosure) value).name() != null
        && ((SValue.StagedClosure) value).residual == null) {
      // A named function is declared at the top of the residual program,
      // and referenced by the name under which it is declared
      final SValue.StagedClosure closure = (SValue.StagedClosure) value;
      return SValue.now(closure.value, c,
          expr.id(session.reference(closure)));
    }
    if (value instanceof SValue.Now) {
      final SValue.Now now = (SValue.Now) value;
      if (now.residual == null && Values.isCompound(now.value)) {
        return SValue.now(now.value, c, expr.id(id.name));
      }
    }
    return c.equals(value.constraint) ? value : value.withConstraint(c);
  }

  private SValue stageBinary(Expr.Binary b, SEnv env, RefinementContext cx) {
    final SValue left = stage(b.a0, env, cx);
    final SValue right = stage(b.a1, env, cx);
    Operator operator = Operator.of(b.op);
    if (b.op == Op.PLUS
        && (implies(left.constraint, STRING)
            || implies(right.constraint, STRING))) {
      operator = Operator.STRING_CONCAT;
      require(left.constraint, STRING, "left of string +");
      require(right.constraint, STRING, "right of string +");
    } else {
      require(left.constraint, operator.params.get(0),
          "left of " + b.op.symbol());
      require(right.constraint, operator.params.get(1),
          "right of " + b.op.symbol());
    }
    return apply(operator, ImmutableList.of(left, right),
        () -> expr.binary(b.op, residualOf(left), residualOf(right)));
  }

  /** Stages "&amp;&amp;" and "||". The right operand is staged only if
   * the left does not decide the result, and with the refinements that
   * the left operand implies. */
  private SValue stageLogical(Expr.Binary b, SEnv env,
      RefinementContext cx) {
    final boolean and = b.op == Op.ANDALSO;
    final SValue left = stage(b.a0, env, cx);
    require(left.constraint, BOOL, "left of " + b.op.symbol());
    final Map<String, Constraint> refinements = Refinements.extract(b.a0);
    final RefinementContext rightCx =
        cx.refine(and ? refinements : Refinements.negate(refinements));
    if (left.isNow()) {
      final boolean v = (Boolean) left.asNow().value;
      if (v != and) {
        // "false && x" is false, "true || x" is true
        return SValue.of(v);
      }
      // "true && x" is x, "false || x" is x
      final SValue right = stage(b.a1, env, rightCx);
      require(right.constraint, BOOL, "right of " + b.op.symbol());
      return right;
    }
    final SValue right = stage(b.a1, env, rightCx);
    require(right.constraint, BOOL, "right of " + b.op.symbol());
    return apply(Operator.of(b.op), ImmutableList.of(left, right),
        () -> expr.binary(b.op, residualOf(left), residualOf(right)));
  }

  private SValue stageUnary(Expr.Unary u, SEnv env, RefinementContext cx) {
    final SValue a = stage(u.a, env, cx);
    final Operator operator = Operator.of(u.op);
    require(a.constraint, operator.params.get(0),
        "operand of " + u.op.symbol());
    return apply(operator, ImmutableList.of(a),
        () -> expr.unary(u.op, residualOf(a)));
  }

  /** Applies an operator to operands whose constraints have been checked;
   * computes now if all are known, otherwise generates residual code. */
  private SValue apply(Operator operator, List<SValue> args,
      Supplier<Expr> residual) {
    final List<Constraint> constraints = constraints(args);
    if (SValue.allNow(args)) {
      final Object v = operator.apply(values(args));
      return SValue.now(v,
          unify(operator.result(constraints), Values.constraintOf(v)));
    }
    return SValue.later(operator.result(constraints), residual.get());
  }

  private SValue stageIf(Expr.If e, SEnv env, RefinementContext cx) {
    final SValue condition = stage(e.condition, env, cx);
    require(condition.constraint, BOOL, "if condition");
    final Map<String, Constraint> refinements =
        Refinements.extract(e.condition);
    final RefinementContext trueCx = cx.refine(refinements);
    final RefinementContext falseCx =
        cx.refine(Refinements.negate(refinements));
    if (condition.isNow()) {
      // Only the branch taken is staged
      return (Boolean) condition.asNow().value
          ? stage(e.ifTrue, env, trueCx)
          : stage(e.ifFalse, env, falseCx);
    }
    final SValue ifTrue = stage(e.ifTrue, env, trueCx);
    final SValue ifFalse = stage(e.ifFalse, env, falseCx);
    return SValue.later(
        simplify(Constraints.or(ifTrue.constraint, ifFalse.constraint)),
        expr.ifThenElse(residualOf(condition), residualOf(ifTrue),
            residualOf(ifFalse)));
  }

  private SValue stageLet(Expr.Let let, SEnv env, RefinementContext cx) {
    final SValue value = stage(let.value, env, cx);
    final SEnv env2 =
        env.set(let.name, Materializer.bindable(let.name, value));
    final SValue result =
        stage(let.body, env2, cx.without(ImmutableList.of(let.name)));
    return materializer.wrap(ImmutableList.of(let.name),
        ImmutableList.of(value), let.body, result);
  }

  private SValue stageLetPattern(Expr.LetPattern e, SEnv env,
      RefinementContext cx) {
    final SValue value = stage(e.value, env, cx);
    final Map<String, SValue> bindings = new LinkedHashMap<>();
    destructure(e.pat, value, bindings);
    final ImmutableList<String> names = ImmutableList.copyOf(bindings.keySet());
    if (value.isNow()) {
      // Every variable is bound to a part of a known value; materialize
      // each as if it were bound by its own "let"
      final Map<String, SValue> bound = new LinkedHashMap<>();
      bindings.forEach((name, v) ->
          bound.put(name, Materializer.bindable(name, v)));
      final SValue result =
          stage(e.body, env.setAll(bound), cx.without(names));
      return materializer.wrap(names,
          ImmutableList.copyOf(bindings.values()), e.body, result);
    }
    final SValue result =
        stage(e.body, env.setAll(bindings), cx.without(names));
    if (result.isNow()) {
      return Materializer.escape(result.asNow(), names);
    }
    if (FreeFinder.usesAny(e.body, names)) {
      session.tracer.onMaterialize(e.pat.toString(), residualOf(value));
      return SValue.later(result.constraint,
          expr.letPattern(e.pat, residualOf(value), residualOf(result)));
    }
    return result;
  }

  /** Binds the variables of a pattern to the corresponding parts of a
   * value. Parts of a value that is not known now are bound to the
   * variable of the same name, which the residual "let" will define. */
  private void destructure(Expr.Pat pat, SValue value,
      Map<String, SValue> bindings) {
    switch (pat.op) {
    case VAR_PAT:
      final String name = ((Expr.VarPat) pat).name;
      bindings.put(name,
          value.isNow() ? value : SValue.later(value.constraint,
              expr.id(name)));
      return;

    case ARRAY_PAT:
      final List<Expr.Pat> elements = ((Expr.ArrayPat) pat).elements;
      require(value.constraint, ARRAY, "array pattern");
      for (int i = 0; i < elements.size(); i++) {
        destructure(elements.get(i), element(value, i), bindings);
      }
      return;

    case OBJECT_PAT:
      require(value.constraint, OBJECT, "object pattern");
      ((Expr.ObjectPat) pat).fields.forEach((field, fieldPat) ->
          destructure(fieldPat, field(value, field), bindings));
      return;

    default:
      throw new AssertionError("unknown pattern " + pat.op);
    }
  }

  /** Returns element {@code i} of an array, for a pattern. */
  private SValue element(SValue array, int i) {
    if (array.isNow()) {
      final List<Object> list = Values.asArray(array.asNow().value);
      if (i >= list.size()) {
        throw new TypeException(Constraints.elementAt(i, ANY),
            array.constraint, "array pattern");
      }
      return SValue.of(list.get(i));
    }
    if (array.isLaterArray()) {
      final SValue element = ((SValue.LaterArray) array).get(i);
      if (element == null) {
        throw new TypeException(Constraints.elementAt(i, ANY),
            array.constraint, "array pattern");
      }
      return element;
    }
    final Constraint c = Constraints.elementConstraint(array.constraint, i);
    return SValue.later(c,
        expr.index(residualOf(array), expr.numberLiteral(i)));
  }

  /** Returns a field of an object, for a pattern. */
  private SValue field(SValue object, String name) {
    if (object.isNow()) {
      final Object o = object.asNow().value;
      if (!(o instanceof Map) || !Values.asObject(o).containsKey(name)) {
        throw new TypeException(Constraints.hasField(name, ANY),
            object.constraint, "object pattern");
      }
      return SValue.of(Values.asObject(o).get(name));
    }
    final Constraint c = Constraints.fieldConstraint(object.constraint, name);
    if (c == null) {
      throw new TypeException(Constraints.hasField(name, ANY),
          object.constraint, "object pattern");
    }
    return SValue.later(c, expr.field(residualOf(object), name));
  }

  /** Stages a group of mutually recursive functions. Each closure's
   * environment contains every closure in the group, so it is computed
   * lazily. */
  private SValue stageLetRec(Expr.LetRec e, SEnv env, RefinementContext cx) {
    final Map<String, SValue> closures = new LinkedHashMap<>();
    final Supplier<SEnv> envSupplier =
        Suppliers.memoize(() -> env.setAll(closures));
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    e.fns.forEach(fn -> names.add(requireNonNull(fn.name)));
    final ImmutableList<String> group = names.build();
    for (Expr.Fn fn : e.fns) {
      final ImmutableList<String> siblings =
          group.stream().filter(name -> !name.equals(fn.name))
              .collect(ImmutableList.toImmutableList());
      closures.put(fn.name,
          SValue.now(new Closure(fn, envSupplier, siblings), FUNCTION));
    }
    final SValue result =
        stage(e.body, envSupplier.get(), cx.without(group));
    if (result.isNow()) {
      return Materializer.escape(result.asNow(), group);
    }
    // Named functions are declared at the top of the residual program
    return result;
  }

  private SValue stageCall(Expr.Call call, SEnv env, RefinementContext cx) {
    final SValue fn = stage(call.fn, env, cx);
    final List<SValue> args = stageAll(call.args, env, cx);
    return invoke(fn, args, env, cx);
  }

  /** Calls a function value with staged arguments. */
  SValue invoke(SValue fn, List<SValue> args, SEnv env,
      RefinementContext cx) {
    if (fn.isNow() && fn.asNow().value instanceof BuiltIn) {
      return callBuiltIn((BuiltIn) fn.asNow().value, args, env, cx);
    }
    require(fn.constraint, FUNCTION, "function call");
    if (!fn.isNow()) {
      // The function will not be known until run time
      return SValue.later(ANY, expr.call(residualOf(fn), residuals(args)));
    }
    if (!fn.isStagedClosure()) {
      throw new TypeException(FUNCTION, fn.constraint, "function call");
    }
    return callClosure((SValue.StagedClosure) fn, args);
  }

  private SValue callBuiltIn(BuiltIn builtIn, List<SValue> args, SEnv env,
      RefinementContext cx) {
    builtIn.checkArgs(args);
    if (builtIn.handler != null) {
      return builtIn.handler.apply(new BuiltInContext(env, cx), args);
    }
    final Constraint result = builtIn.result(constraints(args));
    if (SValue.allNow(args)) {
      final Object v = builtIn.apply(values(args));
      return SValue.now(v,
          simplify(Constraints.and(result, Values.constraintOf(v))));
    }
    return SValue.later(result,
        expr.call(expr.id(builtIn.fnName), residuals(args)));
  }

  /** Calls a closure. Depending on what is known about the arguments, the
   * call is specialized, residualized as a recursive call, or inlined. */
  SValue callClosure(SValue.StagedClosure fn, List<SValue> args) {
    final Closure closure = fn.closure();
    if (args.size() != closure.params().size()) {
      throw new TypeException(
          Constraints.length(Constraints.equalTo(closure.params().size())),
          Constraints.length(Constraints.equalTo(args.size())),
          "call to " + closure);
    }
    session.recordArgs(closure, args);
    final boolean allNow = SValue.allNow(args);
    if (!allNow
        && !closure.comptimeParams().isEmpty()
        && session.specialize()) {
      return specializer.specialize(fn, args);
    }
    if (!allNow && closure.name() != null) {
      return recursion.call(fn, args);
    }
    return inline(fn, args);
  }

  /** Stages the body of a closure in place of a call. */
  private SValue inline(SValue.StagedClosure fn, List<SValue> args) {
    final Closure closure = fn.closure();
    final SValue result = stageBody(fn, args);
    if (!SValue.allNow(args) && fn.residual != null) {
      // Call the function by name rather than copy its body
      final Expr call = expr.call(fn.residual, residuals(args));
      return result.isNow()
          ? SValue.now(result.asNow().value, result.constraint, call)
          : SValue.later(result.constraint, call);
    }
    return materializer.wrap(closure.params(), args, closure.fn.body,
        result);
  }

  /** Stages the body of a closure with its parameters bound to
   * arguments. */
  SValue stageBody(SValue.StagedClosure fn, List<SValue> args) {
    final Closure closure = fn.closure();
    final Map<String, SValue> bindings = new LinkedHashMap<>();
    if (closure.name() != null) {
      bindings.put(closure.name(), SValue.now(closure, FUNCTION));
    }
    for (int i = 0; i < args.size(); i++) {
      final String param = closure.params().get(i);
      bindings.put(param, Materializer.bindable(param, args.get(i)));
    }
    session.enter();
    try {
      return stage(closure.fn.body, closure.env().setAll(bindings),
          RefinementContext.EMPTY);
    } finally {
      session.exit();
    }
  }

  private SValue stageMethodCall(Expr.MethodCall e, SEnv env,
      RefinementContext cx) {
    final SValue receiver = stage(e.receiver, env, cx);
    final BuiltIn builtIn = BuiltIn.lookup(e.method);
    if (builtIn != null && builtIn.isMethod) {
      // "a.map(f)" is "map(a, f)"
      require(receiver.constraint, builtIn.params.get(0),
          "receiver of ." + e.method + "()");
      final List<SValue> args = new ArrayList<>();
      args.add(receiver);
      args.addAll(stageAll(e.args, env, cx));
      return callBuiltIn(builtIn, args, env, cx);
    }
    final Method method = Method.lookup(receiver.constraint, e.method);
    if (method == null) {
      throw new TypeException(Constraints.hasField(e.method, FUNCTION),
          receiver.constraint, "method call ." + e.method + "()");
    }
    final List<SValue> args = stageAll(e.args, env, cx);
    if (!method.acceptsArity(args.size())) {
      throw new TypeException(
          Constraints.length(Constraints.equalTo(method.params.size())),
          Constraints.length(Constraints.equalTo(args.size())),
          "call to ." + e.method + "()");
    }
    for (int i = 0; i < args.size(); i++) {
      require(args.get(i).constraint, method.params.get(i),
          "argument " + i + " of ." + e.method + "()");
    }
    final Constraint result =
        method.result(receiver.constraint, constraints(args));
    if (receiver.isNow() && SValue.allNow(args)) {
      final Object v = method.apply(receiver.asNow().value, values(args));
      return SValue.now(v,
          simplify(Constraints.and(result, Values.constraintOf(v))));
    }
    return SValue.later(result,
        expr.methodCall(residualOf(receiver), e.method, residuals(args)));
  }

  private SValue stageObject(Expr.ObjectLit e, SEnv env,
      RefinementContext cx) {
    final Map<String, SValue> fields = new LinkedHashMap<>();
    e.fields.forEach((name, value) -> fields.put(name, stage(value, env, cx)));
    final List<Constraint> constraints = new ArrayList<>();
    constraints.add(OBJECT);
    fields.forEach((name, value) ->
        constraints.add(Constraints.hasField(name, value.constraint)));
    // Closed: no fields other than those listed
    constraints.add(Constraints.index(NEVER));
    final Constraint c = Constraints.and(constraints);
    final ImmutableMap.Builder<String, Expr> residuals =
        ImmutableMap.builder();
    fields.forEach((name, value) -> residuals.put(name, residualOf(value)));
    if (SValue.allNow(fields.values())) {
      final ImmutableMap.Builder<String, Object> b = ImmutableMap.builder();
      fields.forEach((name, value) -> b.put(name, value.asNow().value));
      final boolean anyResidual =
          fields.values().stream().anyMatch(v -> v.asNow().residual != null);
      return SValue.now(b.build(), c,
          anyResidual ? expr.object(residuals.build()) : null);
    }
    return SValue.later(c, expr.object(residuals.build()));
  }

  private SValue stageField(Expr.Field e, SEnv env, RefinementContext cx) {
    final SValue receiver = stage(e.receiver, env, cx);
    final Constraint c = receiver.constraint;
    if (e.name.equals("length")
        && (implies(c, STRING) || implies(c, ARRAY))) {
      return length(receiver);
    }
    require(c, OBJECT, "field access ." + e.name);
    if (receiver.isNow()) {
      final Object o = receiver.asNow().value;
      if (!(o instanceof Map) || !Values.asObject(o).containsKey(e.name)) {
        throw new TypeException(Constraints.hasField(e.name, ANY), c,
            "field access ." + e.name);
      }
      final Object v = Values.asObject(o).get(e.name);
      final Constraint fieldConstraint = Constraints.fieldConstraint(c, e.name);
      return SValue.now(v,
          fieldConstraint != null ? fieldConstraint : Values.constraintOf(v));
    }
    final Constraint fieldConstraint = Constraints.fieldConstraint(c, e.name);
    if (fieldConstraint == null) {
      // A closed object that does not have this field
      throw new TypeException(Constraints.hasField(e.name, ANY), c,
          "field access ." + e.name);
    }
    return SValue.later(fieldConstraint,
        expr.field(residualOf(receiver), e.name));
  }

  /** Returns the length of a string or array. */
  private SValue length(SValue receiver) {
    if (receiver.isNow()) {
      final Object o = receiver.asNow().value;
      final int length = o instanceof String
          ? ((String) o).length()
          : Values.asArray(o).size();
      return SValue.of((double) length);
    }
    if (receiver.isLaterArray()) {
      final int length = ((SValue.LaterArray) receiver).elements.size();
      return SValue.of((double) length);
    }
    return SValue.later(Constraints.and(NUMBER, Constraints.gte(0)),
        expr.field(residualOf(receiver), "length"));
  }

  private SValue stageArray(Expr.ArrayLit e, SEnv env,
      RefinementContext cx) {
    final List<SValue> elements = stageAll(e.elements, env, cx);
    if (!SValue.allNow(elements)) {
      return SValue.laterArray(elements);
    }
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    elements.forEach(element -> b.add(element.asNow().value));
    final boolean anyResidual =
        elements.stream().anyMatch(v -> v.asNow().residual != null);
    return SValue.now(b.build(),
        Values.arrayConstraint(constraints(elements)),
        anyResidual ? expr.array(residuals(elements)) : null);
  }

  private SValue stageIndex(Expr.Index e, SEnv env, RefinementContext cx) {
    final SValue array = stage(e.array, env, cx);
    final SValue index = stage(e.index, env, cx);
    require(array.constraint, ARRAY, "array index");
    require(index.constraint, NUMBER, "array index");
    if (index.isNow()) {
      final double d = (Double) index.asNow().value;
      final int length = array.isNow()
          ? Values.asArray(array.asNow().value).size()
          : array.isLaterArray()
          ? ((SValue.LaterArray) array).elements.size()
          : -1;
      if (length >= 0 && !(Values.isIndex(d) && d < length)) {
        throw new TypeException(
            Constraints.and(NUMBER, Constraints.gte(0),
                Constraints.lt(length)),
            index.constraint, "array index");
      }
      final int i = (int) d;
      if (array.isNow()) {
        final Object v = Values.asArray(array.asNow().value).get(i);
        return SValue.now(v,
            Constraints.elementConstraint(array.constraint, i));
      }
      if (array.isLaterArray()) {
        // Read the element without materializing the array
        return ((SValue.LaterArray) array).elements.get(i);
      }
      if (Values.isIndex(d)) {
        return SValue.later(Constraints.elementConstraint(array.constraint, i),
            expr.index(residualOf(array), residualOf(index)));
      }
    }
    return SValue.later(Constraints.elementsConstraint(array.constraint),
        expr.index(residualOf(array), residualOf(index)));
  }

  /** Stages a block. The value is that of the last expression; earlier
   * expressions whose values are not known now are kept in the residual
   * code for their effects. */
  private SValue stageBlock(Expr.Block e, SEnv env, RefinementContext cx) {
    if (e.exprs.isEmpty()) {
      return SValue.of(Null.INSTANCE);
    }
    final List<Expr> effects = new ArrayList<>();
    SValue last = stage(e.exprs.get(0), env, cx);
    for (Expr x : e.exprs.subList(1, e.exprs.size())) {
      if (!last.isNow()) {
        effects.add(residualOf(last));
      }
      last = stage(x, env, cx);
    }
    if (effects.isEmpty()) {
      return last;
    }
    effects.add(residualOf(last));
    return SValue.later(last.constraint, expr.block(effects));
  }

  private SValue stageComptime(Expr.Comptime e, SEnv env,
      RefinementContext cx) {
    final SValue result = stage(e.expr, env, cx);
    if (!result.isNow()) {
      throw new StagingException("comptime expression evaluated to runtime "
          + "value. Expression: " + e.expr + ", Constraint: "
          + result.constraint, e.expr.toString(), result.constraint);
    }
    return result;
  }

  private SValue stageRuntime(Expr.Runtime e, SEnv env,
      RefinementContext cx) {
    final SValue result = stage(e.expr, env, cx);
    final String name =
        e.name != null ? e.name : session.nameGenerator.get("rt");
    session.runtime(name, result.constraint);
    return SValue.later(result.constraint, expr.id(name));
  }

  private SValue stageAssert(Expr.Assert e, SEnv env, RefinementContext cx) {
    final Constraint target = typeArgument(e.type, env, cx, "assert");
    final SValue value = stage(e.value, env, cx);
    if (value.isNow()) {
      final Object v = value.asNow().value;
      if (!Values.satisfies(v, target)) {
        throw new AssertionFailedException(
            e.message != null
                ? e.message
                : "Assertion failed: value " + Values.toString(v)
                    + " does not satisfy " + target,
            v, target);
      }
      return value.withConstraint(unify(value.constraint, target));
    }
    // Refer to the type by name if it has one; the expression that computed
    // it may not be in scope at run time
    final String typeName = SEnvs.typeName(target);
    final Expr type = typeName != null ? expr.id(typeName) : e.type;
    return SValue.later(unify(value.constraint, target),
        expr.assertType(residualOf(value), type, e.message));
  }

  /** Stages the type argument of "assert" or "trust", which must be known
   * now, and returns the constraint it denotes. */
  private Constraint typeArgument(Expr e, SEnv env, RefinementContext cx,
      String function) {
    final SValue type = stage(e, env, cx);
    if (!type.isNow()) {
      throw new StagingException(function + " requires a type that is known "
          + "at staging time", e.toString(), type.constraint);
    }
    return typeConstraint(type.asNow().value, function);
  }

  /** Converts a type value, or an array of type values (a tuple), to a
   * constraint. */
  private static Constraint typeConstraint(Object value, String function) {
    if (value instanceof TypeValue) {
      return ((TypeValue) value).constraint;
    }
    if (value instanceof List && !function.equals("assert")) {
      final List<Constraint> list = new ArrayList<>();
      for (Object element : Values.asArray(value)) {
        list.add(typeConstraint(element, function));
      }
      return Constraints.tuple(list);
    }
    throw new TypeException(Constraints.TYPE, Values.constraintOf(value),
        function + " constraint");
  }

  private SValue stageAssertCond(Expr.AssertCond e, SEnv env,
      RefinementContext cx) {
    final SValue condition = stage(e.condition, env, cx);
    require(condition.constraint, BOOL, "assert condition");
    if (condition.isNow()) {
      if (!(Boolean) condition.asNow().value) {
        throw new AssertionFailedException(
            e.message != null
                ? e.message
                : "Assertion failed: condition is false",
            false, BOOL);
      }
      return SValue.now(true, BOOL);
    }
    return SValue.later(BOOL,
        expr.assertCond(residualOf(condition), e.message));
  }

  private SValue stageTrust(Expr.Trust e, SEnv env, RefinementContext cx) {
    final SValue value = stage(e.value, env, cx);
    if (e.type == null) {
      return value;
    }
    final Constraint target = typeArgument(e.type, env, cx, "trust");
    // No check, now or later
    return value.withConstraint(unify(value.constraint, target));
  }

  private SValue stageImport(Expr.Import e, SEnv env, RefinementContext cx) {
    session.loadImports(e.module, e.names);
    final List<String> bound = new ArrayList<>();
    SEnv env2 = env;
    for (String name : e.names) {
      final Signature signature = session.importSignature(e.module, name);
      if (signature == null) {
        throw new StagingException("Module \"" + e.module
            + "\" has no export named \"" + name + "\"");
      }
      if (signature.isGeneric()) {
        // A generic function becomes a closure that calls the imported
        // function, so that each call is staged with its own arguments
        final String implName = "__" + name + "_impl";
        env2 = env2.set(implName, SValue.later(FUNCTION, expr.id(name)));
        final List<String> params = new ArrayList<>();
        final List<Expr> args = new ArrayList<>();
        for (int i = 0; i < signature.paramCount; i++) {
          params.add("arg" + i);
          args.add(expr.id("arg" + i));
        }
        final Expr.Fn fn =
            expr.fn(params, expr.call(expr.id(implName), args));
        env2 = env2.set(name, SValue.now(new Closure(fn, env2), FUNCTION));
        bound.add(implName);
      } else {
        env2 = env2.set(name, SValue.later(signature.constraint,
            expr.id(name)));
      }
      bound.add(name);
    }
    final SValue result = stage(e.body, env2, cx.without(bound));
    if (result.isNow()) {
      return Materializer.escape(result.asNow(), e.names);
    }
    if (FreeFinder.usesAny(e.body, e.names)) {
      return SValue.later(result.constraint,
          expr.importFrom(e.names, e.module, residualOf(result)));
    }
    return result;
  }

  /** Returns the expression that computes a staged value. */
  public Expr residualOf(SValue value) {
    if (value instanceof SValue.Later) {
      return ((SValue.Later) value).residual;
    }
    if (value instanceof SValue.LaterArray) {
      return expr.array(residuals(((SValue.LaterArray) value).elements));
    }
    final SValue.Now now = value.asNow();
    return now.residual != null ? now.residual : valueToExpr(now.value);
  }

  /** Converts a value that is known now to an expression. */
  public Expr valueToExpr(Object value) {
    if (Constraints.isLiteral(value)) {
      return expr.literal(value);
    }
    if (value instanceof Map) {
      final ImmutableMap.Builder<String, Expr> b = ImmutableMap.builder();
      Values.asObject(value).forEach((name, v) -> b.put(name, valueToExpr(v)));
      return expr.object(b.build());
    }
    if (value instanceof List) {
      final List<Expr> list = new ArrayList<>();
      Values.asArray(value).forEach(v -> list.add(valueToExpr(v)));
      return expr.array(list);
    }
    if (value instanceof Closure) {
      final SValue.StagedClosure closure =
          (SValue.StagedClosure) SValue.now(value, FUNCTION);
      if (closure.name() != null) {
        return expr.id(session.reference(closure));
      }
      return residualizer.residualize(closure);
    }
    if (value instanceof BuiltIn) {
      return expr.id(((BuiltIn) value).fnName);
    }
    if (value instanceof TypeValue) {
      final Constraint c = ((TypeValue) value).constraint;
      final String name = SEnvs.typeName(c);
      if (name == null) {
        throw new StagingException("type " + c + " has no name, so cannot "
            + "be used in residual code", null, Constraints.isType(c));
      }
      return expr.id(name);
    }
    throw new AssertionError("not a value: " + value);
  }

  private List<SValue> stageAll(List<Expr> exprs, SEnv env,
      RefinementContext cx) {
    final List<SValue> list = new ArrayList<>();
    for (Expr e : exprs) {
      list.add(stage(e, env, cx));
    }
    return list;
  }

  List<Expr> residuals(List<? extends SValue> values) {
    final ImmutableList.Builder<Expr> b = ImmutableList.builder();
    values.forEach(value -> b.add(residualOf(value)));
    return b.build();
  }

  private static List<Constraint> constraints(List<SValue> values) {
    final ImmutableList.Builder<Constraint> b = ImmutableList.builder();
    values.forEach(value -> b.add(value.constraint));
    return b.build();
  }

  private static List<Object> values(List<SValue> values) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    values.forEach(value -> b.add(value.asNow().value));
    return b.build();
  }

  /** Throws if a constraint does not imply a required constraint. */
  static void require(Constraint actual, Constraint expected,
      String context) {
    if (!implies(actual, expected)) {
      throw new TypeException(expected, actual, context);
    }
  }

  /** What a staged built-in sees of this stager. */
  private class BuiltInContext implements StagedBuiltInContext {
    private final SEnv env;
    private final RefinementContext cx;

    BuiltInContext(SEnv env, RefinementContext cx) {
      this.env = env;
      this.cx = cx;
    }

    @Override public SEnv env() {
      return env;
    }

    @Override public RefinementContext refinements() {
      return cx;
    }

    @Override public SValue invoke(SValue fn, List<SValue> args) {
      return Stager.this.invoke(fn, args, env, cx);
    }

    @Override public Expr valueToExpr(Object value) {
      return Stager.this.valueToExpr(value);
    }

    @Override public Expr residualOf(SValue value) {
      return Stager.this.residualOf(value);
    }

    @Override public SValue.Now now(Object value, Constraint constraint) {
      return SValue.now(value, constraint);
    }

    @Override public SValue.Later later(Constraint constraint,
        Expr residual) {
      return SValue.later(constraint, residual);
    }

    @Override public Consumer<String> out() {
      return session.session.out;
    }
  }
}

// End Stager.java
