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
package net.hydromatic.stager.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.stager.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import net.hydromatic.stager.constraint.Constraints;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression tree.
 *
 * <p>The same tree represents both source programs and the residual
 * programs that staging emits. Nodes are immutable; create them using
 * {@link ExprBuilder#expr}.
 */
public abstract class Expr extends AstNode {
  Expr(Op op) {
    super(op);
  }

  @Override public abstract Expr accept(Shuttle shuttle);

  /** Returns whether this expression is cheap enough to duplicate: a
   * variable or a literal. */
  public boolean isSimple() {
    return op == Op.ID || op == Op.LITERAL;
  }

  /** Encloses the node in parentheses if the surrounding precedence
   * requires it; otherwise writes it using {@code body}. */
  AstWriter wrap(AstWriter w, int left, int right, Consumer<AstWriter> body) {
    if (AstWriter.needsParentheses(left, op, right)) {
      return w.append("(").append(this, 0, 0).append(")");
    }
    body.accept(w);
    return w;
  }

  /** Literal: a number, string, boolean or null. */
  public static class Literal extends Expr {
    public final Object value;

    Literal(Object value) {
      super(Op.LITERAL);
      checkArgument(Constraints.isLiteral(value), "not a literal: %s", value);
      this.value = value;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && value.equals(((Literal) o).value);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (value instanceof Double
          && (Double) value < 0
          && right > Op.NEGATE.right) {
        // "(-1).toString()"
        return w.append("(").appendLiteral(value).append(")");
      }
      return w.appendLiteral(value);
    }
  }

  /** Reference to a variable. */
  public static class Id extends Expr {
    public final String name;

    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && name.equals(((Id) o).name);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Call to a binary operator, such as "a + b". */
  public static class Binary extends Expr {
    public final Expr a0;
    public final Expr a1;

    Binary(Op op, Expr a0, Expr a1) {
      super(op);
      checkArgument(op.isBinary(), "not binary: %s", op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    public Binary copy(Expr a0, Expr a1) {
      return a0 == this.a0 && a1 == this.a1 ? this
          : expr.binary(op, a0, a1);
    }
  }

  /** Call to a unary operator, such as "-a" or "!b". */
  public static class Unary extends Expr {
    public final Expr a;

    Unary(Op op, Expr a) {
      super(op);
      checkArgument(op.isUnary(), "not unary: %s", op);
      this.a = requireNonNull(a);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    public Unary copy(Expr a) {
      return a == this.a ? this : expr.unary(op, a);
    }
  }

  /** "If ... then ... else ..." expression. */
  public static class If extends Expr {
    public final Expr condition;
    public final Expr ifTrue;
    public final Expr ifFalse;

    If(Expr condition, Expr ifTrue, Expr ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append("if ").append(condition, 0, 0)
              .append(" then ").append(ifTrue, 0, 0)
              .append(" else ").append(ifFalse, 0, right));
    }

    public If copy(Expr condition, Expr ifTrue, Expr ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : expr.ifThenElse(condition, ifTrue, ifFalse);
    }
  }

  /** "Let" expression that binds one variable, "let x = e in body". */
  public static class Let extends Expr {
    public final String name;
    public final Expr value;
    public final Expr body;

    Let(String name, Expr value, Expr body) {
      super(Op.LET);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append("let ").append(name).append(" = ").append(value, 0, 0)
              .append(" in ").append(body, 0, right));
    }

    public Let copy(Expr value, Expr body) {
      return value == this.value && body == this.body ? this
          : expr.let(name, value, body);
    }
  }

  /** "Let" expression that destructures a value,
   * "let [a, { b }] = e in body". */
  public static class LetPattern extends Expr {
    public final Pat pat;
    public final Expr value;
    public final Expr body;

    LetPattern(Pat pat, Expr value, Expr body) {
      super(Op.LET_PATTERN);
      this.pat = requireNonNull(pat);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append("let ").append(pat, 0, 0)
              .append(" = ").append(value, 0, 0)
              .append(" in ").append(body, 0, right));
    }

    public LetPattern copy(Expr value, Expr body) {
      return value == this.value && body == this.body ? this
          : expr.letPattern(pat, value, body);
    }
  }

  /** Group of mutually recursive functions,
   * "let rec f = fn(x) => ..., g = fn(y) => ... in body".
   *
   * <p>Every function in the group is named, and every function can see
   * every other. */
  public static class LetRec extends Expr {
    public final ImmutableList<Fn> fns;
    public final Expr body;

    LetRec(ImmutableList<Fn> fns, Expr body) {
      super(Op.LET_REC);
      this.fns = requireNonNull(fns);
      this.body = requireNonNull(body);
      checkArgument(!fns.isEmpty(), "empty group");
      fns.forEach(fn -> checkArgument(fn.name != null, "unnamed: %s", fn));
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 -> {
        w2.append("let rec ");
        for (int i = 0; i < fns.size(); i++) {
          final Fn fn = fns.get(i);
          w2.append(i == 0 ? "" : ", ").append(fn.name).append(" = ");
          fn.unparseAnonymous(w2);
        }
        w2.append(" in ").append(body, 0, right);
      });
    }

    public LetRec copy(ImmutableList<Fn> fns, Expr body) {
      return fns.equals(this.fns) && body == this.body ? this
          : expr.letRec(fns, body);
    }
  }

  /** Function literal, "fn(a, b) => body" or, if it has a name that its
   * body may use to call itself, "fn f(a, b) => body". */
  public static class Fn extends Expr {
    public final @Nullable String name;
    public final ImmutableList<String> params;
    public final Expr body;
    /** Parameters that occur inside {@code comptime} or {@code typeOf} in
     * the body; they must be known to specialize the body. */
    public final ImmutableSet<String> comptimeParams;

    Fn(@Nullable String name, ImmutableList<String> params, Expr body,
        ImmutableSet<String> comptimeParams) {
      super(Op.FN);
      this.name = name;
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      this.comptimeParams = requireNonNull(comptimeParams);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 -> {
        w2.append("fn");
        if (name != null) {
          w2.append(" ").append(name);
        }
        w2.append("(").append(String.join(", ", params)).append(") => ")
            .append(body, 0, right);
      });
    }

    void unparseAnonymous(AstWriter w) {
      w.append("fn(").append(String.join(", ", params)).append(") => ")
          .append(body, 0, 0);
    }

    public Fn copy(Expr body) {
      return body == this.body ? this : expr.fn(name, params, body);
    }
  }

  /** Function call, "f(a, b)". */
  public static class Call extends Expr {
    public final Expr fn;
    public final ImmutableList<Expr> args;

    Call(Expr fn, ImmutableList<Expr> args) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append(fn, left, op.left).append("(").appendAll(args)
              .append(")"));
    }

    public Call copy(Expr fn, ImmutableList<Expr> args) {
      return fn == this.fn && args.equals(this.args) ? this
          : expr.call(fn, args);
    }
  }

  /** Method call, "receiver.method(a, b)". */
  public static class MethodCall extends Expr {
    public final Expr receiver;
    public final String method;
    public final ImmutableList<Expr> args;

    MethodCall(Expr receiver, String method, ImmutableList<Expr> args) {
      super(Op.METHOD_CALL);
      this.receiver = requireNonNull(receiver);
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append(receiver, left, op.left).append(".").append(method)
              .append("(").appendAll(args).append(")"));
    }

    public MethodCall copy(Expr receiver, ImmutableList<Expr> args) {
      return receiver == this.receiver && args.equals(this.args) ? this
          : expr.methodCall(receiver, method, args);
    }
  }

  /** Object literal, "{ a: 1, b: x }". */
  public static class ObjectLit extends Expr {
    public final ImmutableMap<String, Expr> fields;

    ObjectLit(ImmutableMap<String, Expr> fields) {
      super(Op.OBJECT);
      this.fields = requireNonNull(fields);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (fields.isEmpty()) {
        return w.append("{}");
      }
      w.append("{ ");
      int i = 0;
      for (Map.Entry<String, Expr> field : fields.entrySet()) {
        w.append(i++ == 0 ? "" : ", ").append(field.getKey()).append(": ")
            .append(field.getValue(), 0, 0);
      }
      return w.append(" }");
    }

    public ObjectLit copy(ImmutableMap<String, Expr> fields) {
      return fields.equals(this.fields) ? this : expr.object(fields);
    }
  }

  /** Field access, "o.f". */
  public static class Field extends Expr {
    public final Expr receiver;
    public final String name;

    Field(Expr receiver, String name) {
      super(Op.FIELD);
      this.receiver = requireNonNull(receiver);
      this.name = requireNonNull(name);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append(receiver, left, op.left).append(".").append(name));
    }

    public Field copy(Expr receiver) {
      return receiver == this.receiver ? this : expr.field(receiver, name);
    }
  }

  /** Array literal, "[1, x, 3]". */
  public static class ArrayLit extends Expr {
    public final ImmutableList<Expr> elements;

    ArrayLit(ImmutableList<Expr> elements) {
      super(Op.ARRAY);
      this.elements = requireNonNull(elements);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(elements).append("]");
    }

    public ArrayLit copy(ImmutableList<Expr> elements) {
      return elements.equals(this.elements) ? this : expr.array(elements);
    }
  }

  /** Index access, "a[i]". */
  public static class Index extends Expr {
    public final Expr array;
    public final Expr index;

    Index(Expr array, Expr index) {
      super(Op.INDEX);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append(array, left, op.left).append("[").append(index, 0, 0)
              .append("]"));
    }

    public Index copy(Expr array, Expr index) {
      return array == this.array && index == this.index ? this
          : expr.index(array, index);
    }
  }

  /** Sequence of expressions, "(a; b; c)", whose value is the value of the
   * last expression. */
  public static class Block extends Expr {
    public final ImmutableList<Expr> exprs;

    Block(ImmutableList<Expr> exprs) {
      super(Op.BLOCK);
      this.exprs = requireNonNull(exprs);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("(");
      for (int i = 0; i < exprs.size(); i++) {
        w.append(i == 0 ? "" : "; ").append(exprs.get(i), 0, 0);
      }
      return w.append(")");
    }

    public Block copy(ImmutableList<Expr> exprs) {
      return exprs.equals(this.exprs) ? this : expr.block(exprs);
    }
  }

  /** Marker that an expression must be known at staging time,
   * "comptime(e)". */
  public static class Comptime extends Expr {
    public final Expr expr;

    Comptime(Expr expr) {
      super(Op.COMPTIME);
      this.expr = requireNonNull(expr);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("comptime(").append(expr, 0, 0).append(")");
    }

    public Comptime copy(Expr e) {
      return e == this.expr ? this : ExprBuilder.expr.comptime(e);
    }
  }

  /** Marker that an expression is to be evaluated at run time,
   * "runtime(e)" or "runtime(name: e)". */
  public static class Runtime extends Expr {
    public final Expr expr;
    public final @Nullable String name;

    Runtime(Expr expr, @Nullable String name) {
      super(Op.RUNTIME);
      this.expr = requireNonNull(expr);
      this.name = name;
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("runtime(");
      if (name != null) {
        w.append(name).append(": ");
      }
      return w.append(expr, 0, 0).append(")");
    }

    public Runtime copy(Expr e) {
      return e == this.expr ? this : ExprBuilder.expr.runtime(name, e);
    }
  }

  /** Assertion that a value has a type, "assert(v, T)" or
   * "assert(v, T, message)". */
  public static class Assert extends Expr {
    public final Expr value;
    public final Expr type;
    public final @Nullable String message;

    Assert(Expr value, Expr type, @Nullable String message) {
      super(Op.ASSERT);
      this.value = requireNonNull(value);
      this.type = requireNonNull(type);
      this.message = message;
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("assert(").append(value, 0, 0).append(", ")
          .append(type, 0, 0);
      if (message != null) {
        w.append(", ").appendLiteral(message);
      }
      return w.append(")");
    }

    public Assert copy(Expr value, Expr type) {
      return value == this.value && type == this.type ? this
          : expr.assertType(value, type, message);
    }
  }

  /** Assertion that a condition holds, "assert(c)" or
   * "assert(c, message)". */
  public static class AssertCond extends Expr {
    public final Expr condition;
    public final @Nullable String message;

    AssertCond(Expr condition, @Nullable String message) {
      super(Op.ASSERT_COND);
      this.condition = requireNonNull(condition);
      this.message = message;
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("assert(").append(condition, 0, 0);
      if (message != null) {
        w.append(", ").appendLiteral(message);
      }
      return w.append(")");
    }

    public AssertCond copy(Expr condition) {
      return condition == this.condition ? this
          : expr.assertCond(condition, message);
    }
  }

  /** Unchecked refinement of a value's type, "trust(v)" or
   * "trust(v, T)". */
  public static class Trust extends Expr {
    public final Expr value;
    public final @Nullable Expr type;

    Trust(Expr value, @Nullable Expr type) {
      super(Op.TRUST);
      this.value = requireNonNull(value);
      this.type = type;
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("trust(").append(value, 0, 0);
      if (type != null) {
        w.append(", ").append(type, 0, 0);
      }
      return w.append(")");
    }

    public Trust copy(Expr value, @Nullable Expr type) {
      return value == this.value && type == this.type ? this
          : expr.trust(value, type);
    }
  }

  /** The type of an expression, as a value, "typeOf(e)". */
  public static class TypeOf extends Expr {
    public final Expr expr;

    TypeOf(Expr expr) {
      super(Op.TYPE_OF);
      this.expr = requireNonNull(expr);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("typeOf(").append(expr, 0, 0).append(")");
    }

    public TypeOf copy(Expr e) {
      return e == this.expr ? this : ExprBuilder.expr.typeOf(e);
    }
  }

  /** Import of names from a module,
   * "import { a, b } from "module" in body". */
  public static class Import extends Expr {
    public final ImmutableList<String> names;
    public final String module;
    public final Expr body;

    Import(ImmutableList<String> names, String module, Expr body) {
      super(Op.IMPORT);
      this.names = requireNonNull(names);
      this.module = requireNonNull(module);
      this.body = requireNonNull(body);
    }

    @Override public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return wrap(w, left, right, w2 ->
          w2.append("import { ").append(String.join(", ", names))
              .append(" } from ").appendLiteral(module)
              .append(" in ").append(body, 0, right));
    }

    public Import copy(Expr body) {
      return body == this.body ? this : expr.importFrom(names, module, body);
    }
  }

  /** Pattern in a destructuring "let". */
  public abstract static class Pat extends AstNode {
    Pat(Op op) {
      super(op);
    }

    @Override public Pat accept(Shuttle shuttle) {
      return this;
    }

    /** Calls a consumer for each variable that this pattern binds, left to
     * right. */
    public abstract void forEachVar(Consumer<String> consumer);

    /** Returns the variables that this pattern binds. */
    public ImmutableList<String> vars() {
      final ImmutableList.Builder<String> b = ImmutableList.builder();
      forEachVar(b::add);
      return b.build();
    }
  }

  /** Pattern that binds a variable. */
  public static class VarPat extends Pat {
    public final String name;

    VarPat(String name) {
      super(Op.VAR_PAT);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarPat
          && name.equals(((VarPat) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachVar(Consumer<String> consumer) {
      consumer.accept(name);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Pattern that matches an array by position, "[a, b]". */
  public static class ArrayPat extends Pat {
    public final ImmutableList<Pat> elements;

    ArrayPat(ImmutableList<Pat> elements) {
      super(Op.ARRAY_PAT);
      this.elements = requireNonNull(elements);
    }

    @Override public int hashCode() {
      return elements.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayPat
          && elements.equals(((ArrayPat) o).elements);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachVar(Consumer<String> consumer) {
      elements.forEach(p -> p.forEachVar(consumer));
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(elements).append("]");
    }
  }

  /** Pattern that matches an object by field name, "{ a, b: [c] }". */
  public static class ObjectPat extends Pat {
    public final ImmutableMap<String, Pat> fields;

    ObjectPat(ImmutableMap<String, Pat> fields) {
      super(Op.OBJECT_PAT);
      this.fields = requireNonNull(fields);
    }

    @Override public int hashCode() {
      return fields.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ObjectPat
          && fields.equals(((ObjectPat) o).fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachVar(Consumer<String> consumer) {
      fields.values().forEach(p -> p.forEachVar(consumer));
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{ ");
      int i = 0;
      for (Map.Entry<String, Pat> field : fields.entrySet()) {
        w.append(i++ == 0 ? "" : ", ").append(field.getKey());
        if (!Objects.equals(field.getValue(),
            new VarPat(field.getKey()))) {
          w.append(": ").append(field.getValue(), 0, 0);
        }
      }
      return w.append(" }");
    }
  }
}

// End Expr.java
