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
package net.hydromatic.stager.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.stager.ast.Expr;
import net.hydromatic.stager.stage.SValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each staged
   * expression, then calls the underlying tracer. */
  public static Tracer withOnStage(Tracer tracer,
      BiConsumer<Expr, SValue> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStage(Expr e, SValue value) {
        consumer.accept(e, value);
        super.onStage(e, value);
      }
    };
  }

  /** Returns a tracer that performs the given action on each materialized
   * binding, then calls the underlying tracer. */
  public static Tracer withOnMaterialize(Tracer tracer,
      BiConsumer<String, Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onMaterialize(String name, Expr residual) {
        consumer.accept(name, residual);
        super.onMaterialize(name, residual);
      }
    };
  }

  public static Tracer withOnRecursion(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRecursion(String name) {
        consumer.accept(name);
        super.onRecursion(name);
      }
    };
  }

  public static Tracer withOnSpecialize(Tracer tracer,
      BiConsumer<String, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSpecialize(String name, String specializedName,
          Expr body) {
        consumer.accept(name, specializedName);
        super.onSpecialize(name, specializedName, body);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of
   * staging, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<SValue> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(SValue value) {
        consumer.accept(value);
        super.onResult(value);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<@Nullable Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onException(@Nullable Throwable e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onStage(Expr e, SValue value) {
    }

    @Override public void onMaterialize(String name, Expr residual) {
    }

    @Override public void onRecursion(String name) {
    }

    @Override public void onSpecialize(String name, String specializedName,
        Expr body) {
    }

    @Override public void onResult(SValue value) {
    }

    @Override public boolean onException(@Nullable Throwable e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onStage(Expr e, SValue value) {
      tracer.onStage(e, value);
    }

    @Override public void onMaterialize(String name, Expr residual) {
      tracer.onMaterialize(name, residual);
    }

    @Override public void onRecursion(String name) {
      tracer.onRecursion(name);
    }

    @Override public void onSpecialize(String name, String specializedName,
        Expr body) {
      tracer.onSpecialize(name, specializedName, body);
    }

    @Override public void onResult(SValue value) {
      tracer.onResult(value);
    }

    @Override public boolean onException(@Nullable Throwable e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
