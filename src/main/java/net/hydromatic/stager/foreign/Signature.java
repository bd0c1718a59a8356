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
package net.hydromatic.stager.foreign;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.stager.constraint.Constraint;
import net.hydromatic.stager.constraint.Constraints;

/** Signature of a value exported by an external module. */
public class Signature {
  /** Constraint satisfied by the exported value. */
  public final Constraint constraint;
  /** Number of parameters, if the value is a function; otherwise 0. */
  public final int paramCount;
  /** Number of type parameters, if the value is a generic function;
   * otherwise 0. */
  public final int typeParamCount;

  private Signature(Constraint constraint, int paramCount,
      int typeParamCount) {
    checkArgument(paramCount >= 0 && typeParamCount >= 0);
    this.constraint = requireNonNull(constraint);
    this.paramCount = paramCount;
    this.typeParamCount = typeParamCount;
  }

  /** Creates the signature of a value that is not a function. */
  public static Signature value(Constraint constraint) {
    return new Signature(constraint, 0, 0);
  }

  /** Creates the signature of a function. */
  public static Signature function(int paramCount) {
    return new Signature(Constraints.FUNCTION, paramCount, 0);
  }

  /** Creates the signature of a generic function. */
  public static Signature genericFunction(int paramCount,
      int typeParamCount) {
    return new Signature(Constraints.FUNCTION, paramCount, typeParamCount);
  }

  public boolean isGeneric() {
    return typeParamCount > 0;
  }

  @Override public int hashCode() {
    return Objects.hash(constraint, paramCount, typeParamCount);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Signature
        && constraint.equals(((Signature) o).constraint)
        && paramCount == ((Signature) o).paramCount
        && typeParamCount == ((Signature) o).typeParamCount;
  }

  @Override public String toString() {
    return isGeneric()
        ? "<" + typeParamCount + ">(" + paramCount + ") " + constraint
        : constraint.toString();
  }
}

// End Signature.java
