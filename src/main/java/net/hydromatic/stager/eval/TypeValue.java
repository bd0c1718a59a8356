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
package net.hydromatic.stager.eval;

import static java.util.Objects.requireNonNull;

import net.hydromatic.stager.constraint.Constraint;

/** A type used as a value.
 *
 * <p>Types are first-class: {@code number} and {@code typeOf(x)} evaluate to
 * instances of this class, and {@code assert} and {@code trust} take them as
 * arguments. */
public class TypeValue {
  public final Constraint constraint;

  public TypeValue(Constraint constraint) {
    this.constraint = requireNonNull(constraint);
  }

  @Override public int hashCode() {
    return constraint.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TypeValue
        && constraint.equals(((TypeValue) o).constraint);
  }

  @Override public String toString() {
    return "Type<" + constraint + ">";
  }
}

// End TypeValue.java
