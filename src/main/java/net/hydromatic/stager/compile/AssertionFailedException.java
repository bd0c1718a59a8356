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

import net.hydromatic.stager.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An assertion whose inputs are known at staging time failed. */
public class AssertionFailedException extends StagerException {
  /** The value that failed the check; null for a failed condition. */
  public final @Nullable Object value;
  /** The constraint that the value failed; null for a failed condition. */
  public final @Nullable Constraint constraint;

  public AssertionFailedException(String message, @Nullable Object value,
      @Nullable Constraint constraint) {
    super(message);
    this.value = value;
    this.constraint = constraint;
  }
}

// End AssertionFailedException.java
