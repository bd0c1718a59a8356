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

/** An expression had to be known at staging time but its value will only
 * be known at run time; or staging could not proceed for another reason,
 * such as recursing too deeply. */
public class StagingException extends StagerException {
  /** Source text of the offending expression, if known. */
  public final @Nullable String expression;
  /** Constraint of the offending expression, if known. */
  public final @Nullable Constraint constraint;

  public StagingException(String message) {
    this(message, null, null);
  }

  public StagingException(String message, @Nullable String expression,
      @Nullable Constraint constraint) {
    super(message);
    this.expression = expression;
    this.constraint = constraint;
  }
}

// End StagingException.java
