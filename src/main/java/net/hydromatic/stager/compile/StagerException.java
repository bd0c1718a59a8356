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

/** An error that occurred while staging a program.
 *
 * <p>Staging errors are never recovered from internally; they propagate to
 * the caller of {@link net.hydromatic.stager.stage.Stager#stage}. */
public abstract class StagerException extends RuntimeException {
  protected StagerException(String message) {
    super(message);
  }

  /** Appends a description of this error, such as
   * "Error: Unbound variable: x". */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End StagerException.java
