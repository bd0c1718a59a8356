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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/** Session environment.
 *
 * <p>Holds the property values and the destination of the {@code print}
 * builtin. A session lives across any number of staging runs. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Where {@code print} writes lines. */
  public final Consumer<String> out;

  /** Creates a Session with default property values that prints to
   * {@link System#out}. */
  public Session() {
    this(new LinkedHashMap<>(), System.out::println);
  }

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values
   * @param out Consumer of printed lines */
  public Session(Map<Prop, Object> map, Consumer<String> out) {
    this.map = requireNonNull(map);
    this.out = requireNonNull(out);
  }
}

// End Session.java
