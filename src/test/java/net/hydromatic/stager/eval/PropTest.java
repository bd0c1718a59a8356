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

import static net.hydromatic.stager.Matchers.throwsA;
import static net.hydromatic.stager.Staging.assertError;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("maxRecursionDepth"),
        is(Prop.MAX_RECURSION_DEPTH));
    assertThat(Prop.lookup("MAX_RECURSION_DEPTH"),
        is(Prop.MAX_RECURSION_DEPTH));
    assertError(() -> Prop.lookup("nope"),
        throwsA(IllegalArgumentException.class,
            is("property nope not found")));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.CLUSTER));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.CLUSTER.booleanValue(map), is(true));
    assertThat(Prop.SPECIALIZE.booleanValue(map), is(true));
    assertThat(Prop.MAX_RECURSION_DEPTH.intValue(map), is(100));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.MAX_RECURSION_DEPTH.set(map, 50);
    assertThat(Prop.MAX_RECURSION_DEPTH.intValue(map), is(50));
    assertError(() -> Prop.CLUSTER.set(map, "yes"),
        throwsA(IllegalArgumentException.class,
            is("value for property cluster must have type "
                + "class java.lang.Boolean")));
    assertError(() -> Prop.CLUSTER.set(map, null),
        throwsA(IllegalArgumentException.class,
            is("property cluster is required")));
    assertError(() -> Prop.CLUSTER.intValue(map),
        throwsA(IllegalArgumentException.class,
            is("invalid type class java.lang.Boolean for property "
                + "cluster")));
  }
}

// End PropTest.java
