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

import static net.hydromatic.stager.constraint.Constraints.STRING;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link MapDeclarationLoader} and {@link Signature}. */
public class MapDeclarationLoaderTest {
  private static final MapDeclarationLoader LOADER =
      MapDeclarationLoader.builder()
          .add("lodash", "map", Signature.function(2))
          .add("lodash", "identity", Signature.genericFunction(1, 1))
          .add("os", "platform", Signature.value(STRING))
          .build();

  @Test void testLoad() {
    final Map<String, Signature> map =
        LOADER.load("lodash", ImmutableList.of("identity", "nope", "map"));
    assertThat(map.keySet(), hasToString("[identity, map]"));
    assertThat(map.get("map"), is(Signature.function(2)));
    assertThat(map.get("identity").isGeneric(), is(true));

    // A module exports only its own names
    assertThat(LOADER.load("os", ImmutableList.of("map")), is(anEmptyMap()));
    assertThat(LOADER.load("nope", ImmutableList.of("map")),
        is(anEmptyMap()));
    assertThat(
        MapDeclarationLoader.empty().load("os",
            ImmutableList.of("platform")),
        is(anEmptyMap()));
  }

  @Test void testSignature() {
    assertThat(Signature.value(STRING), hasToString("string"));
    assertThat(Signature.function(2), hasToString("function"));
    assertThat(Signature.genericFunction(1, 1),
        hasToString("<1>(1) function"));
    assertThat(Signature.function(2).isGeneric(), is(false));
    assertThat(Signature.function(2).equals(Signature.function(3)),
        is(false));
  }
}

// End MapDeclarationLoaderTest.java
