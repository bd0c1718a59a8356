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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for {@link NameGenerator}. */
public class NameGeneratorTest {
  @Test void testGet() {
    final NameGenerator nameGenerator = new NameGenerator();
    assertThat(nameGenerator.get("rt"), is("rt0"));
    assertThat(nameGenerator.get("rt"), is("rt1"));
    assertThat(nameGenerator.get("x"), is("x0"));
    assertThat(nameGenerator.inc("fn$"), is(0));
    assertThat(nameGenerator.inc("fn$"), is(1));
    assertThat(nameGenerator.get("rt"), is("rt2"));

    nameGenerator.reset();
    assertThat(nameGenerator.get("rt"), is("rt0"));
    assertThat(nameGenerator.inc("fn$"), is(0));
  }
}

// End NameGeneratorTest.java
