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
package net.hydromatic.stager.stage;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import org.junit.jupiter.api.Test;

/** Tests for {@link ClosureGraph}. */
public class ClosureGraphTest {
  @Test void testIndependent() {
    final ClosureGraph graph = new ClosureGraph();
    graph.add("a");
    graph.add("b");
    graph.add("c");
    assertThat(graph.order(), hasToString("[[a], [b], [c]]"));
  }

  /** A node comes after the nodes it refers to, even if it was added
   * first. */
  @Test void testDependenciesFirst() {
    final ClosureGraph graph = new ClosureGraph();
    graph.add("main");
    graph.add("helper");
    graph.add("util");
    graph.addEdge("main", "helper");
    graph.addEdge("helper", "util");
    assertThat(graph.order(), hasToString("[[util], [helper], [main]]"));
  }

  @Test void testMutualRecursion() {
    final ClosureGraph graph = new ClosureGraph();
    graph.add("isEven");
    graph.add("isOdd");
    graph.add("caller");
    graph.addEdge("isEven", "isOdd");
    graph.addEdge("isOdd", "isEven");
    graph.addEdge("caller", "isOdd");
    assertThat(graph.order(), hasToString("[[isEven, isOdd], [caller]]"));
    assertThat(graph.isSelfLoop("isEven"), is(false));
  }

  @Test void testSelfLoop() {
    final ClosureGraph graph = new ClosureGraph();
    graph.add("loop");
    graph.add("other");
    graph.addEdge("loop", "loop");
    assertThat(graph.isSelfLoop("loop"), is(true));
    assertThat(graph.isSelfLoop("other"), is(false));
    assertThat(graph.order(), hasToString("[[loop], [other]]"));
  }

  /** Edges to names that are not declarations, such as runtime
   * placeholders, are ignored. */
  @Test void testEdgeToUnknownNode() {
    final ClosureGraph graph = new ClosureGraph();
    graph.addEdge("f", "rt0");
    assertThat(graph.nodes(), hasToString("[f]"));
    assertThat(graph.order(), hasToString("[[f]]"));
  }

  /** An edge is only recorded if its target has already been added. */
  @Test void testEdgeBeforeTarget() {
    final ClosureGraph graph = new ClosureGraph();
    graph.addEdge("a", "b");
    graph.add("b");
    graph.addEdge("b", "a");
    assertThat(graph.order(), hasToString("[[a], [b]]"));
    assertThat(graph.isSelfLoop("c"), is(false));
  }

  /** Two cycles joined by an edge; the cycle that is referred to comes
   * first. */
  @Test void testTwoCycles() {
    final ClosureGraph graph = new ClosureGraph();
    graph.add("a");
    graph.add("b");
    graph.add("c");
    graph.add("d");
    graph.addEdge("a", "b");
    graph.addEdge("b", "a");
    graph.addEdge("b", "c");
    graph.addEdge("c", "d");
    graph.addEdge("d", "c");
    assertThat(graph.order(), hasToString("[[c, d], [a, b]]"));
  }
}

// End ClosureGraphTest.java
