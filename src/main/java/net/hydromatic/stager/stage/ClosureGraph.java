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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Graph of dependencies between declarations in a residual program.
 *
 * <p>Nodes are declaration names, kept in the order they were added;
 * an edge from {@code a} to {@code b} means that {@code a} refers to
 * {@code b}. {@link #order()} returns the strongly connected components,
 * each of which becomes one (possibly recursive) declaration group, so
 * that every group comes after the groups it refers to. */
class ClosureGraph {
  private final MutableGraph<String> graph =
      GraphBuilder.directed()
          .allowsSelfLoops(true)
          .nodeOrder(ElementOrder.<String>insertion())
          .incidentEdgeOrder(ElementOrder.<String>stable())
          .build();

  /** Adds a node, if not present. */
  void add(String name) {
    graph.addNode(name);
  }

  /** Adds an edge; ignores targets that are not yet nodes. */
  void addEdge(String from, String to) {
    add(from);
    if (graph.nodes().contains(to)) {
      graph.putEdge(from, to);
    }
  }

  /** Returns the strongly connected components, dependencies first. Nodes
   * within a component are in the order they were added. */
  ImmutableList<ImmutableList<String>> order() {
    final List<Set<String>> components = new Tarjan().run();

    // Condensation: which component each node belongs to
    final Map<String, Integer> componentOf = new HashMap<>();
    for (int i = 0; i < components.size(); i++) {
      for (String name : components.get(i)) {
        componentOf.put(name, i);
      }
    }
    final List<Set<Integer>> dependencies = new ArrayList<>();
    final List<Set<Integer>> dependents = new ArrayList<>();
    for (int i = 0; i < components.size(); i++) {
      dependencies.add(new LinkedHashSet<>());
      dependents.add(new LinkedHashSet<>());
    }
    for (String from : graph.nodes()) {
      final int i = componentOf.get(from);
      for (String to : graph.successors(from)) {
        final int j = componentOf.get(to);
        if (j != i) {
          dependencies.get(i).add(j);
          dependents.get(j).add(i);
        }
      }
    }

    // Topological sort; among ready components, the earliest added first
    final Map<Integer, Integer> remaining = new HashMap<>();
    for (int i = 0; i < components.size(); i++) {
      remaining.put(i, dependencies.get(i).size());
    }
    final List<Integer> byFirstNode = new ArrayList<>();
    for (String name : graph.nodes()) {
      final int i = componentOf.get(name);
      if (!byFirstNode.contains(i)) {
        byFirstNode.add(i);
      }
    }
    final ImmutableList.Builder<ImmutableList<String>> result =
        ImmutableList.builder();
    final Set<Integer> done = new LinkedHashSet<>();
    while (done.size() < components.size()) {
      int i = -1;
      for (int k : byFirstNode) {
        if (!done.contains(k) && remaining.get(k) == 0) {
          i = k;
          break;
        }
      }
      if (i < 0) {
        throw new AssertionError("cycle between components");
      }
      done.add(i);
      result.add(sorted(components.get(i)));
      for (int j : dependents.get(i)) {
        remaining.merge(j, -1, Integer::sum);
      }
    }
    return result.build();
  }

  /** Returns the nodes of a component in the order they were added. */
  private ImmutableList<String> sorted(Set<String> component) {
    final ImmutableList.Builder<String> list = ImmutableList.builder();
    for (String name : graph.nodes()) {
      if (component.contains(name)) {
        list.add(name);
      }
    }
    return list.build();
  }

  /** Returns whether a node refers to itself. */
  boolean isSelfLoop(String name) {
    return graph.nodes().contains(name)
        && graph.hasEdgeConnecting(name, name);
  }

  /** Returns the nodes. */
  ImmutableSet<String> nodes() {
    return ImmutableSet.copyOf(graph.nodes());
  }

  /** Tarjan's algorithm for strongly connected components. */
  private class Tarjan {
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new LinkedHashSet<>();
    private final List<Set<String>> components = new ArrayList<>();

    List<Set<String>> run() {
      for (String name : graph.nodes()) {
        if (!index.containsKey(name)) {
          visit(name);
        }
      }
      return components;
    }

    private void visit(String v) {
      final int i = index.size();
      index.put(v, i);
      lowLink.put(v, i);
      stack.push(v);
      onStack.add(v);
      for (String w : graph.successors(v)) {
        if (!index.containsKey(w)) {
          visit(w);
          lowLink.put(v, Math.min(lowLink.get(v), lowLink.get(w)));
        } else if (onStack.contains(w)) {
          lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
        }
      }
      if (lowLink.get(v).equals(index.get(v))) {
        final Set<String> component = new LinkedHashSet<>();
        String w;
        do {
          w = stack.pop();
          onStack.remove(w);
          component.add(w);
        } while (!w.equals(v));
        components.add(component);
      }
    }
  }
}

// End ClosureGraph.java
