package com.github.fsmanalysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Finds cycles that trap a flow forever: strongly connected components from which no terminal
 * state can be reached.
 *
 * Tarjan's algorithm partitions the graph into SCCs; only components with at least two states,
 * or a single state with an edge to itself, are cycles. Reachability to a terminal state is
 * decided per component since one graph can hold several independent cycles of which only some
 * escape. Tarjan completes a component only after every component it can reach, so walking the
 * components in completion order decides escape for all of them in one pass over the edges: a
 * component escapes iff it holds a terminal state or has an edge into a component that escapes.
 *
 * Tarjan runs on an explicit frame stack instead of recursion, machine definitions of any size
 * must not blow the thread stack.
 */
final class EscapeCycleDetector {
  private static final int UNVISITED = -1;

  /**
   * Cycles without exit in Tarjan completion order, member names sorted within each cycle.
   */
  static List<List<String>> cyclesWithoutExit(final StateGraph graph) {
    final List<int[]> components = stronglyConnectedComponents(graph);
    final boolean[] escapes = escapingComponents(graph, components);
    final List<List<String>> trapped = new ArrayList<>();
    for (int c = 0; c < components.size(); c++) {
      final int[] component = components.get(c);
      if (component.length < 2 && !graph.hasSelfLoop(component[0])) {
        continue;
      }
      if (!escapes[c]) {
        final List<String> members = new ArrayList<>(component.length);
        for (final int id : component) {
          members.add(graph.name(id));
        }
        Collections.sort(members);
        trapped.add(Collections.unmodifiableList(members));
      }
    }
    return trapped;
  }

  /**
   * For every component, in the given completion order, whether some terminal state is reachable
   * from it. Relies on completion order being a reverse topological order of the condensation.
   */
  static boolean[] escapingComponents(final StateGraph graph, final List<int[]> components) {
    final int[] componentOf = new int[graph.size()];
    for (int c = 0; c < components.size(); c++) {
      for (final int id : components.get(c)) {
        componentOf[id] = c;
      }
    }
    final boolean[] escapes = new boolean[components.size()];
    for (int c = 0; c < components.size(); c++) {
      boolean escaping = false;
      for (final int id : components.get(c)) {
        if (graph.isTerminal(id)) {
          escaping = true;
          break;
        }
        for (final int next : graph.successors(id)) {
          final int target = componentOf[next];
          if (target != c && escapes[target]) {
            escaping = true;
            break;
          }
        }
        if (escaping) {
          break;
        }
      }
      escapes[c] = escaping;
    }
    return escapes;
  }

  /**
   * All strongly connected components, singletons included, in the order Tarjan completes them.
   * Roots are tried in state declaration order so the output is deterministic.
   */
  static List<int[]> stronglyConnectedComponents(final StateGraph graph) {
    final int size = graph.size();
    final int[] index = new int[size];
    final int[] lowlink = new int[size];
    final boolean[] onStack = new boolean[size];
    Arrays.fill(index, UNVISITED);
    final Deque<Integer> stack = new ArrayDeque<>();

    // frame i of the simulated call stack: node frameNode[i], next edge to try frameEdge[i].
    // Every node enters at most one frame so size bounds the depth.
    final int[] frameNode = new int[size];
    final int[] frameEdge = new int[size];

    final List<int[]> components = new ArrayList<>();
    int counter = 0;
    for (int root = 0; root < size; root++) {
      if (index[root] != UNVISITED) {
        continue;
      }
      int depth = 0;
      frameNode[depth] = root;
      frameEdge[depth] = 0;
      index[root] = lowlink[root] = counter++;
      stack.push(root);
      onStack[root] = true;

      while (depth >= 0) {
        final int node = frameNode[depth];
        final int[] edges = graph.successors(node);
        if (frameEdge[depth] < edges.length) {
          final int next = edges[frameEdge[depth]++];
          if (index[next] == UNVISITED) {
            index[next] = lowlink[next] = counter++;
            stack.push(next);
            onStack[next] = true;
            depth++;
            frameNode[depth] = next;
            frameEdge[depth] = 0;
          } else if (onStack[next]) {
            lowlink[node] = Math.min(lowlink[node], index[next]);
          }
          continue;
        }

        // all edges of node explored
        if (lowlink[node] == index[node]) {
          final List<Integer> members = new ArrayList<>();
          int member;
          do {
            member = stack.pop();
            onStack[member] = false;
            members.add(member);
          } while (member != node);
          final int[] component = new int[members.size()];
          for (int i = 0; i < component.length; i++) {
            component[i] = members.get(i);
          }
          components.add(component);
        }
        depth--;
        if (depth >= 0) {
          final int parent = frameNode[depth];
          lowlink[parent] = Math.min(lowlink[parent], lowlink[node]);
        }
      }
    }
    return components;
  }

  private EscapeCycleDetector() {}
}
