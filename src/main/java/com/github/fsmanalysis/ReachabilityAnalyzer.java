package com.github.fsmanalysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first reachability over a {@link StateGraph}.
 */
final class ReachabilityAnalyzer {

  /**
   * Names of all states that no path from the initial state reaches, sorted. The initial state is
   * always reached, even when it has no outgoing edge.
   *
   * A wildcard transition applies to any state a flow is in, so a machine that declares one has
   * no unreachable states at all, whether or not some state is the target of a transition.
   */
  static List<String> unreachableStates(final StateGraph graph) {
    if (graph.hasWildcard()) {
      return Collections.emptyList();
    }
    final BitSet visited = reachableFrom(graph, new int[] {graph.initial()});
    final List<String> unreachable = new ArrayList<>();
    for (int id = visited.nextClearBit(0); id < graph.size(); id = visited.nextClearBit(id + 1)) {
      unreachable.add(graph.name(id));
    }
    Collections.sort(unreachable);
    return unreachable;
  }

  /**
   * Every state id reachable from any of the seeds, seeds included.
   */
  static BitSet reachableFrom(final StateGraph graph, final int[] seeds) {
    final BitSet visited = new BitSet(graph.size());
    final Deque<Integer> frontier = new ArrayDeque<>();
    for (final int seed : seeds) {
      if (!visited.get(seed)) {
        visited.set(seed);
        frontier.add(seed);
      }
    }
    while (!frontier.isEmpty()) {
      final int current = frontier.poll();
      for (final int next : graph.successors(current)) {
        if (!visited.get(next)) {
          visited.set(next);
          frontier.add(next);
        }
      }
    }
    return visited;
  }

  private ReachabilityAnalyzer() {}
}
