package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Forward adjacency of a specification, built once per analysis and read-only afterwards.
 *
 * Every distinct state name gets an integer id in declaration order; a name declared twice maps
 * to its first id. All traversals work on ids, names are only looked up at the edges. Targets of
 * wildcard transitions are appended to the successor list of every state.
 */
final class StateGraph {
  private final List<String> names;
  private final Map<String, Integer> ids;
  private final int[][] successors;
  private final boolean[] terminal;
  private final int initial;
  private final boolean wildcard;

  static StateGraph of(final FsmSpecification specification) {
    final List<String> names = new ArrayList<>();
    final Map<String, Integer> ids = new HashMap<>();
    for (final State state : specification.getStates()) {
      if (!ids.containsKey(state.getName())) {
        ids.put(state.getName(), names.size());
        names.add(state.getName());
      }
    }

    final List<List<Integer>> adjacency = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      adjacency.add(new ArrayList<>());
    }
    final List<Integer> wildcardTargets = new ArrayList<>();
    for (final Transition transition : specification.getTransitions()) {
      final int to = lookup(ids, transition.getToState());
      if (transition.isWildcard()) {
        wildcardTargets.add(to);
      } else {
        adjacency.get(lookup(ids, transition.getFromState())).add(to);
      }
    }

    final int[][] successors = new int[names.size()][];
    final boolean[] terminal = new boolean[names.size()];
    for (int i = 0; i < names.size(); i++) {
      final List<Integer> concrete = adjacency.get(i);
      final int[] edges = new int[concrete.size() + wildcardTargets.size()];
      int edge = 0;
      for (final int to : concrete) {
        edges[edge++] = to;
      }
      for (final int to : wildcardTargets) {
        edges[edge++] = to;
      }
      successors[i] = edges;
      terminal[i] = specification.isTerminal(names.get(i));
    }
    return new StateGraph(names, ids, successors, terminal,
        lookup(ids, specification.getInitialState()), !wildcardTargets.isEmpty());
  }

  private static int lookup(final Map<String, Integer> ids, final String name) {
    final Integer id = ids.get(name);
    if (id == null) {
      throw new IllegalArgumentException("Undeclared state referenced by specification: " + name);
    }
    return id;
  }

  int size() {
    return names.size();
  }

  String name(final int id) {
    return names.get(id);
  }

  List<String> names() {
    return names;
  }

  int id(final String name) {
    return lookup(ids, name);
  }

  int[] successors(final int id) {
    return successors[id];
  }

  boolean isTerminal(final int id) {
    return terminal[id];
  }

  int initial() {
    return initial;
  }

  /**
   * True when the specification declares at least one wildcard transition.
   */
  boolean hasWildcard() {
    return wildcard;
  }

  boolean hasSelfLoop(final int id) {
    for (final int to : successors[id]) {
      if (to == id) {
        return true;
      }
    }
    return false;
  }

  private StateGraph(final List<String> names, final Map<String, Integer> ids,
      final int[][] successors, final boolean[] terminal, final int initial,
      final boolean wildcard) {
    this.names = Collections.unmodifiableList(names);
    this.ids = ids;
    this.successors = successors;
    this.terminal = terminal;
    this.initial = initial;
    this.wildcard = wildcard;
  }

}
