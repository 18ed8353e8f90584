package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reports dead-end states: neither terminal nor error, yet without a single outgoing transition.
 * Any wildcard transition gives every state a way out, in which case nothing is reported.
 */
final class MissingTransitionDetector {

  static List<String> missingTransitions(final FsmSpecification specification) {
    if (specification.hasWildcardTransition()) {
      return Collections.emptyList();
    }
    final Set<String> withExit = new HashSet<>();
    for (final Transition transition : specification.getTransitions()) {
      withExit.add(transition.getFromState());
    }
    final Set<String> missing = new TreeSet<>();
    for (final State state : specification.getStates()) {
      final String name = state.getName();
      if (!withExit.contains(name) && !specification.isTerminal(name)
          && !specification.isError(name)) {
        missing.add(name);
      }
    }
    return new ArrayList<>(missing);
  }

  private MissingTransitionDetector() {}
}
