package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A concrete transition leaving an unreachable state can never fire. Wildcards are exempt: the
 * initial state is always reachable and every wildcard applies to it.
 */
final class DeadTransitionDetector {

  static List<String> deadTransitions(final FsmSpecification specification,
      final Collection<String> unreachableStates) {
    final Set<String> unreachable = new HashSet<>(unreachableStates);
    final Set<String> dead = new TreeSet<>();
    for (final Transition transition : specification.getTransitions()) {
      if (!transition.isWildcard() && unreachable.contains(transition.getFromState())) {
        dead.add(transition.getName());
      }
    }
    return new ArrayList<>(dead);
  }

  private DeadTransitionDetector() {}
}
