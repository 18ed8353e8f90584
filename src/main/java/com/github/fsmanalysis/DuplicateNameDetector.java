package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

final class DuplicateNameDetector {

  static List<String> duplicateStateNames(final FsmSpecification specification) {
    final Set<String> seen = new HashSet<>();
    final Set<String> duplicates = new TreeSet<>();
    for (final State state : specification.getStates()) {
      if (!seen.add(state.getName())) {
        duplicates.add(state.getName());
      }
    }
    return new ArrayList<>(duplicates);
  }

  private DuplicateNameDetector() {}
}
