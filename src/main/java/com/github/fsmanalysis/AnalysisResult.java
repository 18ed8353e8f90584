package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of analyzing one {@link FsmSpecification}.
 *
 * Each of the six issue collections is never null, possibly empty and unmodifiable.
 * {@link #isValid()} is derived from them and so can never disagree with them. {@link #errors}
 * holds the same findings rendered as human readable lines, in check order.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class AnalysisResult {
  private final List<String> unreachableStates;
  private final List<List<String>> cyclesWithoutExit;
  private final List<AmbiguousTransition> ambiguousTransitions;
  private final List<String> deadTransitions;
  private final List<String> missingTransitions;
  private final List<String> duplicateStateNames;
  private final List<String> errors;

  AnalysisResult(final List<String> unreachableStates, final List<List<String>> cyclesWithoutExit,
      final List<AmbiguousTransition> ambiguousTransitions, final List<String> deadTransitions,
      final List<String> missingTransitions, final List<String> duplicateStateNames,
      final List<String> errors) {
    this.unreachableStates = freeze(unreachableStates);
    this.cyclesWithoutExit = freeze(cyclesWithoutExit);
    this.ambiguousTransitions = freeze(ambiguousTransitions);
    this.deadTransitions = freeze(deadTransitions);
    this.missingTransitions = freeze(missingTransitions);
    this.duplicateStateNames = freeze(duplicateStateNames);
    this.errors = freeze(errors);
  }

  private static <T> List<T> freeze(final List<T> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(values));
  }

  /**
   * Sorted names of states not reachable from the initial state. Always empty when the machine
   * declares a wildcard transition.
   */
  public List<String> getUnreachableStates() {
    return unreachableStates;
  }

  /**
   * Trapping cycles in discovery order, each with its member names sorted. A cycle is a set of
   * mutually reachable states; the order of its members is alphabetical and says nothing about
   * which transitions connect them.
   */
  public List<List<String>> getCyclesWithoutExit() {
    return cyclesWithoutExit;
  }

  public List<AmbiguousTransition> getAmbiguousTransitions() {
    return ambiguousTransitions;
  }

  /**
   * Sorted names of transitions that can never fire.
   */
  public List<String> getDeadTransitions() {
    return deadTransitions;
  }

  /**
   * Sorted names of dead-end states.
   */
  public List<String> getMissingTransitions() {
    return missingTransitions;
  }

  public List<String> getDuplicateStateNames() {
    return duplicateStateNames;
  }

  public List<String> getErrors() {
    return errors;
  }

  public boolean isValid() {
    return unreachableStates.isEmpty() && cyclesWithoutExit.isEmpty()
        && ambiguousTransitions.isEmpty() && deadTransitions.isEmpty()
        && missingTransitions.isEmpty() && duplicateStateNames.isEmpty();
  }

  public int issueCount() {
    return unreachableStates.size() + cyclesWithoutExit.size() + ambiguousTransitions.size()
        + deadTransitions.size() + missingTransitions.size() + duplicateStateNames.size();
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + unreachableStates.hashCode();
    result = prime * result + cyclesWithoutExit.hashCode();
    result = prime * result + ambiguousTransitions.hashCode();
    result = prime * result + deadTransitions.hashCode();
    result = prime * result + missingTransitions.hashCode();
    result = prime * result + duplicateStateNames.hashCode();
    result = prime * result + errors.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    AnalysisResult other = (AnalysisResult) obj;
    return unreachableStates.equals(other.unreachableStates)
        && cyclesWithoutExit.equals(other.cyclesWithoutExit)
        && ambiguousTransitions.equals(other.ambiguousTransitions)
        && deadTransitions.equals(other.deadTransitions)
        && missingTransitions.equals(other.missingTransitions)
        && duplicateStateNames.equals(other.duplicateStateNames) && errors.equals(other.errors);
  }

  @Override
  public String toString() {
    return "AnalysisResult [valid=" + isValid() + ", unreachableStates=" + unreachableStates
        + ", cyclesWithoutExit=" + cyclesWithoutExit + ", ambiguousTransitions="
        + ambiguousTransitions + ", deadTransitions=" + deadTransitions + ", missingTransitions="
        + missingTransitions + ", duplicateStateNames=" + duplicateStateNames + "]";
  }
}
