package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One (fromState, trigger, priority) bucket that leads to more than one distinct target state.
 */
public final class AmbiguousTransition {
  private final String fromState;
  private final String trigger;
  private final int priority;
  private final List<String> targetStates;

  AmbiguousTransition(final String fromState, final String trigger, final int priority,
      final List<String> targetStates) {
    this.fromState = fromState;
    this.trigger = trigger;
    this.priority = priority;
    final List<String> sorted = new ArrayList<>(targetStates);
    Collections.sort(sorted);
    this.targetStates = Collections.unmodifiableList(sorted);
  }

  public String getFromState() {
    return fromState;
  }

  public String getTrigger() {
    return trigger;
  }

  public int getPriority() {
    return priority;
  }

  /**
   * Distinct conflicting targets, sorted.
   */
  public List<String> getTargetStates() {
    return targetStates;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, trigger, priority, targetStates);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AmbiguousTransition)) {
      return false;
    }
    AmbiguousTransition other = (AmbiguousTransition) obj;
    return priority == other.priority && fromState.equals(other.fromState)
        && trigger.equals(other.trigger) && targetStates.equals(other.targetStates);
  }

  @Override
  public String toString() {
    return "AmbiguousTransition [fromState=" + fromState + ", trigger=" + trigger + ", priority="
        + priority + ", targetStates=" + targetStates + "]";
  }
}
