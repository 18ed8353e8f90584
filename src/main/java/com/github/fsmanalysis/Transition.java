package com.github.fsmanalysis;

import java.util.Objects;
import java.util.Optional;

import com.github.fsmanalysis.FsmAnalysisException.Code;

/**
 * Immutable description of a single transition between two states. A transition whose fromState
 * is {@link #WILDCARD} applies to every state of the machine.
 *
 * The guard {@link #getCondition()} is carried along for diagnostics only. Its truth value is
 * only knowable at execution time and the analyzer never looks at it.
 */
public final class Transition {
  public static final String WILDCARD = "*";

  private final String name;
  private final String fromState;
  private final String toState;
  private final String trigger;
  private final int priority;
  private final Optional<String> condition;

  public Transition(final String name, final String fromState, final String toState,
      final String trigger, final int priority) throws FsmAnalysisException {
    this(name, fromState, toState, trigger, priority, Optional.empty());
  }

  public Transition(final String name, final String fromState, final String toState,
      final String trigger, final int priority, final Optional<String> condition)
      throws FsmAnalysisException {
    if (isBlank(name) || isBlank(fromState) || isBlank(toState) || isBlank(trigger)) {
      throw new FsmAnalysisException(Code.INVALID_TRANSITION);
    }
    if (WILDCARD.equals(toState.trim())) {
      throw new FsmAnalysisException(Code.INVALID_TRANSITION,
          "Transition " + name + " cannot target the wildcard state");
    }
    this.name = name.trim();
    this.fromState = fromState.trim();
    this.toState = toState.trim();
    this.trigger = trigger.trim();
    this.priority = priority;
    this.condition = condition == null ? Optional.empty() : condition;
  }

  public String getName() {
    return name;
  }

  public String getFromState() {
    return fromState;
  }

  public String getToState() {
    return toState;
  }

  public String getTrigger() {
    return trigger;
  }

  public int getPriority() {
    return priority;
  }

  public Optional<String> getCondition() {
    return condition;
  }

  public boolean isWildcard() {
    return WILDCARD.equals(fromState);
  }

  private static boolean isBlank(final String value) {
    return value == null || value.trim().isEmpty();
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fromState, toState, trigger, priority, condition);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) obj;
    return priority == other.priority && name.equals(other.name)
        && fromState.equals(other.fromState) && toState.equals(other.toState)
        && trigger.equals(other.trigger) && condition.equals(other.condition);
  }

  @Override
  public String toString() {
    return "Transition [name=" + name + ", fromState=" + fromState + ", toState=" + toState
        + ", trigger=" + trigger + ", priority=" + priority + "]";
  }
}
