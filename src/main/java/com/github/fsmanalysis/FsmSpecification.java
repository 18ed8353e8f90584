package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.github.fsmanalysis.FsmAnalysisException.Code;

/**
 * Immutable, structurally-valid description of a state machine: the ordered states, the ordered
 * transitions, the initial state and the terminal and error sinks. Use the
 * {@code FsmSpecificationBuilder} to build it.
 *
 * Notes:<br>
 * 1. build() guarantees that every state referenced by a transition, by the initial state or by
 * the terminal/error sets is declared.<br>
 * 2. state name uniqueness is deliberately not enforced here. Duplicates are one of the defects
 * reported by {@link FsmAnalyzer}.<br>
 */
public final class FsmSpecification {
  private final String name;
  private final List<State> states;
  private final List<Transition> transitions;
  private final String initialState;
  private final Set<String> terminalStates;
  private final Set<String> errorStates;

  public String getName() {
    return name;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public String getInitialState() {
    return initialState;
  }

  public Set<String> getTerminalStates() {
    return terminalStates;
  }

  public Set<String> getErrorStates() {
    return errorStates;
  }

  public boolean isTerminal(final String stateName) {
    return terminalStates.contains(stateName);
  }

  public boolean isError(final String stateName) {
    return errorStates.contains(stateName);
  }

  public boolean hasWildcardTransition() {
    for (final Transition transition : transitions) {
      if (transition.isWildcard()) {
        return true;
      }
    }
    return false;
  }

  public final static class FsmSpecificationBuilder {
    private String name = "UNDEF";
    private final List<State> states = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private String initialState;
    private final Set<String> terminalStates = new LinkedHashSet<>();
    private final Set<String> errorStates = new LinkedHashSet<>();

    public static FsmSpecificationBuilder newBuilder() {
      return new FsmSpecificationBuilder();
    }

    public FsmSpecificationBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public FsmSpecificationBuilder state(final State state) {
      this.states.add(state);
      return this;
    }

    public FsmSpecificationBuilder states(final List<State> states) {
      this.states.addAll(states);
      return this;
    }

    public FsmSpecificationBuilder transition(final Transition transition) {
      this.transitions.add(transition);
      return this;
    }

    public FsmSpecificationBuilder transitions(final List<Transition> transitions) {
      this.transitions.addAll(transitions);
      return this;
    }

    public FsmSpecificationBuilder initialState(final String initialState) {
      this.initialState = initialState;
      return this;
    }

    public FsmSpecificationBuilder terminalState(final String terminalState) {
      this.terminalStates.add(terminalState);
      return this;
    }

    public FsmSpecificationBuilder terminalStates(final Set<String> terminalStates) {
      this.terminalStates.addAll(terminalStates);
      return this;
    }

    public FsmSpecificationBuilder errorState(final String errorState) {
      this.errorStates.add(errorState);
      return this;
    }

    public FsmSpecificationBuilder errorStates(final Set<String> errorStates) {
      this.errorStates.addAll(errorStates);
      return this;
    }

    public FsmSpecification build() throws FsmAnalysisException {
      final FsmSpecification specification = new FsmSpecification(name, states, transitions,
          initialState, terminalStates, errorStates);
      specification.validate();
      return specification;
    }

    private FsmSpecificationBuilder() {}
  }

  private void validate() throws FsmAnalysisException {
    if (states.isEmpty()) {
      throw new FsmAnalysisException(Code.NO_STATES);
    }
    final Set<String> declared = new HashSet<>();
    for (final State state : states) {
      if (state == null) {
        throw new FsmAnalysisException(Code.INVALID_STATE_NAME, "Null state is invalid");
      }
      declared.add(state.getName());
    }
    if (initialState == null || !declared.contains(initialState)) {
      throw new FsmAnalysisException(Code.INVALID_INITIAL_STATE,
          "Initial state " + initialState + " is not declared in machine " + name);
    }
    final StringBuilder messages = new StringBuilder();
    for (final Transition transition : transitions) {
      if (transition == null) {
        throw new FsmAnalysisException(Code.INVALID_TRANSITION, "Null transition is invalid");
      }
      if (!transition.isWildcard() && !declared.contains(transition.getFromState())) {
        messages.append("Transition ").append(transition.getName())
            .append(" leaves undeclared state ").append(transition.getFromState()).append(". ");
      }
      if (!declared.contains(transition.getToState())) {
        messages.append("Transition ").append(transition.getName())
            .append(" enters undeclared state ").append(transition.getToState()).append(". ");
      }
    }
    for (final String terminalState : terminalStates) {
      if (!declared.contains(terminalState)) {
        messages.append("Terminal state ").append(terminalState).append(" is not declared. ");
      }
    }
    for (final String errorState : errorStates) {
      if (!declared.contains(errorState)) {
        messages.append("Error state ").append(errorState).append(" is not declared. ");
      }
    }
    if (messages.length() > 0) {
      throw new FsmAnalysisException(Code.UNKNOWN_STATE_REFERENCE, messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "FsmSpecification [name=" + name + ", states=" + states.size() + ", transitions="
        + transitions.size() + ", initialState=" + initialState + ", terminalStates="
        + terminalStates + ", errorStates=" + errorStates + "]";
  }

  private FsmSpecification(final String name, final List<State> states,
      final List<Transition> transitions, final String initialState,
      final Set<String> terminalStates, final Set<String> errorStates) {
    this.name = name == null ? "UNDEF" : name;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.initialState = initialState;
    this.terminalStates = Collections.unmodifiableSet(new LinkedHashSet<>(terminalStates));
    this.errorStates = Collections.unmodifiableSet(new LinkedHashSet<>(errorStates));
  }

}
