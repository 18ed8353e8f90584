package com.github.fsmanalysis;

import java.util.Optional;

import com.github.fsmanalysis.FsmAnalysisException.Code;

/**
 * This object represents immutable metadata about a declared state. Whether a state is terminal
 * or an error sink is decided by the owning {@link FsmSpecification}, not by the state itself.
 */
public final class State {
  final static int maxStateNameLength = 128;

  private final String name;
  private final Optional<String> description; // optional

  public State(final String name) throws FsmAnalysisException {
    this(name, Optional.empty());
  }

  public State(final String name, final Optional<String> description)
      throws FsmAnalysisException {
    if (name == null || name.trim().isEmpty() || name.trim().length() > maxStateNameLength) {
      throw new FsmAnalysisException(Code.INVALID_STATE_NAME);
    }
    if (Transition.WILDCARD.equals(name.trim())) {
      throw new FsmAnalysisException(Code.INVALID_STATE_NAME,
          "State name cannot be the wildcard " + Transition.WILDCARD);
    }
    this.name = name.trim();
    this.description = description == null ? Optional.empty() : description;
  }

  public String getName() {
    return name;
  }

  public Optional<String> getDescription() {
    return description;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + description.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    return name.equals(other.name) && description.equals(other.description);
  }

  @Override
  public String toString() {
    return "State [name=" + name + "]";
  }
}
