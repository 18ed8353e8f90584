package com.github.fsmanalysis;

/**
 * Unified single exception that's thrown by this analyzer. The idea is to use the code enum to
 * encapsulate the various ways a specification or a configuration can be rejected before any
 * analysis runs. Semantic defects found by the analysis itself are never reported through this
 * exception, they are data in the {@link AnalysisResult}.
 */
public final class FsmAnalysisException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FsmAnalysisException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FsmAnalysisException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FsmAnalysisException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE_NAME(
        "State name cannot be null, blank or longer than " + State.maxStateNameLength
            + " characters"),
    // 2.
    INVALID_TRANSITION("Transition name, trigger and endpoints cannot be null or blank"),
    // 3.
    NO_STATES("State machine must declare at least one state"),
    // 4.
    INVALID_INITIAL_STATE("Initial state is missing or not declared as a state"),
    // 5.
    UNKNOWN_STATE_REFERENCE("Transition or state set refers to a state that is not declared"),
    // 6.
    INVALID_ANALYZER_CONFIG("Analyzer configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
