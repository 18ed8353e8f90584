package com.github.fsmanalysis;

/**
 * The individual checks an {@link FsmAnalyzer} can run. Declaration order is the order in which
 * checks run and in which their diagnostics appear.
 */
public enum AnalysisCheck {
  // states no path from the initial state reaches
  UNREACHABLE_STATES,
  // strongly connected components with no path to a terminal state
  CYCLES_WITHOUT_EXIT,
  // same source, trigger and priority leading to different targets
  AMBIGUOUS_TRANSITIONS,
  // transitions leaving an unreachable state
  DEAD_TRANSITIONS,
  // non-terminal, non-error states without outgoing transitions
  MISSING_TRANSITIONS,
  // state names declared more than once
  DUPLICATE_STATE_NAMES;
}
