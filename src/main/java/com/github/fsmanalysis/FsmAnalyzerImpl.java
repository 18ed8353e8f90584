package com.github.fsmanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the individual detectors over one specification and assembles the result.
 *
 * The state graph is built once per call and shared by the reachability and cycle checks. The
 * dead-transition check reuses the unreachable states, computing them even when the
 * unreachable-state check itself is switched off.
 */
public final class FsmAnalyzerImpl implements FsmAnalyzer {
  private static final Logger logger = LogManager.getLogger(FsmAnalyzerImpl.class.getSimpleName());

  private final String analyzerId = UUID.randomUUID().toString();
  private final FsmAnalyzerConfiguration config;
  private final AnalyzerStatistics analyzerStats;

  FsmAnalyzerImpl(final FsmAnalyzerConfiguration config) {
    this.config = config;
    this.analyzerStats = new AnalyzerStatistics(analyzerId);
    logInfo(analyzerId, null, "Fired up analyzer with " + config);
  }

  @Override
  public AnalysisResult analyze(final FsmSpecification specification) {
    final long startNanos = System.nanoTime();
    final String machine = specification.getName();
    logDebug(analyzerId, machine, "Analyzing " + specification);

    final StateGraph graph = StateGraph.of(specification);
    List<String> unreachableStates = Collections.emptyList();
    List<List<String>> cyclesWithoutExit = Collections.emptyList();
    List<AmbiguousTransition> ambiguousTransitions = Collections.emptyList();
    List<String> deadTransitions = Collections.emptyList();
    List<String> missingTransitions = Collections.emptyList();
    List<String> duplicateStateNames = Collections.emptyList();

    List<String> unreachable = null;
    for (final AnalysisCheck check : AnalysisCheck.values()) {
      if (!config.isEnabled(check)) {
        continue;
      }
      int found = 0;
      switch (check) {
        case UNREACHABLE_STATES:
          unreachable = ReachabilityAnalyzer.unreachableStates(graph);
          unreachableStates = unreachable;
          found = unreachableStates.size();
          break;
        case CYCLES_WITHOUT_EXIT:
          cyclesWithoutExit = EscapeCycleDetector.cyclesWithoutExit(graph);
          found = cyclesWithoutExit.size();
          break;
        case AMBIGUOUS_TRANSITIONS:
          ambiguousTransitions = AmbiguityDetector.ambiguousTransitions(specification);
          found = ambiguousTransitions.size();
          break;
        case DEAD_TRANSITIONS:
          if (unreachable == null) {
            unreachable = ReachabilityAnalyzer.unreachableStates(graph);
          }
          deadTransitions = DeadTransitionDetector.deadTransitions(specification, unreachable);
          found = deadTransitions.size();
          break;
        case MISSING_TRANSITIONS:
          missingTransitions = MissingTransitionDetector.missingTransitions(specification);
          found = missingTransitions.size();
          break;
        case DUPLICATE_STATE_NAMES:
          duplicateStateNames = DuplicateNameDetector.duplicateStateNames(specification);
          found = duplicateStateNames.size();
          break;
        default:
          throw new IllegalStateException("Unhandled analysis check " + check);
      }
      logDebug(analyzerId, machine, String.format("Check %s found %d issue(s)", check, found));
      if (found > 0 && config.getFailFast()) {
        logDebug(analyzerId, machine, "Stopping after " + check + " since failFast is set");
        break;
      }
    }

    final AnalysisResult result = new AnalysisResult(unreachableStates, cyclesWithoutExit,
        ambiguousTransitions, deadTransitions, missingTransitions, duplicateStateNames,
        errors(unreachableStates, cyclesWithoutExit, ambiguousTransitions, deadTransitions,
            missingTransitions, duplicateStateNames));

    final long elapsedNanos = System.nanoTime() - startNanos;
    analyzerStats.record(result, elapsedNanos);
    logInfo(analyzerId, machine,
        String.format("Analyzed %d states, %d transitions::valid:%s, issues:%d, micros:%d",
            graph.size(), specification.getTransitions().size(), result.isValid(),
            result.issueCount(), TimeUnit.NANOSECONDS.toMicros(elapsedNanos)));
    return result;
  }

  static List<String> errors(final List<String> unreachableStates,
      final List<List<String>> cyclesWithoutExit,
      final List<AmbiguousTransition> ambiguousTransitions, final List<String> deadTransitions,
      final List<String> missingTransitions, final List<String> duplicateStateNames) {
    final List<String> errors = new ArrayList<>();
    if (!unreachableStates.isEmpty()) {
      errors.add(String.format("Found %d unreachable state(s): %s", unreachableStates.size(),
          String.join(", ", unreachableStates)));
    }
    // cycle members are listed sorted and closed on the first one, not as an actual edge path
    for (final List<String> cycle : cyclesWithoutExit) {
      errors.add("Found cycle without exit: " + String.join(" -> ", cycle) + " -> "
          + cycle.get(0));
    }
    for (final AmbiguousTransition ambiguous : ambiguousTransitions) {
      errors.add(String.format("Ambiguous transition: %s + %s -> {%s}", ambiguous.getFromState(),
          ambiguous.getTrigger(), String.join(", ", ambiguous.getTargetStates())));
    }
    if (!deadTransitions.isEmpty()) {
      errors.add(String.format("Found %d dead transition(s): %s", deadTransitions.size(),
          String.join(", ", deadTransitions)));
    }
    if (!missingTransitions.isEmpty()) {
      errors.add(String.format("Found %d state(s) with missing outgoing transitions: %s",
          missingTransitions.size(), String.join(", ", missingTransitions)));
    }
    if (!duplicateStateNames.isEmpty()) {
      errors.add(String.format("Found %d duplicate state name(s): %s", duplicateStateNames.size(),
          String.join(", ", duplicateStateNames)));
    }
    return errors;
  }

  @Override
  public String getId() {
    return analyzerId;
  }

  @Override
  public FsmAnalyzerConfiguration getConfiguration() {
    return config;
  }

  @Override
  public AnalyzerStatistics getStatistics() {
    return analyzerStats;
  }

  private static void logInfo(final String analyzerId, final String machine,
      final String message) {
    logger.info(new StringBuilder().append("[a:").append(analyzerId).append("][m:")
        .append(machine).append("] ").append(message).toString());
  }

  private static void logDebug(final String analyzerId, final String machine,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(analyzerId).append("][m:")
          .append(machine).append("] ").append(message).toString());
    }
  }

}
