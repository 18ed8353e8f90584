package com.github.fsmanalysis;

import static com.github.fsmanalysis.FsmFixtures.machine;
import static com.github.fsmanalysis.FsmFixtures.transition;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;

import com.github.fsmanalysis.FsmAnalyzer.FsmAnalyzerBuilder;
import com.github.fsmanalysis.FsmAnalyzerConfiguration.FsmAnalyzerConfigurationBuilder;

/**
 * Tests to maintain the sanity and correctness of the analyzer end to end.
 */
public class FsmAnalyzerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final FsmAnalyzer analyzer = FsmAnalyzerBuilder.newBuilder().build();

  @Test
  public void testValidMachineHasNoIssues() throws FsmAnalysisException {
    final AnalysisResult result = analyzer.analyze(FsmFixtures.linear());
    assertTrue(result.isValid());
    assertTrue(result.getUnreachableStates().isEmpty());
    assertTrue(result.getCyclesWithoutExit().isEmpty());
    assertTrue(result.getAmbiguousTransitions().isEmpty());
    assertTrue(result.getDeadTransitions().isEmpty());
    assertTrue(result.getMissingTransitions().isEmpty());
    assertTrue(result.getDuplicateStateNames().isEmpty());
    assertTrue(result.getErrors().isEmpty());
    assertEquals(0, result.issueCount());
  }

  @Test
  public void testAllIssuesReportedNotJustFirst() throws FsmAnalysisException {
    final AnalysisResult result = analyzer.analyze(multipleIssues());
    assertFalse(result.isValid());
    assertEquals(Collections.singletonList("orphan"), result.getUnreachableStates());
    assertEquals(Collections.singletonList(Arrays.asList("cycleA", "cycleB")),
        result.getCyclesWithoutExit());
    assertEquals(1, result.getAmbiguousTransitions().size());
    assertEquals("processing", result.getAmbiguousTransitions().get(0).getFromState());
    assertEquals(Collections.singletonList("orphan_to_completed"), result.getDeadTransitions());
    assertEquals(Collections.singletonList("dead_end"), result.getMissingTransitions());
    assertTrue(result.getDuplicateStateNames().isEmpty());
    assertEquals(Arrays.asList("Found 1 unreachable state(s): orphan",
        "Found cycle without exit: cycleA -> cycleB -> cycleA",
        "Ambiguous transition: processing + ambiguous -> {stateB, stateC}",
        "Found 1 dead transition(s): orphan_to_completed",
        "Found 1 state(s) with missing outgoing transitions: dead_end"), result.getErrors());
  }

  @Test
  public void testDuplicateStateNamesInvalidateMachine() throws FsmAnalysisException {
    final FsmSpecification specification =
        machine("Dupes", "idle", "idle", "completed", "idle").terminalState("completed")
            .transition(transition("idle", "completed", "finish")).build();
    final AnalysisResult result = analyzer.analyze(specification);
    assertFalse(result.isValid());
    assertEquals(Collections.singletonList("idle"), result.getDuplicateStateNames());
    assertEquals(Collections.singletonList("Found 1 duplicate state name(s): idle"),
        result.getErrors());
  }

  @Test
  public void testWildcardErrorHandlerWithSpecificOverrideIsValid() throws FsmAnalysisException {
    final FsmSpecification specification = machine("WildcardWorkflow", "idle", "idle",
        "processing", "retry_state", "error_state", "completed").terminalState("completed")
            .terminalState("error_state").errorState("error_state")
            .transition(transition("start", "idle", "processing", "start", 1))
            .transition(transition("global_error", Transition.WILDCARD, "error_state", "error", 1))
            .transition(transition("processing_error", "processing", "retry_state", "error", 1))
            .transition(transition("retry", "retry_state", "processing", "retry", 1))
            .transition(transition("finish", "processing", "completed", "finish", 1)).build();
    final AnalysisResult result = analyzer.analyze(specification);
    assertTrue(result.toString(), result.isValid());
  }

  @Test
  public void testStateOnlyLeftThroughWildcardIsNotUnreachable() throws FsmAnalysisException {
    final FsmSpecification specification = machine("WildcardOnly", "A", "A", "B", "C")
        .terminalState("B").transition(transition("to_b", Transition.WILDCARD, "B", "b", 0))
        .build();
    final AnalysisResult result = analyzer.analyze(specification);
    assertTrue(result.getUnreachableStates().isEmpty());
    assertTrue(result.getErrors().isEmpty());
    assertTrue(result.isValid());
  }

  @Test
  public void testDifferentPrioritiesAreValid() throws FsmAnalysisException {
    final FsmSpecification specification = machine("DifferentPriority", "idle", "idle",
        "processing", "stateB", "stateC", "completed").terminalState("completed")
            .transition(transition("start", "idle", "processing", "start", 1))
            .transition(transition("high_priority", "processing", "stateB", "event", 2))
            .transition(transition("low_priority", "processing", "stateC", "event", 1))
            .transition(transition("finish_b", "stateB", "completed", "finish", 1))
            .transition(transition("finish_c", "stateC", "completed", "finish", 1)).build();
    assertTrue(analyzer.analyze(specification).isValid());
  }

  @Test
  public void testMultipleTerminalStatesAreValid() throws FsmAnalysisException {
    final FsmSpecification specification =
        machine("MultiTerminal", "idle", "idle", "processing", "success", "failure")
            .terminalState("success").terminalState("failure").errorState("failure")
            .transition(transition("idle", "processing", "start"))
            .transition(transition("processing", "success", "finish"))
            .transition(transition("processing", "failure", "error")).build();
    assertTrue(analyzer.analyze(specification).isValid());
  }

  @Test
  public void testMinimalMachine() throws FsmAnalysisException {
    final FsmSpecification specification = machine("Minimal", "initial", "initial", "terminal")
        .terminalState("terminal").transition(transition("initial", "terminal", "finish")).build();
    assertTrue(analyzer.analyze(specification).isValid());
  }

  @Test
  public void testCycleWithoutExitMessage() throws FsmAnalysisException {
    final FsmSpecification specification = machine("Trap", "A", "A", "B", "Terminal")
        .terminalState("Terminal").transition(transition("A", "B", "next"))
        .transition(transition("B", "A", "next")).build();
    final AnalysisResult result = analyzer.analyze(specification);
    assertEquals(Collections.singletonList(Arrays.asList("A", "B")),
        result.getCyclesWithoutExit());
    // Terminal is never entered
    assertEquals(Arrays.asList("Found 1 unreachable state(s): Terminal",
        "Found cycle without exit: A -> B -> A"), result.getErrors());
  }

  @Test
  public void testDisabledCheckStaysEmpty() throws FsmAnalysisException {
    final EnumSet<AnalysisCheck> checks = EnumSet.allOf(AnalysisCheck.class);
    checks.remove(AnalysisCheck.UNREACHABLE_STATES);
    final FsmAnalyzer partial = FsmAnalyzerBuilder.newBuilder()
        .config(FsmAnalyzerConfigurationBuilder.newBuilder().checks(checks).build()).build();
    final AnalysisResult result = partial.analyze(multipleIssues());
    assertTrue(result.getUnreachableStates().isEmpty());
    // dead transitions still see the unreachable states
    assertEquals(Collections.singletonList("orphan_to_completed"), result.getDeadTransitions());
    assertEquals(4, result.getErrors().size());
  }

  @Test
  public void testFailFastStopsAfterFirstFinding() throws FsmAnalysisException {
    final FsmAnalyzer failFast = FsmAnalyzerBuilder.newBuilder()
        .config(FsmAnalyzerConfigurationBuilder.newBuilder().failFast(true).build()).build();
    final AnalysisResult result = failFast.analyze(multipleIssues());
    assertFalse(result.isValid());
    assertEquals(Collections.singletonList("orphan"), result.getUnreachableStates());
    assertTrue(result.getCyclesWithoutExit().isEmpty());
    assertTrue(result.getMissingTransitions().isEmpty());
    assertEquals(1, result.getErrors().size());
    // nothing to stop on in a valid machine
    assertTrue(failFast.analyze(FsmFixtures.linear()).isValid());
  }

  @Test
  public void testAnalysisIsIdempotent() throws FsmAnalysisException {
    final FsmSpecification specification = multipleIssues();
    final AnalysisResult first = analyzer.analyze(specification);
    final AnalysisResult second = analyzer.analyze(specification);
    assertEquals(first, second);
    assertEquals(first.getErrors(), second.getErrors());
    assertEquals(first.toString(), second.toString());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testResultIsImmutable() throws FsmAnalysisException {
    analyzer.analyze(multipleIssues()).getErrors().clear();
  }

  @Test
  public void testStatisticsAccumulate() throws FsmAnalysisException {
    final FsmAnalyzer fresh = FsmAnalyzerBuilder.newBuilder().build();
    assertNotNull(fresh.getId());
    assertEquals(fresh.getId(), fresh.getStatistics().getAnalyzerId());
    fresh.analyze(FsmFixtures.linear());
    fresh.analyze(multipleIssues());
    final AnalyzerStatistics stats = fresh.getStatistics();
    assertEquals(2L, stats.getTotalAnalyses());
    assertEquals(1L, stats.getTotalInvalidSpecifications());
    assertEquals(5L, stats.getTotalIssues());
    assertTrue(stats.getLastElapsedNanos() > 0L);
  }

  @Test
  public void testSharedAnalyzerAcrossThreads() throws Exception {
    final FsmSpecification specification = multipleIssues();
    final AnalysisResult expected = analyzer.analyze(specification);
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Callable<AnalysisResult>> calls =
          Collections.nCopies(16, () -> analyzer.analyze(specification));
      for (final Future<AnalysisResult> future : executor.invokeAll(calls)) {
        assertEquals(expected, future.get());
      }
    } finally {
      executor.shutdownNow();
    }
  }

  // orphan unreachable, processing ambiguous, dead_end stuck, cycleA <-> cycleB trapped
  static FsmSpecification multipleIssues() throws FsmAnalysisException {
    return machine("MultipleIssues", "idle", "idle", "processing", "stateB", "stateC", "dead_end",
        "cycleA", "cycleB", "orphan", "completed").terminalState("completed")
            .transition(transition("start", "idle", "processing", "start", 1))
            .transition(transition("ambiguous_to_b", "processing", "stateB", "ambiguous", 1))
            .transition(transition("ambiguous_to_c", "processing", "stateC", "ambiguous", 1))
            .transition(transition("stateB", "completed", "finish"))
            .transition(transition("stateC", "dead_end", "stall"))
            .transition(transition("processing", "cycleA", "loop"))
            .transition(transition("cycleA", "cycleB", "next"))
            .transition(transition("cycleB", "cycleA", "next"))
            .transition(transition("orphan", "completed", "finish")).build();
  }
}
