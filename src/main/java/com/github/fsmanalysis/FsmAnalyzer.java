package com.github.fsmanalysis;

/**
 * Static semantic analyzer for finite state machine specifications. It reasons about a machine
 * before deployment and never runs one.
 *
 * Notes for users:<br>
 * 1. an analyzer instance is thread-safe and holds no per-analysis state, so a single instance
 * can serve any number of callers<br>
 *
 * 2. analyze() is deterministic: the same specification always yields an equal result<br>
 *
 * 3. defects in the analyzed machine are data in the returned {@link AnalysisResult}, never
 * exceptions. Structural problems are rejected earlier, when the {@link FsmSpecification} is
 * built<br>
 *
 * 4. guard conditions on transitions are not evaluated, their truth is only known at run time<br>
 */
public interface FsmAnalyzer {

  /**
   * Run every configured check against the specification and report all findings.
   */
  AnalysisResult analyze(final FsmSpecification specification);

  /**
   * Reports the id of this analyzer instance.
   */
  String getId();

  /**
   * Returns the config that this analyzer is wired with.
   */
  FsmAnalyzerConfiguration getConfiguration();

  /**
   * Report statistics for this analyzer.
   */
  AnalyzerStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build analyzers.
   */
  public final static class FsmAnalyzerBuilder {
    private FsmAnalyzerConfiguration config;

    public static FsmAnalyzerBuilder newBuilder() {
      return new FsmAnalyzerBuilder();
    }

    public FsmAnalyzerBuilder config(final FsmAnalyzerConfiguration config) {
      this.config = config;
      return this;
    }

    public FsmAnalyzer build() {
      return new FsmAnalyzerImpl(config == null ? FsmAnalyzerConfiguration.defaults() : config);
    }

    private FsmAnalyzerBuilder() {}
  }

}
