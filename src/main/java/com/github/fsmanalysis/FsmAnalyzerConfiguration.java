package com.github.fsmanalysis;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * This class encapsulates all the configuration parameters for the FsmAnalyzer. Use the
 * {@code FsmAnalyzerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If checks are not set, all of {@link AnalysisCheck} run. A check that is switched off leaves
 * its collection in the {@link AnalysisResult} empty and contributes no error lines.<br>
 * 2. failFast stops the analysis after the first check, in {@link AnalysisCheck} order, that
 * reports anything. It is off by default so that every issue of a machine is reported in one go.
 * <br>
 */
public final class FsmAnalyzerConfiguration {
  private final Set<AnalysisCheck> checks;
  private final boolean failFast;

  public Set<AnalysisCheck> getChecks() {
    return checks;
  }

  public boolean isEnabled(final AnalysisCheck check) {
    return checks.contains(check);
  }

  public boolean getFailFast() {
    return failFast;
  }

  public static FsmAnalyzerConfiguration defaults() {
    return new FsmAnalyzerConfiguration(EnumSet.allOf(AnalysisCheck.class), false);
  }

  public final static class FsmAnalyzerConfigurationBuilder {
    private Set<AnalysisCheck> checks = EnumSet.allOf(AnalysisCheck.class);
    private boolean failFast;

    public static FsmAnalyzerConfigurationBuilder newBuilder() {
      return new FsmAnalyzerConfigurationBuilder();
    }

    public FsmAnalyzerConfigurationBuilder checks(final Set<AnalysisCheck> checks) {
      this.checks = checks;
      return this;
    }

    public FsmAnalyzerConfigurationBuilder failFast(final boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    public FsmAnalyzerConfiguration build() throws FsmAnalysisException {
      validate(checks);
      return new FsmAnalyzerConfiguration(EnumSet.copyOf(checks), failFast);
    }

    private FsmAnalyzerConfigurationBuilder() {}
  }

  private static void validate(final Set<AnalysisCheck> checks) throws FsmAnalysisException {
    StringBuilder messages = new StringBuilder();
    if (checks == null) {
      messages.append("Checks cannot be null. ");
    } else if (checks.isEmpty()) {
      messages.append("At least one check must be enabled. ");
    } else {
      for (final AnalysisCheck check : checks) {
        if (check == null) {
          messages.append("Checks cannot contain null. ");
          break;
        }
      }
    }
    if (messages.length() > 0) {
      throw new FsmAnalysisException(FsmAnalysisException.Code.INVALID_ANALYZER_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "FsmAnalyzerConfiguration [checks=" + checks + ", failFast=" + failFast + "]";
  }

  private FsmAnalyzerConfiguration(final Set<AnalysisCheck> checks, final boolean failFast) {
    this.checks = Collections.unmodifiableSet(checks);
    this.failFast = failFast;
  }

}
