package com.github.fsmanalysis;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Holder of running statistics for one analyzer. Counters are lock-free since an analyzer is
 * shared between threads.
 */
public final class AnalyzerStatistics {
  private final String analyzerId;
  private final long startTstampMillis = System.currentTimeMillis();
  private final AtomicLong totalAnalyses = new AtomicLong();
  private final AtomicLong totalInvalidSpecifications = new AtomicLong();
  private final AtomicLong totalIssues = new AtomicLong();
  private final AtomicLong lastElapsedNanos = new AtomicLong();

  AnalyzerStatistics(final String analyzerId) {
    this.analyzerId = analyzerId;
  }

  void record(final AnalysisResult result, final long elapsedNanos) {
    totalAnalyses.incrementAndGet();
    if (!result.isValid()) {
      totalInvalidSpecifications.incrementAndGet();
    }
    totalIssues.addAndGet(result.issueCount());
    lastElapsedNanos.set(elapsedNanos);
  }

  public String getAnalyzerId() {
    return analyzerId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getTotalAnalyses() {
    return totalAnalyses.get();
  }

  public long getTotalInvalidSpecifications() {
    return totalInvalidSpecifications.get();
  }

  public long getTotalIssues() {
    return totalIssues.get();
  }

  public long getLastElapsedNanos() {
    return lastElapsedNanos.get();
  }

  @Override
  public String toString() {
    return "AnalyzerStatistics [analyzerId=" + analyzerId + ", startTstampMillis="
        + startTstampMillis + ", totalAnalyses=" + totalAnalyses + ", totalInvalidSpecifications="
        + totalInvalidSpecifications + ", totalIssues=" + totalIssues + ", lastElapsedNanos="
        + lastElapsedNanos + "]";
  }

}
