package org.Aayush.geomatch.core;

/**
 * Deterministic counters and timings for one match pass.
 */
public record MatchTelemetry(
        int queryCount,
        int referenceCount,
        int treeNodeCount,
        int candidateCount,
        long buildNanos,
        long queryNanos
) {
    /**
     * Telemetry for a pass that short-circuited on empty input.
     */
    public static MatchTelemetry skipped(int queryCount, int referenceCount, int candidateCount) {
        return new MatchTelemetry(queryCount, referenceCount, 0, candidateCount, 0L, 0L);
    }

    /**
     * True when the pass produced no records because one side was empty.
     */
    public boolean emptyInput() {
        return queryCount == 0 || referenceCount == 0;
    }
}
