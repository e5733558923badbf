package org.Aayush.geomatch.core;

/**
 * Receives telemetry from {@link GeodesicMatcher}. Implementations must not throw.
 */
@FunctionalInterface
public interface MatchObserver {
    MatchObserver NOOP = telemetry -> { };

    /**
     * Called once per {@code match} call, after the result set is complete.
     */
    void onMatchCompleted(MatchTelemetry telemetry);
}
