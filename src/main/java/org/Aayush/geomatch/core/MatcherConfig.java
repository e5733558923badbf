package org.Aayush.geomatch.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.geomatch.spatial.SpatialIndex;

/**
 * Configuration for {@link GeodesicMatcher}.
 */
@Value
@Builder
public class MatcherConfig {
    /**
     * Maximum points per KD leaf bucket.
     */
    @Builder.Default
    int leafSize = SpatialIndex.DEFAULT_LEAF_SIZE;

    /**
     * Number of index candidates re-ranked by haversine distance per query.
     * {@code 1} takes the index's single best candidate as-is.
     */
    @Builder.Default
    int candidateCount = 1;

    /**
     * Telemetry sink, invoked once per match call.
     */
    @Builder.Default
    MatchObserver observer = MatchObserver.NOOP;

    /**
     * Returns the all-defaults configuration.
     */
    public static MatcherConfig defaults() {
        return builder().build();
    }
}
