package org.Aayush.geomatch.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-neighbor match result in radian space.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SpatialMatch {
    /** Position of the matched point in the indexed reference set. */
    private final int index;
    private final double latitudeRadians;
    private final double longitudeRadians;
    /** Squared Euclidean distance in radian space. */
    private final double distanceSquared;
}
