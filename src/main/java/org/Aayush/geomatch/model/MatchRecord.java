package org.Aayush.geomatch.model;

import java.util.Objects;

/**
 * One query point paired with its nearest reference point.
 *
 * @param query point from the query set.
 * @param match nearest point from the reference set.
 * @param matchIndex position of {@code match} within the reference set.
 * @param distanceKm great-circle distance in kilometers, unrounded.
 */
public record MatchRecord(GeoPoint query, GeoPoint match, int matchIndex, double distanceKm) {
    public MatchRecord {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(match, "match");
        if (matchIndex < 0) {
            throw new IllegalArgumentException("matchIndex must be >= 0, got " + matchIndex);
        }
        if (!(distanceKm >= 0.0d)) {
            throw new IllegalArgumentException("distanceKm must be >= 0, got " + distanceKm);
        }
    }
}
