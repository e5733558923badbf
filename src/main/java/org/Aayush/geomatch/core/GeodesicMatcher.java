package org.Aayush.geomatch.core;

import org.Aayush.geomatch.geometry.GeometryDistance;
import org.Aayush.geomatch.model.GeoPoint;
import org.Aayush.geomatch.model.MatchRecord;
import org.Aayush.geomatch.model.PointSet;
import org.Aayush.geomatch.model.ResultSet;
import org.Aayush.geomatch.spatial.SpatialIndex;
import org.Aayush.geomatch.spatial.SpatialMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nearest-point matching orchestration.
 *
 * <p>Execution flow for one call:</p>
 * <ul>
 * <li>Return an empty result when either set is empty.</li>
 * <li>Build a {@link SpatialIndex} over the reference set. The index lives only for this call.</li>
 * <li>For each query point, in order, take the index candidate(s) under the radian metric.</li>
 * <li>Report the exact haversine distance to the chosen candidate.</li>
 * </ul>
 *
 * <p>With {@code candidateCount > 1} the index returns that many candidates and the one with
 * the smallest haversine distance wins; ties keep the candidate the index ranked first.</p>
 */
public final class GeodesicMatcher implements MatchService {
    private final int leafSize;
    private final int candidateCount;
    private final MatchObserver observer;

    public GeodesicMatcher() {
        this(MatcherConfig.defaults());
    }

    public GeodesicMatcher(MatcherConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.getLeafSize() <= 0) {
            throw new IllegalArgumentException("leafSize must be > 0, got " + config.getLeafSize());
        }
        if (config.getCandidateCount() <= 0) {
            throw new IllegalArgumentException("candidateCount must be > 0, got " + config.getCandidateCount());
        }
        this.leafSize = config.getLeafSize();
        this.candidateCount = config.getCandidateCount();
        this.observer = config.getObserver() == null ? MatchObserver.NOOP : config.getObserver();
    }

    @Override
    public ResultSet match(PointSet queries, PointSet references) {
        Objects.requireNonNull(queries, "queries");
        Objects.requireNonNull(references, "references");

        if (queries.isEmpty() || references.isEmpty()) {
            observer.onMatchCompleted(MatchTelemetry.skipped(queries.size(), references.size(), candidateCount));
            return ResultSet.empty();
        }

        long buildStart = System.nanoTime();
        SpatialIndex index = SpatialIndex.build(references, leafSize);
        long buildNanos = System.nanoTime() - buildStart;

        long queryStart = System.nanoTime();
        List<MatchRecord> records = new ArrayList<>(queries.size());
        for (GeoPoint query : queries) {
            records.add(matchOne(query, references, index));
        }
        long queryNanos = System.nanoTime() - queryStart;

        observer.onMatchCompleted(new MatchTelemetry(
                queries.size(),
                references.size(),
                index.treeNodeCount(),
                candidateCount,
                buildNanos,
                queryNanos
        ));
        return ResultSet.of(records);
    }

    private MatchRecord matchOne(GeoPoint query, PointSet references, SpatialIndex index) {
        double queryLatRad = query.latitudeRadians();
        double queryLonRad = query.longitudeRadians();

        if (candidateCount == 1) {
            SpatialMatch nearest = index.nearest(queryLatRad, queryLonRad);
            GeoPoint candidate = references.get(nearest.index());
            return new MatchRecord(query, candidate, nearest.index(), distanceKm(query, candidate));
        }

        int[] candidates = index.nearestIndices(queryLatRad, queryLonRad, candidateCount);
        int bestIndex = candidates[0];
        double bestDistance = distanceKm(query, references.get(bestIndex));
        for (int i = 1; i < candidates.length; i++) {
            double distance = distanceKm(query, references.get(candidates[i]));
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = candidates[i];
            }
        }
        return new MatchRecord(query, references.get(bestIndex), bestIndex, bestDistance);
    }

    private static double distanceKm(GeoPoint from, GeoPoint to) {
        return GeometryDistance.haversineKm(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }
}
