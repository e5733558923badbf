package org.Aayush.geomatch.spatial;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.Aayush.geomatch.geometry.GeometryDistance;
import org.Aayush.geomatch.model.GeoPoint;
import org.Aayush.geomatch.model.PointSet;

import java.util.Arrays;
import java.util.Objects;

/**
 * Balanced 2-D KD tree over a reference point set projected to radians.
 * <p>
 * Latitude and longitude are each scaled by {@code PI/180} and ranked with plain Euclidean
 * distance. This is an approximation of geodesic proximity: it distorts near the poles and
 * across the antimeridian, so the returned candidate is not guaranteed to be the true
 * great-circle nearest neighbor there.
 * </p>
 * <p>
 * This class is immutable after construction and safe for concurrent reads.
 * Tie-break is deterministic: the lower reference index wins when distances are equal.
 * </p>
 */
public final class SpatialIndex {
    public static final int DEFAULT_LEAF_SIZE = 8;

    private final double[] pointLatitudes;
    private final double[] pointLongitudes;
    private final int leafSize;

    private final int rootIndex;
    private final double[] splitValues;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] itemStartIndices;
    private final int[] itemCounts;
    private final byte[] splitAxes;
    private final byte[] leafFlags;
    private final int[] leafItems;

    private SpatialIndex(
            double[] pointLatitudes,
            double[] pointLongitudes,
            int leafSize,
            int rootIndex,
            double[] splitValues,
            int[] leftChildren,
            int[] rightChildren,
            int[] itemStartIndices,
            int[] itemCounts,
            byte[] splitAxes,
            byte[] leafFlags,
            int[] leafItems
    ) {
        this.pointLatitudes = pointLatitudes;
        this.pointLongitudes = pointLongitudes;
        this.leafSize = leafSize;
        this.rootIndex = rootIndex;
        this.splitValues = splitValues;
        this.leftChildren = leftChildren;
        this.rightChildren = rightChildren;
        this.itemStartIndices = itemStartIndices;
        this.itemCounts = itemCounts;
        this.splitAxes = splitAxes;
        this.leafFlags = leafFlags;
        this.leafItems = leafItems;
    }

    /**
     * Builds an index with {@link #DEFAULT_LEAF_SIZE}.
     */
    public static SpatialIndex build(PointSet points) {
        return build(points, DEFAULT_LEAF_SIZE);
    }

    /**
     * Builds an index over a non-empty reference set.
     *
     * @param points reference points; their order defines the returned indices.
     * @param leafSize maximum number of points stored in one leaf bucket.
     */
    public static SpatialIndex build(PointSet points, int leafSize) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Spatial index requires a non-empty reference set");
        }
        if (leafSize <= 0) {
            throw new IllegalArgumentException("leafSize must be > 0, got " + leafSize);
        }

        int pointCount = points.size();
        double[] latitudes = new double[pointCount];
        double[] longitudes = new double[pointCount];
        for (int i = 0; i < pointCount; i++) {
            GeoPoint point = points.get(i);
            latitudes[i] = point.latitudeRadians();
            longitudes[i] = point.longitudeRadians();
        }

        KDBuilder builder = new KDBuilder(latitudes, longitudes, leafSize);
        int root = builder.build(0, pointCount, 0);

        return new SpatialIndex(
                latitudes,
                longitudes,
                leafSize,
                root,
                builder.splitValues.toDoubleArray(),
                builder.leftChildren.toIntArray(),
                builder.rightChildren.toIntArray(),
                builder.itemStartIndices.toIntArray(),
                builder.itemCounts.toIntArray(),
                builder.splitAxes.toByteArray(),
                builder.leafFlags.toByteArray(),
                builder.order
        );
    }

    /**
     * Number of indexed reference points.
     */
    public int size() {
        return pointLatitudes.length;
    }

    /**
     * Number of tree nodes, internal and leaf.
     */
    public int treeNodeCount() {
        return splitValues.length;
    }

    public int leafSize() {
        return leafSize;
    }

    /**
     * Finds the nearest reference point to a query given in radians.
     *
     * @return nearest match including radian coordinates and squared radian distance.
     */
    public SpatialMatch nearest(double queryLatRad, double queryLonRad) {
        int index = nearestIndex(queryLatRad, queryLonRad);
        double lat = pointLatitudes[index];
        double lon = pointLongitudes[index];
        return new SpatialMatch(index, lat, lon, GeometryDistance.squaredEuclidean(queryLatRad, queryLonRad, lat, lon));
    }

    /**
     * Finds the nearest reference index to a query given in radians.
     */
    public int nearestIndex(double queryLatRad, double queryLonRad) {
        validateQueryCoordinate(queryLatRad, "queryLatRad");
        validateQueryCoordinate(queryLonRad, "queryLonRad");

        int best = -1;
        double bestDistanceSquared = Double.POSITIVE_INFINITY;

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        double[] bounds = new double[stack.length];
        int top = 0;
        stack[top] = rootIndex;
        bounds[top++] = 0.0d;

        while (top > 0) {
            int nodeIndex = stack[--top];
            if (bounds[top] > bestDistanceSquared) {
                continue;
            }

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];
                for (int i = start; i < end; i++) {
                    int candidate = leafItems[i];
                    double distanceSquared = GeometryDistance.squaredEuclidean(
                            queryLatRad, queryLonRad, pointLatitudes[candidate], pointLongitudes[candidate]);

                    if (distanceSquared < bestDistanceSquared
                            || (distanceSquared == bestDistanceSquared && candidate < best)) {
                        bestDistanceSquared = distanceSquared;
                        best = candidate;
                    }
                }
                continue;
            }

            double delta = (splitAxes[nodeIndex] == 0 ? queryLatRad : queryLonRad) - splitValues[nodeIndex];
            double splitPlaneDistanceSquared = delta * delta;
            int nearChild = delta <= 0.0d ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0d ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            if (top + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length << 1);
                bounds = Arrays.copyOf(bounds, stack.length);
            }
            if (farChild >= 0 && splitPlaneDistanceSquared <= bestDistanceSquared) {
                stack[top] = farChild;
                bounds[top++] = splitPlaneDistanceSquared;
            }
            if (nearChild >= 0) {
                stack[top] = nearChild;
                bounds[top++] = 0.0d;
            }
        }

        if (best < 0) {
            throw new IllegalStateException("Spatial index contains no reachable leaf items");
        }
        return best;
    }

    /**
     * Finds up to {@code k} nearest reference indices, ordered by ascending radian distance
     * (ties broken by lower index).
     */
    public int[] nearestIndices(double queryLatRad, double queryLonRad, int k) {
        validateQueryCoordinate(queryLatRad, "queryLatRad");
        validateQueryCoordinate(queryLonRad, "queryLonRad");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0, got " + k);
        }

        int capacity = Math.min(k, pointLatitudes.length);
        int[] bestIndices = new int[capacity];
        double[] bestDistances = new double[capacity];
        int found = 0;

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        double[] bounds = new double[stack.length];
        int top = 0;
        stack[top] = rootIndex;
        bounds[top++] = 0.0d;

        while (top > 0) {
            int nodeIndex = stack[--top];
            double worst = found < capacity ? Double.POSITIVE_INFINITY : bestDistances[found - 1];
            if (bounds[top] > worst) {
                continue;
            }

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];
                for (int i = start; i < end; i++) {
                    int candidate = leafItems[i];
                    double distanceSquared = GeometryDistance.squaredEuclidean(
                            queryLatRad, queryLonRad, pointLatitudes[candidate], pointLongitudes[candidate]);
                    found = offer(bestIndices, bestDistances, found, candidate, distanceSquared);
                }
                continue;
            }

            double delta = (splitAxes[nodeIndex] == 0 ? queryLatRad : queryLonRad) - splitValues[nodeIndex];
            double splitPlaneDistanceSquared = delta * delta;
            int nearChild = delta <= 0.0d ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0d ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            if (top + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length << 1);
                bounds = Arrays.copyOf(bounds, stack.length);
            }
            if (farChild >= 0 && splitPlaneDistanceSquared <= worst) {
                stack[top] = farChild;
                bounds[top++] = splitPlaneDistanceSquared;
            }
            if (nearChild >= 0) {
                stack[top] = nearChild;
                bounds[top++] = 0.0d;
            }
        }

        return found == capacity ? bestIndices : Arrays.copyOf(bestIndices, found);
    }

    @Override
    public String toString() {
        return "SpatialIndex[points=" + pointLatitudes.length +
                ", treeNodes=" + splitValues.length +
                ", leafSize=" + leafSize + "]";
    }

    /**
     * Inserts a candidate into the sorted best-k buffers when it qualifies.
     *
     * @return updated number of filled slots.
     */
    private static int offer(int[] indices, double[] distances, int found, int candidate, double distanceSquared) {
        int capacity = indices.length;
        if (found == capacity) {
            int last = capacity - 1;
            if (distanceSquared > distances[last]
                    || (distanceSquared == distances[last] && candidate > indices[last])) {
                return found;
            }
            found = last;
        }

        int position = found;
        while (position > 0
                && (distances[position - 1] > distanceSquared
                || (distances[position - 1] == distanceSquared && indices[position - 1] > candidate))) {
            indices[position] = indices[position - 1];
            distances[position] = distances[position - 1];
            position--;
        }
        indices[position] = candidate;
        distances[position] = distanceSquared;
        return found + 1;
    }

    private static void validateQueryCoordinate(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }

    /**
     * Median-split builder. Leaf buckets reference contiguous ranges of {@code order}.
     */
    private static final class KDBuilder {
        private final double[] latitudes;
        private final double[] longitudes;
        private final int leafSize;
        private final int[] order;

        private final DoubleArrayList splitValues = new DoubleArrayList();
        private final IntArrayList leftChildren = new IntArrayList();
        private final IntArrayList rightChildren = new IntArrayList();
        private final IntArrayList itemStartIndices = new IntArrayList();
        private final IntArrayList itemCounts = new IntArrayList();
        private final ByteArrayList splitAxes = new ByteArrayList();
        private final ByteArrayList leafFlags = new ByteArrayList();

        private KDBuilder(double[] latitudes, double[] longitudes, int leafSize) {
            this.latitudes = latitudes;
            this.longitudes = longitudes;
            this.leafSize = leafSize;
            this.order = new int[latitudes.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = i;
            }
        }

        private int build(int from, int to, int depth) {
            int axis = depth & 1;
            if (to - from <= leafSize) {
                return addNode(0.0d, from, to - from, axis, true);
            }

            double[] coordinates = axis == 0 ? latitudes : longitudes;
            IntArrays.quickSort(order, from, to, (a, b) -> {
                int cmp = Double.compare(coordinates[a], coordinates[b]);
                return cmp != 0 ? cmp : Integer.compare(a, b);
            });

            int mid = (from + to) >>> 1;
            int nodeIndex = addNode(coordinates[order[mid]], 0, 0, axis, false);
            int leftChild = build(from, mid, depth + 1);
            int rightChild = build(mid, to, depth + 1);
            leftChildren.set(nodeIndex, leftChild);
            rightChildren.set(nodeIndex, rightChild);
            return nodeIndex;
        }

        private int addNode(double splitValue, int itemStart, int itemCount, int axis, boolean leaf) {
            int nodeIndex = splitValues.size();
            splitValues.add(splitValue);
            leftChildren.add(-1);
            rightChildren.add(-1);
            itemStartIndices.add(itemStart);
            itemCounts.add(itemCount);
            splitAxes.add((byte) axis);
            leafFlags.add((byte) (leaf ? 1 : 0));
            return nodeIndex;
        }
    }
}
