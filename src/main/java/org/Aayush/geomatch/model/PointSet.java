package org.Aayush.geomatch.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Immutable ordered sequence of {@link GeoPoint}s.
 *
 * <p>Insertion order is the order in which match records are emitted and the
 * order used to assign reference indices when an index is built over the set.</p>
 */
public final class PointSet implements Iterable<GeoPoint> {
    private static final PointSet EMPTY = new PointSet(List.of());

    private final List<GeoPoint> points;

    private PointSet(List<GeoPoint> points) {
        this.points = points;
    }

    /**
     * Returns the shared empty set.
     */
    public static PointSet empty() {
        return EMPTY;
    }

    /**
     * Creates a set from an ordered collection of points.
     *
     * @throws NullPointerException when the list or any element is null.
     */
    public static PointSet of(List<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            return EMPTY;
        }
        return new PointSet(List.copyOf(points));
    }

    public static PointSet of(GeoPoint... points) {
        return of(List.of(points));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public GeoPoint get(int index) {
        return points.get(index);
    }

    /**
     * Returns the points as an unmodifiable list.
     */
    public List<GeoPoint> points() {
        return points;
    }

    public Stream<GeoPoint> stream() {
        return points.stream();
    }

    @Override
    public Iterator<GeoPoint> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PointSet other)) {
            return false;
        }
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "PointSet[size=" + points.size() + "]";
    }

    /**
     * Order-preserving accumulator.
     */
    public static final class Builder {
        private final List<GeoPoint> points = new ArrayList<>();

        private Builder() {
        }

        public Builder add(GeoPoint point) {
            points.add(Objects.requireNonNull(point, "point"));
            return this;
        }

        public Builder add(double latitude, double longitude) {
            return add(GeoPoint.of(latitude, longitude));
        }

        public int size() {
            return points.size();
        }

        public PointSet build() {
            return of(points);
        }
    }
}
