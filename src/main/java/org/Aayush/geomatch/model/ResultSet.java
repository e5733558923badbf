package org.Aayush.geomatch.model;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Ordered, immutable sequence of {@link MatchRecord}s, one per query point.
 */
public final class ResultSet implements Iterable<MatchRecord> {
    private static final ResultSet EMPTY = new ResultSet(List.of());

    private final List<MatchRecord> records;

    private ResultSet(List<MatchRecord> records) {
        this.records = records;
    }

    public static ResultSet empty() {
        return EMPTY;
    }

    public static ResultSet of(List<MatchRecord> records) {
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return EMPTY;
        }
        return new ResultSet(List.copyOf(records));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public MatchRecord get(int index) {
        return records.get(index);
    }

    public List<MatchRecord> records() {
        return records;
    }

    public Stream<MatchRecord> stream() {
        return records.stream();
    }

    @Override
    public Iterator<MatchRecord> iterator() {
        return records.iterator();
    }

    @Override
    public String toString() {
        return "ResultSet[size=" + records.size() + "]";
    }
}
