package org.Aayush.geomatch.parse;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.PointSet;

import java.util.List;

/**
 * Outcome of parsing a batch of coordinate rows.
 *
 * @param points accepted points in row order.
 * @param rejectedRows zero-based positions of skipped rows, ascending.
 * @param failures one failure per skipped row, aligned with {@code rejectedRows}.
 */
public record BatchParseResult(PointSet points, IntList rejectedRows, List<GeoMatchException> failures) {
    public int acceptedCount() {
        return points.size();
    }

    public int rejectedCount() {
        return rejectedRows.size();
    }
}
