package org.Aayush.geomatch.io;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.PointSet;

import java.util.List;

/**
 * Points read from a delimited source plus the one-based line numbers of skipped rows.
 *
 * @param points accepted points in file order.
 * @param rejectedLines one-based line numbers of skipped data rows, ascending.
 * @param failures one failure per skipped row, aligned with {@code rejectedLines}.
 */
public record DelimitedReadResult(PointSet points, IntList rejectedLines, List<GeoMatchException> failures) {
}
