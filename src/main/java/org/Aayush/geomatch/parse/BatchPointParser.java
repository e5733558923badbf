package org.Aayush.geomatch.parse;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.PointSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link PointSet} from rows of raw latitude/longitude tokens.
 *
 * <p>A row that fails to parse, or decodes to an out-of-range point, is skipped and
 * reported; the remaining rows are still processed.</p>
 */
public final class BatchPointParser {
    private final CoordinateParser parser;

    public BatchPointParser() {
        this(CoordinateParser.defaultParser());
    }

    public BatchPointParser(CoordinateParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Parses rows of exactly two tokens: latitude then longitude.
     *
     * @param rows ordered rows; a null row or one without exactly two tokens is rejected.
     */
    public BatchParseResult parse(List<? extends List<String>> rows) {
        Objects.requireNonNull(rows, "rows");
        PointSet.Builder points = PointSet.builder();
        IntArrayList rejected = new IntArrayList();
        List<GeoMatchException> failures = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            try {
                if (row == null || row.size() != 2) {
                    throw new CoordinateFormatException(
                            CoordinateFormatException.REASON_UNRECOGNIZED_COORDINATE,
                            String.valueOf(row),
                            "row must contain exactly a latitude and a longitude token: " + row
                    );
                }
                points.add(parser.parsePoint(row.get(0), row.get(1)));
            } catch (GeoMatchException e) {
                rejected.add(i);
                failures.add(e);
            }
        }

        return new BatchParseResult(
                points.build(),
                IntLists.unmodifiable(rejected),
                List.copyOf(failures)
        );
    }
}
