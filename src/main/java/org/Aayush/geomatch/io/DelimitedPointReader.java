package org.Aayush.geomatch.io;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.parse.BatchParseResult;
import org.Aayush.geomatch.parse.BatchPointParser;
import org.Aayush.geomatch.parse.CoordinateFormatException;
import org.Aayush.geomatch.parse.CoordinateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Reads latitude/longitude pairs from delimited text.
 *
 * <p>Fields may be wrapped in double quotes, with {@code ""} as an escaped quote. Blank lines
 * are ignored. Rows that are too short or whose coordinates fail to parse are skipped and
 * reported by line number; the rest of the file is still read.</p>
 */
public final class DelimitedPointReader {
    private static final Logger logger = LoggerFactory.getLogger(DelimitedPointReader.class);

    public static final String REASON_COLUMN_NOT_FOUND = "GEO_COLUMN_NOT_FOUND";

    private static final Set<String> LATITUDE_NAMES = Set.of("lat", "latitude");
    private static final Set<String> LONGITUDE_NAMES = Set.of("lon", "lng", "long", "longitude");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final DelimitedReaderConfig config;
    private final CoordinateParser parser;
    private final BatchPointParser batchParser;

    public DelimitedPointReader() {
        this(DelimitedReaderConfig.defaults());
    }

    public DelimitedPointReader(DelimitedReaderConfig config) {
        this(config, CoordinateParser.defaultParser());
    }

    public DelimitedPointReader(DelimitedReaderConfig config, CoordinateParser parser) {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.batchParser = new BatchPointParser(parser);
        if (config.getLatitudeIndex() < 0 || config.getLongitudeIndex() < 0) {
            throw new IllegalArgumentException("column indices must be >= 0");
        }
    }

    /**
     * Reads a UTF-8 file.
     */
    public DelimitedReadResult read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DelimitedReadResult result = read(reader);
            logger.info("Read {} points from {} ({} rows skipped)",
                    result.points().size(), path, result.rejectedLines().size());
            return result;
        }
    }

    /**
     * Reads from a character stream. The caller keeps ownership of the reader.
     *
     * <p>With {@code header} enabled, a first line without recognizable column names whose
     * index columns hold coordinates is read as data rather than discarded.</p>
     *
     * @throws GeoMatchException when a configured header column is missing.
     */
    public DelimitedReadResult read(Reader source) throws IOException {
        Objects.requireNonNull(source, "source");
        BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);

        List<List<String>> rows = new ArrayList<>();
        IntArrayList rowLines = new IntArrayList();
        boolean headerPending = config.isHeader();
        int[] columns = {config.getLatitudeIndex(), config.getLongitudeIndex()};

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            if (line.isBlank()) {
                continue;
            }

            List<String> fields = splitFields(line, config.getDelimiter());
            if (headerPending) {
                headerPending = false;
                int[] named = resolveColumns(fields);
                if (named != null) {
                    columns = named;
                    continue;
                }
                if (!isCoordinateRow(fields, columns)) {
                    logger.warn("Header {} has no recognizable coordinate columns, using indices {} and {}",
                            fields, columns[0], columns[1]);
                    continue;
                }
                logger.info("Line {} holds coordinates, reading input as headerless", lineNumber);
            }

            rowLines.add(lineNumber);
            if (fields.size() <= Math.max(columns[0], columns[1])) {
                rows.add(List.of(line));
            } else {
                rows.add(List.of(fields.get(columns[0]), fields.get(columns[1])));
            }
        }

        BatchParseResult batch = batchParser.parse(rows);
        IntArrayList rejectedLines = new IntArrayList(batch.rejectedCount());
        for (int i = 0; i < batch.rejectedCount(); i++) {
            int rejectedLine = rowLines.getInt(batch.rejectedRows().getInt(i));
            rejectedLines.add(rejectedLine);
            logger.warn("Skipping line {}: {}", rejectedLine, batch.failures().get(i).getMessage());
        }
        return new DelimitedReadResult(batch.points(), IntLists.unmodifiable(rejectedLines), batch.failures());
    }

    private int[] resolveColumns(List<String> header) {
        int latitude = -1;
        int longitude = -1;
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).trim().toLowerCase(Locale.ROOT);
            if (latitude < 0 && matches(name, config.getLatitudeColumn(), LATITUDE_NAMES)) {
                latitude = i;
            } else if (longitude < 0 && matches(name, config.getLongitudeColumn(), LONGITUDE_NAMES)) {
                longitude = i;
            }
        }

        if (config.getLatitudeColumn() != null && latitude < 0) {
            throw new GeoMatchException(REASON_COLUMN_NOT_FOUND,
                    "latitude column '" + config.getLatitudeColumn() + "' not found in header " + header);
        }
        if (config.getLongitudeColumn() != null && longitude < 0) {
            throw new GeoMatchException(REASON_COLUMN_NOT_FOUND,
                    "longitude column '" + config.getLongitudeColumn() + "' not found in header " + header);
        }
        if (latitude < 0 || longitude < 0) {
            return null;
        }
        return new int[]{latitude, longitude};
    }

    /**
     * True when the fields at the given columns both tokenize as coordinates.
     * Range is not checked here, so an out-of-range first row is still read and rejected.
     */
    private boolean isCoordinateRow(List<String> fields, int[] columns) {
        if (fields.size() <= Math.max(columns[0], columns[1])) {
            return false;
        }
        try {
            parser.tokenize(fields.get(columns[0]));
            parser.tokenize(fields.get(columns[1]));
            return true;
        } catch (CoordinateFormatException e) {
            return false;
        }
    }

    private static boolean matches(String name, String configured, Set<String> wellKnown) {
        if (configured != null) {
            return name.equals(configured.trim().toLowerCase(Locale.ROOT));
        }
        return wellKnown.contains(name);
    }

    /**
     * Splits one line on the delimiter, honoring double-quoted fields.
     */
    static List<String> splitFields(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }

            if (c == delimiter) {
                fields.add(field.toString().trim());
                field.setLength(0);
                fieldStart = true;
                continue;
            }
            if (c == '"' && fieldStart && field.toString().isBlank()) {
                field.setLength(0);
                quoted = true;
                fieldStart = false;
                continue;
            }
            if (!Character.isWhitespace(c)) {
                fieldStart = false;
            }
            field.append(c);
        }
        fields.add(field.toString().trim());
        return fields;
    }
}
