package org.Aayush.geomatch.parse;

import org.Aayush.geomatch.model.GeoPoint;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Converts raw coordinate text into signed decimal degrees.
 *
 * <p>Grammars are tried in a fixed priority order and the first grammar that matches the
 * whole trimmed token wins. The default order is {@link CoordinateFormat#MOST_SPECIFIC_FIRST}.
 * Instances are immutable and safe for concurrent use.</p>
 */
public final class CoordinateParser {
    private static final CoordinateParser DEFAULT = new CoordinateParser(CoordinateFormat.MOST_SPECIFIC_FIRST);

    private final List<CoordinateFormat> priority;

    /**
     * Creates a parser with an explicit grammar priority.
     *
     * @param priority non-empty, duplicate-free grammar order.
     */
    public CoordinateParser(List<CoordinateFormat> priority) {
        Objects.requireNonNull(priority, "priority");
        if (priority.isEmpty()) {
            throw new IllegalArgumentException("priority must contain at least one format");
        }
        EnumSet<CoordinateFormat> seen = EnumSet.noneOf(CoordinateFormat.class);
        for (CoordinateFormat format : priority) {
            if (!seen.add(Objects.requireNonNull(format, "format"))) {
                throw new IllegalArgumentException("duplicate format in priority: " + format);
            }
        }
        this.priority = List.copyOf(priority);
    }

    /**
     * Returns the shared most-specific-first parser.
     */
    public static CoordinateParser defaultParser() {
        return DEFAULT;
    }

    public List<CoordinateFormat> priority() {
        return priority;
    }

    /**
     * Parses one token into signed decimal degrees.
     *
     * @throws CoordinateFormatException when no grammar matches the whole token.
     */
    public double parse(String text) {
        return tokenize(text).value();
    }

    /**
     * Recognizes one token and reports which grammar matched.
     *
     * @throws CoordinateFormatException when no grammar matches the whole token.
     */
    public CoordinateToken tokenize(String text) {
        if (text == null) {
            throw CoordinateFormatException.unrecognized(null);
        }
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            for (CoordinateFormat format : priority) {
                CoordinateToken token = format.tryParse(trimmed);
                if (token != null) {
                    return token;
                }
            }
        }
        throw CoordinateFormatException.unrecognized(text);
    }

    /**
     * Parses a latitude token, rejecting E/W hemisphere letters.
     */
    public double parseLatitude(String text) {
        return parseAxis(text, Hemisphere.Axis.LATITUDE);
    }

    /**
     * Parses a longitude token, rejecting N/S hemisphere letters.
     */
    public double parseLongitude(String text) {
        return parseAxis(text, Hemisphere.Axis.LONGITUDE);
    }

    /**
     * Parses a latitude/longitude token pair into a validated point.
     *
     * @throws CoordinateFormatException when either token is unrecognized or on the wrong axis.
     * @throws org.Aayush.geomatch.model.GeoMatchException when the decoded point is out of range.
     */
    public GeoPoint parsePoint(String latitudeText, String longitudeText) {
        return GeoPoint.of(parseLatitude(latitudeText), parseLongitude(longitudeText));
    }

    private double parseAxis(String text, Hemisphere.Axis axis) {
        CoordinateToken token = tokenize(text);
        if (token.hemisphere() != null && token.hemisphere().axis() != axis) {
            throw CoordinateFormatException.axisMismatch(text, axis);
        }
        return token.value();
    }
}
