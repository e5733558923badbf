package org.Aayush.geomatch.parse;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geomatch.model.GeoMatchException;

/**
 * Raised when a coordinate token matches none of the accepted textual formats,
 * or carries a hemisphere letter for the wrong axis.
 */
@Getter
@Accessors(fluent = true)
public final class CoordinateFormatException extends GeoMatchException {
    public static final String REASON_UNRECOGNIZED_COORDINATE = "GEO_UNRECOGNIZED_COORDINATE";
    public static final String REASON_HEMISPHERE_AXIS_MISMATCH = "GEO_HEMISPHERE_AXIS_MISMATCH";

    /** Raw token as supplied by the caller, before trimming. */
    private final String raw;

    public CoordinateFormatException(String reasonCode, String raw, String message) {
        super(reasonCode, message);
        this.raw = raw;
    }

    static CoordinateFormatException unrecognized(String raw) {
        return new CoordinateFormatException(
                REASON_UNRECOGNIZED_COORDINATE,
                raw,
                "unrecognized coordinate format: '" + raw + "'"
        );
    }

    static CoordinateFormatException axisMismatch(String raw, Hemisphere.Axis expected) {
        return new CoordinateFormatException(
                REASON_HEMISPHERE_AXIS_MISMATCH,
                raw,
                "hemisphere letter does not belong to " + expected + ": '" + raw + "'"
        );
    }
}
