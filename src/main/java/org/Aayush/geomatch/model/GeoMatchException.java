package org.Aayush.geomatch.model;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base contract exception for coordinate parsing and matching, carrying a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]} so log lines stay greppable.</p>
 */
@Getter
@Accessors(fluent = true)
public class GeoMatchException extends RuntimeException {
    public static final String REASON_NON_FINITE_COORDINATES = "GEO_NON_FINITE_COORDINATES";
    public static final String REASON_LATITUDE_RANGE = "GEO_LATITUDE_RANGE";
    public static final String REASON_LONGITUDE_RANGE = "GEO_LONGITUDE_RANGE";

    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GeoMatchException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public GeoMatchException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
