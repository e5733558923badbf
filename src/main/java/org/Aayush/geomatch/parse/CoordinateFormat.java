package org.Aayush.geomatch.parse;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural coordinate grammars.
 *
 * <p>Each grammar must match the whole (trimmed) token. Numeric groups may be separated by
 * any run of characters that are neither digits nor the decimal point, so degree, minute
 * and second marks, punctuation and whitespace are all accepted. Only marks and whitespace
 * may sit between the last numeric group and the hemisphere letter.</p>
 */
public enum CoordinateFormat {
    /**
     * Integer degrees, integer minutes, seconds (may be fractional), hemisphere letter required.
     * Example: {@code 52°31'12"N}.
     */
    DEGREES_MINUTES_SECONDS(Pattern.compile(
            "^([+-]?\\d+)" + Syntax.SEPARATOR
                    + "(\\d+)" + Syntax.SEPARATOR
                    + "(\\d+(?:\\.\\d+)?)" + Syntax.TRAIL
                    + "([NSEWnsew])$"
    )) {
        @Override
        CoordinateToken decode(String raw, Matcher m) {
            double minutes = Double.parseDouble(m.group(2));
            double seconds = Double.parseDouble(m.group(3));
            if (minutes >= 60.0d || seconds >= 60.0d) {
                return null;
            }
            return token(raw, m.group(1), minutes, seconds, m.group(4));
        }
    },

    /**
     * Integer degrees, minutes (may be fractional), hemisphere letter required.
     * Example: {@code 52°31.2'N}.
     */
    DEGREES_MINUTES(Pattern.compile(
            "^([+-]?\\d+)" + Syntax.SEPARATOR
                    + "(\\d+(?:\\.\\d+)?)" + Syntax.TRAIL
                    + "([NSEWnsew])$"
    )) {
        @Override
        CoordinateToken decode(String raw, Matcher m) {
            double minutes = Double.parseDouble(m.group(2));
            if (minutes >= 60.0d) {
                return null;
            }
            return token(raw, m.group(1), minutes, 0.0d, m.group(3));
        }
    },

    /**
     * Signed decimal degrees with an optional hemisphere letter.
     * Example: {@code -52.52}, {@code 52.52S}.
     */
    DECIMAL_DEGREES(Pattern.compile(
            "^([+-]?\\d+(?:\\.\\d+)?)" + Syntax.TRAIL + "([NSEWnsew])?$"
    )) {
        @Override
        CoordinateToken decode(String raw, Matcher m) {
            return token(raw, m.group(1), 0.0d, 0.0d, m.group(2));
        }
    };

    /**
     * Most-specific-first priority: DMS, then DDM, then DD.
     */
    public static final List<CoordinateFormat> MOST_SPECIFIC_FIRST =
            List.of(DEGREES_MINUTES_SECONDS, DEGREES_MINUTES, DECIMAL_DEGREES);

    private final Pattern pattern;

    CoordinateFormat(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Attempts to recognize a trimmed token with this grammar.
     *
     * @return decoded token, or null when the grammar does not match the whole token
     * or a minutes/seconds component is out of {@code [0, 60)}.
     */
    public CoordinateToken tryParse(String trimmed) {
        Matcher m = pattern.matcher(trimmed);
        if (!m.matches()) {
            return null;
        }
        return decode(trimmed, m);
    }

    abstract CoordinateToken decode(String raw, Matcher m);

    /**
     * Combines components. A hemisphere letter is authoritative over the numeric sign.
     */
    final CoordinateToken token(String raw, String degreesText, double minutes, double seconds, String letter) {
        double degrees = Double.parseDouble(degreesText);
        double magnitude = Math.abs(degrees) + minutes / 60.0d + seconds / 3600.0d;

        Hemisphere hemisphere = null;
        double value;
        if (letter != null) {
            hemisphere = Hemisphere.fromLetter(letter.charAt(0));
            value = hemisphere.sign() * magnitude;
        } else {
            value = degreesText.startsWith("-") ? -magnitude : magnitude;
        }
        return new CoordinateToken(raw, this, value, hemisphere);
    }

    private static final class Syntax {
        /** Any non-digit, non-decimal-point run between numeric groups. */
        static final String SEPARATOR = "[^\\d.]+";
        /** Marks and whitespace allowed before the hemisphere letter. */
        static final String TRAIL = "[^\\dA-Za-z.+-]*";
    }
}
