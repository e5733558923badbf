package org.Aayush.geomatch.io;

import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.PointSet;
import org.Aayush.geomatch.parse.CoordinateFormatException;
import org.Aayush.geomatch.parse.CoordinateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Collects points entered one per line from a {@link TextSource}.
 *
 * <p>Each line holds a latitude and a longitude separated by a comma, semicolon, tab, or
 * (when neither token contains whitespace) a single space run. Collection stops at end of
 * input, a blank line, or {@code done}. A malformed line is reported and the user retries on
 * the next line.</p>
 */
public final class InteractivePointCollector {
    private static final Logger logger = LoggerFactory.getLogger(InteractivePointCollector.class);

    static final String TERMINATOR = "done";

    private final TextSource source;
    private final CoordinateParser parser;
    private final Consumer<String> messages;

    /**
     * @param source line source.
     * @param parser coordinate parser.
     * @param messages receives prompts and error feedback for the user.
     */
    public InteractivePointCollector(TextSource source, CoordinateParser parser, Consumer<String> messages) {
        this.source = Objects.requireNonNull(source, "source");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    /**
     * Collects points until a terminator or end of input.
     *
     * @param label name of the set shown in prompts, e.g. {@code "A"}.
     */
    public PointSet collect(String label) {
        PointSet.Builder points = PointSet.builder();
        messages.accept("Enter points for set " + label + " as 'latitude, longitude' (blank line or 'done' to finish):");

        while (true) {
            messages.accept("[" + label + " #" + (points.size() + 1) + "] ");
            Optional<String> next = source.next();
            if (next.isEmpty()) {
                break;
            }
            String line = next.get().trim();
            if (line.isEmpty() || line.toLowerCase(Locale.ROOT).equals(TERMINATOR)) {
                break;
            }

            try {
                String[] tokens = splitPair(line);
                points.add(parser.parsePoint(tokens[0], tokens[1]));
            } catch (GeoMatchException e) {
                logger.debug("Rejected interactive entry '{}': {}", line, e.getMessage());
                messages.accept("Invalid point '" + line + "': " + e.getMessage() + ". Please try again.");
            }
        }
        return points.build();
    }

    /**
     * Splits one line into latitude and longitude tokens.
     *
     * @throws CoordinateFormatException when the line does not hold exactly two tokens.
     */
    static String[] splitPair(String line) {
        for (char delimiter : new char[]{',', ';', '\t'}) {
            int at = line.indexOf(delimiter);
            if (at >= 0) {
                if (line.indexOf(delimiter, at + 1) >= 0) {
                    break;
                }
                return new String[]{line.substring(0, at).trim(), line.substring(at + 1).trim()};
            }
        }
        String[] parts = line.trim().split("\\s+");
        if (parts.length == 2) {
            return parts;
        }
        throw new CoordinateFormatException(
                CoordinateFormatException.REASON_UNRECOGNIZED_COORDINATE,
                line,
                "expected a latitude and a longitude, got '" + line + "'"
        );
    }
}
