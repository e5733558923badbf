package org.Aayush.geomatch.parse;

import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("CoordinateParser Tests")
class CoordinateParserTest {

    private final CoordinateParser parser = CoordinateParser.defaultParser();

    // =====================================================================
    // DECIMAL DEGREES
    // =====================================================================

    @Test
    @DisplayName("Decimal degrees with and without hemisphere letters")
    void testDecimalDegrees() {
        assertEquals(52.5200d, parser.parse("52.5200N"), 1e-12);
        assertEquals(13.4050d, parser.parse("13.4050E"), 1e-12);
        assertEquals(-52.5200d, parser.parse("-52.5200"), 1e-12);
        assertEquals(-52.52d, parser.parse("52.52S"), 1e-12);
        assertEquals(-0.1278d, parser.parse("0.1278W"), 1e-12);
        assertEquals(7.0d, parser.parse("+7"), 1e-12);
        assertEquals(52.52d, parser.parse("  52.52° N  "), 1e-12);
    }

    @Test
    @DisplayName("Hemisphere letter overrides a conflicting numeric sign")
    void testHemisphereOverridesSign() {
        assertEquals(52.5d, parser.parse("-52.5N"), 1e-12);
        assertEquals(52.5d, parser.parse("52.5N"), 1e-12);
        assertEquals(-52.5d, parser.parse("+52.5S"), 1e-12);
        assertEquals(-13.0d, parser.parse("-13°0'0\"W"), 1e-12);
    }

    @Test
    @DisplayName("Lowercase hemisphere letters are accepted")
    void testLowercaseHemisphere() {
        assertEquals(-33.8688d, parser.parse("33.8688s"), 1e-12);
        assertEquals(151.2093d, parser.parse("151.2093e"), 1e-12);
    }

    // =====================================================================
    // DMS / DDM
    // =====================================================================

    @Test
    @DisplayName("Degrees-minutes-seconds with glyph separators")
    void testDegreesMinutesSeconds() {
        assertEquals(52.52d, parser.parse("52°31'12\"N"), 0.01d);
        assertEquals(13.405d, parser.parse("13°24'18\"E"), 0.01d);
        assertEquals(-52.52d, parser.parse("52°31'12\"S"), 0.01d);
        assertEquals(52.52d, parser.parse("52 31 12 N"), 1e-9);
        assertEquals(40.446195d, parser.parse("40°26′46.302″N"), 1e-6);
    }

    @Test
    @DisplayName("Degrees-minutes with fractional minutes")
    void testDegreesMinutes() {
        assertEquals(52.52d, parser.parse("52°31.2'N"), 1e-9);
        assertEquals(52.0d + 31.0d / 60.0d, parser.parse("52°31'N"), 1e-9);
        assertEquals(-(74.0d + 0.36d / 60.0d), parser.parse("74 0.36 W"), 1e-9);
    }

    @Test
    @DisplayName("Equivalent DD, DDM and DMS spellings decode to the same angle")
    void testFormatEquivalence() {
        double dd = parser.parse("52.5200N");
        assertEquals(dd, parser.parse("52°31.2'N"), 1e-3);
        assertEquals(dd, parser.parse("52°31'12\"N"), 1e-3);
        assertEquals(dd, parser.parse("52 31 12N"), 1e-3);
    }

    @Test
    @DisplayName("Most-specific-first priority reports the grammar that matched")
    void testFormatTagging() {
        assertSame(CoordinateFormat.DECIMAL_DEGREES, parser.tokenize("52.5200N").format());
        assertSame(CoordinateFormat.DEGREES_MINUTES, parser.tokenize("52°31'N").format());
        assertSame(CoordinateFormat.DEGREES_MINUTES_SECONDS, parser.tokenize("52°31'12\"N").format());

        CoordinateToken token = parser.tokenize("  -52.5200 ");
        assertEquals("-52.5200", token.raw());
        assertNull(token.hemisphere());
        assertSame(Hemisphere.NORTH, parser.tokenize("52.5200N").hemisphere());
    }

    // =====================================================================
    // FAILURES
    // =====================================================================

    @Test
    @DisplayName("Unrecognized tokens raise a format error carrying the raw text")
    void testUnrecognizedTokens() {
        for (String raw : List.of("", "   ", "abc", "52.52X", "N52.52", "52..5", "1e5", "52°31'12\"", "52°31'")) {
            CoordinateFormatException ex = assertThrows(CoordinateFormatException.class, () -> parser.parse(raw));
            assertEquals(CoordinateFormatException.REASON_UNRECOGNIZED_COORDINATE, ex.reasonCode());
            assertEquals(raw, ex.raw());
        }
        assertThrows(CoordinateFormatException.class, () -> parser.parse(null));
    }

    @Test
    @DisplayName("Minutes or seconds of sixty or more never match")
    void testComponentRange() {
        assertThrows(CoordinateFormatException.class, () -> parser.parse("52°60'N"));
        assertThrows(CoordinateFormatException.class, () -> parser.parse("52°31'60\"N"));
        assertThrows(CoordinateFormatException.class, () -> parser.parse("52°75'12\"N"));
    }

    @Test
    @DisplayName("Axis-aware parsing rejects hemisphere letters for the other axis")
    void testAxisMismatch() {
        assertEquals(52.52d, parser.parseLatitude("52.52N"), 1e-12);
        assertEquals(-13.405d, parser.parseLongitude("13.405W"), 1e-12);
        assertEquals(13.405d, parser.parseLongitude("13.405"), 1e-12);

        CoordinateFormatException ex = assertThrows(
                CoordinateFormatException.class,
                () -> parser.parseLatitude("13.405E")
        );
        assertEquals(CoordinateFormatException.REASON_HEMISPHERE_AXIS_MISMATCH, ex.reasonCode());
        assertThrows(CoordinateFormatException.class, () -> parser.parseLongitude("52.52N"));
    }

    @Test
    @DisplayName("parsePoint builds a validated GeoPoint")
    void testParsePoint() {
        GeoPoint point = parser.parsePoint("52°31'12\"N", "13°24'18\"E");
        assertEquals(52.52d, point.latitude(), 1e-9);
        assertEquals(13.405d, point.longitude(), 1e-9);

        GeoMatchException ex = assertThrows(GeoMatchException.class, () -> parser.parsePoint("95.0", "0.0"));
        assertEquals(GeoMatchException.REASON_LATITUDE_RANGE, ex.reasonCode());
    }

    // =====================================================================
    // PRIORITY CONFIGURATION
    // =====================================================================

    @Test
    @DisplayName("Custom priority restricts the accepted grammars")
    void testCustomPriority() {
        CoordinateParser decimalOnly = new CoordinateParser(List.of(CoordinateFormat.DECIMAL_DEGREES));
        assertEquals(52.52d, decimalOnly.parse("52.52N"), 1e-12);
        assertThrows(CoordinateFormatException.class, () -> decimalOnly.parse("52°31'12\"N"));

        CoordinateParser leastSpecificFirst = new CoordinateParser(List.of(
                CoordinateFormat.DECIMAL_DEGREES,
                CoordinateFormat.DEGREES_MINUTES,
                CoordinateFormat.DEGREES_MINUTES_SECONDS
        ));
        assertEquals(parser.parse("52°31'12\"N"), leastSpecificFirst.parse("52°31'12\"N"), 1e-12);
    }

    @Test
    @DisplayName("Priority list must be non-empty and duplicate-free")
    void testPriorityValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CoordinateParser(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new CoordinateParser(List.of(
                CoordinateFormat.DECIMAL_DEGREES,
                CoordinateFormat.DECIMAL_DEGREES
        )));
        assertEquals(CoordinateFormat.MOST_SPECIFIC_FIRST, parser.priority());
    }
}
