package org.Aayush.geomatch.io;

import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.GeoPoint;
import org.Aayush.geomatch.parse.CoordinateFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DelimitedPointReader Tests")
class DelimitedPointReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Header names are detected and mixed formats parse")
    void testHeaderDetection() throws IOException {
        String csv = """
                name,lon,lat
                Berlin,13.4050E,52.5200N
                Paris,"2°21'8""E","48°51'24""N"
                """;

        DelimitedReadResult result = new DelimitedPointReader().read(new StringReader(csv));

        assertEquals(2, result.points().size());
        assertEquals(GeoPoint.of(52.52d, 13.405d), result.points().get(0));
        assertEquals(48.8567d, result.points().get(1).latitude(), 1e-4);
        assertEquals(2.3522d, result.points().get(1).longitude(), 1e-4);
        assertTrue(result.rejectedLines().isEmpty());
    }

    @Test
    @DisplayName("Malformed rows are skipped and reported by line number")
    void testMalformedRowsSkipped() throws IOException {
        String csv = """
                latitude,longitude
                52.52,13.405

                garbage,13.405
                51.5074
                95.0,0.0
                -33.8688,151.2093
                """;

        DelimitedReadResult result = new DelimitedPointReader().read(new StringReader(csv));

        assertEquals(2, result.points().size());
        assertEquals(List.of(4, 5, 6), result.rejectedLines());
        assertEquals(3, result.failures().size());
        assertInstanceOf(CoordinateFormatException.class, result.failures().get(0));
        assertEquals(GeoMatchException.REASON_LATITUDE_RANGE, result.failures().get(2).reasonCode());
        assertEquals(GeoPoint.of(-33.8688d, 151.2093d), result.points().get(1));
    }

    @Test
    @DisplayName("Headerless input uses configured column indices and delimiter")
    void testHeaderlessIndices() throws IOException {
        DelimitedReaderConfig config = DelimitedReaderConfig.builder()
                .header(false)
                .delimiter(';')
                .latitudeIndex(2)
                .longitudeIndex(1)
                .build();
        String text = "a;13.405;52.52\nb;2.3522;48.8566\n";

        DelimitedReadResult result = new DelimitedPointReader(config).read(new StringReader(text));

        assertEquals(2, result.points().size());
        assertEquals(GeoPoint.of(48.8566d, 2.3522d), result.points().get(1));
    }

    @Test
    @DisplayName("Headerless input with default config keeps its first data row")
    void testHeaderlessDefaultConfigKeepsFirstRow() throws IOException {
        DelimitedReadResult result = new DelimitedPointReader()
                .read(new StringReader("52.52,13.405\n51.5074,-0.1278\n"));

        assertEquals(2, result.points().size());
        assertEquals(GeoPoint.of(52.52d, 13.405d), result.points().get(0));
        assertTrue(result.rejectedLines().isEmpty());
    }

    @Test
    @DisplayName("Out-of-range first row is reported instead of being taken as a header")
    void testHeaderlessOutOfRangeFirstRowRejected() throws IOException {
        DelimitedReadResult result = new DelimitedPointReader()
                .read(new StringReader("95.0,13.405\n48°51'24\"N,2°21'8\"E\n"));

        assertEquals(1, result.points().size());
        assertEquals(List.of(1), result.rejectedLines());
        assertEquals(GeoMatchException.REASON_LATITUDE_RANGE, result.failures().get(0).reasonCode());
    }

    @Test
    @DisplayName("Explicit column names must exist in the header")
    void testExplicitColumnMissing() {
        DelimitedReaderConfig config = DelimitedReaderConfig.builder()
                .latitudeColumn("y")
                .longitudeColumn("x")
                .build();
        DelimitedPointReader reader = new DelimitedPointReader(config);

        GeoMatchException ex = assertThrows(GeoMatchException.class,
                () -> reader.read(new StringReader("lat,lon\n1,2\n")));
        assertEquals(DelimitedPointReader.REASON_COLUMN_NOT_FOUND, ex.reasonCode());
    }

    @Test
    @DisplayName("Explicit column names are matched case-insensitively")
    void testExplicitColumnNames() throws IOException {
        DelimitedReaderConfig config = DelimitedReaderConfig.builder()
                .latitudeColumn("Y")
                .longitudeColumn("X")
                .build();

        DelimitedReadResult result = new DelimitedPointReader(config).read(new StringReader("id,x,y\n1,10.0,20.0\n"));
        assertEquals(GeoPoint.of(20.0d, 10.0d), result.points().get(0));
    }

    @Test
    @DisplayName("Unrecognized header falls back to column indices")
    void testUnknownHeaderFallsBack() throws IOException {
        DelimitedReadResult result = new DelimitedPointReader().read(new StringReader("a,b\n1.5,2.5\n"));
        assertEquals(GeoPoint.of(1.5d, 2.5d), result.points().get(0));
    }

    @Test
    @DisplayName("UTF-8 file with byte order mark is read")
    void testFileWithByteOrderMark() throws IOException {
        Path file = tempDir.resolve("points.csv");
        Files.writeString(file, "\uFEFFlat,lng\n52°31'12\"N,13°24'18\"E\n", StandardCharsets.UTF_8);

        DelimitedReadResult result = new DelimitedPointReader().read(file);

        assertEquals(1, result.points().size());
        assertEquals(52.52d, result.points().get(0).latitude(), 1e-9);
    }

    @Test
    @DisplayName("Empty input yields an empty point set")
    void testEmptyInput() throws IOException {
        assertTrue(new DelimitedPointReader().read(new StringReader("")).points().isEmpty());
        assertTrue(new DelimitedPointReader().read(new StringReader("lat,lon\n")).points().isEmpty());
    }

    @Test
    @DisplayName("Field splitting honors quotes and escaped quotes")
    void testSplitFields() {
        assertEquals(List.of("a", "b", ""), DelimitedPointReader.splitFields("a, b ,", ','));
        assertEquals(List.of("x,y", "say \"hi\""), DelimitedPointReader.splitFields("\"x,y\",\"say \"\"hi\"\"\"", ','));
        assertEquals(List.of("1", "2"), DelimitedPointReader.splitFields("1\t2", '\t'));
    }

    @Test
    @DisplayName("Negative column indices are rejected")
    void testNegativeIndices() {
        DelimitedReaderConfig config = DelimitedReaderConfig.builder().latitudeIndex(-1).build();
        assertThrows(IllegalArgumentException.class, () -> new DelimitedPointReader(config));
    }
}
