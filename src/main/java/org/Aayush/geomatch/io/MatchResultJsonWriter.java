package org.Aayush.geomatch.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.Aayush.geomatch.model.GeoPoint;
import org.Aayush.geomatch.model.MatchRecord;
import org.Aayush.geomatch.model.ResultSet;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serializes match results as a JSON array.
 *
 * <p>Each element has the shape
 * {@code {"input_point":{"latitude","longitude"},"closest_point":{"latitude","longitude"},"distance_km"}}
 * with {@code distance_km} rounded half-up to two decimal places.</p>
 */
public final class MatchResultJsonWriter {
    static final int DISTANCE_SCALE = 2;

    private final ObjectMapper mapper;

    public MatchResultJsonWriter() {
        this(true);
    }

    /**
     * @param pretty whether to indent output.
     */
    public MatchResultJsonWriter(boolean pretty) {
        this.mapper = new ObjectMapper();
        this.mapper.getFactory().configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    /**
     * Writes to a character stream. The stream is flushed but not closed.
     */
    public void write(ResultSet results, Writer out) throws IOException {
        Objects.requireNonNull(out, "out");
        mapper.writeValue(out, toDocument(results));
        out.flush();
    }

    /**
     * Writes a UTF-8 file, replacing any existing content.
     */
    public void write(ResultSet results, Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(results, out);
        }
    }

    public String toJson(ResultSet results) throws IOException {
        return mapper.writeValueAsString(toDocument(results));
    }

    static double roundDistance(double distanceKm) {
        return BigDecimal.valueOf(distanceKm).setScale(DISTANCE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static List<MatchJson> toDocument(ResultSet results) {
        Objects.requireNonNull(results, "results");
        List<MatchJson> document = new ArrayList<>(results.size());
        for (MatchRecord record : results) {
            document.add(new MatchJson(
                    PointJson.of(record.query()),
                    PointJson.of(record.match()),
                    roundDistance(record.distanceKm())
            ));
        }
        return document;
    }

    @JsonPropertyOrder({"input_point", "closest_point", "distance_km"})
    record MatchJson(
            @JsonProperty("input_point") PointJson inputPoint,
            @JsonProperty("closest_point") PointJson closestPoint,
            @JsonProperty("distance_km") double distanceKm
    ) {
    }

    @JsonPropertyOrder({"latitude", "longitude"})
    record PointJson(
            @JsonProperty("latitude") double latitude,
            @JsonProperty("longitude") double longitude
    ) {
        static PointJson of(GeoPoint point) {
            return new PointJson(point.latitude(), point.longitude());
        }
    }
}
