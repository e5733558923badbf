package org.Aayush.geomatch.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TextSource} over a character stream or a fixed list of lines.
 */
public final class LineTextSource implements TextSource {
    private final BufferedReader reader;
    private final Iterator<String> lines;

    private LineTextSource(BufferedReader reader, Iterator<String> lines) {
        this.reader = reader;
        this.lines = lines;
    }

    /**
     * Wraps a reader. The caller keeps ownership and closes it.
     */
    public static LineTextSource of(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        return new LineTextSource(buffered, null);
    }

    public static LineTextSource of(List<String> lines) {
        return new LineTextSource(null, List.copyOf(lines).iterator());
    }

    @Override
    public Optional<String> next() {
        if (lines != null) {
            return lines.hasNext() ? Optional.of(lines.next()) : Optional.empty();
        }
        try {
            return Optional.ofNullable(reader.readLine());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read next line", e);
        }
    }
}
