package org.Aayush.geomatch.io;

import java.util.Optional;

/**
 * Pull-based source of raw text lines.
 */
@FunctionalInterface
public interface TextSource {
    /**
     * Returns the next line, or empty at end of input.
     *
     * @throws java.io.UncheckedIOException when the underlying source fails.
     */
    Optional<String> next();
}
