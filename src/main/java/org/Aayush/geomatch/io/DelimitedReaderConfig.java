package org.Aayush.geomatch.io;

import lombok.Builder;
import lombok.Value;

/**
 * Layout of a delimited point file.
 *
 * <p>Column resolution order: explicit header names, then well-known header names
 * ({@code lat}/{@code latitude}, {@code lon}/{@code lng}/{@code long}/{@code longitude}),
 * then the configured column indices.</p>
 */
@Value
@Builder
public class DelimitedReaderConfig {
    /** Field delimiter. */
    @Builder.Default
    char delimiter = ',';

    /**
     * Whether the first non-blank line may be a header row. When it names no coordinate
     * columns but holds coordinates at the index columns, it is read as data.
     */
    @Builder.Default
    boolean header = true;

    /** Header name of the latitude column, matched case-insensitively. Null to auto-detect. */
    String latitudeColumn;

    /** Header name of the longitude column, matched case-insensitively. Null to auto-detect. */
    String longitudeColumn;

    /** Zero-based latitude column used when no header name resolves. */
    @Builder.Default
    int latitudeIndex = 0;

    /** Zero-based longitude column used when no header name resolves. */
    @Builder.Default
    int longitudeIndex = 1;

    public static DelimitedReaderConfig defaults() {
        return builder().build();
    }
}
