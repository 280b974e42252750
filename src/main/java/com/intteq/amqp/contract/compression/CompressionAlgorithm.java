package com.intteq.amqp.contract.compression;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Body compression algorithms, identified on the wire by the AMQP
 * {@code content-encoding} property.
 */
public enum CompressionAlgorithm {

    GZIP("gzip"),
    DEFLATE("deflate");

    private final String encoding;

    CompressionAlgorithm(String encoding) {
        this.encoding = encoding;
    }

    public String encoding() {
        return encoding;
    }

    /**
     * Case-insensitive lookup by content-encoding value.
     */
    public static Optional<CompressionAlgorithm> fromEncoding(String contentEncoding) {
        if (contentEncoding == null) {
            return Optional.empty();
        }
        String normalized = contentEncoding.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(a -> a.encoding.equals(normalized))
                .findFirst();
    }

    static String supportedEncodings() {
        return Arrays.stream(values())
                .map(CompressionAlgorithm::encoding)
                .collect(Collectors.joining(", "));
    }
}
