package com.intteq.amqp.contract.compression;

import com.intteq.amqp.contract.exception.TechnicalException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Compresses outgoing bodies and decompresses incoming ones.
 *
 * <p>{@code deflate} uses the zlib container (RFC 1950), {@code gzip} the gzip
 * container (RFC 1952). Both are byte-exact on round trip.</p>
 */
public final class MessageCodec {

    private MessageCodec() {
    }

    public static byte[] compress(byte[] body, CompressionAlgorithm algorithm) {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");

        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, body.length / 2));
        try (OutputStream stream = switch (algorithm) {
            case GZIP -> new GZIPOutputStream(out);
            case DEFLATE -> new DeflaterOutputStream(out);
        }) {
            stream.write(body);
        } catch (IOException e) {
            throw new TechnicalException("Failed to compress message body with " + algorithm.encoding(), e);
        }
        return out.toByteArray();
    }

    /**
     * Reverses {@link #compress}. A {@code null} or blank encoding returns the body unchanged.
     *
     * @throws TechnicalException for an unsupported encoding or corrupt data
     */
    public static byte[] decompress(byte[] body, String contentEncoding) {
        Objects.requireNonNull(body, "body must not be null");

        if (contentEncoding == null || contentEncoding.isBlank()) {
            return body;
        }

        CompressionAlgorithm algorithm = CompressionAlgorithm.fromEncoding(contentEncoding)
                .orElseThrow(() -> new TechnicalException(
                        "Unsupported content-encoding: \"" + contentEncoding + "\". "
                                + "Supported encodings are: " + CompressionAlgorithm.supportedEncodings() + "."));

        try (InputStream stream = switch (algorithm) {
            case GZIP -> new GZIPInputStream(new ByteArrayInputStream(body));
            case DEFLATE -> new InflaterInputStream(new ByteArrayInputStream(body));
        }) {
            return stream.readAllBytes();
        } catch (IOException e) {
            throw new TechnicalException("Failed to decompress message body with " + algorithm.encoding(), e);
        }
    }
}
