package com.weavecipher.crypto;

import com.weavecipher.common.CipherKey;
import com.weavecipher.common.StreamTransformException;
import com.weavecipher.common.TransformDirection;
import com.weavecipher.config.CipherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Byte-stream adapters around the transform.
 *
 * - *Stream methods: per-character substitution, written as it is read, no interleave.
 * - *Buffered methods: read the whole input, then apply the full interleaved transform.
 *
 * Streams are never closed here; the caller owns them.
 */
public class StreamTransformer {
    private static final Logger logger = LoggerFactory.getLogger(StreamTransformer.class);

    private final TransformService transformService;
    private final int bufferSize;

    public StreamTransformer(TransformService transformService, int bufferSize) {
        this.transformService = Objects.requireNonNull(transformService, "transformService cannot be null");
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    public static StreamTransformer fromConfig(TransformService transformService, CipherConfig cfg) {
        Objects.requireNonNull(cfg, "cfg cannot be null");
        return new StreamTransformer(transformService, cfg.getStreamBufferSize());
    }

    /* ======================== Per-character (no interleave) ======================== */

    public long encodeStream(InputStream in, OutputStream out, CipherKey key1, CipherKey key2) throws IOException {
        return substituteStream(TransformDirection.ENCODE, in, out, key1, key2);
    }

    public long encodeStream(InputStream in, OutputStream out, CipherKey key1) throws IOException {
        return encodeStream(in, out, key1, transformService.getDefaultKey2());
    }

    public long decodeStream(InputStream in, OutputStream out, CipherKey key1, CipherKey key2) throws IOException {
        return substituteStream(TransformDirection.DECODE, in, out, key1, key2);
    }

    public long decodeStream(InputStream in, OutputStream out, CipherKey key1) throws IOException {
        return decodeStream(in, out, key1, transformService.getDefaultKey2());
    }

    /**
     * Copies {@code in} to {@code out}, substituting each byte with the rotating key schedule.
     *
     * @return the number of bytes transformed
     * @throws StreamTransformException if a read or write fails; output written so far stays in place
     * @throws com.weavecipher.common.OutOfRangeCharacterException on a byte outside [0, 128)
     */
    public long substituteStream(TransformDirection direction, InputStream in, OutputStream out,
                                 CipherKey key1, CipherKey key2) throws IOException {
        Objects.requireNonNull(in, "in cannot be null");
        Objects.requireNonNull(out, "out cannot be null");
        SubstitutionOutputStream sink = new SubstitutionOutputStream(out, direction, key1, key2);

        final byte[] buffer = new byte[bufferSize];
        int count = read(in, buffer, sink.getBytesWritten());
        while (count >= 0) {
            try {
                sink.write(buffer, 0, count);
            } catch (IOException e) {
                logger.error("Write failed after {} bytes during {}", sink.getBytesWritten(), direction.tag(), e);
                throw new StreamTransformException("Write failed after " + sink.getBytesWritten() + " bytes",
                        sink.getBytesWritten(), e);
            }
            count = read(in, buffer, sink.getBytesWritten());
        }
        flush(out, sink.getBytesWritten());

        logger.debug("Streamed {} bytes ({})", sink.getBytesWritten(), direction.tag());
        return sink.getBytesWritten();
    }

    /* ======================== Whole-buffer (interleaved) ======================== */

    public long encodeBuffered(InputStream in, OutputStream out, CipherKey key1, CipherKey key2) throws IOException {
        return transformBuffered(TransformDirection.ENCODE, in, out, key1, key2);
    }

    public long encodeBuffered(InputStream in, OutputStream out, CipherKey key1) throws IOException {
        return encodeBuffered(in, out, key1, transformService.getDefaultKey2());
    }

    public long decodeBuffered(InputStream in, OutputStream out, CipherKey key1, CipherKey key2) throws IOException {
        return transformBuffered(TransformDirection.DECODE, in, out, key1, key2);
    }

    public long decodeBuffered(InputStream in, OutputStream out, CipherKey key1) throws IOException {
        return decodeBuffered(in, out, key1, transformService.getDefaultKey2());
    }

    /**
     * Reads all of {@code in}, transforms it as one sequence and writes the result.
     * Nothing is written unless the whole input was read and transformed.
     */
    public long transformBuffered(TransformDirection direction, InputStream in, OutputStream out,
                                  CipherKey key1, CipherKey key2) throws IOException {
        Objects.requireNonNull(in, "in cannot be null");
        Objects.requireNonNull(out, "out cannot be null");

        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        final byte[] buffer = new byte[bufferSize];
        int count = read(in, buffer, 0);
        while (count >= 0) {
            collected.write(buffer, 0, count);
            count = read(in, buffer, 0);
        }

        byte[] result = transformService.transform(direction, collected.toByteArray(), key1, key2);
        int written = 0;
        try {
            while (written < result.length) {
                int n = Math.min(bufferSize, result.length - written);
                out.write(result, written, n);
                written += n;
            }
        } catch (IOException e) {
            logger.error("Write failed after {} of {} buffered bytes during {}",
                    written, result.length, direction.tag(), e);
            throw new StreamTransformException("Write failed after " + written + " bytes", written, e);
        }
        flush(out, result.length);

        logger.debug("Buffered {} bytes ({})", result.length, direction.tag());
        return result.length;
    }

    /* ======================== Helpers ======================== */

    private static int read(InputStream in, byte[] buffer, long transformedSoFar) throws StreamTransformException {
        try {
            return in.read(buffer, 0, buffer.length);
        } catch (IOException e) {
            logger.error("Read failed after {} bytes", transformedSoFar, e);
            throw new StreamTransformException("Read failed after " + transformedSoFar + " bytes", transformedSoFar, e);
        }
    }

    private static void flush(OutputStream out, long transformed) throws StreamTransformException {
        try {
            out.flush();
        } catch (IOException e) {
            logger.error("Flush failed after {} bytes", transformed, e);
            throw new StreamTransformException("Flush failed after " + transformed + " bytes", transformed, e);
        }
    }
}
