package com.weavecipher.crypto;

import com.weavecipher.common.CipherKey;
import com.weavecipher.common.OutOfRangeCharacterException;
import com.weavecipher.common.TransformDirection;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Substitutes every byte written through it, one character at a time.
 * No interleave is applied: the full length is not known while streaming.
 */
public class SubstitutionOutputStream extends FilterOutputStream {
    private final TransformDirection direction;
    private final KeySchedule schedule;
    private long written;

    /**
     * @param out the next OutputStream in the chain.
     * @param direction whether written bytes are encoded or decoded.
     * @param key1 first key.
     * @param key2 second key.
     */
    public SubstitutionOutputStream(OutputStream out, TransformDirection direction, CipherKey key1, CipherKey key2) {
        super(Objects.requireNonNull(out, "out cannot be null"));
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
        this.schedule = new KeySchedule(key1, key2);
    }

    /** Writes a single transformed byte.
     * @param b the byte to write; its unsigned value must be below 128.
     * @throws IOException if the underlying write fails.
     */
    @Override
    public void write(int b) throws IOException {
        int code = b & 0xFF;
        if (code >= 128) {
            throw new OutOfRangeCharacterException(written, code);
        }
        out.write(schedule.next(direction, code));
        written++;
    }

    /** Writes a buffer of transformed bytes. The caller's array is not modified.
     * If a byte is out of range, the bytes before it are written first.
     */
    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        byte[] chunk = new byte[len];
        int valid = 0;
        while (valid < len && b[off + valid] >= 0) {
            chunk[valid] = (byte) schedule.next(direction, b[off + valid]);
            valid++;
        }
        out.write(chunk, 0, valid);
        long before = written;
        written += valid;
        if (valid < len) {
            throw new OutOfRangeCharacterException(before + valid, b[off + valid] & 0xFF);
        }
    }

    /** Number of transformed bytes handed to the underlying stream so far. */
    public long getBytesWritten() {
        return written;
    }
}
