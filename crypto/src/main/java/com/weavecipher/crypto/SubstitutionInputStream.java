package com.weavecipher.crypto;

import com.weavecipher.common.CipherKey;
import com.weavecipher.common.OutOfRangeCharacterException;
import com.weavecipher.common.TransformDirection;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Substitutes every byte read through it, one character at a time.
 */
public class SubstitutionInputStream extends FilterInputStream {
    private final TransformDirection direction;
    private final KeySchedule schedule;
    private long position;

    public SubstitutionInputStream(InputStream in, TransformDirection direction, CipherKey key1, CipherKey key2) {
        super(Objects.requireNonNull(in, "in cannot be null"));
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
        this.schedule = new KeySchedule(key1, key2);
    }

    /** Reads a single byte.
     * @return the transformed byte, or -1 at end of stream.
     * @throws IOException when there's a problem with the read
     */
    @Override
    public int read() throws IOException {
        final int x = in.read();
        if (x == -1) {
            return x;
        }
        if (x >= 128) {
            throw new OutOfRangeCharacterException(position, x);
        }
        position++;
        return schedule.next(direction, x);
    }

    /** Reads a series of bytes, transforming them in place.
     * @return the number of bytes read, or -1 at end of stream.
     */
    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int amt = in.read(b, off, len);
        for (int k = 0; k < amt; k++) {
            byte code = b[off + k];
            if (code < 0) {
                throw new OutOfRangeCharacterException(position, code & 0xFF);
            }
            b[off + k] = (byte) schedule.next(direction, code);
            position++;
        }
        return amt;
    }

    /** Skips input bytes, keeping the key schedule in step.
     * @return the actual number skipped (may be less than n)
     */
    @Override
    public long skip(long n) throws IOException {
        long ans = in.skip(n);
        if (ans > 0) {
            schedule.skip(ans);
            position += ans;
        }
        return ans;
    }

    /** Throws an exception since we don't support mark/reset. */
    @Override
    public synchronized void reset() throws IOException {
        throw new IOException("mark/reset not supported on SubstitutionInputStream");
    }

    /** Returns false since we don't support mark/reset. */
    @Override
    public boolean markSupported() {
        return false;
    }

    /** Number of bytes read and transformed so far. */
    public long getPosition() {
        return position;
    }
}
