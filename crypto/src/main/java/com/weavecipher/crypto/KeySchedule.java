package com.weavecipher.crypto;

import com.weavecipher.common.CipherKey;
import com.weavecipher.common.TransformDirection;

import java.util.Objects;

/**
 * Per-call cipher state: two independently rotating key indices.
 *
 * A fresh schedule starts both indices at 0. Every processed character advances
 * index i modulo len(key1) and index j modulo len(key2). Instances are not thread-safe
 * and must never be shared between calls.
 */
public final class KeySchedule {
    private final CipherKey key1;
    private final CipherKey key2;
    private int i;
    private int j;

    public KeySchedule(CipherKey key1, CipherKey key2) {
        this.key1 = Objects.requireNonNull(key1, "key1 cannot be null");
        this.key2 = Objects.requireNonNull(key2, "key2 cannot be null");
    }

    /** Substitutes one in-domain code and advances both indices. */
    public int encodeNext(int c) {
        int out = Substitution.encryptChar(c, key1.codeAt(i), key2.codeAt(j));
        advance();
        return out;
    }

    /** Reverses one substitution and advances both indices. */
    public int decodeNext(int c) {
        int out = Substitution.decryptChar(c, key1.codeAt(i), key2.codeAt(j));
        advance();
        return out;
    }

    public int next(TransformDirection direction, int c) {
        return direction == TransformDirection.ENCODE ? encodeNext(c) : decodeNext(c);
    }

    /** Advances both indices by {@code n} positions without transforming anything. */
    public void skip(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot skip a negative count: " + n);
        }
        i = (int) ((i + n % key1.length()) % key1.length());
        j = (int) ((j + n % key2.length()) % key2.length());
    }

    int key1Index() {
        return i;
    }

    int key2Index() {
        return j;
    }

    private void advance() {
        i = (i + 1) % key1.length();
        j = (j + 1) % key2.length();
    }
}
