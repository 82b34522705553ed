package com.weavecipher.crypto;

import java.util.Objects;

/**
 * Positional shuffle applied after substitution.
 *
 * shuffle(s) = reverse(s[0], s[2], ...) ++ reverse(s[1], s[3], ...).
 * The first part always holds ceil(n/2) codes, so the inverse needs only the length.
 */
public final class Interleave {

    private Interleave() {}

    public static byte[] shuffle(byte[] s) {
        Objects.requireNonNull(s, "sequence cannot be null");
        int n = s.length;
        int m = evenCount(n);
        byte[] out = new byte[n];
        for (int k = 0; k < m; k++) {
            out[k] = s[2 * (m - 1 - k)];
        }
        for (int k = 0; k < n - m; k++) {
            out[m + k] = s[2 * (n - m - 1 - k) + 1];
        }
        return out;
    }

    public static byte[] unshuffle(byte[] c) {
        Objects.requireNonNull(c, "sequence cannot be null");
        int n = c.length;
        int m = evenCount(n);
        byte[] s = new byte[n];
        for (int k = 0; k < m; k++) {
            s[2 * k] = c[m - 1 - k];
        }
        for (int k = 0; k < n - m; k++) {
            s[2 * k + 1] = c[n - 1 - k];
        }
        return s;
    }

    /** ceil(n / 2): number of even-indexed positions in a sequence of length n. */
    static int evenCount(int n) {
        return (n + 1) / 2;
    }
}
