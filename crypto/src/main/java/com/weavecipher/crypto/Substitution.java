package com.weavecipher.crypto;

import com.weavecipher.common.CharacterDomain;
import com.weavecipher.common.CipherKey;
import com.weavecipher.common.TransformDirection;

import java.util.Objects;

import static com.weavecipher.common.CharacterDomain.MODULUS;

/**
 * Two-stage modular (Vigenere-style) substitution over the 7-bit alphabet.
 */
public final class Substitution {

    private Substitution() {}

    /** ((c + k1) mod 128 + k2) mod 128. All arguments must be in [0, 128). */
    public static int encryptChar(int c, int k1, int k2) {
        return ((c + k1) % MODULUS + k2) % MODULUS;
    }

    /** Inverse of {@link #encryptChar}: removes k2, then k1, correcting negatives by +128. */
    public static int decryptChar(int c, int k1, int k2) {
        int x = c - k2;
        if (x < 0) x += MODULUS;
        int y = x - k1;
        if (y < 0) y += MODULUS;
        return y;
    }

    /**
     * Applies {@link #encryptChar} left to right with a fresh {@link KeySchedule}.
     *
     * @throws com.weavecipher.common.OutOfRangeCharacterException if any code is outside [0, 128)
     */
    public static byte[] substitute(byte[] data, CipherKey key1, CipherKey key2) {
        return apply(TransformDirection.ENCODE, data, key1, key2);
    }

    /** Applies {@link #decryptChar} left to right with a fresh {@link KeySchedule}. */
    public static byte[] unsubstitute(byte[] data, CipherKey key1, CipherKey key2) {
        return apply(TransformDirection.DECODE, data, key1, key2);
    }

    static byte[] apply(TransformDirection direction, byte[] data, CipherKey key1, CipherKey key2) {
        Objects.requireNonNull(data, "data cannot be null");
        KeySchedule schedule = new KeySchedule(key1, key2);
        CharacterDomain.requireInDomain(data);

        byte[] out = new byte[data.length];
        for (int k = 0; k < data.length; k++) {
            out[k] = (byte) schedule.next(direction, data[k]);
        }
        return out;
    }
}
