package com.weavecipher.common;

import java.util.Arrays;
import java.util.Objects;

/**
 * CipherKey: an immutable, non-empty sequence of 7-bit character codes.
 *
 * Keys are consumed cyclically by the substitution stage, so a key of
 * length zero can never be constructed.
 */
public final class CipherKey {

    /** Public constant used whenever a caller omits the second key. It is not a secret. */
    public static final String DEFAULT_SECOND_KEY = "]09agvn cv8eA ino;av 478uyTR`~=( ADJ OD *^t";

    private static final CipherKey DEFAULT_SECOND = of(DEFAULT_SECOND_KEY);

    private final byte[] codes;

    private CipherKey(byte[] codes) {
        this.codes = codes;
    }

    /**
     * Builds a key from a string; every char must be a code in [0, 128).
     *
     * @throws InvalidCipherKeyException if the key is empty or contains a non 7-bit char
     */
    public static CipherKey of(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (key.isEmpty()) {
            throw new InvalidCipherKeyException("Key must contain at least one character");
        }
        byte[] codes = new byte[key.length()];
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!CharacterDomain.isInDomain(c)) {
                throw new InvalidCipherKeyException(
                        "Key character at index " + i + " is outside the 7-bit range (code " + (int) c + ")");
            }
            codes[i] = (byte) c;
        }
        return new CipherKey(codes);
    }

    /**
     * Builds a key from raw codes. The array is copied.
     *
     * @throws InvalidCipherKeyException if the array is empty or holds a code outside [0, 128)
     */
    public static CipherKey of(byte[] codes) {
        Objects.requireNonNull(codes, "codes cannot be null");
        if (codes.length == 0) {
            throw new InvalidCipherKeyException("Key must contain at least one character");
        }
        for (int i = 0; i < codes.length; i++) {
            if (!CharacterDomain.isInDomain(codes[i])) {
                throw new InvalidCipherKeyException(
                        "Key code at index " + i + " is outside the 7-bit range (code " + (codes[i] & 0xFF) + ")");
            }
        }
        return new CipherKey(codes.clone());
    }

    public static CipherKey defaultSecondKey() {
        return DEFAULT_SECOND;
    }

    public int length() {
        return codes.length;
    }

    /** Code at {@code index}; callers wrap the index themselves. */
    public int codeAt(int index) {
        return codes[index];
    }

    public byte[] toBytes() {
        return codes.clone();
    }

    @Override
    public String toString() {
        // never print key material
        return String.format("CipherKey{length=%d}", codes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CipherKey that)) return false;
        return Arrays.equals(codes, that.codes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(codes);
    }
}
