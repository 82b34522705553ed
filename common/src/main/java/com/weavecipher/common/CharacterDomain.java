package com.weavecipher.common;

import java.util.Objects;

/**
 * The 7-bit character space every transform works in.
 */
public final class CharacterDomain {

    /** Size of the substitution alphabet (ASCII). */
    public static final int MODULUS = 128;

    private CharacterDomain() {}

    public static boolean isInDomain(int code) {
        return code >= 0 && code < MODULUS;
    }

    /** A byte is in the domain when its unsigned value is below 128, i.e. it is non-negative. */
    public static boolean isInDomain(byte code) {
        return code >= 0;
    }

    /**
     * Checks every code of {@code data}.
     *
     * @throws OutOfRangeCharacterException on the first code outside [0, 128)
     */
    public static void requireInDomain(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        for (int i = 0; i < data.length; i++) {
            if (data[i] < 0) {
                throw new OutOfRangeCharacterException(i, data[i] & 0xFF);
            }
        }
    }

    /**
     * Converts a string to its codes, one byte per char.
     *
     * @throws OutOfRangeCharacterException if a char is not a 7-bit code
     */
    public static byte[] toCodes(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        byte[] codes = new byte[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= MODULUS) {
                throw new OutOfRangeCharacterException(i, c);
            }
            codes[i] = (byte) c;
        }
        return codes;
    }

    /** Inverse of {@link #toCodes(String)}. */
    public static String fromCodes(byte[] codes) {
        Objects.requireNonNull(codes, "codes cannot be null");
        char[] chars = new char[codes.length];
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] < 0) {
                throw new OutOfRangeCharacterException(i, codes[i] & 0xFF);
            }
            chars[i] = (char) codes[i];
        }
        return new String(chars);
    }
}
