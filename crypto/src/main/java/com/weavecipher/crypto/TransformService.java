package com.weavecipher.crypto;

import com.weavecipher.common.CharacterDomain;
import com.weavecipher.common.CipherKey;
import com.weavecipher.common.TransformDirection;

/**
 * TransformService: keyed substitution followed by the positional interleave.
 * decode(encode(x, k1, k2), k1, k2) == x for every 7-bit input.
 */
public interface TransformService {

    /**
     * Substitutes {@code plaintext} with both keys, then shuffles the result.
     * The output has the same length and every code lies in [0, 128).
     */
    byte[] encode(byte[] plaintext, CipherKey key1, CipherKey key2);

    /**
     * Unshuffles {@code ciphertext}, then reverses the substitution.
     */
    byte[] decode(byte[] ciphertext, CipherKey key1, CipherKey key2);

    /**
     * Second key used by the single-key overloads.
     */
    CipherKey getDefaultKey2();

    /**
     * Convenience: encode with the default second key.
     */
    default byte[] encode(byte[] plaintext, CipherKey key1) {
        return encode(plaintext, key1, getDefaultKey2());
    }

    /**
     * Convenience: decode with the default second key.
     */
    default byte[] decode(byte[] ciphertext, CipherKey key1) {
        return decode(ciphertext, key1, getDefaultKey2());
    }

    default byte[] transform(TransformDirection direction, byte[] data, CipherKey key1, CipherKey key2) {
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        return direction == TransformDirection.ENCODE
                ? encode(data, key1, key2)
                : decode(data, key1, key2);
    }

    default String encodeString(String text, String key1) {
        return CharacterDomain.fromCodes(encode(CharacterDomain.toCodes(text), CipherKey.of(key1)));
    }

    default String encodeString(String text, String key1, String key2) {
        return CharacterDomain.fromCodes(
                encode(CharacterDomain.toCodes(text), CipherKey.of(key1), CipherKey.of(key2)));
    }

    default String decodeString(String text, String key1) {
        return CharacterDomain.fromCodes(decode(CharacterDomain.toCodes(text), CipherKey.of(key1)));
    }

    default String decodeString(String text, String key1, String key2) {
        return CharacterDomain.fromCodes(
                decode(CharacterDomain.toCodes(text), CipherKey.of(key1), CipherKey.of(key2)));
    }
}
