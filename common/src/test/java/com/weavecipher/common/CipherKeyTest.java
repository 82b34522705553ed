package com.weavecipher.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CipherKey Unit Tests")
class CipherKeyTest {

    @Test
    void of_string_keepsCodesInOrder() {
        CipherKey key = CipherKey.of("sayaka");
        assertEquals(6, key.length());
        assertEquals('s', key.codeAt(0));
        assertEquals('k', key.codeAt(4));
        assertArrayEquals(new byte[]{'s', 'a', 'y', 'a', 'k', 'a'}, key.toBytes());
    }

    @Test
    void emptyKeyRejected() {
        assertThrows(InvalidCipherKeyException.class, () -> CipherKey.of(""));
        assertThrows(InvalidCipherKeyException.class, () -> CipherKey.of(new byte[0]));
    }

    @Test
    void nonAsciiKeyRejected() {
        InvalidCipherKeyException ex =
                assertThrows(InvalidCipherKeyException.class, () -> CipherKey.of("abé"));
        assertTrue(ex.getMessage().contains("index 2"));
        assertThrows(InvalidCipherKeyException.class, () -> CipherKey.of(new byte[]{1, (byte) 0x80}));
    }

    @Test
    void nullKeyThrows() {
        assertThrows(NullPointerException.class, () -> CipherKey.of((String) null));
        assertThrows(NullPointerException.class, () -> CipherKey.of((byte[]) null));
    }

    @Test
    void controlCodesAreValidKeyMaterial() {
        CipherKey key = CipherKey.of(new byte[]{0, 127});
        assertEquals(0, key.codeAt(0));
        assertEquals(127, key.codeAt(1));
    }

    @Test
    void byteFactoryCopiesInput() {
        byte[] raw = {'a', 'b'};
        CipherKey key = CipherKey.of(raw);
        raw[0] = 'z';
        assertEquals('a', key.codeAt(0));

        byte[] out = key.toBytes();
        out[1] = 'z';
        assertEquals('b', key.codeAt(1));
    }

    @Test
    void defaultSecondKeyMatchesConstant() {
        assertEquals(CipherKey.of(CipherKey.DEFAULT_SECOND_KEY), CipherKey.defaultSecondKey());
        assertEquals(43, CipherKey.defaultSecondKey().length());
    }

    @Test
    void toStringHidesKeyMaterial() {
        String s = CipherKey.of("hunter2").toString();
        assertFalse(s.contains("hunter2"));
        assertTrue(s.contains("length=7"));
    }

    @Test
    void equalityIsByContent() {
        assertEquals(CipherKey.of("abc"), CipherKey.of(new byte[]{'a', 'b', 'c'}));
        assertEquals(CipherKey.of("abc").hashCode(), CipherKey.of("abc").hashCode());
        assertNotEquals(CipherKey.of("abc"), CipherKey.of("abd"));
    }
}
