package com.weavecipher.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Interleave Unit Tests")
class InterleaveTest {

    @Test
    void oddLengthShuffle() {
        byte[] s = {10, 20, 30, 40, 50};
        assertArrayEquals(new byte[]{50, 30, 10, 40, 20}, Interleave.shuffle(s));
        assertArrayEquals(s, Interleave.unshuffle(new byte[]{50, 30, 10, 40, 20}));
    }

    @Test
    void evenLengthShuffle() {
        byte[] s = {1, 2, 3, 4, 5, 6};
        // evens 1,3,5 reversed; odds 2,4,6 reversed
        assertArrayEquals(new byte[]{5, 3, 1, 6, 4, 2}, Interleave.shuffle(s));
    }

    @Test
    void trivialLengths() {
        assertArrayEquals(new byte[0], Interleave.shuffle(new byte[0]));
        assertArrayEquals(new byte[0], Interleave.unshuffle(new byte[0]));
        assertArrayEquals(new byte[]{7}, Interleave.shuffle(new byte[]{7}));
        assertArrayEquals(new byte[]{7, 8}, Interleave.shuffle(new byte[]{7, 8}));
        assertArrayEquals(new byte[]{9, 7, 8}, Interleave.shuffle(new byte[]{7, 8, 9}));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 16, 17, 255, 256})
    void unshuffleInvertsShuffle(int n) {
        byte[] s = new byte[n];
        for (int k = 0; k < n; k++) {
            s[k] = (byte) (k % 128);
        }
        byte[] shuffled = Interleave.shuffle(s);
        assertEquals(n, shuffled.length);
        assertArrayEquals(s, Interleave.unshuffle(shuffled));
    }

    @Test
    void inputIsNotMutated() {
        byte[] s = {1, 2, 3};
        Interleave.shuffle(s);
        Interleave.unshuffle(s);
        assertArrayEquals(new byte[]{1, 2, 3}, s);
    }

    @Test
    void evenCountIsCeilOfHalf() {
        assertEquals(0, Interleave.evenCount(0));
        assertEquals(1, Interleave.evenCount(1));
        assertEquals(1, Interleave.evenCount(2));
        assertEquals(3, Interleave.evenCount(5));
    }
}
