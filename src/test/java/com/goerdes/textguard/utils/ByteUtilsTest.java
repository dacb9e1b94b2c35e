package com.goerdes.textguard.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ByteUtilsTest {

    @Test
    void testIntsArePackedLittleEndian() {
        byte[] packed = ByteUtils.packIntsToBytes(new int[]{1, Integer.MAX_VALUE});

        assertEquals(8, packed.length);
        assertArrayEquals(new byte[]{1, 0, 0, 0, -1, -1, -1, 127}, packed);
        assertArrayEquals(new int[]{1, Integer.MAX_VALUE}, ByteUtils.unpackBytesToInts(packed));
    }

    @Test
    void testSha256OfText() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                ByteUtils.computeSha256("hello"));
    }
}
