package com.goerdes.textguard.utils;

import com.goerdes.textguard.exception.TextProcessingException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * Utility methods for packing sketches into byte arrays and hashing content.
 */
public final class ByteUtils {

    private ByteUtils() {
    }

    /**
     * Packs an array of ints into a byte array (little-endian).
     *
     * @param values the int[] to pack
     * @return a byte[] of length values.length * 4
     */
    public static byte[] packIntsToBytes(int[] values) {
        ByteBuffer buf = ByteBuffer
                .allocate(values.length * Integer.BYTES)
                .order(LITTLE_ENDIAN);
        for (int v : values) {
            buf.putInt(v);
        }
        return buf.array();
    }

    /**
     * Unpacks a little-endian byte[] back into an int[].
     *
     * @param bytes the byte array (length must be multiple of 4)
     * @return an array of ints
     */
    public static int[] unpackBytesToInts(byte[] bytes) {
        if (bytes.length % Integer.BYTES != 0) {
            throw new IllegalArgumentException("Byte array length must be a multiple of " + Integer.BYTES);
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(LITTLE_ENDIAN);
        int[] ints = new int[bytes.length / Integer.BYTES];
        for (int i = 0; i < ints.length; i++) {
            ints[i] = buf.getInt();
        }
        return ints;
    }

    /**
     * Computes the SHA-256 digest of the given byte array and returns
     * it as a lowercase hexadecimal string.
     *
     * @param data the input bytes to hash
     * @return the hex-encoded SHA-256 hash
     * @throws TextProcessingException if SHA-256 algorithm is unavailable
     */
    public static String computeSha256(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new TextProcessingException("SHA-256 algorithm not available", e);
        }
    }

    public static String computeSha256(String text) {
        return computeSha256(text.getBytes(StandardCharsets.UTF_8));
    }

}
