package com.herzen.progress.bitmap;

import java.util.Arrays;
import java.util.Base64;

/**
 * Byte-array codec for completion bitmaps. Bit {@code p} lives in byte {@code p / 8},
 * most significant bit first, which is the layout Redis uses for SETBIT/GETBIT.
 */
public final class CompletionBitmap {
    private static final byte[] EMPTY = new byte[0];

    private CompletionBitmap() {}

    public static byte[] empty() {
        return EMPTY.clone();
    }

    public static int bytesFor(int lessonCount) {
        if (lessonCount <= 0) return 0;
        return (lessonCount + 7) / 8;
    }

    public static boolean isSet(byte[] bitmap, int position) {
        checkPosition(position);
        if (bitmap == null) return false;
        int index = position >>> 3;
        if (index >= bitmap.length) return false;
        return (bitmap[index] & mask(position)) != 0;
    }

    /** Returns a bitmap with {@code position} set, growing the array when needed. The input is never modified. */
    public static byte[] withBit(byte[] bitmap, int position) {
        checkPosition(position);
        byte[] source = bitmap == null ? EMPTY : bitmap;
        int index = position >>> 3;
        byte[] result = Arrays.copyOf(source, Math.max(source.length, index + 1));
        result[index] = (byte) (result[index] | mask(position));
        return result;
    }

    public static int cardinality(byte[] bitmap) {
        if (bitmap == null) return 0;
        int count = 0;
        for (byte b : bitmap) {
            count += Integer.bitCount(b & 0xFF);
        }
        return count;
    }

    public static String encode(byte[] bitmap) {
        if (bitmap == null || bitmap.length == 0) return "";
        return Base64.getEncoder().encodeToString(bitmap);
    }

    public static byte[] decode(String encoded) {
        if (encoded == null || encoded.isBlank()) return empty();
        return Base64.getDecoder().decode(encoded);
    }

    private static int mask(int position) {
        return 0x80 >>> (position & 7);
    }

    private static void checkPosition(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("Bit position must be non-negative: " + position);
        }
    }
}
