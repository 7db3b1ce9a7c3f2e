package com.example.filmarchive.common.util;

public final class HashUtil {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashUtil() {
    }

    /**
     * Packs bits into lowercase hex, four bits per character, most significant bit first.
     * The bit count must be a multiple of four.
     */
    public static String bitsToHex(boolean[] bits) {
        if (bits.length % 4 != 0) {
            throw new IllegalArgumentException("bit count must be a multiple of 4: " + bits.length);
        }
        StringBuilder sb = new StringBuilder(bits.length / 4);
        for (int i = 0; i < bits.length; i += 4) {
            int nibble = (bits[i] ? 8 : 0) | (bits[i + 1] ? 4 : 0) | (bits[i + 2] ? 2 : 0) | (bits[i + 3] ? 1 : 0);
            sb.append(HEX[nibble]);
        }
        return sb.toString();
    }

    /**
     * Hamming distance between two hex strings of equal length, or -1 when they are not comparable.
     */
    public static int hammingDistanceHex(String a, String b) {
        if (a == null || b == null || a.length() != b.length()) {
            return -1;
        }
        int distance = 0;
        for (int i = 0; i < a.length(); i++) {
            int x = Character.digit(a.charAt(i), 16);
            int y = Character.digit(b.charAt(i), 16);
            if (x < 0 || y < 0) {
                return -1;
            }
            distance += Integer.bitCount(x ^ y);
        }
        return distance;
    }
}
