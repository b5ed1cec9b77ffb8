package io.colstore.util;

/**
 * Bit width helpers for packed integers.
 */
public final class BitUtil {
    private BitUtil() {} // no instance

    public static int bitWidth(int max) {
        return 32 - Integer.numberOfLeadingZeros(max);
    }

    /**
     * The largest unsigned value representable with <code>bitWidth</code> bits, 0 to 32 bits.
     */
    public static long maxValue(int bitWidth) {
        return (1L << bitWidth) - 1;
    }

    /** How many 64 bits words needed to hold <code>bits</code> bits. */
    public static int words(long bits) {
        return (int) ((bits + 63) >>> 6);
    }
}
