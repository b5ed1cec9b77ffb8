package io.colstore.storage.pack;

import it.unimi.dsi.fastutil.ints.IntList;

import io.colstore.storage.EncodingException;

/**
 * Builds {@link PackedIntVector}s. Values must be non-negative ints.
 */
public class PackedIntVectors {

    public static PackedIntVector encode(ZsType type, IntList values) {
        int max = 0;
        for (int i = 0; i < values.size(); i++) {
            int v = values.getInt(i);
            if (v < 0) {
                throw EncodingException.capacity("value %d at %d exceeds the packing domain", v & 0xFFFFFFFFL, i);
            }
            max = Math.max(max, v);
        }
        return build(type, values, max);
    }

    /**
     * @param maxValue the max value of <code>values</code>, or a bigger one which is still going to fit,
     *                 e.g. a null value id not actually used.
     */
    public static PackedIntVector encode(ZsType type, IntList values, int maxValue) {
        if (maxValue < 0) {
            throw EncodingException.capacity("max value %d exceeds the packing domain", maxValue & 0xFFFFFFFFL);
        }
        for (int i = 0; i < values.size(); i++) {
            int v = values.getInt(i);
            if (v < 0 || v > maxValue) {
                throw EncodingException.capacity("value %d at %d is out of [0, %d]", v & 0xFFFFFFFFL, i, maxValue);
            }
        }
        return build(type, values, maxValue);
    }

    private static PackedIntVector build(ZsType type, IntList values, int maxValue) {
        switch (type) {
            case FIXED_SIZE_BYTE_ALIGNED:
                return FixedSizeByteAlignedVector.build(values, maxValue);
            case BIT_PACKED:
                return BitPackedVector.build(values, maxValue);
            default:
                throw EncodingException.unsupported("unsupported zs type: %s", type);
        }
    }
}
