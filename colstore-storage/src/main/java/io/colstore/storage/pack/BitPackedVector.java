package io.colstore.storage.pack;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.NoSuchElementException;

import io.colstore.util.BitUtil;

/**
 * Values packed back to back into 64 bits words, little end first.
 * A value may span two words. Width 0 is legal, every value is 0 then.
 */
public final class BitPackedVector implements PackedIntVector {
    private final int size;
    private final int bitWidth;
    private final long mask;
    private final long[] words;

    private BitPackedVector(int size, int bitWidth, long[] words) {
        this.size = size;
        this.bitWidth = bitWidth;
        this.mask = BitUtil.maxValue(bitWidth);
        this.words = words;
    }

    static BitPackedVector build(IntList values, int maxValue) {
        Preconditions.checkArgument(maxValue >= 0);
        int size = values.size();
        int bitWidth = BitUtil.bitWidth(maxValue);
        // One spare word so that reads never check the word boundary.
        long[] words = new long[Math.max(1, BitUtil.words((long) size * bitWidth)) + 1];
        long bitPos = 0;
        for (int i = 0; i < size; i++, bitPos += bitWidth) {
            long v = values.getInt(i);
            int word = (int) (bitPos >>> 6);
            int shift = (int) (bitPos & 63);
            words[word] |= v << shift;
            if (shift + bitWidth > 64) {
                words[word + 1] |= v >>> (64 - shift);
            }
        }
        return new BitPackedVector(size, bitWidth, words);
    }

    @Override
    public ZsType type() {
        return ZsType.BIT_PACKED;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int bitWidth() {
        return bitWidth;
    }

    @Override
    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index: " + index + ", size: " + size);
        }
        long bitPos = (long) index * bitWidth;
        int word = (int) (bitPos >>> 6);
        int shift = (int) (bitPos & 63);
        // (x << 1) << (63 - shift) is 0 when shift is 0, which a single shift by 64 is not.
        long v = (words[word] >>> shift) | ((words[word + 1] << 1) << (63 - shift));
        return (int) (v & mask);
    }

    @Override
    public IntIterator iterator() {
        return new IntIterator() {
            int pos = 0;
            int word = 0;
            int shift = 0;

            @Override
            public boolean hasNext() {
                return pos < size;
            }

            @Override
            public int nextInt() {
                if (pos >= size) {
                    throw new NoSuchElementException();
                }
                long v = (words[word] >>> shift) | ((words[word + 1] << 1) << (63 - shift));
                pos++;
                shift += bitWidth;
                if (shift >= 64) {
                    shift -= 64;
                    word++;
                }
                return (int) (v & mask);
            }
        };
    }

    @Override
    public long dataSize() {
        return (long) words.length << 3;
    }
}
