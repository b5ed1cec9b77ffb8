package io.colstore.storage.pack;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.NoSuchElementException;

/**
 * Values stored in a plain <code>byte[]</code>, <code>short[]</code> or <code>int[]</code>,
 * whichever is the narrowest one holding the max value.
 */
public abstract class FixedSizeByteAlignedVector implements PackedIntVector {
    public static final int MAX_BYTE_VALUE = 0xFF;
    public static final int MAX_SHORT_VALUE = 0xFFFF;

    protected final int size;

    FixedSizeByteAlignedVector(int size) {
        this.size = size;
    }

    @Override
    public final ZsType type() {
        return ZsType.FIXED_SIZE_BYTE_ALIGNED;
    }

    @Override
    public final int size() {
        return size;
    }

    @Override
    public final long dataSize() {
        return ((long) size * bitWidth()) >>> 3;
    }

    /**
     * The bit width used for values no bigger than <code>maxValue</code>.
     */
    public static int bitWidthFor(int maxValue) {
        Preconditions.checkArgument(maxValue >= 0);
        if (maxValue <= MAX_BYTE_VALUE) {
            return 8;
        } else if (maxValue <= MAX_SHORT_VALUE) {
            return 16;
        } else {
            return 32;
        }
    }

    static FixedSizeByteAlignedVector build(IntList values, int maxValue) {
        int size = values.size();
        switch (bitWidthFor(maxValue)) {
            case 8: {
                byte[] data = new byte[size];
                for (int i = 0; i < size; i++) {
                    data[i] = (byte) values.getInt(i);
                }
                return new ByteVector(data);
            }
            case 16: {
                short[] data = new short[size];
                for (int i = 0; i < size; i++) {
                    data[i] = (short) values.getInt(i);
                }
                return new ShortVector(data);
            }
            default:
                return new IntVector(values.toIntArray());
        }
    }

    private static abstract class ArrayIterator implements IntIterator {
        final int size;
        int pos;

        ArrayIterator(int size) {
            this.size = size;
        }

        @Override
        public final boolean hasNext() {
            return pos < size;
        }

        @Override
        public final int nextInt() {
            if (pos >= size) {
                throw new NoSuchElementException();
            }
            return read(pos++);
        }

        abstract int read(int pos);
    }

    static final class ByteVector extends FixedSizeByteAlignedVector {
        private final byte[] data;

        ByteVector(byte[] data) {
            super(data.length);
            this.data = data;
        }

        @Override
        public int bitWidth() {
            return 8;
        }

        @Override
        public int get(int index) {
            return data[index] & 0xFF;
        }

        @Override
        public IntIterator iterator() {
            return new ArrayIterator(size) {
                @Override
                int read(int pos) {
                    return data[pos] & 0xFF;
                }
            };
        }
    }

    static final class ShortVector extends FixedSizeByteAlignedVector {
        private final short[] data;

        ShortVector(short[] data) {
            super(data.length);
            this.data = data;
        }

        @Override
        public int bitWidth() {
            return 16;
        }

        @Override
        public int get(int index) {
            return data[index] & 0xFFFF;
        }

        @Override
        public IntIterator iterator() {
            return new ArrayIterator(size) {
                @Override
                int read(int pos) {
                    return data[pos] & 0xFFFF;
                }
            };
        }
    }

    static final class IntVector extends FixedSizeByteAlignedVector {
        private final int[] data;

        IntVector(int[] data) {
            super(data.length);
            this.data = data;
        }

        @Override
        public int bitWidth() {
            return 32;
        }

        @Override
        public int get(int index) {
            return data[index];
        }

        @Override
        public IntIterator iterator() {
            return new ArrayIterator(size) {
                @Override
                int read(int pos) {
                    return data[pos];
                }
            };
        }
    }
}
