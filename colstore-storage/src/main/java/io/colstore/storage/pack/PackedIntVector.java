package io.colstore.storage.pack;

import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * An immutable sequence of non-negative ints, all stored with the same bit width.
 */
public interface PackedIntVector {

    ZsType type();

    int size();

    /**
     * The bits each value occupies.
     */
    int bitWidth();

    /**
     * Random access, cost independent of other positions.
     */
    int get(int index);

    /**
     * A new iterator from the first value. Cheaper than calling {@link #get(int)} for a full scan.
     */
    IntIterator iterator();

    /**
     * Bytes of the backing storage.
     */
    long dataSize();
}
