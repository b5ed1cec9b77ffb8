package io.colstore.storage.column;

import io.colstore.data.DataType;

/**
 * A column of one chunk, raw or encoded.
 *
 * Encoded columns are immutable. Scanning code should go through
 * {@link io.colstore.storage.iterable.DecoderDispatch} rather than {@link #valueAt(int)},
 * which boxes and dispatches on every call.
 */
public interface BaseColumn {

    DataType dataType();

    EncodingType encodingType();

    int size();

    /**
     * The value at <code>index</code>, or null.
     */
    Object valueAt(int index);

    /**
     * Approximate heap bytes held by this column.
     */
    long estimateMemoryUsage();
}
