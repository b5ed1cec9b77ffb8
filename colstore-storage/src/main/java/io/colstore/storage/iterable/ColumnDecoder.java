package io.colstore.storage.iterable;

import io.colstore.data.DataType;
import io.colstore.storage.column.EncodingType;

/**
 * Typed read access to one column. A decoder only borrows its column, it is cheap to create and
 * must not be kept beyond the column's lifetime.
 *
 * <code>get(i)</code> and the <code>i</code>-th row of {@link #cursor()} always agree.
 */
public interface ColumnDecoder<T> extends ColumnIterable<T> {

    EncodingType encodingType();

    DataType dataType();

    /**
     * The value at <code>index</code>, or null.
     *
     * @throws IndexOutOfBoundsException if index is not in <code>[0, size())</code>.
     */
    T get(int index);

    boolean isNullAt(int index);
}
