package io.colstore.storage.encoder;

import io.colstore.storage.column.EncodedColumn;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.ValueColumn;

/**
 * Turns a raw column into a new, immutable encoded column. The raw column is not touched.
 */
public interface ColumnEncoder {

    EncodingType type();

    <T> EncodedColumn encode(ValueColumn<T> column);
}
