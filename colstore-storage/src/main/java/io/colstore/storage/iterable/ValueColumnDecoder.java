package io.colstore.storage.iterable;

import com.google.common.base.Preconditions;

import io.colstore.data.DataType;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.ValueColumn;

public final class ValueColumnDecoder<T> implements ColumnDecoder<T> {
    private final ValueColumn<T> column;

    public ValueColumnDecoder(ValueColumn<T> column) {
        this.column = column;
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.UNENCODED;
    }

    @Override
    public DataType dataType() {
        return column.dataType();
    }

    @Override
    public int size() {
        return column.size();
    }

    @Override
    public T get(int index) {
        return column.get(index);
    }

    @Override
    public boolean isNullAt(int index) {
        return column.isNullAt(index);
    }

    @Override
    public ColumnCursor<T> cursor() {
        return new ColumnCursor<T>() {
            final int size = column.size();
            int pos = -1;
            T value;

            @Override
            public boolean next() {
                if (pos + 1 >= size) {
                    return false;
                }
                value = column.get(++pos);
                return true;
            }

            @Override
            public int position() {
                return pos;
            }

            @Override
            public boolean isNull() {
                Preconditions.checkState(pos >= 0, "Cursor is before the first row");
                return value == null;
            }

            @Override
            public T value() {
                Preconditions.checkState(pos >= 0, "Cursor is before the first row");
                return value;
            }
        };
    }
}
