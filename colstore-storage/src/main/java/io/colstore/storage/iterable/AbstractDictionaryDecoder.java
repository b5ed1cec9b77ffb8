package io.colstore.storage.iterable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.ints.IntIterator;

import io.colstore.data.DataType;
import io.colstore.storage.pack.PackedIntVector;

/**
 * Shared by both dictionary layouts, they only differ in the null value id.
 */
abstract class AbstractDictionaryDecoder<T> implements ColumnDecoder<T> {
    private final DataType dataType;
    private final ImmutableList<T> dictionary;
    private final PackedIntVector attributeVector;
    private final int nullValueId;

    AbstractDictionaryDecoder(DataType dataType, ImmutableList<T> dictionary, PackedIntVector attributeVector, int nullValueId) {
        this.dataType = dataType;
        this.dictionary = dictionary;
        this.attributeVector = attributeVector;
        this.nullValueId = nullValueId;
    }

    @Override
    public final DataType dataType() {
        return dataType;
    }

    @Override
    public final int size() {
        return attributeVector.size();
    }

    @Override
    public final T get(int index) {
        int id = attributeVector.get(index);
        return id == nullValueId ? null : dictionary.get(id);
    }

    @Override
    public final boolean isNullAt(int index) {
        return attributeVector.get(index) == nullValueId;
    }

    @Override
    public final ColumnCursor<T> cursor() {
        return new ColumnCursor<T>() {
            final IntIterator ids = attributeVector.iterator();
            int pos = -1;
            int id;

            @Override
            public boolean next() {
                if (!ids.hasNext()) {
                    return false;
                }
                id = ids.nextInt();
                pos++;
                return true;
            }

            @Override
            public int position() {
                return pos;
            }

            @Override
            public boolean isNull() {
                Preconditions.checkState(pos >= 0, "Cursor is before the first row");
                return id == nullValueId;
            }

            @Override
            public T value() {
                Preconditions.checkState(pos >= 0, "Cursor is before the first row");
                return id == nullValueId ? null : dictionary.get(id);
            }
        };
    }
}
