package io.colstore.storage.column;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import io.colstore.data.DataType;
import io.colstore.storage.pack.PackedIntVector;
import io.colstore.storage.pack.ZsType;

/**
 * A sorted dictionary of the distinct values, plus one packed value id per row.
 * <pre>
 * | dictionary (sorted, unique) |  attribute vector (value ids)  |
 *                                 id == dictionary.size() means null
 * </pre>
 */
public final class DictionaryColumn<T> implements EncodedColumn {
    private final DataType dataType;
    private final ImmutableList<T> dictionary;
    private final PackedIntVector attributeVector;
    private final int nullValueId;

    public DictionaryColumn(DataType dataType, ImmutableList<T> dictionary, PackedIntVector attributeVector) {
        this.dataType = Preconditions.checkNotNull(dataType);
        this.dictionary = Preconditions.checkNotNull(dictionary);
        this.attributeVector = Preconditions.checkNotNull(attributeVector);
        this.nullValueId = dictionary.size();
    }

    public ImmutableList<T> dictionary() {
        return dictionary;
    }

    public PackedIntVector attributeVector() {
        return attributeVector;
    }

    public int nullValueId() {
        return nullValueId;
    }

    public int uniqueValuesCount() {
        return dictionary.size();
    }

    /**
     * The id of the first dictionary entry not less than <code>value</code>,
     * or {@link #nullValueId()} if all entries are less.
     */
    public int lowerBound(T value) {
        Ordering<T> ordering = dataType.ordering();
        int from = 0;
        int to = dictionary.size();
        while (from < to) {
            int mid = from + to >>> 1;
            if (ordering.compare(dictionary.get(mid), value) < 0) {
                from = mid + 1;
            } else {
                to = mid;
            }
        }
        return from;
    }

    /**
     * The id of the first dictionary entry greater than <code>value</code>,
     * or {@link #nullValueId()} if no entry is greater.
     */
    public int upperBound(T value) {
        Ordering<T> ordering = dataType.ordering();
        int from = 0;
        int to = dictionary.size();
        while (from < to) {
            int mid = from + to >>> 1;
            if (ordering.compare(dictionary.get(mid), value) <= 0) {
                from = mid + 1;
            } else {
                to = mid;
            }
        }
        return from;
    }

    @Override
    public ZsType zsType() {
        return attributeVector.type();
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.DICTIONARY;
    }

    @Override
    public int size() {
        return attributeVector.size();
    }

    @Override
    public Object valueAt(int index) {
        int id = attributeVector.get(index);
        return id == nullValueId ? null : dictionary.get(id);
    }

    @Override
    public long estimateMemoryUsage() {
        long size = (long) dictionary.size() << 3;
        for (T v : dictionary) {
            size += dataType.estimateSize(v);
        }
        return size + attributeVector.dataSize();
    }
}
