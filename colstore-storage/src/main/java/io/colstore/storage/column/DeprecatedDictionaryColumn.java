package io.colstore.storage.column;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import io.colstore.data.DataType;
import io.colstore.storage.pack.FixedSizeByteAlignedVector;
import io.colstore.storage.pack.PackedIntVector;
import io.colstore.storage.pack.ZsType;

/**
 * The old dictionary layout, kept to read columns produced before {@link DictionaryColumn}.
 *
 * The attribute vector is always byte aligned and fitted by the dictionary size only.
 * Null is the all ones value of that width (0xFF, 0xFFFF, or 0x7FFFFFFF for 32 bits),
 * not the dictionary size.
 */
public final class DeprecatedDictionaryColumn<T> implements EncodedColumn {
    private final DataType dataType;
    private final ImmutableList<T> dictionary;
    private final PackedIntVector attributeVector;
    private final int nullValueId;

    public DeprecatedDictionaryColumn(DataType dataType, ImmutableList<T> dictionary, PackedIntVector attributeVector) {
        Preconditions.checkArgument(attributeVector.type() == ZsType.FIXED_SIZE_BYTE_ALIGNED,
                "Legacy dictionary needs a byte aligned attribute vector, got %s", attributeVector.type());
        this.dataType = Preconditions.checkNotNull(dataType);
        this.dictionary = Preconditions.checkNotNull(dictionary);
        this.attributeVector = attributeVector;
        this.nullValueId = nullValueIdFor(dictionary.size());
        Preconditions.checkArgument(attributeVector.size() == 0
                        || FixedSizeByteAlignedVector.bitWidthFor(nullValueId) == attributeVector.bitWidth(),
                "Attribute vector width %s does not fit dictionary size %s", attributeVector.bitWidth(), dictionary.size());
    }

    /**
     * The null value id of a dictionary with <code>dictionarySize</code> entries.
     */
    public static int nullValueIdFor(int dictionarySize) {
        if (dictionarySize <= FixedSizeByteAlignedVector.MAX_BYTE_VALUE) {
            return FixedSizeByteAlignedVector.MAX_BYTE_VALUE;
        } else if (dictionarySize <= FixedSizeByteAlignedVector.MAX_SHORT_VALUE) {
            return FixedSizeByteAlignedVector.MAX_SHORT_VALUE;
        } else {
            return Integer.MAX_VALUE;
        }
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

    @Override
    public ZsType zsType() {
        return ZsType.FIXED_SIZE_BYTE_ALIGNED;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.DEPRECATED_DICTIONARY;
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
