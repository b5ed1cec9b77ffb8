package io.colstore.storage.encoder;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import io.colstore.storage.column.DeprecatedDictionaryColumn;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.ValueColumn;
import io.colstore.storage.pack.PackedIntVector;
import io.colstore.storage.pack.PackedIntVectors;
import io.colstore.storage.pack.ZsType;

/**
 * Writes the legacy layout of {@link DeprecatedDictionaryColumn}.
 */
public class DeprecatedDictionaryEncoder implements ColumnEncoder {
    public static final EncodingType TYPE = EncodingType.DEPRECATED_DICTIONARY;

    @Override
    public EncodingType type() {
        return TYPE;
    }

    @Override
    public <T> DeprecatedDictionaryColumn<T> encode(ValueColumn<T> column) {
        DictionaryBuilder<T> builder = DictionaryBuilder.build(column);
        int nullValueId = DeprecatedDictionaryColumn.nullValueIdFor(builder.dictionary().size());

        IntArrayList valueIds = new IntArrayList(builder.valueIds());
        for (int i = 0; i < valueIds.size(); i++) {
            if (valueIds.getInt(i) == builder.nullValueId()) {
                valueIds.set(i, nullValueId);
            }
        }
        PackedIntVector attributeVector = PackedIntVectors.encode(ZsType.FIXED_SIZE_BYTE_ALIGNED, valueIds, nullValueId);
        return new DeprecatedDictionaryColumn<>(column.dataType(), builder.dictionary(), attributeVector);
    }
}
