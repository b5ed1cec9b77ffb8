package io.colstore.storage.encoder;

import com.google.common.base.Preconditions;

import io.colstore.storage.column.DictionaryColumn;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.ValueColumn;
import io.colstore.storage.pack.PackedIntVector;
import io.colstore.storage.pack.PackedIntVectors;
import io.colstore.storage.pack.ZsType;

public class DictionaryEncoder implements ColumnEncoder {
    public static final EncodingType TYPE = EncodingType.DICTIONARY;

    private final ZsType zsType;

    public DictionaryEncoder(ZsType zsType) {
        this.zsType = Preconditions.checkNotNull(zsType);
    }

    @Override
    public EncodingType type() {
        return TYPE;
    }

    public ZsType zsType() {
        return zsType;
    }

    @Override
    public <T> DictionaryColumn<T> encode(ValueColumn<T> column) {
        DictionaryBuilder<T> builder = DictionaryBuilder.build(column);
        // Pack by the null value id even if no row is null, so the width only depends on the dictionary.
        PackedIntVector attributeVector = PackedIntVectors.encode(zsType, builder.valueIds(), builder.nullValueId());
        return new DictionaryColumn<>(column.dataType(), builder.dictionary(), attributeVector);
    }
}
