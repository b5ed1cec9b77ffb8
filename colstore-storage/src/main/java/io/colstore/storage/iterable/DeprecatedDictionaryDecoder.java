package io.colstore.storage.iterable;

import io.colstore.storage.column.DeprecatedDictionaryColumn;
import io.colstore.storage.column.EncodingType;

public final class DeprecatedDictionaryDecoder<T> extends AbstractDictionaryDecoder<T> {

    public DeprecatedDictionaryDecoder(DeprecatedDictionaryColumn<T> column) {
        super(column.dataType(), column.dictionary(), column.attributeVector(), column.nullValueId());
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.DEPRECATED_DICTIONARY;
    }
}
