package io.colstore.storage.iterable;

import io.colstore.storage.column.DictionaryColumn;
import io.colstore.storage.column.EncodingType;

public final class DictionaryDecoder<T> extends AbstractDictionaryDecoder<T> {

    public DictionaryDecoder(DictionaryColumn<T> column) {
        super(column.dataType(), column.dictionary(), column.attributeVector(), column.nullValueId());
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.DICTIONARY;
    }
}
