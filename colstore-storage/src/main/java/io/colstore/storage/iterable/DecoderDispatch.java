package io.colstore.storage.iterable;

import com.google.common.base.Preconditions;

import io.colstore.data.DataType;
import io.colstore.storage.EncodingException;
import io.colstore.storage.column.BaseColumn;
import io.colstore.storage.column.DeprecatedDictionaryColumn;
import io.colstore.storage.column.DictionaryColumn;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.RunLengthColumn;
import io.colstore.storage.column.ValueColumn;

/**
 * Resolves a column, whose data type and encoding are only known at runtime, to its decoder.
 * Resolve once per column, then scan through the decoder.
 */
public class DecoderDispatch {

    public static <R> R resolve(BaseColumn column, DataType dataType, DecoderHandler<R> handler) {
        return handler.handle(decoder(column, dataType));
    }

    public static <R> R resolve(BaseColumn column, DecoderHandler<R> handler) {
        return resolve(column, column.dataType(), handler);
    }

    /**
     * @throws EncodingException with {@link io.colstore.storage.ErrorCode#UNSUPPORTED_COMBINATION}
     *                           if no decoder reads this column as <code>dataType</code>.
     */
    @SuppressWarnings("unchecked")
    public static ColumnDecoder<?> decoder(BaseColumn column, DataType dataType) {
        Preconditions.checkNotNull(column);
        Preconditions.checkNotNull(dataType);
        if (column.dataType() != dataType) {
            throw EncodingException.unsupported("Column of %s can not be read as %s", column.dataType(), dataType);
        }
        EncodingType type = column.encodingType();
        if (type == null || !type.supports(dataType)) {
            throw EncodingException.unsupported("Encoding %s does not support %s", type, dataType);
        }
        switch (type) {
            case UNENCODED:
                return valueColumnDecoder(cast(column, ValueColumn.class, type));
            case DICTIONARY:
                return dictionaryDecoder(cast(column, DictionaryColumn.class, type));
            case DEPRECATED_DICTIONARY:
                return deprecatedDictionaryDecoder(cast(column, DeprecatedDictionaryColumn.class, type));
            case RUN_LENGTH:
                return runLengthDecoder(cast(column, RunLengthColumn.class, type));
            default:
                throw EncodingException.unsupported("Unknown encoding type: %s", type);
        }
    }

    private static <C> C cast(BaseColumn column, Class<C> clazz, EncodingType type) {
        if (!clazz.isInstance(column)) {
            throw EncodingException.unsupported("%s tagged %s is not a %s",
                    column.getClass().getSimpleName(), type, clazz.getSimpleName());
        }
        return clazz.cast(column);
    }

    private static <T> ColumnDecoder<T> valueColumnDecoder(ValueColumn<T> column) {
        return new ValueColumnDecoder<>(column);
    }

    private static <T> ColumnDecoder<T> dictionaryDecoder(DictionaryColumn<T> column) {
        return new DictionaryDecoder<>(column);
    }

    private static <T> ColumnDecoder<T> deprecatedDictionaryDecoder(DeprecatedDictionaryColumn<T> column) {
        return new DeprecatedDictionaryDecoder<>(column);
    }

    private static <T> ColumnDecoder<T> runLengthDecoder(RunLengthColumn<T> column) {
        return new RunLengthDecoder<>(column);
    }
}
