package io.colstore.storage.encoder;

import com.google.common.collect.ImmutableMap;

import java.util.function.Function;

import io.colstore.storage.EncodingException;
import io.colstore.storage.StorageConfig;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.pack.ZsType;

/**
 * The fixed mapping from encoding type to encoder. Encoders are cheap and stateless after construction,
 * a new one is created per request.
 */
public class Encoders {
    private static final ImmutableMap<EncodingType, Function<ZsType, ColumnEncoder>> ENCODERS =
            ImmutableMap.<EncodingType, Function<ZsType, ColumnEncoder>>of(
                    EncodingType.DICTIONARY, DictionaryEncoder::new,
                    EncodingType.RUN_LENGTH, zsType -> new RunLengthEncoder(),
                    EncodingType.DEPRECATED_DICTIONARY, zsType -> new DeprecatedDictionaryEncoder());

    public static ColumnEncoder create(EncodingType type) {
        return create(type, null);
    }

    /**
     * @param zsType null to use the default one, if the encoding packs ids at all.
     */
    public static ColumnEncoder create(EncodingType type, ZsType zsType) {
        Function<ZsType, ColumnEncoder> factory = ENCODERS.get(type);
        if (factory == null) {
            throw EncodingException.unsupported("No encoder for encoding type %s", type);
        }
        if (zsType != null && !type.usesZeroSuppression) {
            throw EncodingException.unsupported("Encoding %s does not support zero suppression %s", type, zsType);
        }
        if (zsType == null && type.usesZeroSuppression) {
            zsType = defaultZsType();
        }
        return factory.apply(zsType);
    }

    public static ZsType defaultZsType() {
        return ZsType.fromName(StorageConfig.DEFAULT_ZS_TYPE.get());
    }
}
