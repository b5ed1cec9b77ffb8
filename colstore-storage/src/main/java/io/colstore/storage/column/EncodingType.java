package io.colstore.storage.column;

import java.util.EnumSet;

import io.colstore.data.DataType;
import io.colstore.storage.EncodingException;

public enum EncodingType {
    /** Raw {@link ValueColumn}, left as it is. */
    UNENCODED(0, "unencoded", false),
    DICTIONARY(1, "dictionary", true),
    RUN_LENGTH(2, "run_length", false),
    /** Dictionary with the old attribute vector layout, see {@link DeprecatedDictionaryColumn}. */
    DEPRECATED_DICTIONARY(3, "deprecated_dictionary", false),
    //
    ;

    public final int id;
    public final String alias;
    /** Whether the encoding packs value ids with a configurable {@link io.colstore.storage.pack.ZsType}. */
    public final boolean usesZeroSuppression;
    private final EnumSet<DataType> supportedTypes;

    EncodingType(int id, String alias, boolean usesZeroSuppression) {
        this.id = id;
        this.alias = alias;
        this.usesZeroSuppression = usesZeroSuppression;
        this.supportedTypes = EnumSet.allOf(DataType.class);
    }

    public boolean supports(DataType dataType) {
        return supportedTypes.contains(dataType);
    }

    public static EncodingType fromId(int id) {
        for (EncodingType t : values()) {
            if (t.id == id) {
                return t;
            }
        }
        throw EncodingException.unsupported("Illegal encoding type id: %d", id);
    }

    public static EncodingType fromName(String name) {
        for (EncodingType t : values()) {
            if (t.alias.equalsIgnoreCase(name) || t.name().equalsIgnoreCase(name)) {
                return t;
            }
        }
        throw EncodingException.unsupported("Unsupported encoding type: %s", name);
    }
}
