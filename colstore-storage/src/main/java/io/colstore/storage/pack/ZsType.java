package io.colstore.storage.pack;

import io.colstore.storage.EncodingException;

/**
 * Zero suppression schemes for packed value ids.
 */
public enum ZsType {
    FIXED_SIZE_BYTE_ALIGNED(1, "fixed_size_byte_aligned"),
    BIT_PACKED(2, "bit_packed"),
    //
    ;

    public final int id;
    public final String alias;

    ZsType(int id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public static ZsType fromId(int id) {
        for (ZsType t : values()) {
            if (t.id == id) {
                return t;
            }
        }
        throw EncodingException.unsupported("Illegal zs type id: %d", id);
    }

    public static ZsType fromName(String name) {
        for (ZsType t : values()) {
            if (t.alias.equalsIgnoreCase(name) || t.name().equalsIgnoreCase(name)) {
                return t;
            }
        }
        throw EncodingException.unsupported("Unsupported zs type: %s", name);
    }
}
