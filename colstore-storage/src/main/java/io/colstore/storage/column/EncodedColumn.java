package io.colstore.storage.column;

import io.colstore.storage.pack.ZsType;

public interface EncodedColumn extends BaseColumn {

    /**
     * The scheme value ids are packed with, or null if this encoding packs no ids.
     */
    ZsType zsType();
}
