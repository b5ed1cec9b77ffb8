package io.colstore.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Objects;

import io.colstore.storage.column.EncodingType;
import io.colstore.storage.pack.ZsType;
import io.colstore.util.JsonUtil;

/**
 * How one column should be encoded, e.g. <code>{"encoding": "dictionary", "zs": "bit_packed"}</code>.
 * A null zs type means the default of the encoding.
 */
public final class ColumnEncodingSpec {
    public static final ColumnEncodingSpec UNENCODED = new ColumnEncodingSpec(EncodingType.UNENCODED);

    @JsonIgnore
    public final EncodingType encodingType;
    @JsonIgnore
    public final ZsType zsType;

    public ColumnEncodingSpec(EncodingType encodingType, ZsType zsType) {
        this.encodingType = Preconditions.checkNotNull(encodingType);
        this.zsType = zsType;
    }

    public ColumnEncodingSpec(EncodingType encodingType) {
        this(encodingType, null);
    }

    @JsonCreator
    public ColumnEncodingSpec(@JsonProperty("encoding") String encoding,
                              @JsonProperty("zs") String zs) {
        this(EncodingType.fromName(Preconditions.checkNotNull(encoding, "encoding")),
                zs == null ? null : ZsType.fromName(zs));
    }

    @JsonProperty("encoding")
    public String getEncoding() {
        return encodingType.alias;
    }

    @JsonProperty("zs")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getZs() {
        return zsType == null ? null : zsType.alias;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnEncodingSpec that = (ColumnEncodingSpec) o;
        return encodingType == that.encodingType && zsType == that.zsType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(encodingType, zsType);
    }

    @Override
    public String toString() {
        return JsonUtil.toJson(this);
    }
}
