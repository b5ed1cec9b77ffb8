package io.colstore.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;

import io.colstore.util.JsonUtil;

/**
 * One {@link ColumnEncodingSpec} per column of a chunk, in column order.
 */
public final class ChunkEncodingSpec {
    private final ImmutableList<ColumnEncodingSpec> columns;

    @JsonCreator
    public ChunkEncodingSpec(@JsonProperty("columns") List<ColumnEncodingSpec> columns) {
        Preconditions.checkNotNull(columns, "columns");
        this.columns = ImmutableList.copyOf(columns);
    }

    public static ChunkEncodingSpec of(ColumnEncodingSpec... columns) {
        return new ChunkEncodingSpec(ImmutableList.copyOf(columns));
    }

    /**
     * The same spec for all <code>columnCount</code> columns.
     */
    public static ChunkEncodingSpec uniform(int columnCount, ColumnEncodingSpec spec) {
        return new ChunkEncodingSpec(Collections.nCopies(columnCount, spec));
    }

    @JsonProperty("columns")
    public List<ColumnEncodingSpec> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public ColumnEncodingSpec get(int columnId) {
        return columns.get(columnId);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ChunkEncodingSpec && columns.equals(((ChunkEncodingSpec) o).columns));
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return JsonUtil.toJson(this);
    }
}
