package io.colstore.storage;

import com.google.common.base.Preconditions;

import io.colstore.data.DataType;

public class ColumnDefinition {
    public final String name;
    public final DataType dataType;
    public final boolean nullable;

    public ColumnDefinition(String name, DataType dataType, boolean nullable) {
        this.name = Preconditions.checkNotNull(name).toLowerCase();
        this.dataType = Preconditions.checkNotNull(dataType);
        this.nullable = nullable;
    }

    public ColumnDefinition(String name, DataType dataType) {
        this(name, dataType, true);
    }

    @Override
    public String toString() {
        return name + " " + dataType + (nullable ? "" : " NOT NULL");
    }
}
