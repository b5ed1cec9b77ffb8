package io.colstore.storage;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import io.colstore.storage.column.BaseColumn;
import io.colstore.storage.column.ValueColumn;

/**
 * A horizontal slice of a table, one column object per table column.
 *
 * Not thread safe. Whoever encodes a chunk must keep readers and writers away until it is done.
 */
public class Chunk {
    private final ObjectArrayList<BaseColumn> columns = new ObjectArrayList<>();
    private final MvccColumns mvccColumns;

    public Chunk(boolean useMvcc) {
        this.mvccColumns = useMvcc ? new MvccColumns() : null;
    }

    public void addColumn(BaseColumn column) {
        Preconditions.checkArgument(columns.isEmpty() || column.size() == size(),
                "Column size %s differs from chunk size %s", column.size(), size());
        columns.add(column);
        if (mvccColumns != null && columns.size() == 1 && mvccColumns.size() < column.size()) {
            mvccColumns.grow(column.size() - mvccColumns.size(), 0);
        }
    }

    public int columnCount() {
        return columns.size();
    }

    public int size() {
        return columns.isEmpty() ? 0 : columns.get(0).size();
    }

    public BaseColumn getColumn(int columnId) {
        return columns.get(columnId);
    }

    /**
     * Swaps in a new column object for <code>columnId</code>. The old one is left as it is,
     * anyone still holding it keeps reading consistent data.
     */
    public void replaceColumn(int columnId, BaseColumn column) {
        Preconditions.checkArgument(column.size() == size(),
                "Column size %s differs from chunk size %s", column.size(), size());
        columns.set(columnId, column);
    }

    /**
     * Appends one row, only legal while all columns are raw.
     */
    @SuppressWarnings("unchecked")
    public void append(Object... values) {
        Preconditions.checkArgument(values.length == columns.size(),
                "Row has %s values, chunk has %s columns", values.length, columns.size());
        for (int i = 0; i < values.length; i++) {
            BaseColumn column = columns.get(i);
            Preconditions.checkState(column instanceof ValueColumn, "Can not append to %s column", column.encodingType());
            ((ValueColumn<?>) column).checkValue(values[i]);
        }
        // All values checked, the row goes in whole.
        for (int i = 0; i < values.length; i++) {
            ((ValueColumn<Object>) columns.get(i)).append(values[i]);
        }
        if (mvccColumns != null) {
            mvccColumns.grow(1, 0);
        }
    }

    public boolean hasMvccColumns() {
        return mvccColumns != null;
    }

    public MvccColumns mvccColumns() {
        Preconditions.checkState(mvccColumns != null, "Chunk has no mvcc columns");
        return mvccColumns;
    }

    public void shrinkMvccColumns() {
        mvccColumns().shrink(size());
    }

    public long estimateMemoryUsage() {
        long size = 0;
        for (BaseColumn column : columns) {
            size += column.estimateMemoryUsage();
        }
        if (mvccColumns != null) {
            size += (long) mvccColumns.capacity() * 3 * 8;
        }
        return size;
    }
}
