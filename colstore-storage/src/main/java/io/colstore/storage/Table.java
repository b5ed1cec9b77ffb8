package io.colstore.storage;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

import io.colstore.data.DataType;
import io.colstore.storage.column.ValueColumn;

/**
 * Rows split into chunks of at most <code>maxChunkSize</code> rows. Only the last chunk takes new rows.
 */
public class Table {
    private final ImmutableList<ColumnDefinition> columnDefinitions;
    private final ImmutableList<DataType> columnTypes;
    private final int maxChunkSize;
    private final boolean useMvcc;
    private final ObjectArrayList<Chunk> chunks = new ObjectArrayList<>();

    public Table(List<ColumnDefinition> columnDefinitions, int maxChunkSize, boolean useMvcc) {
        Preconditions.checkArgument(maxChunkSize > 0, "Illegal chunk size: %s", maxChunkSize);
        this.columnDefinitions = ImmutableList.copyOf(columnDefinitions);
        ImmutableList.Builder<DataType> types = ImmutableList.builder();
        for (ColumnDefinition definition : columnDefinitions) {
            types.add(definition.dataType);
        }
        this.columnTypes = types.build();
        this.maxChunkSize = maxChunkSize;
        this.useMvcc = useMvcc;
    }

    public Table(List<ColumnDefinition> columnDefinitions) {
        this(columnDefinitions, StorageConfig.CHUNK_SIZE.getInt(), false);
    }

    public void append(Object... row) {
        Preconditions.checkArgument(row.length == columnDefinitions.size(),
                "Row has %s values, table has %s columns", row.length, columnDefinitions.size());
        Chunk last = chunks.isEmpty() ? null : chunks.get(chunks.size() - 1);
        if (last == null || last.size() >= maxChunkSize) {
            last = createNewChunk();
        }
        last.append(row);
    }

    /**
     * Starts a new, empty chunk of raw columns. Later rows go there.
     */
    public Chunk createNewChunk() {
        Chunk chunk = new Chunk(useMvcc);
        for (ColumnDefinition definition : columnDefinitions) {
            chunk.addColumn(new ValueColumn<>(definition.dataType, definition.nullable));
        }
        chunks.add(chunk);
        return chunk;
    }

    public List<ColumnDefinition> columnDefinitions() {
        return columnDefinitions;
    }

    public List<DataType> columnTypes() {
        return columnTypes;
    }

    public int columnCount() {
        return columnDefinitions.size();
    }

    public String columnName(int columnId) {
        return columnDefinitions.get(columnId).name;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    public int chunkCount() {
        return chunks.size();
    }

    public Chunk getChunk(int chunkId) {
        Preconditions.checkElementIndex(chunkId, chunks.size(), "chunkId");
        return chunks.get(chunkId);
    }

    public long rowCount() {
        long count = 0;
        for (Chunk chunk : chunks) {
            count += chunk.size();
        }
        return count;
    }
}
