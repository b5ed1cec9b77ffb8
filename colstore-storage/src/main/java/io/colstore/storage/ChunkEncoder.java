package io.colstore.storage;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import io.colstore.data.DataType;
import io.colstore.storage.column.BaseColumn;
import io.colstore.storage.column.EncodedColumn;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.ValueColumn;
import io.colstore.storage.encoder.ColumnEncoder;
import io.colstore.storage.encoder.Encoders;
import io.colstore.storage.pack.ZsType;

/**
 * Replaces raw columns of chunks with encoded ones.
 *
 * Nothing here locks. Callers must make sure no one reads or appends to a chunk while it is being encoded.
 */
public class ChunkEncoder {
    private static final Logger logger = LoggerFactory.getLogger(ChunkEncoder.class);

    /**
     * Encodes the columns of a chunk in place and shrinks its mvcc columns if it has any.
     *
     * Columns are replaced one by one, a failure leaves the columns before it encoded.
     */
    public static void encodeChunk(Chunk chunk, List<DataType> dataTypes, ChunkEncodingSpec spec) {
        Preconditions.checkNotNull(chunk);
        int columnCount = chunk.columnCount();
        if (dataTypes.size() != columnCount) {
            throw EncodingException.precondition("Chunk has %d columns but %d data types given", columnCount, dataTypes.size());
        }
        if (spec.size() != columnCount) {
            throw EncodingException.precondition("Chunk has %d columns but %d column specs given", columnCount, spec.size());
        }
        if (chunk.hasMvccColumns() && chunk.mvccColumns().size() < chunk.size()) {
            throw EncodingException.precondition("Chunk has %d rows but only %d mvcc rows", chunk.size(), chunk.mvccColumns().size());
        }

        for (int columnId = 0; columnId < columnCount; columnId++) {
            ColumnEncodingSpec columnSpec = spec.get(columnId);
            if (columnSpec.encodingType == EncodingType.UNENCODED) {
                continue;
            }
            BaseColumn column = chunk.getColumn(columnId);
            if (!(column instanceof ValueColumn)) {
                throw EncodingException.precondition("Column %d is already encoded as %s", columnId, column.encodingType());
            }
            if (column.dataType() != dataTypes.get(columnId)) {
                throw EncodingException.precondition("Column %d holds %s, expected %s",
                        columnId, column.dataType(), dataTypes.get(columnId));
            }
            ColumnEncoder encoder = Encoders.create(columnSpec.encodingType, columnSpec.zsType);
            EncodedColumn encoded = encoder.encode((ValueColumn<?>) column);
            if (logger.isDebugEnabled()) {
                logger.debug("column {} [{}] encoded to {}/{}, rows: {}, memory: {} -> {}",
                        columnId, column.dataType(), encoded.encodingType(), encoded.zsType(),
                        column.size(), column.estimateMemoryUsage(), encoded.estimateMemoryUsage());
            }
            chunk.replaceColumn(columnId, encoded);
        }

        if (chunk.hasMvccColumns()) {
            chunk.shrinkMvccColumns();
        }
    }

    /**
     * Encodes the chunks listed in <code>chunkIds</code>, each by its own spec in <code>specs</code>.
     */
    public static void encodeChunks(Table table, List<Integer> chunkIds, Map<Integer, ChunkEncodingSpec> specs) {
        long time = System.currentTimeMillis();
        for (int chunkId : chunkIds) {
            if (chunkId < 0 || chunkId >= table.chunkCount()) {
                throw EncodingException.precondition("Chunk %d does not exist, table has %d chunks", chunkId, table.chunkCount());
            }
            ChunkEncodingSpec spec = specs.get(chunkId);
            if (spec == null) {
                throw EncodingException.precondition("No encoding spec for chunk %d", chunkId);
            }
            encodeChunk(table.getChunk(chunkId), table.columnTypes(), spec);
        }
        logger.info("encoded {} chunks, took {}ms", chunkIds.size(), System.currentTimeMillis() - time);
    }

    /**
     * Encodes every chunk of the table, chunk <code>i</code> by <code>specs.get(i)</code>.
     */
    public static void encodeAllChunks(Table table, List<ChunkEncodingSpec> specs) {
        if (specs.size() != table.chunkCount()) {
            throw EncodingException.precondition("Table has %d chunks but %d chunk specs given", table.chunkCount(), specs.size());
        }
        long time = System.currentTimeMillis();
        for (int chunkId = 0; chunkId < specs.size(); chunkId++) {
            encodeChunk(table.getChunk(chunkId), table.columnTypes(), specs.get(chunkId));
        }
        logger.info("encoded all {} chunks, took {}ms", specs.size(), System.currentTimeMillis() - time);
    }

    /**
     * Encodes every chunk of the table with the same spec.
     */
    public static void encodeAllChunks(Table table, ChunkEncodingSpec spec) {
        long time = System.currentTimeMillis();
        for (int chunkId = 0; chunkId < table.chunkCount(); chunkId++) {
            encodeChunk(table.getChunk(chunkId), table.columnTypes(), spec);
        }
        logger.info("encoded all {} chunks with {}, took {}ms", table.chunkCount(), spec, System.currentTimeMillis() - time);
    }

    /**
     * Encodes every column of every chunk with the configured default encoding.
     */
    public static void encodeAllChunks(Table table) {
        encodeAllChunks(table, ChunkEncodingSpec.uniform(table.columnCount(), defaultColumnSpec()));
    }

    public static ColumnEncodingSpec defaultColumnSpec() {
        EncodingType encodingType = EncodingType.fromName(StorageConfig.DEFAULT_ENCODING.get());
        ZsType zsType = encodingType.usesZeroSuppression ? Encoders.defaultZsType() : null;
        return new ColumnEncodingSpec(encodingType, zsType);
    }
}
