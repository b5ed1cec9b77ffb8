package io.colstore.storage.column;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.booleans.BooleanList;
import it.unimi.dsi.fastutil.booleans.BooleanLists;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;

import io.colstore.data.DataType;
import io.colstore.storage.pack.ZsType;
import io.colstore.util.BinarySearch;

/**
 * Maximal runs of equal values. Run <code>i</code> covers rows
 * <code>[endPosition(i - 1), endPosition(i))</code>, the first run starts at 0.
 * A null run holds <code>null</code> as its value.
 */
public final class RunLengthColumn<T> implements EncodedColumn {
    private final DataType dataType;
    private final ObjectArrayList<T> values;
    private final BooleanArrayList nullValues;
    private final int[] endPositions;

    public RunLengthColumn(DataType dataType, ObjectArrayList<T> values, BooleanArrayList nullValues, IntArrayList endPositions) {
        Preconditions.checkArgument(values.size() == nullValues.size() && values.size() == endPositions.size(),
                "Runs mismatch, values: %s, nulls: %s, ends: %s", values.size(), nullValues.size(), endPositions.size());
        this.dataType = Preconditions.checkNotNull(dataType);
        this.values = new ObjectArrayList<>(values);
        this.nullValues = new BooleanArrayList(nullValues);
        this.endPositions = endPositions.toIntArray();

        int lastEnd = 0;
        for (int run = 0; run < this.endPositions.length; run++) {
            T v = this.values.get(run);
            Preconditions.checkArgument(this.nullValues.getBoolean(run) == (v == null),
                    "Run %s null flag %s does not match value [%s]", run, this.nullValues.getBoolean(run), v);
            Preconditions.checkArgument(v == null || dataType.isInstance(v),
                    "Run %s value [%s] does not match column type %s", run, v, dataType);
            Preconditions.checkArgument(this.endPositions[run] > lastEnd,
                    "Run %s ends at %s, not after %s", run, this.endPositions[run], lastEnd);
            lastEnd = this.endPositions[run];
        }
    }

    public int runCount() {
        return endPositions.length;
    }

    public ObjectList<T> values() {
        return ObjectLists.unmodifiable(values);
    }

    public BooleanList nullValues() {
        return BooleanLists.unmodifiable(nullValues);
    }

    public IntList endPositions() {
        return IntLists.unmodifiable(IntArrayList.wrap(endPositions));
    }

    public T runValue(int run) {
        return values.get(run);
    }

    public boolean isNullRun(int run) {
        return nullValues.getBoolean(run);
    }

    public int endPosition(int run) {
        return endPositions[run];
    }

    /**
     * The run holding row <code>index</code>.
     */
    public int runIndexOf(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("index: " + index + ", size: " + size());
        }
        return BinarySearch.upperBoundInts(endPositions, endPositions.length, index);
    }

    @Override
    public ZsType zsType() {
        return null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.RUN_LENGTH;
    }

    @Override
    public int size() {
        return endPositions.length == 0 ? 0 : endPositions[endPositions.length - 1];
    }

    @Override
    public Object valueAt(int index) {
        return values.get(runIndexOf(index));
    }

    @Override
    public long estimateMemoryUsage() {
        long size = ((long) values.size() << 3) + nullValues.size() + ((long) endPositions.length << 2);
        for (T v : values) {
            if (v != null) {
                size += dataType.estimateSize(v);
            }
        }
        return size;
    }
}
