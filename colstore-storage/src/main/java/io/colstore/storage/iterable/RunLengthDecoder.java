package io.colstore.storage.iterable;

import com.google.common.base.Preconditions;

import io.colstore.data.DataType;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.RunLengthColumn;

/**
 * Random access searches the run by its end position, the cursor just steps from run to run.
 */
public final class RunLengthDecoder<T> implements ColumnDecoder<T> {
    private final RunLengthColumn<T> column;

    public RunLengthDecoder(RunLengthColumn<T> column) {
        this.column = column;
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.RUN_LENGTH;
    }

    @Override
    public DataType dataType() {
        return column.dataType();
    }

    @Override
    public int size() {
        return column.size();
    }

    @Override
    public T get(int index) {
        return column.runValue(column.runIndexOf(index));
    }

    @Override
    public boolean isNullAt(int index) {
        return column.isNullRun(column.runIndexOf(index));
    }

    @Override
    public ColumnCursor<T> cursor() {
        return new ColumnCursor<T>() {
            final int size = column.size();
            int pos = -1;
            int run = 0;
            int runEnd = column.runCount() == 0 ? 0 : column.endPosition(0);

            @Override
            public boolean next() {
                if (pos + 1 >= size) {
                    return false;
                }
                pos++;
                if (pos == runEnd) {
                    run++;
                    runEnd = column.endPosition(run);
                }
                return true;
            }

            @Override
            public int position() {
                return pos;
            }

            @Override
            public boolean isNull() {
                Preconditions.checkState(pos >= 0, "Cursor is before the first row");
                return column.isNullRun(run);
            }

            @Override
            public T value() {
                Preconditions.checkState(pos >= 0, "Cursor is before the first row");
                return column.runValue(run);
            }
        };
    }
}
