package io.colstore.storage.encoder;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Objects;

import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.RunLengthColumn;
import io.colstore.storage.column.ValueColumn;

/**
 * Collapses consecutive equal values, nulls included, into maximal runs.
 * Values are compared by {@link Object#equals(Object)}, which agrees with the dictionary order
 * for all supported types.
 */
public class RunLengthEncoder implements ColumnEncoder {
    public static final EncodingType TYPE = EncodingType.RUN_LENGTH;

    @Override
    public EncodingType type() {
        return TYPE;
    }

    @Override
    public <T> RunLengthColumn<T> encode(ValueColumn<T> column) {
        ObjectArrayList<T> values = new ObjectArrayList<>();
        BooleanArrayList nullValues = new BooleanArrayList();
        IntArrayList endPositions = new IntArrayList();

        int valCount = column.size();
        if (valCount > 0) {
            T curVal = column.get(0);
            for (int i = 1; i < valCount; i++) {
                T v = column.get(i);
                if (!Objects.equals(v, curVal)) {
                    values.add(curVal);
                    nullValues.add(curVal == null);
                    endPositions.add(i);
                    curVal = v;
                }
            }
            values.add(curVal);
            nullValues.add(curVal == null);
            endPositions.add(valCount);
        }

        return new RunLengthColumn<>(column.dataType(), values, nullValues, endPositions);
    }
}
