package io.colstore.storage.column;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;

import java.util.Arrays;
import java.util.List;

import io.colstore.data.DataType;

/**
 * The raw, appendable column. Null positions hold <code>null</code>.
 */
public class ValueColumn<T> implements BaseColumn {
    private final DataType dataType;
    private final boolean nullable;
    private final ObjectArrayList<T> values;

    public ValueColumn(DataType dataType, boolean nullable) {
        this.dataType = Preconditions.checkNotNull(dataType);
        this.nullable = nullable;
        this.values = new ObjectArrayList<>();
    }

    /**
     * A nullable column holding a copy of <code>values</code>.
     */
    public static <T> ValueColumn<T> of(DataType dataType, List<T> values) {
        ValueColumn<T> column = new ValueColumn<>(dataType, true);
        for (T v : values) {
            column.append(v);
        }
        return column;
    }

    @SafeVarargs
    public static <T> ValueColumn<T> of(DataType dataType, T... values) {
        return of(dataType, Arrays.asList(values));
    }

    public void append(T value) {
        checkValue(value);
        values.add(value);
    }

    /**
     * Throws {@link IllegalArgumentException} if <code>value</code> can not be appended to this column.
     */
    public void checkValue(Object value) {
        if (value == null) {
            Preconditions.checkArgument(nullable, "Column of %s is not nullable", dataType);
        } else {
            Preconditions.checkArgument(dataType.isInstance(value),
                    "Value [%s] of %s does not match column type %s", value, value.getClass().getSimpleName(), dataType);
        }
    }

    public T get(int index) {
        return values.get(index);
    }

    public boolean isNullAt(int index) {
        return values.get(index) == null;
    }

    public boolean isNullable() {
        return nullable;
    }

    public ObjectList<T> values() {
        return ObjectLists.unmodifiable(values);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public EncodingType encodingType() {
        return EncodingType.UNENCODED;
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public Object valueAt(int index) {
        return values.get(index);
    }

    @Override
    public long estimateMemoryUsage() {
        // One reference per slot.
        long size = (long) values.size() << 3;
        for (T v : values) {
            if (v != null) {
                size += dataType.estimateSize(v);
            }
        }
        return size;
    }
}
