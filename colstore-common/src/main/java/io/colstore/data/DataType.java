package io.colstore.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.Ordering;

/**
 * The closed set of value types a column can hold.
 *
 * The id here should never be changed. Please append new types to the end.
 */
public enum DataType {
    INT(1, Integer.class, 4, "INT", "INTEGER"),
    LONG(2, Long.class, 8, "BIGINT", "LONG"),
    FLOAT(3, Float.class, 4, "FLOAT"),
    DOUBLE(4, Double.class, 8, "DOUBLE"),
    STRING(5, String.class, -1, "VARCHAR", "STRING"),
    //
    ;

    public final int id;
    public final Class<?> javaClass;
    /** Fixed value size in bytes, or -1 for variable length types. */
    public final int fixedSize;
    public final String[] names;

    DataType(int id, Class<?> javaClass, int fixedSize, String... names) {
        this.id = id;
        this.javaClass = javaClass;
        this.fixedSize = fixedSize;
        this.names = names;
    }

    public boolean isNumber() {
        return this != STRING;
    }

    public boolean isInstance(Object value) {
        return javaClass.isInstance(value);
    }

    /**
     * The order dictionaries are sorted by. It is the natural order of the java class,
     * so floating point values follow {@link Double#compare(double, double)}.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> Ordering<T> ordering() {
        return (Ordering) Ordering.natural();
    }

    /**
     * Approximate heap bytes one non-null value takes.
     */
    public long estimateSize(Object value) {
        Preconditions.checkArgument(isInstance(value), "%s is not a value of %s", value, this);
        if (fixedSize >= 0) {
            return fixedSize;
        }
        // Object header and fields plus the char data.
        return 40 + (((String) value).length() << 1);
    }

    public static DataType fromId(int id) {
        for (DataType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        throw new IllegalStateException("Illegal data type id: " + id);
    }

    public static DataType fromName(String name) {
        for (DataType type : values()) {
            for (String tname : type.names) {
                if (tname.equalsIgnoreCase(name)) {
                    return type;
                }
            }
        }
        throw new IllegalStateException("Unsupported data type: " + name);
    }
}
