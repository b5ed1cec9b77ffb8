package io.colstore.storage.iterable;

/**
 * Forward only position over the rows of a column. Starts before the first row,
 * {@link #next()} must be called before reading.
 */
public interface ColumnCursor<T> {

    /**
     * Moves to the next row, returns false if there is none.
     */
    boolean next();

    int position();

    boolean isNull();

    /**
     * The value of current row, null if {@link #isNull()}.
     */
    T value();
}
