package io.colstore.storage.iterable;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

/**
 * Rows of a column in order, any number of times.
 */
public interface ColumnIterable<T> {

    int size();

    /**
     * A new cursor before the first row.
     */
    ColumnCursor<T> cursor();

    default void forEach(ColumnValueConsumer<? super T> consumer) {
        ColumnCursor<T> cursor = cursor();
        while (cursor.next()) {
            consumer.accept(cursor.position(), cursor.value(), cursor.isNull());
        }
    }

    /**
     * All values in row order, null rows as <code>null</code>.
     */
    default List<T> toList() {
        ObjectArrayList<T> list = new ObjectArrayList<>(size());
        ColumnCursor<T> cursor = cursor();
        while (cursor.next()) {
            list.add(cursor.value());
        }
        return list;
    }
}
