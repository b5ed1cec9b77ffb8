package io.colstore.storage.iterable;

@FunctionalInterface
public interface ColumnValueConsumer<T> {
    void accept(int position, T value, boolean isNull);
}
