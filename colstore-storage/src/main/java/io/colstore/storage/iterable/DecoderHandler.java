package io.colstore.storage.iterable;

/**
 * Code written once against {@link ColumnDecoder}, called with whatever decoder a column resolves to.
 */
@FunctionalInterface
public interface DecoderHandler<R> {
    <T> R handle(ColumnDecoder<T> decoder);
}
