package io.colstore.storage;

public enum ErrorCode {
    /** The input breaks a contract of the operation, e.g. encoding an already encoded column. */
    PRECONDITION_VIOLATED,
    /** Unknown encoding, or a data type / encoding / zs type combination nothing can handle. */
    UNSUPPORTED_COMBINATION,
    /** A value does not fit into any supported packing width. */
    CAPACITY_EXCEEDED,
    //
    ;
}
