package io.colstore.storage;

/**
 * Raised by encoding, packing and dispatch. Those are contract errors, retry with the same input never helps.
 */
public class EncodingException extends RuntimeException {
    private final ErrorCode code;

    public EncodingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EncodingException(ErrorCode code, String format, Object... args) {
        this(code, String.format(format, args));
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }

    public static EncodingException precondition(String format, Object... args) {
        return new EncodingException(ErrorCode.PRECONDITION_VIOLATED, format, args);
    }

    public static EncodingException unsupported(String format, Object... args) {
        return new EncodingException(ErrorCode.UNSUPPORTED_COMBINATION, format, args);
    }

    public static EncodingException capacity(String format, Object... args) {
        return new EncodingException(ErrorCode.CAPACITY_EXCEEDED, format, args);
    }
}
