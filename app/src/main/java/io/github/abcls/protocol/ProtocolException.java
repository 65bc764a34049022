package io.github.abcls.protocol;

/** A request that cannot be served, with the error code reported to the caller. */
public class ProtocolException extends Exception {
    private final int code;

    public ProtocolException(int code, String message) {
        super(message);
        this.code = code;
    }

    public ProtocolException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
