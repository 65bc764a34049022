package io.github.abcls.protocol;

/** Numeric error codes shared by the editor and socket surfaces. */
public final class ErrorCodes {
    public static final int DOCUMENT_NOT_FOUND = -32001;
    public static final int FILE_TYPE_NOT_SUPPORTED = -32002;
    public static final int INVALID_REQUEST = -32600;
    public static final int UNKNOWN_METHOD = -32601;
    public static final int INVALID_PARAMS = -32602;

    private ErrorCodes() {
        // utility
    }
}
