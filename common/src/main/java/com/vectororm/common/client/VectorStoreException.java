package com.vectororm.common.client;

/**
 * Failure reported by a vector database or by the transport to it.
 */
public class VectorStoreException extends RuntimeException {

    public static final int TRANSPORT_ERROR = -1;

    private final int code;

    public VectorStoreException(String message) {
        this(TRANSPORT_ERROR, message);
    }

    public VectorStoreException(int code, String message) {
        super(message);
        this.code = code;
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
        this.code = TRANSPORT_ERROR;
    }

    /**
     * Error code returned by the store, or {@link #TRANSPORT_ERROR}
     */
    public int getCode() {
        return code;
    }
}
