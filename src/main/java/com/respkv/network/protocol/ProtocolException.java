package com.respkv.network.protocol;

/**
 * Exception thrown when the incoming byte stream is not valid RESP.
 * The stream cannot be resynchronized, so the connection must be closed.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
