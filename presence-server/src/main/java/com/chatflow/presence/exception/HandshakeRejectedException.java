package com.chatflow.presence.exception;

/**
 * Identity resolution failed; the connection never reaches the registry.
 */
public class HandshakeRejectedException extends RuntimeException {

    public HandshakeRejectedException(String message) {
        super(message);
    }

    public HandshakeRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
