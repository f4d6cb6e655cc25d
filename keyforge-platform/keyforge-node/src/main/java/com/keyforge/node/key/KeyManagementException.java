package com.keyforge.node.key;

/**
 * Signing keys could not be generated or persisted.
 */
public class KeyManagementException extends RuntimeException {

    public KeyManagementException(String message) {
        super(message);
    }

    public KeyManagementException(String message, Throwable cause) {
        super(message, cause);
    }
}
