package com.pairninja.infra;

/**
 * Durable state could not be written or read.
 */
public class StateStoreException extends Exception {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
