package com.studio.access.exception;

/**
 * The record store could not answer: unreachable, a lookup contract violation such as
 * two records sharing a secret, or stored data this service cannot interpret.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public RecordStoreException(String message) {
        super(message);
    }
}
