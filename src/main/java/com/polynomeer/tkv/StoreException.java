package com.polynomeer.tkv;

/**
 * Failure of a store operation; the message names the failing step and the cause carries the
 * underlying client error. Nothing is retried on the caller's behalf.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
