package com.polynomeer.tkv.client;

/**
 * Transport failure, protocol failure or error reply from the backing store.
 */
public class StoreClientException extends RuntimeException {
    public StoreClientException(String message) {
        super(message);
    }

    public StoreClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
