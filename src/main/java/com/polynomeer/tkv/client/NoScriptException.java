package com.polynomeer.tkv.client;

/**
 * EVALSHA named a script the server does not have (never loaded, or SCRIPT FLUSH since).
 */
public class NoScriptException extends StoreClientException {
    public NoScriptException(String message) {
        super(message);
    }
}
