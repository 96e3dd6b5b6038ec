package com.polynomeer.tkv;

/**
 * The range script replied with something other than {@code [total, [values...]]}. Usually
 * means the server and this client disagree on the script, not a transient failure.
 */
public class UnexpectedScriptResultException extends StoreException {
    public UnexpectedScriptResultException(String message) {
        super("unexpected result from lua script: " + message);
    }
}
