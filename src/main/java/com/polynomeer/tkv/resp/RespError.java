package com.polynomeer.tkv.resp;

/**
 * Malformed RESP input, in a command frame read by the server or a reply read by a client.
 * The connection that produced it cannot be resynchronized and should be closed.
 */
public class RespError extends RuntimeException {
    public RespError(String msg) {
        super(msg);
    }

    public RespError(String msg, Throwable cause) {
        super(msg, cause);
    }
}
