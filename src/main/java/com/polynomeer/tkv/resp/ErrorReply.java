package com.polynomeer.tkv.resp;

/**
 * A decoded "-ERR ..." reply. Returned as a value so callers can attach the failing command.
 */
public final class ErrorReply {
    private final String message;

    public ErrorReply(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    /**
     * First word of the message, e.g. "ERR", "NOSCRIPT", "WRONGTYPE".
     */
    public String code() {
        int sp = message.indexOf(' ');
        return sp < 0 ? message : message.substring(0, sp);
    }

    @Override
    public String toString() {
        return message;
    }
}
