package com.polynomeer.tkv.db;

/**
 * Signals an operation against a key holding the wrong kind of value.
 */
public class WrongTypeException extends RuntimeException {
    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
