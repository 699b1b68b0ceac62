package io.chronoledger.core;

/** Root of every failure raised while recording entity history. */
public class TemporalException extends RuntimeException {
    public TemporalException(String message) { super(message); }
    public TemporalException(String message, Throwable cause) { super(message, cause); }
}
