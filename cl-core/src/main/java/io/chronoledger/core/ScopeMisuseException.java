package io.chronoledger.core;

/** Programming error in scope handling, e.g. exit without enter. Raised immediately. */
public class ScopeMisuseException extends TemporalException {
    public ScopeMisuseException(String message) { super(message); }
}
