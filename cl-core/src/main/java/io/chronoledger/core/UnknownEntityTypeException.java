package io.chronoledger.core;

public class UnknownEntityTypeException extends TemporalException {
    public UnknownEntityTypeException(String entityType) {
        super("no temporal policy declared for " + entityType);
    }
}
