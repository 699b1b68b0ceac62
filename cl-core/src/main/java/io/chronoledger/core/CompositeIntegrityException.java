package io.chronoledger.core;

import java.util.List;

/** A composite attribute had only some of its members resolvable. */
public class CompositeIntegrityException extends TemporalException {
    private final String attribute;
    private final List<String> missing;

    public CompositeIntegrityException(String attribute, List<String> missing) {
        super("composite " + attribute + " is missing members " + missing);
        this.attribute = attribute;
        this.missing = List.copyOf(missing);
    }

    public String attribute() { return attribute; }
    public List<String> missing() { return missing; }
}
