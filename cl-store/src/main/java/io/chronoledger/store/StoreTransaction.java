package io.chronoledger.store;

/** The store transaction a session records into. */
public interface StoreTransaction {

    TemporalStatements statements();

    /**
     * Run {@code callback} right before the transaction commits. An exception thrown by the
     * callback aborts the commit and rolls everything back.
     */
    void onBeforeCommit(Runnable callback);

    /** The transaction must not commit anymore; ending it rolls everything back. */
    void setRollbackOnly();
}
