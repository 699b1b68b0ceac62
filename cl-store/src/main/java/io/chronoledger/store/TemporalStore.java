package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;

import java.util.concurrent.Flow;

/** Committed view of a store, plus a feed of versions as their transactions commit. */
public interface TemporalStore extends TemporalQueries {
    Flow.Publisher<ClockRecord> subscribe();
}
