package io.chronoledger.store;

import java.util.function.Consumer;
import java.util.function.Function;

/** Runs work in a fresh transaction with a session whose changes are flushed on commit. */
public interface SessionFactory {

    <T> T inSession(Function<TemporalSession, T> work);

    default void run(Consumer<TemporalSession> work) {
        inSession(s -> { work.accept(s); return null; });
    }
}
