package io.chronoledger.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Brackets a batch of mutations that should become one version per entity.
 *
 * Scopes nest: {@link #enter()} increments a depth counter and only the outermost
 * {@link #exit()} returns the scope to idle. The pending values stay on the mutated
 * entities; nothing is written at exit, and the owning session refuses to flush while
 * the scope is active. A scope belongs to exactly one session and thread.
 *
 * <pre>{@code
 * try (var tick = scope.enter("import-2024-06")) {
 *     entity.set("description", "second description");
 * }
 * }</pre>
 */
public final class RecordingScope {
    private int depth;
    private final List<String> activities = new ArrayList<>();

    public Tick enter() { return enter(null); }

    /** Enter, attributing changes made inside to {@code activity} (may be null). */
    public Tick enter(String activity) {
        depth++;
        activities.add(activity);
        return new Tick();
    }

    public void exit() {
        if (depth == 0) throw new ScopeMisuseException("exit() without a matching enter()");
        activities.remove(activities.size() - 1);
        depth--;
    }

    public boolean isActive() { return depth > 0; }

    public int depth() { return depth; }

    /** Innermost activity named by the enclosing scopes, or null. */
    public String activity() {
        for (int i = activities.size() - 1; i >= 0; i--) {
            if (activities.get(i) != null) return activities.get(i);
        }
        return null;
    }

    /** Handle returned by {@link #enter()}; closing it exits the scope exactly once. */
    public final class Tick implements AutoCloseable {
        private boolean closed;

        private Tick() {}

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            exit();
        }
    }
}
