package com.frame.core;

import com.frame.graph.Dependent;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named unit of work owned by a {@link Stage}.
 * <p>
 * A stopped task keeps its place in the dependency graph and only skips its
 * callback. Once removed, a task never re-enters its stage; registering the
 * same key again creates a new task.
 */
public final class Task implements Dependent {

    private final Stage stage;
    private final Key key;
    private final TaskCallback callback;
    private Set<Key> after;
    private Set<Key> before;
    private boolean enabled;
    private boolean removed;

    Task(Stage stage, Key key, TaskCallback callback, TaskOptions options) {
        this.stage = stage;
        this.key = key;
        this.callback = callback;
        this.after = options.after();
        this.before = options.before();
        this.enabled = options.enabled();
    }

    @Override
    public Key key() {
        return key;
    }

    /**
     * Owning stage.
     */
    public Stage stage() {
        return stage;
    }

    @Override
    public Set<Key> after() {
        return after;
    }

    @Override
    public Set<Key> before() {
        return before;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isRemoved() {
        return removed;
    }

    /**
     * Enable the task. Takes effect from the next pass over the stage's tasks.
     */
    public void start() {
        enabled = true;
    }

    /**
     * Disable the task. Its position still constrains its neighbours.
     */
    public void stop() {
        enabled = false;
    }

    /**
     * Replace the task's constraint sets.
     *
     * @param after  New after-set, or null to keep the current one
     * @param before New before-set, or null to keep the current one
     */
    public void setDependencies(Collection<Key> after, Collection<Key> before) {
        if (removed) {
            throw new IllegalStateException("Task '" + key + "' has been removed");
        }
        if (after != null) {
            this.after = Collections.unmodifiableSet(new LinkedHashSet<>(after));
        }
        if (before != null) {
            this.before = Collections.unmodifiableSet(new LinkedHashSet<>(before));
        }
        stage.markDirty();
    }

    /**
     * Remove the task from its stage.
     *
     * @return true if removed, false if the task had already been removed
     */
    public boolean remove() {
        return stage.detach(this);
    }

    void invoke(double deltaSeconds) {
        callback.run(deltaSeconds);
    }

    void markRemoved() {
        removed = true;
    }

    @Override
    public String toString() {
        return "Task[" + stage.key() + "/" + key + (enabled ? "" : ", stopped") + "]";
    }
}
