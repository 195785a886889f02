package com.frame.core;

/**
 * Receives failures that the scheduler isolates instead of propagating.
 * All methods default to no-ops.
 */
public interface FrameListener {

    /**
     * A task callback threw. The remaining tasks of the stage still run.
     */
    default void taskFailed(Task task, Throwable error) {
    }

    /**
     * A stage could not run its tasks this frame, either because its task
     * graph is cyclic or because its gate threw. The remaining stages still run.
     */
    default void stageFailed(Stage stage, Throwable error) {
    }

    /**
     * A task or stage was removed a second time.
     *
     * @param owner Key of the stage (for tasks) or null (for stages)
     * @param key   Key of the removed item
     */
    default void staleRemoval(Key owner, Key key) {
    }
}
