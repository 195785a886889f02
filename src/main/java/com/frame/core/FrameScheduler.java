package com.frame.core;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered collection of stages, driven once per frame by an external loop.
 * <p>
 * Not thread-safe: all calls, including structural changes made from inside
 * task callbacks, must come from the thread that calls {@link #runFrame(double)}.
 */
public interface FrameScheduler {

    /**
     * Register a stage with no constraints and no gate.
     *
     * @throws com.frame.exception.DuplicateKeyException if the key is already registered
     */
    Stage createStage(Key key);

    /**
     * Register a stage.
     *
     * @throws com.frame.exception.DuplicateKeyException if the key is already registered
     */
    Stage createStage(Key key, StageOptions options);

    Stage createStage(String key);

    Stage createStage(String key, StageOptions options);

    Optional<Stage> getStage(Key key);

    /**
     * Remove a stage by key.
     *
     * @return true if removed, false if no such stage is registered
     */
    boolean removeStage(Key key);

    /**
     * Registered stages in registration order.
     */
    Collection<Stage> stages();

    /**
     * Stage keys in execution order, recomputing if needed.
     *
     * @throws com.frame.exception.CyclicDependencyException if the stage constraints contain a cycle
     */
    List<Key> resolvedOrder();

    /**
     * Stage keys from the last successful resolution, without recomputing.
     */
    List<Key> cachedOrder();

    /**
     * Stage constraint keys that named no registered stage at the last resolution.
     */
    Set<Key> unresolvedReferences();

    /**
     * Run every stage once, in resolved order.
     *
     * @param deltaSeconds Time since the previous frame, in seconds
     * @throws com.frame.exception.CyclicDependencyException if the stage order cannot be
     *         resolved; no stage runs and the previous order is kept
     */
    void runFrame(double deltaSeconds);

    /**
     * Number of frames that ran to completion.
     */
    long frameCount();

    void addListener(FrameListener listener);

    void removeListener(FrameListener listener);
}
