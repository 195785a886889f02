package com.frame.core;

import com.frame.exception.CyclicDependencyException;
import com.frame.exception.DuplicateKeyException;
import com.frame.graph.DependencyResolver;
import com.frame.graph.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default single-threaded scheduler.
 * Stage order is cached and recomputed only after a structural change.
 */
public class DefaultFrameScheduler implements FrameScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultFrameScheduler.class);

    private final Map<Key, Stage> stages = new LinkedHashMap<>();
    private final List<FrameListener> listeners = new CopyOnWriteArrayList<>();
    private List<Stage> order = List.of();
    private Set<Key> unresolvedReferences = Set.of();
    private boolean dirty = true;
    private boolean running;
    private long frameCount;

    public DefaultFrameScheduler() {
        log.info("DefaultFrameScheduler initialized");
    }

    @Override
    public Stage createStage(Key key) {
        return createStage(key, StageOptions.defaults());
    }

    @Override
    public Stage createStage(String key) {
        return createStage(Key.of(key), StageOptions.defaults());
    }

    @Override
    public Stage createStage(String key, StageOptions options) {
        return createStage(Key.of(key), options);
    }

    @Override
    public Stage createStage(Key key, StageOptions options) {
        Objects.requireNonNull(key, "Stage key cannot be null");
        if (stages.containsKey(key)) {
            throw new DuplicateKeyException(key, "scheduler");
        }

        Stage stage = new Stage(this, key, options != null ? options : StageOptions.defaults());
        stages.put(key, stage);
        markDirty();
        log.debug("Stage '{}' created (after={}, before={}, gated={})",
                key, stage.after(), stage.before(), stage.gate().isPresent());
        return stage;
    }

    @Override
    public Optional<Stage> getStage(Key key) {
        return Optional.ofNullable(stages.get(key));
    }

    @Override
    public boolean removeStage(Key key) {
        Stage stage = stages.get(key);
        if (stage == null) {
            log.warn("Stage '{}' is not registered, nothing to remove", key);
            notifyStaleRemoval(null, key);
            return false;
        }
        return detach(stage);
    }

    boolean detach(Stage stage) {
        if (stage.isRemoved() || stages.get(stage.key()) != stage) {
            log.warn("Stage '{}' was already removed", stage.key());
            notifyStaleRemoval(null, stage.key());
            return false;
        }
        stages.remove(stage.key());
        stage.markRemoved();
        markDirty();
        log.debug("Stage '{}' removed", stage.key());
        return true;
    }

    @Override
    public Collection<Stage> stages() {
        return Collections.unmodifiableList(new ArrayList<>(stages.values()));
    }

    @Override
    public List<Key> resolvedOrder() {
        return ensureOrder().stream().map(Stage::key).toList();
    }

    @Override
    public List<Key> cachedOrder() {
        return order.stream().map(Stage::key).toList();
    }

    @Override
    public Set<Key> unresolvedReferences() {
        ensureOrder();
        return unresolvedReferences;
    }

    @Override
    public void runFrame(double deltaSeconds) {
        if (Double.isNaN(deltaSeconds) || deltaSeconds < 0) {
            throw new IllegalArgumentException("Delta time must be a non-negative number: " + deltaSeconds);
        }
        if (running) {
            throw new IllegalStateException("runFrame cannot be called from inside a frame");
        }

        List<Stage> snapshot;
        try {
            snapshot = ensureOrder();
        } catch (CyclicDependencyException e) {
            log.error("Frame {} skipped: {}", frameCount + 1, e.getMessage());
            throw e;
        }

        running = true;
        try {
            for (Stage stage : snapshot) {
                stage.run(deltaSeconds);
            }
            frameCount++;
        } finally {
            running = false;
        }
    }

    @Override
    public long frameCount() {
        return frameCount;
    }

    @Override
    public void addListener(FrameListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeListener(FrameListener listener) {
        listeners.remove(listener);
    }

    public boolean isDirty() {
        return dirty;
    }

    void markDirty() {
        dirty = true;
    }

    private List<Stage> ensureOrder() {
        if (!dirty) {
            return order;
        }
        Resolution<Stage> resolution = DependencyResolver.resolve(new ArrayList<>(stages.values()));
        order = resolution.order();
        unresolvedReferences = resolution.unresolvedReferences();
        dirty = false;
        if (!unresolvedReferences.isEmpty()) {
            log.debug("Ignoring unknown stage references {}", unresolvedReferences);
        }
        log.debug("Stage order resolved: {}", resolution.keys());
        return order;
    }

    // =====================================================================
    // Listener notification
    // =====================================================================

    void notifyTaskFailed(Task task, Throwable error) {
        for (FrameListener listener : listeners) {
            try {
                listener.taskFailed(task, error);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on task failure of '{}'", listener, task.key(), e);
            }
        }
    }

    void notifyStageFailed(Stage stage, Throwable error) {
        for (FrameListener listener : listeners) {
            try {
                listener.stageFailed(stage, error);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on stage failure of '{}'", listener, stage.key(), e);
            }
        }
    }

    void notifyStaleRemoval(Key owner, Key key) {
        for (FrameListener listener : listeners) {
            try {
                listener.staleRemoval(owner, key);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on stale removal of '{}'", listener, key, e);
            }
        }
    }
}
