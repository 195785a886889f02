package com.frame.core;

import com.frame.exception.CyclicDependencyException;
import com.frame.exception.DuplicateKeyException;
import com.frame.graph.Dependent;
import com.frame.graph.DependencyResolver;
import com.frame.graph.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A phase of the frame pipeline holding an ordered set of tasks.
 * <p>
 * Task order is recomputed lazily: structural changes only mark the stage
 * dirty, and the next {@link #run(double)} or {@link #resolvedOrder()} call
 * resolves it again. A pass over the tasks works on the order resolved when
 * the pass began, so tasks added or removed from inside a callback only
 * show up in the next frame.
 */
public final class Stage implements Dependent {

    private static final Logger log = LoggerFactory.getLogger(Stage.class);

    private final DefaultFrameScheduler scheduler;
    private final Key key;
    private final StageGate gate;
    private final Map<Key, Task> tasks = new LinkedHashMap<>();
    private Set<Key> after;
    private Set<Key> before;

    private List<Task> order = List.of();
    private Set<Key> unresolvedReferences = Set.of();
    private boolean dirty = true;
    private boolean removed;

    Stage(DefaultFrameScheduler scheduler, Key key, StageOptions options) {
        this.scheduler = scheduler;
        this.key = key;
        this.gate = options.gate();
        this.after = options.after();
        this.before = options.before();
    }

    @Override
    public Key key() {
        return key;
    }

    @Override
    public Set<Key> after() {
        return after;
    }

    @Override
    public Set<Key> before() {
        return before;
    }

    public Optional<StageGate> gate() {
        return Optional.ofNullable(gate);
    }

    public boolean isRemoved() {
        return removed;
    }

    // =====================================================================
    // Task membership
    // =====================================================================

    public Task createTask(String key, TaskCallback callback) {
        return createTask(Key.of(key), callback, TaskOptions.defaults());
    }

    public Task createTask(String key, TaskCallback callback, TaskOptions options) {
        return createTask(Key.of(key), callback, options);
    }

    public Task createTask(Key key, TaskCallback callback) {
        return createTask(key, callback, TaskOptions.defaults());
    }

    /**
     * Register a task in this stage.
     *
     * @throws DuplicateKeyException if a task with the same key is registered
     */
    public Task createTask(Key key, TaskCallback callback, TaskOptions options) {
        Objects.requireNonNull(key, "Task key cannot be null");
        Objects.requireNonNull(callback, "Task callback cannot be null");
        if (tasks.containsKey(key)) {
            throw new DuplicateKeyException(key, "stage '" + this.key + "'");
        }

        Task task = new Task(this, key, callback, options != null ? options : TaskOptions.defaults());
        tasks.put(key, task);
        markDirty();
        log.debug("Task '{}' created in stage '{}' (after={}, before={}, enabled={})",
                key, this.key, task.after(), task.before(), task.isEnabled());
        return task;
    }

    public Optional<Task> getTask(Key key) {
        return Optional.ofNullable(tasks.get(key));
    }

    public Optional<Task> getTask(String key) {
        return getTask(Key.of(key));
    }

    /**
     * Remove a task by key.
     *
     * @return true if removed, false if no such task is registered
     */
    public boolean removeTask(Key key) {
        Task task = tasks.get(key);
        if (task == null) {
            log.warn("Task '{}' is not registered in stage '{}', nothing to remove", key, this.key);
            scheduler.notifyStaleRemoval(this.key, key);
            return false;
        }
        return detach(task);
    }

    public boolean removeTask(String key) {
        return removeTask(Key.of(key));
    }

    boolean detach(Task task) {
        if (task.isRemoved() || tasks.get(task.key()) != task) {
            log.warn("Task '{}' was already removed from stage '{}'", task.key(), key);
            scheduler.notifyStaleRemoval(key, task.key());
            return false;
        }
        tasks.remove(task.key());
        task.markRemoved();
        markDirty();
        log.debug("Task '{}' removed from stage '{}'", task.key(), key);
        return true;
    }

    /**
     * Registered tasks in registration order.
     */
    public Collection<Task> tasks() {
        return Collections.unmodifiableList(new ArrayList<>(tasks.values()));
    }

    // =====================================================================
    // Stage-level dependencies
    // =====================================================================

    /**
     * Replace the stage's constraint sets.
     *
     * @param after  New after-set, or null to keep the current one
     * @param before New before-set, or null to keep the current one
     */
    public void setDependencies(Collection<Key> after, Collection<Key> before) {
        if (removed) {
            throw new IllegalStateException("Stage '" + key + "' has been removed");
        }
        if (after != null) {
            this.after = Collections.unmodifiableSet(new LinkedHashSet<>(after));
        }
        if (before != null) {
            this.before = Collections.unmodifiableSet(new LinkedHashSet<>(before));
        }
        scheduler.markDirty();
    }

    /**
     * Remove this stage from its scheduler.
     *
     * @return true if removed, false if it had already been removed
     */
    public boolean remove() {
        return scheduler.detach(this);
    }

    // =====================================================================
    // Order
    // =====================================================================

    /**
     * Task keys in execution order, recomputing if needed.
     *
     * @throws CyclicDependencyException if the task constraints contain a cycle
     */
    public List<Key> resolvedOrder() {
        return ensureOrder().stream().map(Task::key).toList();
    }

    /**
     * Task keys from the last successful resolution, without recomputing.
     */
    public List<Key> cachedOrder() {
        return order.stream().map(Task::key).toList();
    }

    /**
     * Task constraint keys that named no registered task at the last
     * resolution. They become active as soon as a task with that key is
     * registered.
     */
    public Set<Key> unresolvedReferences() {
        ensureOrder();
        return unresolvedReferences;
    }

    public boolean isDirty() {
        return dirty;
    }

    void markDirty() {
        dirty = true;
    }

    private List<Task> ensureOrder() {
        if (!dirty) {
            return order;
        }
        Resolution<Task> resolution = DependencyResolver.resolve(new ArrayList<>(tasks.values()));
        order = resolution.order();
        unresolvedReferences = resolution.unresolvedReferences();
        dirty = false;
        if (!unresolvedReferences.isEmpty()) {
            log.debug("Stage '{}' ignores unknown task references {}", key, unresolvedReferences);
        }
        log.debug("Stage '{}' task order resolved: {}", key, resolution.keys());
        return order;
    }

    // =====================================================================
    // Execution
    // =====================================================================

    /**
     * Run this stage for one frame. A task cycle or a failing gate skips the
     * stage for this frame and is reported to the scheduler's listeners.
     */
    public void run(double deltaSeconds) {
        List<Task> snapshot;
        try {
            snapshot = ensureOrder();
        } catch (CyclicDependencyException e) {
            log.error("Stage '{}' skipped this frame: {}", key, e.getMessage());
            scheduler.notifyStageFailed(this, e);
            return;
        }

        Runnable runTasks = () -> runTasks(snapshot, deltaSeconds);
        if (gate == null) {
            runTasks.run();
            return;
        }
        try {
            gate.run(deltaSeconds, runTasks);
        } catch (RuntimeException e) {
            log.error("Gate of stage '{}' failed", key, e);
            scheduler.notifyStageFailed(this, e);
        }
    }

    private void runTasks(List<Task> snapshot, double deltaSeconds) {
        List<Task> enabled = snapshot.stream().filter(Task::isEnabled).toList();
        for (Task task : enabled) {
            try {
                task.invoke(deltaSeconds);
            } catch (RuntimeException e) {
                log.error("Task '{}' in stage '{}' failed", task.key(), key, e);
                scheduler.notifyTaskFailed(task, e);
            }
        }
    }

    void markRemoved() {
        removed = true;
    }

    @Override
    public String toString() {
        return "Stage[" + key + ", tasks=" + tasks.size() + (gate != null ? ", gated" : "") + "]";
    }
}
