package com.frame.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that records every notification, for assertions.
 */
class RecordingListener implements FrameListener {

    final List<String> taskFailures = new ArrayList<>();
    final List<Throwable> taskErrors = new ArrayList<>();
    final List<String> stageFailures = new ArrayList<>();
    final List<Throwable> stageErrors = new ArrayList<>();
    final List<String> staleRemovals = new ArrayList<>();

    @Override
    public void taskFailed(Task task, Throwable error) {
        taskFailures.add(task.key().name());
        taskErrors.add(error);
    }

    @Override
    public void stageFailed(Stage stage, Throwable error) {
        stageFailures.add(stage.key().name());
        stageErrors.add(error);
    }

    @Override
    public void staleRemoval(Key owner, Key key) {
        staleRemovals.add((owner != null ? owner.name() + "/" : "") + key.name());
    }
}
