package com.frame.core;

/**
 * Body of a task, invoked once per frame while the task is enabled.
 */
@FunctionalInterface
public interface TaskCallback {

    /**
     * @param deltaSeconds Time elapsed since the previous frame, in seconds
     */
    void run(double deltaSeconds);
}
