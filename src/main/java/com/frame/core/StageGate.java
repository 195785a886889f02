package com.frame.core;

/**
 * Wraps the execution of a stage's tasks.
 * <p>
 * The gate decides whether and how often to invoke {@code runTasks}. The
 * scheduler never inspects that decision.
 */
@FunctionalInterface
public interface StageGate {

    /**
     * @param deltaSeconds Time elapsed since the previous frame, in seconds
     * @param runTasks     Runs every enabled task of the stage in resolved order
     */
    void run(double deltaSeconds, Runnable runTasks);
}
