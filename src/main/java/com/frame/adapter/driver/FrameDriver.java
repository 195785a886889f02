package com.frame.adapter.driver;

import java.util.concurrent.TimeUnit;

/**
 * External loop that calls the pipeline once per frame.
 */
public interface FrameDriver {

    /**
     * Start driving frames.
     *
     * @throws IllegalStateException if already started or stopped
     */
    void start();

    /**
     * Stop after the frame in progress, if any.
     */
    void stop();

    /**
     * Wait for the loop to finish after {@link #stop()}.
     *
     * @return true if terminated, false if timeout elapsed
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    boolean isRunning();

    /**
     * Number of frames this driver has attempted, including skipped ones.
     */
    long getFramesDriven();
}
