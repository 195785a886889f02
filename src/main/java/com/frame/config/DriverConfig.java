package com.frame.config;

/**
 * Configuration for the fixed-rate frame driver.
 *
 * @param targetFps       Frames per second the driver aims for
 * @param maxDeltaSeconds Upper bound on the delta passed to a frame (longer gaps are clamped)
 */
public record DriverConfig(
        int targetFps,
        double maxDeltaSeconds
) {
    public static DriverConfig defaults() {
        return new DriverConfig(60, 0.1);
    }

    /**
     * Frame period in nanoseconds.
     */
    public long periodNanos() {
        return 1_000_000_000L / targetFps;
    }
}
