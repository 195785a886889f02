package com.frame.config;

import java.util.List;

/**
 * Root configuration of a frame pipeline.
 *
 * @param name   Pipeline name, used in logs
 * @param render Render stage configuration
 * @param driver Frame driver configuration
 * @param stages Additional stages created next to the default main and render stages
 */
public record FrameConfig(
        String name,
        RenderConfig render,
        DriverConfig driver,
        List<StageConfig> stages
) {
    public FrameConfig {
        render = render == null ? RenderConfig.defaults() : render;
        driver = driver == null ? DriverConfig.defaults() : driver;
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static FrameConfig defaults() {
        return new FrameConfig("default-frame", RenderConfig.defaults(), DriverConfig.defaults(), List.of());
    }
}
