package com.frame.config;

import com.frame.render.RenderMode;

/**
 * Render stage configuration.
 *
 * @param mode       When the render stage runs its tasks
 * @param autoRender Whether the built-in auto-render task is enabled
 */
public record RenderConfig(
        RenderMode mode,
        boolean autoRender
) {
    public static RenderConfig defaults() {
        return new RenderConfig(RenderMode.ON_DEMAND, true);
    }
}
