package com.frame.render;

import java.util.Locale;

/**
 * When the render stage runs its tasks.
 */
public enum RenderMode {
    /**
     * Render every frame.
     */
    ALWAYS,

    /**
     * Render only when the frame was invalidated or an invalidation hold is active.
     */
    ON_DEMAND,

    /**
     * Render only when an advance was requested for this frame.
     */
    MANUAL;

    /**
     * Parse a mode name such as {@code "on-demand"} or {@code "ON_DEMAND"}.
     *
     * @throws IllegalArgumentException if the name matches no mode
     */
    public static RenderMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Render mode cannot be null or blank");
        }
        return RenderMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
    }
}
