package com.frame.config;

import com.frame.core.Key;
import com.frame.core.StageOptions;

import java.util.List;

/**
 * An ungated stage declared in configuration.
 *
 * @param key    Stage key
 * @param after  Keys of stages that must run first
 * @param before Keys of stages that must run later
 */
public record StageConfig(
        String key,
        List<String> after,
        List<String> before
) {
    public StageConfig {
        after = after == null ? List.of() : List.copyOf(after);
        before = before == null ? List.of() : List.copyOf(before);
    }

    public static StageConfig of(String key) {
        return new StageConfig(key, List.of(), List.of());
    }

    /**
     * Registration options for this stage.
     */
    public StageOptions toOptions() {
        StageOptions.Builder builder = StageOptions.builder();
        after.forEach(k -> builder.after(Key.of(k)));
        before.forEach(k -> builder.before(Key.of(k)));
        return builder.build();
    }
}
