package com.frame.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registration options for a stage.
 *
 * @param after  Keys of stages that must run before this stage
 * @param before Keys of stages that must run after this stage
 * @param gate   Optional gate wrapping the stage's task execution (null runs tasks unconditionally)
 */
public record StageOptions(
        Set<Key> after,
        Set<Key> before,
        StageGate gate
) {
    public StageOptions {
        after = after == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(after));
        before = before == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(before));
    }

    public static StageOptions defaults() {
        return new StageOptions(Set.of(), Set.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<Key> after = new LinkedHashSet<>();
        private final Set<Key> before = new LinkedHashSet<>();
        private StageGate gate;

        private Builder() {
        }

        public Builder after(Key... keys) {
            after.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder after(String... names) {
            for (String name : names) {
                after.add(Key.of(name));
            }
            return this;
        }

        public Builder after(Stage stage) {
            after.add(stage.key());
            return this;
        }

        public Builder before(Key... keys) {
            before.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder before(String... names) {
            for (String name : names) {
                before.add(Key.of(name));
            }
            return this;
        }

        public Builder before(Stage stage) {
            before.add(stage.key());
            return this;
        }

        public Builder gate(StageGate gate) {
            this.gate = gate;
            return this;
        }

        public StageOptions build() {
            return new StageOptions(after, before, gate);
        }
    }
}
