package com.frame.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registration options for a task.
 *
 * @param after   Keys of sibling tasks that must run before this task
 * @param before  Keys of sibling tasks that must run after this task
 * @param enabled Whether the task starts enabled
 */
public record TaskOptions(
        Set<Key> after,
        Set<Key> before,
        boolean enabled
) {
    public TaskOptions {
        after = after == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(after));
        before = before == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(before));
    }

    public static TaskOptions defaults() {
        return new TaskOptions(Set.of(), Set.of(), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<Key> after = new LinkedHashSet<>();
        private final Set<Key> before = new LinkedHashSet<>();
        private boolean enabled = true;

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

        public Builder after(Task task) {
            after.add(task.key());
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

        public Builder before(Task task) {
            before.add(task.key());
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public TaskOptions build() {
            return new TaskOptions(after, before, enabled);
        }
    }
}
