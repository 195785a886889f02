package com.frame.render;

import com.frame.core.StageGate;

import java.util.Objects;

/**
 * Gate that runs the render stage's tasks only when {@link FrameInvalidation#shouldRender()}.
 */
public class RenderGate implements StageGate {

    private final FrameInvalidation invalidation;

    public RenderGate(FrameInvalidation invalidation) {
        this.invalidation = Objects.requireNonNull(invalidation, "Invalidation cannot be null");
    }

    public FrameInvalidation invalidation() {
        return invalidation;
    }

    @Override
    public void run(double deltaSeconds, Runnable runTasks) {
        if (invalidation.shouldRender()) {
            runTasks.run();
        }
    }
}
