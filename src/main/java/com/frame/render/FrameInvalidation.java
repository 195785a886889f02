package com.frame.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-frame render flags read by {@link RenderGate}.
 * <p>
 * The flags are cleared by {@link #reset()} after the frame completes, never
 * by the gate, so the decision stays the same for the whole frame. A new
 * instance starts invalidated so that the first frame renders.
 */
public class FrameInvalidation {

    private static final Logger log = LoggerFactory.getLogger(FrameInvalidation.class);

    private RenderMode renderMode;
    private boolean frameInvalidated = true;
    private boolean advanceRequested;
    private final Set<Object> holds = new LinkedHashSet<>();

    public FrameInvalidation(RenderMode renderMode) {
        this.renderMode = Objects.requireNonNull(renderMode, "Render mode cannot be null");
    }

    public RenderMode getRenderMode() {
        return renderMode;
    }

    public void setRenderMode(RenderMode renderMode) {
        Objects.requireNonNull(renderMode, "Render mode cannot be null");
        if (this.renderMode != renderMode) {
            log.info("Render mode changed: {} -> {}", this.renderMode, renderMode);
            this.renderMode = renderMode;
        }
    }

    /**
     * Mark the current frame as needing a render in {@link RenderMode#ON_DEMAND}.
     */
    public void invalidate() {
        frameInvalidated = true;
    }

    /**
     * Request one render in {@link RenderMode#MANUAL}.
     */
    public void advance() {
        advanceRequested = true;
    }

    /**
     * Keep every frame invalidated until the same owner calls {@link #release(Object)}.
     *
     * @return false if the owner already held an invalidation
     */
    public boolean hold(Object owner) {
        return holds.add(Objects.requireNonNull(owner, "Owner cannot be null"));
    }

    /**
     * @return false if the owner held no invalidation
     */
    public boolean release(Object owner) {
        return holds.remove(owner);
    }

    public Set<Object> getHolds() {
        return Collections.unmodifiableSet(holds);
    }

    public boolean isFrameInvalidated() {
        return frameInvalidated;
    }

    public boolean isAdvanceRequested() {
        return advanceRequested;
    }

    /**
     * Whether render-class tasks should run in the current frame.
     */
    public boolean shouldRender() {
        return switch (renderMode) {
            case ALWAYS -> true;
            case ON_DEMAND -> frameInvalidated || !holds.isEmpty();
            case MANUAL -> advanceRequested;
        };
    }

    /**
     * Clear the per-frame flags. Called by the frame driver once the frame is done.
     * Holds are not affected.
     */
    public void reset() {
        frameInvalidated = false;
        advanceRequested = false;
    }
}
