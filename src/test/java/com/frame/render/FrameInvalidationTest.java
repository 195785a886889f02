package com.frame.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FrameInvalidation and RenderMode.
 */
class FrameInvalidationTest {

    @ParameterizedTest(name = "{0}: invalidated={1}, hold={2}, advance={3} -> {4}")
    @CsvSource({
            "ALWAYS,    false, false, false, true",
            "ALWAYS,    true,  true,  true,  true",
            "ON_DEMAND, false, false, false, false",
            "ON_DEMAND, true,  false, false, true",
            "ON_DEMAND, false, true,  false, true",
            "ON_DEMAND, false, false, true,  false",
            "MANUAL,    false, false, false, false",
            "MANUAL,    true,  true,  false, false",
            "MANUAL,    false, false, true,  true"
    })
    @DisplayName("shouldRender combines mode and flags")
    void shouldRenderDecision(RenderMode mode, boolean invalidated, boolean hold, boolean advance,
                              boolean expected) {
        FrameInvalidation invalidation = new FrameInvalidation(mode);
        invalidation.reset();

        if (invalidated) {
            invalidation.invalidate();
        }
        if (hold) {
            invalidation.hold("controls");
        }
        if (advance) {
            invalidation.advance();
        }

        assertEquals(expected, invalidation.shouldRender());
    }

    @Test
    @DisplayName("New instance starts invalidated so the first frame renders")
    void startsInvalidated() {
        FrameInvalidation invalidation = new FrameInvalidation(RenderMode.ON_DEMAND);

        assertTrue(invalidation.isFrameInvalidated());
        assertTrue(invalidation.shouldRender());
    }

    @Test
    @DisplayName("reset clears per-frame flags but keeps holds")
    void resetKeepsHolds() {
        FrameInvalidation invalidation = new FrameInvalidation(RenderMode.ON_DEMAND);
        invalidation.advance();
        invalidation.hold("orbit-controls");

        invalidation.reset();

        assertFalse(invalidation.isFrameInvalidated());
        assertFalse(invalidation.isAdvanceRequested());
        assertTrue(invalidation.shouldRender());

        assertTrue(invalidation.release("orbit-controls"));
        assertFalse(invalidation.shouldRender());
    }

    @Test
    @DisplayName("hold and release report whether they changed anything")
    void holdAndReleaseAreIdempotent() {
        FrameInvalidation invalidation = new FrameInvalidation(RenderMode.ON_DEMAND);
        Object owner = new Object();

        assertTrue(invalidation.hold(owner));
        assertFalse(invalidation.hold(owner));
        assertEquals(1, invalidation.getHolds().size());
        assertTrue(invalidation.release(owner));
        assertFalse(invalidation.release(owner));
    }

    @Test
    @DisplayName("Render mode can change at runtime")
    void changeRenderMode() {
        FrameInvalidation invalidation = new FrameInvalidation(RenderMode.ON_DEMAND);
        invalidation.reset();
        assertFalse(invalidation.shouldRender());

        invalidation.setRenderMode(RenderMode.ALWAYS);

        assertEquals(RenderMode.ALWAYS, invalidation.getRenderMode());
        assertTrue(invalidation.shouldRender());
    }

    @ParameterizedTest
    @CsvSource({
            "always,    ALWAYS",
            "on-demand, ON_DEMAND",
            "ON_DEMAND, ON_DEMAND",
            "Manual,    MANUAL"
    })
    @DisplayName("Render mode names parse case-insensitively")
    void parseRenderMode(String value, RenderMode expected) {
        assertEquals(expected, RenderMode.parse(value));
    }

    @Test
    @DisplayName("Unknown render mode name is rejected")
    void parseUnknownRenderMode() {
        assertThrows(IllegalArgumentException.class, () -> RenderMode.parse("sometimes"));
        assertThrows(IllegalArgumentException.class, () -> RenderMode.parse(" "));
    }
}
