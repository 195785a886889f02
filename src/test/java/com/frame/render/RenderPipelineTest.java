package com.frame.render;

import com.frame.config.DriverConfig;
import com.frame.config.FrameConfig;
import com.frame.config.RenderConfig;
import com.frame.config.StageConfig;
import com.frame.core.Key;
import com.frame.core.StageOptions;
import com.frame.core.TaskOptions;
import com.frame.exception.CyclicDependencyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RenderPipeline and the render gate.
 */
class RenderPipelineTest {

    private final AtomicInteger renders = new AtomicInteger();

    private RenderPipeline pipeline(RenderMode mode) {
        return RenderPipeline.builder()
                .renderMode(mode)
                .renderer(renders::incrementAndGet)
                .build();
    }

    private void runFrames(RenderPipeline pipeline, int frames) {
        for (int i = 0; i < frames; i++) {
            pipeline.runFrame(1.0 / 60);
        }
    }

    @Test
    @DisplayName("Default pipeline has a main stage followed by a gated render stage")
    void defaultStages() {
        RenderPipeline pipeline = pipeline(RenderMode.ALWAYS);

        assertEquals(List.of(RenderPipeline.MAIN_STAGE, RenderPipeline.RENDER_STAGE),
                pipeline.getScheduler().resolvedOrder());
        assertTrue(pipeline.getRenderStage().gate().isPresent());
        assertTrue(pipeline.getMainStage().gate().isEmpty());
        assertSame(pipeline.getRenderStage(), pipeline.getAutoRenderTask().stage());
    }

    @Test
    @DisplayName("Always mode renders every frame")
    void alwaysRendersEveryFrame() {
        RenderPipeline pipeline = pipeline(RenderMode.ALWAYS);

        runFrames(pipeline, 5);

        assertEquals(5, renders.get());
    }

    @Test
    @DisplayName("Manual mode renders only frames with an advance request")
    void manualRendersOnAdvance() {
        RenderPipeline pipeline = pipeline(RenderMode.MANUAL);

        runFrames(pipeline, 3);
        assertEquals(0, renders.get());

        pipeline.advance();
        runFrames(pipeline, 3);

        assertEquals(1, renders.get());
    }

    @Test
    @DisplayName("On-demand mode renders the first frame and invalidated frames")
    void onDemandRendersWhenInvalidated() {
        RenderPipeline pipeline = pipeline(RenderMode.ON_DEMAND);

        runFrames(pipeline, 3);
        assertEquals(1, renders.get());

        pipeline.invalidate();
        runFrames(pipeline, 2);
        assertEquals(2, renders.get());
    }

    @Test
    @DisplayName("Invalidation hold keeps rendering until released")
    void holdKeepsRendering() {
        RenderPipeline pipeline = pipeline(RenderMode.ON_DEMAND);
        runFrames(pipeline, 1);

        pipeline.getInvalidation().hold("camera-animation");
        runFrames(pipeline, 3);
        pipeline.getInvalidation().release("camera-animation");
        runFrames(pipeline, 3);

        assertEquals(4, renders.get());
    }

    @Test
    @DisplayName("Main stage task invalidating the frame renders that same frame")
    void invalidationFromMainStageRendersSameFrame() {
        RenderPipeline pipeline = pipeline(RenderMode.ON_DEMAND);
        runFrames(pipeline, 1);
        AtomicInteger frame = new AtomicInteger();
        pipeline.createTask("animate", delta -> {
            if (frame.incrementAndGet() == 2) {
                pipeline.invalidate();
            }
        });

        runFrames(pipeline, 3);

        assertEquals(2, renders.get());
    }

    @Test
    @DisplayName("Gate decision holds for the whole frame even if a later stage invalidates")
    void invalidationAfterRenderStageAppliesNextFrame() {
        RenderPipeline pipeline = pipeline(RenderMode.ON_DEMAND);
        runFrames(pipeline, 1);
        pipeline.getScheduler()
                .createStage("late", StageOptions.builder().after(RenderPipeline.RENDER_STAGE).build())
                .createTask("invalidate", delta -> pipeline.invalidate());

        runFrames(pipeline, 1);

        // The flag raised after rendering is cleared when the frame ends
        assertEquals(1, renders.get());
        assertFalse(pipeline.getInvalidation().isFrameInvalidated());
    }

    @Test
    @DisplayName("Disabling auto-render stops the built-in render task")
    void autoRenderToggle() {
        RenderPipeline pipeline = pipeline(RenderMode.ALWAYS);

        pipeline.setAutoRender(false);
        runFrames(pipeline, 2);
        assertEquals(0, renders.get());
        assertFalse(pipeline.getAutoRenderTask().isEnabled());

        pipeline.setAutoRender(true);
        runFrames(pipeline, 2);
        assertEquals(2, renders.get());
    }

    @Test
    @DisplayName("Custom render task in the render stage is gated too")
    void customRenderTaskIsGated() {
        RenderPipeline pipeline = RenderPipeline.builder()
                .renderMode(RenderMode.MANUAL)
                .autoRender(false)
                .build();
        List<String> calls = new ArrayList<>();
        pipeline.getRenderStage().createTask("custom-render", delta -> calls.add("custom"),
                TaskOptions.builder().after(RenderPipeline.AUTO_RENDER_TASK).build());

        runFrames(pipeline, 2);
        pipeline.advance();
        runFrames(pipeline, 1);

        assertEquals(List.of("custom"), calls);
    }

    @Test
    @DisplayName("createTask registers tasks in the main stage")
    void createTaskUsesMainStage() {
        RenderPipeline pipeline = pipeline(RenderMode.ALWAYS);

        pipeline.createTask("update", delta -> { });

        assertTrue(pipeline.getMainStage().getTask("update").isPresent());
    }

    @Test
    @DisplayName("Skipped frame keeps its invalidation flags")
    void skippedFrameKeepsFlags() {
        RenderPipeline pipeline = pipeline(RenderMode.MANUAL);
        pipeline.getScheduler().createStage("loop", StageOptions.builder()
                .after(RenderPipeline.RENDER_STAGE)
                .before(RenderPipeline.MAIN_STAGE)
                .build());
        pipeline.advance();

        assertThrows(CyclicDependencyException.class, () -> pipeline.runFrame(0.016));
        assertTrue(pipeline.getInvalidation().isAdvanceRequested());

        pipeline.getScheduler().removeStage(Key.of("loop"));
        pipeline.runFrame(0.016);

        assertEquals(1, renders.get());
        assertFalse(pipeline.getInvalidation().isAdvanceRequested());
    }

    @Test
    @DisplayName("Nested pipeline reuses the parent's scheduler, stages and state")
    void nestedPipelineSharesParent() {
        RenderPipeline parent = pipeline(RenderMode.ON_DEMAND);

        RenderPipeline nested = RenderPipeline.builder()
                .name("hud")
                .scheduler(parent.getScheduler())
                .invalidation(parent.getInvalidation())
                .build();

        assertSame(parent.getMainStage(), nested.getMainStage());
        assertSame(parent.getRenderStage(), nested.getRenderStage());
        assertSame(parent.getAutoRenderTask(), nested.getAutoRenderTask());
        assertEquals(2, parent.getScheduler().stages().size());

        nested.invalidate();
        assertTrue(parent.getInvalidation().isFrameInvalidated());
    }

    @Test
    @DisplayName("Nested pipeline built from the scheduler alone drives the parent's render gate")
    void nestedPipelineTakesInvalidationFromRenderStage() {
        RenderPipeline parent = pipeline(RenderMode.ON_DEMAND);
        runFrames(parent, 1);
        assertEquals(1, renders.get());

        RenderPipeline nested = RenderPipeline.builder()
                .name("hud")
                .scheduler(parent.getScheduler())
                .build();

        assertSame(parent.getInvalidation(), nested.getInvalidation());

        nested.invalidate();
        assertTrue(nested.shouldRender());
        nested.runFrame(1.0 / 60);

        assertEquals(2, renders.get());
        assertFalse(parent.getInvalidation().isFrameInvalidated());

        nested.setRenderMode(RenderMode.ALWAYS);
        runFrames(parent, 2);
        assertEquals(4, renders.get());
    }

    @Test
    @DisplayName("Reusing a render stage with a different invalidation state is rejected")
    void nestedPipelineRejectsForeignInvalidation() {
        RenderPipeline parent = pipeline(RenderMode.ON_DEMAND);

        assertThrows(IllegalArgumentException.class, () -> RenderPipeline.builder()
                .scheduler(parent.getScheduler())
                .invalidation(new FrameInvalidation(RenderMode.ALWAYS))
                .build());
    }

    @Test
    @DisplayName("Auto-render state is shared by pipelines sharing the task")
    void nestedPipelineSharesAutoRender() {
        RenderPipeline parent = pipeline(RenderMode.ALWAYS);

        RenderPipeline nested = RenderPipeline.builder()
                .scheduler(parent.getScheduler())
                .autoRender(false)
                .build();

        assertFalse(parent.isAutoRender());
        assertFalse(nested.isAutoRender());
        runFrames(parent, 2);
        assertEquals(0, renders.get());

        // Not setting auto-render leaves the shared task as it is
        RenderPipeline other = RenderPipeline.builder()
                .scheduler(parent.getScheduler())
                .build();
        assertFalse(other.isAutoRender());

        parent.setAutoRender(true);
        assertTrue(nested.isAutoRender());
        runFrames(parent, 1);
        assertEquals(1, renders.get());
    }

    @Test
    @DisplayName("Configured stages are created around the default stages")
    void configuredStages() {
        FrameConfig config = new FrameConfig(
                "configured",
                new RenderConfig(RenderMode.MANUAL, false),
                DriverConfig.defaults(),
                List.of(
                        new StageConfig("post-processing", List.of("render"), List.of()),
                        new StageConfig("physics", List.of(), List.of("main"))));

        RenderPipeline pipeline = RenderPipeline.create(config, renders::incrementAndGet);

        assertEquals("configured", pipeline.getName());
        assertEquals(RenderMode.MANUAL, pipeline.getRenderMode());
        assertFalse(pipeline.isAutoRender());
        assertEquals(
                List.of(Key.of("physics"), Key.of("main"), Key.of("render"), Key.of("post-processing")),
                pipeline.getScheduler().resolvedOrder());
    }
}
