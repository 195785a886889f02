package com.frame.render;

import com.frame.config.FrameConfig;
import com.frame.config.StageConfig;
import com.frame.core.DefaultFrameScheduler;
import com.frame.core.FrameScheduler;
import com.frame.core.Key;
import com.frame.core.Stage;
import com.frame.core.StageOptions;
import com.frame.core.Task;
import com.frame.core.TaskCallback;
import com.frame.core.TaskOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The default frame pipeline of an application: a main stage for ad hoc
 * tasks, and a render stage that runs after it behind a {@link RenderGate}
 * and holds the auto-render task.
 * <p>
 * A nested pipeline can share its parent's scheduler, invalidation state and
 * stages by passing them to the builder; missing parts are created.
 */
public class RenderPipeline {

    private static final Logger log = LoggerFactory.getLogger(RenderPipeline.class);

    public static final Key MAIN_STAGE = Key.of("main");
    public static final Key RENDER_STAGE = Key.of("render");
    public static final Key AUTO_RENDER_TASK = Key.of("auto-render");

    private final String name;
    private final FrameScheduler scheduler;
    private final FrameInvalidation invalidation;
    private final Stage mainStage;
    private final Stage renderStage;
    private final Task autoRenderTask;

    private RenderPipeline(Builder builder) {
        this.name = builder.name;
        this.scheduler = builder.scheduler != null ? builder.scheduler : new DefaultFrameScheduler();

        Stage existingRenderStage = builder.renderStage != null
                ? builder.renderStage
                : scheduler.getStage(RENDER_STAGE).orElse(null);
        this.invalidation = resolveInvalidation(builder, existingRenderStage);

        this.mainStage = builder.mainStage != null
                ? builder.mainStage
                : scheduler.getStage(MAIN_STAGE).orElseGet(() -> scheduler.createStage(MAIN_STAGE));

        this.renderStage = existingRenderStage != null
                ? existingRenderStage
                : scheduler.createStage(
                        RENDER_STAGE,
                        StageOptions.builder()
                                .after(mainStage)
                                .gate(new RenderGate(invalidation))
                                .build());

        Renderer renderer = builder.renderer;
        Task existingTask = builder.autoRenderTask != null
                ? builder.autoRenderTask
                : renderStage.getTask(AUTO_RENDER_TASK).orElse(null);
        this.autoRenderTask = existingTask != null
                ? existingTask
                : renderStage.createTask(AUTO_RENDER_TASK, delta -> renderer.render());

        for (StageConfig stageConfig : builder.stages) {
            scheduler.createStage(Key.of(stageConfig.key()), stageConfig.toOptions());
        }

        // A reused auto-render task keeps its state unless the builder sets one
        if (builder.autoRender != null) {
            setAutoRender(builder.autoRender);
        } else if (existingTask == null) {
            setAutoRender(true);
        }

        log.info("RenderPipeline '{}' initialized (mode={}, autoRender={}, stages={})",
                name, invalidation.getRenderMode(), isAutoRender(), scheduler.stages().size());
    }

    /**
     * The render stage's gate decides from its own invalidation state, so a
     * reused render stage brings that state along.
     */
    private static FrameInvalidation resolveInvalidation(Builder builder, Stage renderStage) {
        FrameInvalidation gated = renderStage == null ? null : renderStage.gate()
                .filter(RenderGate.class::isInstance)
                .map(gate -> ((RenderGate) gate).invalidation())
                .orElse(null);

        if (builder.invalidation == null) {
            return gated != null ? gated : new FrameInvalidation(builder.renderMode);
        }
        if (gated != null && gated != builder.invalidation) {
            throw new IllegalArgumentException("Render stage " + renderStage.key()
                    + " is gated on a different invalidation state");
        }
        return builder.invalidation;
    }

    /**
     * Build a pipeline from loaded configuration.
     */
    public static RenderPipeline create(FrameConfig config, Renderer renderer) {
        return builder()
                .name(config.name())
                .renderMode(config.render().mode())
                .autoRender(config.render().autoRender())
                .stages(config.stages())
                .renderer(renderer)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // =====================================================================
    // Frame stepping
    // =====================================================================

    /**
     * Run one frame and clear the per-frame invalidation flags afterwards.
     * A frame skipped because of a stage cycle keeps its flags.
     *
     * @throws com.frame.exception.CyclicDependencyException if the stage order cannot be resolved
     */
    public void runFrame(double deltaSeconds) {
        scheduler.runFrame(deltaSeconds);
        invalidation.reset();
    }

    // =====================================================================
    // Tasks
    // =====================================================================

    /**
     * Register a task in the main stage.
     */
    public Task createTask(Key key, TaskCallback callback, TaskOptions options) {
        return mainStage.createTask(key, callback, options);
    }

    public Task createTask(Key key, TaskCallback callback) {
        return mainStage.createTask(key, callback);
    }

    public Task createTask(String key, TaskCallback callback) {
        return mainStage.createTask(key, callback);
    }

    public Task createTask(String key, TaskCallback callback, TaskOptions options) {
        return mainStage.createTask(key, callback, options);
    }

    // =====================================================================
    // Render state
    // =====================================================================

    public void invalidate() {
        invalidation.invalidate();
    }

    public void advance() {
        invalidation.advance();
    }

    /**
     * Whether the render stage runs its tasks this frame.
     * The answer holds for the whole frame.
     */
    public boolean shouldRender() {
        return invalidation.shouldRender();
    }

    public RenderMode getRenderMode() {
        return invalidation.getRenderMode();
    }

    public void setRenderMode(RenderMode renderMode) {
        invalidation.setRenderMode(renderMode);
    }

    /**
     * Whether the auto-render task is enabled. Pipelines sharing the task see the same value.
     */
    public boolean isAutoRender() {
        return autoRenderTask.isEnabled();
    }

    /**
     * Enable or disable the built-in auto-render task, for applications that
     * render from their own task in the render stage.
     */
    public void setAutoRender(boolean autoRender) {
        if (autoRender) {
            autoRenderTask.start();
        } else {
            autoRenderTask.stop();
        }
    }

    public String getName() {
        return name;
    }

    public FrameScheduler getScheduler() {
        return scheduler;
    }

    public FrameInvalidation getInvalidation() {
        return invalidation;
    }

    public Stage getMainStage() {
        return mainStage;
    }

    public Stage getRenderStage() {
        return renderStage;
    }

    public Task getAutoRenderTask() {
        return autoRenderTask;
    }

    /**
     * Builder for RenderPipeline.
     */
    public static final class Builder {
        private String name = "default-frame";
        private FrameScheduler scheduler;
        private FrameInvalidation invalidation;
        private Stage mainStage;
        private Stage renderStage;
        private Task autoRenderTask;
        private Renderer renderer = () -> { };
        private RenderMode renderMode = RenderMode.ON_DEMAND;
        private Boolean autoRender;
        private final List<StageConfig> stages = new ArrayList<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Name cannot be null");
            return this;
        }

        /**
         * Reuse an existing scheduler instead of creating one.
         */
        public Builder scheduler(FrameScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Share invalidation state with another pipeline. Takes precedence over {@link #renderMode}.
         * Without it, a reused render stage supplies its gate's state.
         */
        public Builder invalidation(FrameInvalidation invalidation) {
            this.invalidation = invalidation;
            return this;
        }

        public Builder mainStage(Stage mainStage) {
            this.mainStage = mainStage;
            return this;
        }

        public Builder renderStage(Stage renderStage) {
            this.renderStage = renderStage;
            return this;
        }

        public Builder autoRenderTask(Task autoRenderTask) {
            this.autoRenderTask = autoRenderTask;
            return this;
        }

        public Builder renderer(Renderer renderer) {
            this.renderer = Objects.requireNonNull(renderer, "Renderer cannot be null");
            return this;
        }

        public Builder renderMode(RenderMode renderMode) {
            this.renderMode = Objects.requireNonNull(renderMode, "Render mode cannot be null");
            return this;
        }

        public Builder autoRender(boolean autoRender) {
            this.autoRender = autoRender;
            return this;
        }

        /**
         * Additional ungated stages to create.
         */
        public Builder stages(List<StageConfig> stages) {
            this.stages.addAll(stages);
            return this;
        }

        public RenderPipeline build() {
            return new RenderPipeline(this);
        }
    }
}
