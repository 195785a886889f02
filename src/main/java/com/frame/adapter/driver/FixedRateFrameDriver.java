package com.frame.adapter.driver;

import com.frame.config.DriverConfig;
import com.frame.exception.CyclicDependencyException;
import com.frame.render.RenderPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a {@link RenderPipeline} at a fixed rate on a dedicated thread.
 * <p>
 * Every frame runs on the driver thread, so the pipeline must only be mutated
 * from task callbacks once the driver is started. Delta time is measured
 * between frame starts and clamped to {@link DriverConfig#maxDeltaSeconds()}.
 */
public class FixedRateFrameDriver implements FrameDriver {

    private static final Logger log = LoggerFactory.getLogger(FixedRateFrameDriver.class);

    private final RenderPipeline pipeline;
    private final DriverConfig config;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong framesDriven = new AtomicLong(0);
    private final AtomicLong skippedFrames = new AtomicLong(0);
    private long lastFrameNanos = -1;

    public FixedRateFrameDriver(RenderPipeline pipeline, DriverConfig config) {
        this.pipeline = pipeline;
        this.config = config;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("frame-driver-" + pipeline.getName());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Frame driver has already been started");
        }
        running.set(true);
        executor.scheduleAtFixedRate(this::tick, 0, config.periodNanos(), TimeUnit.NANOSECONDS);
        log.info("Frame driver started for '{}' at {} fps", pipeline.getName(), config.targetFps());
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            executor.shutdown();
            log.info("Frame driver stopped for '{}' after {} frames ({} skipped)",
                    pipeline.getName(), framesDriven.get(), skippedFrames.get());
        }
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public long getFramesDriven() {
        return framesDriven.get();
    }

    public long getSkippedFrames() {
        return skippedFrames.get();
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        long now = System.nanoTime();
        double delta = lastFrameNanos < 0 ? 0.0 : (now - lastFrameNanos) / 1_000_000_000.0;
        lastFrameNanos = now;

        framesDriven.incrementAndGet();
        try {
            pipeline.runFrame(Math.min(delta, config.maxDeltaSeconds()));
        } catch (CyclicDependencyException e) {
            // A thrown exception would cancel the periodic schedule
            skippedFrames.incrementAndGet();
            log.error("Frame skipped in '{}': {}", pipeline.getName(), e.getMessage());
        } catch (RuntimeException e) {
            skippedFrames.incrementAndGet();
            log.error("Frame failed in '{}'", pipeline.getName(), e);
        }
    }
}
