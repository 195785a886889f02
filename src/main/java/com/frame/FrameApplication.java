package com.frame;

import com.frame.core.FrameListener;
import com.frame.core.Key;
import com.frame.core.Stage;
import com.frame.core.Task;
import com.frame.core.TaskOptions;
import com.frame.render.RenderPipeline;
import com.frame.render.Renderer;
import com.frame.spring.EnableFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Example Spring Boot application demonstrating frame scheduling.
 */
@SpringBootApplication
@EnableFrame
public class FrameApplication {

    private static final Logger log = LoggerFactory.getLogger(FrameApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FrameApplication.class, args);
    }

    @Bean
    public Renderer renderer() {
        AtomicInteger renders = new AtomicInteger();
        return () -> log.info("Render #{}", renders.incrementAndGet());
    }

    @Bean
    public CommandLineRunner demo(RenderPipeline pipeline) {
        return args -> {
            log.info("=== Frame Demo Started ===");

            pipeline.getScheduler().addListener(new FrameListener() {
                @Override
                public void taskFailed(Task task, Throwable error) {
                    log.warn("Task '{}' failed: {}", task.key(), error.getMessage());
                }
            });

            double[] position = {0.0};
            Task move = pipeline.createTask("move", delta -> {
                position[0] += delta * 2.0;
                pipeline.invalidate();
            });
            pipeline.createTask("log-position",
                    delta -> log.info("Position: {}", String.format("%.3f", position[0])),
                    TaskOptions.builder().after(move).build());

            Stage physics = pipeline.getScheduler().getStage(Key.of("physics"))
                    .orElseGet(() -> pipeline.getScheduler().createStage("physics"));
            physics.createTask("step", delta -> log.debug("Physics step {}", delta));

            log.info("Stage order: {}", pipeline.getScheduler().resolvedOrder());
            log.info("Main stage order: {}", pipeline.getMainStage().resolvedOrder());

            double delta = 1.0 / 60.0;
            for (int frame = 0; frame < 3; frame++) {
                pipeline.runFrame(delta);
            }

            // Nothing invalidates the frame once movement stops
            move.stop();
            for (int frame = 0; frame < 3; frame++) {
                pipeline.runFrame(delta);
            }

            log.info("=== Frame Demo Completed after {} frames ===", pipeline.getScheduler().frameCount());
        };
    }
}
