package com.frame.adapter.spring;

import com.frame.adapter.driver.FixedRateFrameDriver;
import com.frame.adapter.driver.FrameDriver;
import com.frame.config.ConfigLoader;
import com.frame.config.FrameConfig;
import com.frame.core.FrameScheduler;
import com.frame.render.RenderPipeline;
import com.frame.render.Renderer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the frame pipeline.
 */
@Configuration
@ConditionalOnProperty(prefix = "frame", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FrameProperties.class)
public class FrameAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FrameAutoConfiguration.class);

    private FrameDriver frameDriver;

    @Bean
    @ConditionalOnMissingBean
    public FrameConfig frameConfig(FrameProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RenderPipeline renderPipeline(FrameConfig config, ObjectProvider<Renderer> renderer) {
        log.info("Creating RenderPipeline: {}", config.name());
        return RenderPipeline.create(config, renderer.getIfAvailable(() -> () -> { }));
    }

    @Bean
    @ConditionalOnMissingBean
    public FrameScheduler frameScheduler(RenderPipeline pipeline) {
        return pipeline.getScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "frame.driver", name = "enabled", havingValue = "true")
    public FrameDriver frameDriver(RenderPipeline pipeline, FrameConfig config) {
        this.frameDriver = new FixedRateFrameDriver(pipeline, config.driver());
        this.frameDriver.start();
        return this.frameDriver;
    }

    @PreDestroy
    public void shutdown() {
        if (frameDriver != null && frameDriver.isRunning()) {
            log.info("Stopping frame driver");
            frameDriver.stop();
        }
    }
}
