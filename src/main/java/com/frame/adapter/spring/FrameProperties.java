package com.frame.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the frame pipeline.
 */
@ConfigurationProperties(prefix = "frame")
public class FrameProperties {

    /**
     * Whether the frame pipeline is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the frame configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:frame.yaml";

    private final Driver driver = new Driver();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public Driver getDriver() {
        return driver;
    }

    public static class Driver {

        /**
         * Whether to start a fixed-rate frame driver with the application.
         */
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
