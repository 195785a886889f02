package com.frame.config;

import com.frame.exception.ConfigurationException;
import com.frame.render.RenderMode;
import com.frame.render.RenderPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads frame pipeline configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static FrameConfig load(String path) {
        log.info("Loading frame configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static FrameConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asSection(loaded, "root");

        // The frame section may sit at the root or under a 'frame' key
        Map<String, Object> frameMap = root.containsKey("frame")
                ? getSection(root, "frame")
                : root;
        if (frameMap == null) {
            throw new ConfigurationException("Section 'frame' is empty");
        }

        String name = getString(frameMap, "name", "default-frame");
        RenderConfig render = parseRenderConfig(getSection(frameMap, "render"));
        DriverConfig driver = parseDriverConfig(getSection(frameMap, "driver"));
        List<StageConfig> stages = parseStages(frameMap.get("stages"));

        FrameConfig config = new FrameConfig(name, render, driver, stages);

        log.info("Loaded frame configuration: {} (mode={}, autoRender={}, targetFps={}, {} extra stages)",
                name, render.mode(), render.autoRender(), driver.targetFps(), stages.size());

        return config;
    }

    private static RenderConfig parseRenderConfig(Map<String, Object> map) {
        if (map == null) {
            return RenderConfig.defaults();
        }

        String modeValue = getString(map, "mode", null);
        RenderMode mode = RenderConfig.defaults().mode();
        if (modeValue != null) {
            try {
                mode = RenderMode.parse(modeValue);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown render mode '" + modeValue
                        + "'. Expected one of: always, on-demand, manual", e);
            }
        }
        boolean autoRender = getBoolean(map, "auto-render", true);
        return new RenderConfig(mode, autoRender);
    }

    private static DriverConfig parseDriverConfig(Map<String, Object> map) {
        if (map == null) {
            return DriverConfig.defaults();
        }

        DriverConfig defaults = DriverConfig.defaults();
        int targetFps = getInt(map, "target-fps", defaults.targetFps());
        double maxDelta = getDouble(map, "max-delta", defaults.maxDeltaSeconds());

        if (targetFps <= 0 || targetFps > 1000) {
            throw new ConfigurationException("driver.target-fps must be between 1 and 1000, was " + targetFps);
        }
        if (!(maxDelta > 0)) {
            throw new ConfigurationException("driver.max-delta must be positive, was " + maxDelta);
        }
        return new DriverConfig(targetFps, maxDelta);
    }

    private static List<StageConfig> parseStages(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Section 'stages' must be a list, was '" + value + "'");
        }

        Set<String> reserved = Set.of(
                RenderPipeline.MAIN_STAGE.name(),
                RenderPipeline.RENDER_STAGE.name());
        Set<String> seen = new HashSet<>();
        List<StageConfig> stages = new ArrayList<>();

        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> stageMap = asSection(list.get(i), "stages[" + i + "]");
            String key = getString(stageMap, "key", null);
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("Stage at index " + i + " has no key");
            }
            if (reserved.contains(key)) {
                throw new ConfigurationException("Stage key '" + key
                        + "' is reserved for the default pipeline stages");
            }
            if (!seen.add(key)) {
                throw new ConfigurationException("Duplicate stage key '" + key + "'");
            }

            StageConfig stage = new StageConfig(
                    key,
                    getStringList(stageMap, "after"),
                    getStringList(stageMap, "before"));
            stages.add(stage);

            log.debug("Parsed stage: key={}, after={}, before={}", key, stage.after(), stage.before());
        }

        return stages;
    }

    // Helper methods

    private static Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? asSection(value, key) : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asSection(Object value, String section) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + section + "' must be a mapping, was '" + value + "'");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, was '" + value + "'", e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, was '" + value + "'", e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> values) {
            return values.stream().map(Object::toString).toList();
        }
        // A single key may be written without list brackets
        return List.of(value.toString());
    }
}
