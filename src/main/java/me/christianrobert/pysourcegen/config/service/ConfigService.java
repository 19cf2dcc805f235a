package me.christianrobert.pysourcegen.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.pysourcegen.unparser.context.RenderOptions;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String INDENT_UNIT = "unparse.indent-unit";
    public static final String DEFAULT_DIALECT = "unparse.default-dialect";
    public static final String INCLUDE_TREE = "unparse.include-tree";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(INDENT_UNIT, RenderOptions.DEFAULT_INDENT_UNIT);
        configuration.put(DEFAULT_DIALECT, PythonVersion.latest().label());
        configuration.put(INCLUDE_TREE, false);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Render options from {@code unparse.indent-unit}. A number is read as a width in spaces.
     */
    public RenderOptions getRenderOptions() {
        Object value = configuration.get(INDENT_UNIT);
        if (value instanceof Number) {
            return RenderOptions.withIndentWidth(((Number) value).intValue());
        }
        if (value == null) {
            return RenderOptions.defaults();
        }
        return RenderOptions.withIndentUnit(value.toString());
    }

    /**
     * @throws IllegalArgumentException if {@code unparse.default-dialect} is not a known version
     */
    public PythonVersion getDefaultVersion() {
        String label = getConfigValueAsString(DEFAULT_DIALECT);
        return label == null ? PythonVersion.latest() : PythonVersion.fromLabel(label);
    }

    public boolean isIncludeTree() {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(INCLUDE_TREE));
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
