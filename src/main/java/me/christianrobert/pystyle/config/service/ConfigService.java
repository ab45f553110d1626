package me.christianrobert.pystyle.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.pystyle.config.model.ConversionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String PACKAGE_NAME = "conversion.package-name";
    public static final String INDENT_SIZE = "conversion.indent-size";
    public static final String ADD_ACCESS_MODIFIERS = "conversion.add-access-modifiers";
    public static final String ENABLE_TYPE_INFERENCE = "conversion.enable-type-inference";
    public static final String CACHE_CAPACITY = "conversion.cache-capacity";
    public static final String ADD_PACKAGE_DECLARATION = "conversion.add-package-declaration";
    /** Path of the JSON file the conversion cache is loaded from and saved to; unset by default. */
    public static final String CACHE_FILE = "conversion.cache-file";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(PACKAGE_NAME, ConversionConfig.DEFAULT_PACKAGE_NAME);
        configuration.put(INDENT_SIZE, ConversionConfig.DEFAULT_INDENT_SIZE);
        configuration.put(ADD_ACCESS_MODIFIERS, true);
        configuration.put(ENABLE_TYPE_INFERENCE, true);
        configuration.put(CACHE_CAPACITY, ConversionConfig.DEFAULT_CACHE_CAPACITY);
        configuration.put(ADD_PACKAGE_DECLARATION, true);

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
     * Gets a configuration value as an integer.
     * Accepts numbers and numeric strings ("4").
     *
     * @param key Configuration key
     * @return Integer value, or null if missing
     * @throws IllegalArgumentException if the value is not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config value " + key + " is not a number: " + value, e);
        }
    }

    /**
     * Builds the immutable configuration for a conversion run from the current values.
     *
     * @throws IllegalArgumentException if a value is out of range (indent size &lt; 1, negative capacity)
     */
    public ConversionConfig getConversionConfig() {
        ConversionConfig config = ConversionConfig.builder()
                .packageName(getConfigValueAsString(PACKAGE_NAME))
                .indentSize(valueOrDefault(getConfigValueAsInteger(INDENT_SIZE), ConversionConfig.DEFAULT_INDENT_SIZE))
                .addAccessModifiers(valueOrDefault(getConfigValueAsBoolean(ADD_ACCESS_MODIFIERS), true))
                .enableTypeInference(valueOrDefault(getConfigValueAsBoolean(ENABLE_TYPE_INFERENCE), true))
                .cacheCapacity(valueOrDefault(getConfigValueAsInteger(CACHE_CAPACITY), ConversionConfig.DEFAULT_CACHE_CAPACITY))
                .addPackageDeclaration(valueOrDefault(getConfigValueAsBoolean(ADD_PACKAGE_DECLARATION), true))
                .build();
        log.debug("Built conversion config: {}", config);
        return config;
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

    private static <T> T valueOrDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }
}
