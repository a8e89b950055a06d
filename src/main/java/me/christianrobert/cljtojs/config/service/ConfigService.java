package me.christianrobert.cljtojs.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String VECTOR_CLASS = "translator.vector-class";
    public static final String VECTOR_EMPTY_NODE = "translator.vector-empty-node";
    public static final String VECTOR_SHIFT = "translator.vector-shift";
    public static final String KEYWORD_CLASS = "translator.keyword-class";
    public static final String NULL_SYMBOL = "translator.null-symbol";
    public static final String REST_PARAMETER = "translator.rest-parameter";
    public static final String NOT_FUNCTION = "translator.not-function";
    public static final String DEREF_FUNCTION = "translator.deref-function";
    public static final String INCLUDE_TREES = "translator.include-trees";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(VECTOR_CLASS, "PersistentVector");
        configuration.put(VECTOR_EMPTY_NODE, "PersistentVector.EMPTY_NODE");
        configuration.put(VECTOR_SHIFT, 5);
        configuration.put(KEYWORD_CLASS, "Keyword");
        configuration.put(NULL_SYMBOL, "js/null");
        configuration.put(REST_PARAMETER, "arguments");
        configuration.put(NOT_FUNCTION, "not");
        configuration.put(DEREF_FUNCTION, "deref");
        configuration.put(INCLUDE_TREES, false);

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
     * Accepts numbers and numeric strings ("5").
     *
     * @param key Configuration key
     * @return Integer value, or null if missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} is not an integer: {}", key, value);
                return null;
            }
        }
        return null;
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
