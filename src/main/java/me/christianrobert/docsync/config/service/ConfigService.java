package me.christianrobert.docsync.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put("local.env-file", ".env");
        configuration.put("local.url", "");
        configuration.put("local.username", "");
        configuration.put("local.password", "");
        configuration.put("production.env-file", ".env.production");
        configuration.put("production.url", "");
        configuration.put("production.username", "");
        configuration.put("production.password", "");
        configuration.put("sync.batch-size", 2000);
        configuration.put("sync.embedding-batch-size", 50);
        configuration.put("sync.mode", "STRICT");

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

    /**
     * Gets a configuration value as an integer.
     * Accepts numeric values and numeric strings (e.g. values posted as JSON strings).
     *
     * @param key Configuration key
     * @return the integer value, or null if the key is not set
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
            throw new IllegalArgumentException("Configuration value '" + key + "' is not a number: " + value, e);
        }
    }

    public boolean hasText(String key) {
        String value = getConfigValueAsString(key);
        return value != null && !value.trim().isEmpty();
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, maskIfSecret(key, value), maskIfSecret(key, oldValue));
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, maskIfSecret(key, value), maskIfSecret(key, oldValue));
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private static Object maskIfSecret(String key, Object value) {
        if (value != null && key.endsWith(".password")) {
            return "****";
        }
        return value;
    }
}
