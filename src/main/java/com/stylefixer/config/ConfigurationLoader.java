package com.stylefixer.config;

import com.stylefixer.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@code .stylefixer.yml} files, filling in defaults and resetting out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    private static final Set<String> LINE_ENDINGS = Set.of("\n", "\r\n", "\r");

    private static FixerConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FixerConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                config = new HashMap<>();
            }

            FixerConfig fixerConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully with " +
                    fixerConfig.getRuleConfigsMap().size() + " rule configurations");

            return fixerConfig;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration once and caches it.
     */
    public static synchronized FixerConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.info("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FixerConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> ruleConfigs = new HashMap<>();
        if (config.get("rules") instanceof Map) {
            Map<String, Object> rulesMap = (Map<String, Object>) config.get("rules");

            for (Map.Entry<String, Object> entry : rulesMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    ruleConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for rule '" + entry.getKey() + "', using defaults");
                    ruleConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else {
            logger.warning("Missing or invalid 'rules' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultRuleConfigs(ruleConfigs);

        return new FixerConfig(generalConfig, ruleConfigs);
    }

    private static void _validateConfigurationValues(Map<String, Object> generalConfig) {
        _validateIntRange(generalConfig, "indentSize", 1, 8);
        _validateIntRange(generalConfig, "tabSize", 1, 8);

        Object newLine = generalConfig.get("newLine");
        if (newLine != null && !LINE_ENDINGS.contains(newLine.toString())) {
            logger.warning("Configuration value 'newLine' must be \\n, \\r\\n or \\r. Using default value.");
            generalConfig.remove("newLine");
        }
    }

    /**
     * Removes an integer value outside {@code [min, max]} so that its default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static FixerConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> ruleConfigs = new HashMap<>();
        _ensureDefaultRuleConfigs(ruleConfigs);

        return new FixerConfig(generalConfig, ruleConfigs);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("indentSize") instanceof Number)) {
            generalConfig.put("indentSize", 4);
        }
        if (!(generalConfig.get("tabSize") instanceof Number)) {
            generalConfig.put("tabSize", 4);
        }
        if (!(generalConfig.get("useTabs") instanceof Boolean)) {
            generalConfig.put("useTabs", false);
        }
        if (!(generalConfig.get("newLine") instanceof String)) {
            generalConfig.put("newLine", "\r\n");
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultRuleConfigs(Map<String, Map<String, Object>> ruleConfigs) {
        Map<String, Object> separatorConfig = ruleConfigs.computeIfAbsent("SA1107", k -> new HashMap<>());
        if (!(separatorConfig.get("enabled") instanceof Boolean)) {
            separatorConfig.put("enabled", true);
        }

        Map<String, Object> declarationConfig = ruleConfigs.computeIfAbsent("SA1132", k -> new HashMap<>());
        if (!(declarationConfig.get("enabled") instanceof Boolean)) {
            declarationConfig.put("enabled", true);
        }
        if (!(declarationConfig.get("includeLocals") instanceof Boolean)) {
            declarationConfig.put("includeLocals", false);
        }
    }

    /**
     * Writes a configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FixerConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("rules", config.getRuleConfigsMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
