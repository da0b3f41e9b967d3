package com.stylefixer.config;

import com.stylefixer.rewrite.IndentationSettings;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the fixer: a {@code general} section plus one section per rule id.
 */
public class FixerConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> ruleConfigs;

    public FixerConfig(Map<String, Object> generalConfig,
                       Map<String, Map<String, Object>> ruleConfigs) {
        this.generalConfig = generalConfig;
        this.ruleConfigs = ruleConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the rule configs map.
     */
    public Map<String, Map<String, Object>> getRuleConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : ruleConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _convert(generalConfig.get(key), defaultValue);
    }

    public <T> T getRuleConfig(String ruleId, String key, T defaultValue) {
        Map<String, Object> ruleConfig = ruleConfigs.get(ruleId);
        if (ruleConfig == null) {
            return defaultValue;
        }
        return _convert(ruleConfig.get(key), defaultValue);
    }

    /**
     * Rules are enabled unless their section says otherwise.
     */
    public boolean isRuleEnabled(String ruleId) {
        return getRuleConfig(ruleId, "enabled", Boolean.TRUE);
    }

    /**
     * Indentation and line-ending settings derived from the {@code general} section.
     */
    public IndentationSettings getIndentationSettings() {
        IndentationSettings defaults = IndentationSettings.DEFAULT;
        return new IndentationSettings(
                getGeneralConfig("indentSize", defaults.getIndentSize()),
                getGeneralConfig("tabSize", defaults.getTabSize()),
                getGeneralConfig("useTabs", defaults.isUseTabs()),
                getGeneralConfig("newLine", defaults.getNewLine()));
    }

    @SuppressWarnings("unchecked")
    private static <T> T _convert(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }
        // Collection defaults are often immutable List.of()/Map.of(), YAML yields ArrayList/LinkedHashMap
        if ((defaultValue instanceof List && value instanceof List)
                || (defaultValue instanceof Map && value instanceof Map)) {
            return (T) value;
        }
        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
