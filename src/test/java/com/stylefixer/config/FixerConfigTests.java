package com.stylefixer.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixerConfigTests {

    @Test
    void testValueConversion() {
        Map<String, Object> general = new HashMap<>();
        general.put("indentSize", 2L);
        general.put("useTabs", "true");
        general.put("newLine", '\n');
        FixerConfig config = new FixerConfig(general, new HashMap<>());

        int indentSize = config.getGeneralConfig("indentSize", 4);
        boolean useTabs = config.getGeneralConfig("useTabs", false);
        String newLine = config.getGeneralConfig("newLine", "\r\n");
        int tabSize = config.getGeneralConfig("tabSize", 8);

        assertEquals(2, indentSize);
        assertTrue(useTabs);
        assertEquals("\n", newLine);
        assertEquals(8, tabSize);
    }

    @Test
    void testCollectionValuesMatchImmutableDefaults() {
        List<String> ignored = new ArrayList<>(List.of("**/bin/**", "generated/**"));
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("depth", 2);
        Map<String, Object> general = new HashMap<>();
        general.put("ignoreFiles", ignored);
        general.put("extra", nested);
        FixerConfig config = new FixerConfig(general, new HashMap<>());

        List<String> ignoreFiles = config.getGeneralConfig("ignoreFiles", List.of());
        Map<String, Object> extra = config.getGeneralConfig("extra", Map.of());

        assertEquals(List.of("**/bin/**", "generated/**"), ignoreFiles);
        assertEquals(Map.of("depth", 2), extra);
    }

    @Test
    void testUnconvertibleValueUsesDefault() {
        Map<String, Object> general = new HashMap<>();
        general.put("indentSize", "wide");
        FixerConfig config = new FixerConfig(general, new HashMap<>());

        assertEquals(4, config.getIndentationSettings().getIndentSize());
    }

    @Test
    void testRulesAreEnabledUnlessDisabled() {
        Map<String, Map<String, Object>> rules = new HashMap<>();
        Map<String, Object> disabled = new HashMap<>();
        disabled.put("enabled", false);
        rules.put("SA1132", disabled);
        FixerConfig config = new FixerConfig(new HashMap<>(), rules);

        assertTrue(config.isRuleEnabled("SA1107"));
        assertFalse(config.isRuleEnabled("SA1132"));
    }

    @Test
    void testMapsAreCopies() {
        Map<String, Map<String, Object>> rules = new HashMap<>();
        rules.put("SA1107", new HashMap<>());
        FixerConfig config = new FixerConfig(new HashMap<>(), rules);

        config.getRuleConfigsMap().get("SA1107").put("enabled", false);
        config.getGeneralConfigMap().put("indentSize", 1);

        assertTrue(config.isRuleEnabled("SA1107"));
        assertEquals(4, config.getIndentationSettings().getIndentSize());
    }
}
