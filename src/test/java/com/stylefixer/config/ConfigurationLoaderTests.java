package com.stylefixer.config;

import com.stylefixer.rewrite.IndentationSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationLoaderTests {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultConfiguration() {
        FixerConfig config = ConfigurationLoader.loadDefaultConfig();
        IndentationSettings settings = config.getIndentationSettings();

        assertEquals(4, settings.getIndentSize());
        assertEquals(4, settings.getTabSize());
        assertFalse(settings.isUseTabs());
        assertEquals("\r\n", settings.getNewLine());
        assertTrue(config.isRuleEnabled("SA1107"));
        assertTrue(config.isRuleEnabled("SA1132"));
        assertFalse(config.getRuleConfig("SA1132", "includeLocals", true));
        assertEquals(List.of("**/bin/**", "**/obj/**"), config.getGeneralConfig("ignoreFiles", List.of()));
    }

    @Test
    void testLoadsYamlFile() throws IOException {
        Path file = _write("general:\n"
                + "  indentSize: 2\n"
                + "  useTabs: true\n"
                + "  newLine: \"\\n\"\n"
                + "rules:\n"
                + "  SA1107:\n"
                + "    enabled: false\n"
                + "  SA1132:\n"
                + "    includeLocals: true\n");

        FixerConfig config = ConfigurationLoader.loadConfig(file);
        IndentationSettings settings = config.getIndentationSettings();

        assertEquals(2, settings.getIndentSize());
        assertEquals(4, settings.getTabSize());
        assertTrue(settings.isUseTabs());
        assertEquals("\n", settings.getNewLine());
        assertFalse(config.isRuleEnabled("SA1107"));
        assertTrue(config.isRuleEnabled("SA1132"));
        assertTrue(config.getRuleConfig("SA1132", "includeLocals", false));
    }

    @Test
    void testOutOfRangeValuesFallBackToDefaults() throws IOException {
        Path file = _write("general:\n"
                + "  indentSize: 40\n"
                + "  tabSize: 0\n"
                + "  newLine: \"CRLF\"\n");

        IndentationSettings settings = ConfigurationLoader.loadConfig(file).getIndentationSettings();

        assertEquals(4, settings.getIndentSize());
        assertEquals(4, settings.getTabSize());
        assertEquals("\r\n", settings.getNewLine());
    }

    @Test
    void testMissingFileUsesDefaults() {
        FixerConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("missing.yml"));

        assertEquals(ConfigurationLoader.loadDefaultConfig().getGeneralConfigMap(), config.getGeneralConfigMap());
    }

    @Test
    void testMalformedFileUsesDefaults() throws IOException {
        Path file = _write("general: [unclosed\n");

        FixerConfig config = ConfigurationLoader.loadConfig(file);

        assertEquals(4, config.getIndentationSettings().getIndentSize());
    }

    @Test
    void testInvalidRuleSectionIsReplaced() throws IOException {
        Path file = _write("rules:\n  SA1107: yes please\n");

        FixerConfig config = ConfigurationLoader.loadConfig(file);

        assertTrue(config.isRuleEnabled("SA1107"));
    }

    @Test
    void testSaveAndReload() throws IOException {
        FixerConfig config = ConfigurationLoader.loadDefaultConfig();
        Path file = tempDir.resolve("nested/dir/.stylefixer.yml");

        ConfigurationLoader.saveConfig(config, file);
        FixerConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertTrue(Files.exists(file));
        assertEquals(config.getGeneralConfigMap(), reloaded.getGeneralConfigMap());
        assertEquals(config.getRuleConfigsMap(), reloaded.getRuleConfigsMap());
    }

    private Path _write(String yaml) throws IOException {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }
}
