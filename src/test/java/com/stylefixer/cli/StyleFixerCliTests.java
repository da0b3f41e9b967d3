package com.stylefixer.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StyleFixerCliTests {
    private static final String VIOLATING = "class A\n{\n    private int x, y;\n\n    void M()\n    {\n        x = 1; y = 2;\n    }\n}\n";
    private static final String FIXED = "class A\n{\n    private int x;\n    private int y;\n\n    void M()\n    {\n        x = 1;\n        y = 2;\n    }\n}\n";

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path sourceDir;

    @BeforeEach
    void setUp() throws IOException {
        configPath = tempDir.resolve("cfg.yml");
        sourceDir = Files.createDirectories(tempDir.resolve("src"));
        assertEquals(StyleFixerCli.EXIT_OK, _run("init", "--config=" + configPath));
    }

    @Test
    void testInitDoesNotOverwriteWithoutForce() throws IOException {
        assertTrue(Files.exists(configPath));
        Files.writeString(configPath, "general:\n  indentSize: 2\n", StandardCharsets.UTF_8);

        assertEquals(StyleFixerCli.EXIT_OK, _run("init", "--config=" + configPath));
        assertEquals("general:\n  indentSize: 2\n", Files.readString(configPath, StandardCharsets.UTF_8));

        assertEquals(StyleFixerCli.EXIT_OK, _run("init", "--config=" + configPath, "--force"));
        assertTrue(Files.readString(configPath, StandardCharsets.UTF_8).contains("SA1132"));
    }

    @Test
    void testCheckThenFixThenCheck() throws IOException {
        Path file = _write("A.cs", VIOLATING);

        assertEquals(StyleFixerCli.EXIT_FAILURE, _run("check", sourceDir.toString(), "--config=" + configPath));
        assertEquals(VIOLATING, Files.readString(file, StandardCharsets.UTF_8));

        assertEquals(StyleFixerCli.EXIT_OK, _run("fix", sourceDir.toString(), "--config=" + configPath, "--threads=2"));
        assertEquals(FIXED, Files.readString(file, StandardCharsets.UTF_8));

        assertEquals(StyleFixerCli.EXIT_OK, _run("check", sourceDir.toString(), "--config=" + configPath));
    }

    @Test
    void testFixReportsUnparsableFile() throws IOException {
        Path broken = _write("Broken.cs", "class Broken { void M() { a( ; } }");

        assertEquals(StyleFixerCli.EXIT_FAILURE, _run("fix", sourceDir.toString(), "--config=" + configPath));
        assertEquals("class Broken { void M() { a( ; } }", Files.readString(broken, StandardCharsets.UTF_8));
    }

    @Test
    void testAnalyzeReportsViolationsWithoutFailing() throws IOException {
        Path file = _write("A.cs", VIOLATING);

        assertEquals(StyleFixerCli.EXIT_OK, _run("analyze", sourceDir.toString(), "--config=" + configPath, "--ci"));
        assertEquals(VIOLATING, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testIncludePatternLimitsFiles() throws IOException {
        Path included = _write("Included.cs", VIOLATING);
        Path skipped = _write("Skipped.cs", VIOLATING);

        assertEquals(StyleFixerCli.EXIT_OK,
                _run("fix", sourceDir.toString(), "--config=" + configPath, "--include=Incl*"));
        assertEquals(FIXED, Files.readString(included, StandardCharsets.UTF_8));
        assertEquals(VIOLATING, Files.readString(skipped, StandardCharsets.UTF_8));
    }

    @Test
    void testUsageErrors() {
        assertEquals(StyleFixerCli.EXIT_FAILURE, _run());
        assertEquals(StyleFixerCli.EXIT_FAILURE, _run("reformat", sourceDir.toString()));
        assertEquals(StyleFixerCli.EXIT_FAILURE, _run("fix"));
        assertEquals(StyleFixerCli.EXIT_FAILURE, _run("fix", tempDir.resolve("absent").toString()));
        assertEquals(StyleFixerCli.EXIT_OK, _run("--version"));
        assertEquals(StyleFixerCli.EXIT_OK, _run("-h"));
    }

    private int _run(String... args) {
        String[] withNoColor = new String[args.length + 1];
        System.arraycopy(args, 0, withNoColor, 0, args.length);
        withNoColor[args.length] = "--no-color";
        return StyleFixerCli.run(withNoColor);
    }

    private Path _write(String name, String content) throws IOException {
        Path file = sourceDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
