package com.stylefixer.api;

import java.nio.file.Path;

import com.stylefixer.config.FixerConfig;

/**
 * A language plugin: analyzes source text for rule violations and rewrites them.
 */
public interface FixerPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FixerConfig config);

    /**
     * Fixes every enabled rule's violations in the source.
     */
    FixResult fix(Path filePath, String sourceCode);

    /**
     * Reports violations without rewriting; the result's code equals the input.
     */
    FixResult analyze(Path filePath, String sourceCode);
}
