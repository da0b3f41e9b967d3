package com.stylefixer.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for fixing single sources and whole directory trees.
 */
public interface StyleFixer {
    FixResult fixFile(Path filePath, String sourceCode);
    FixResult analyzeFile(Path filePath, String sourceCode);
    Map<Path, FixResult> fixDirectory(Path directory);
}
