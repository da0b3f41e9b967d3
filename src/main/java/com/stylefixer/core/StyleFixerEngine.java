package com.stylefixer.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.stylefixer.api.FixResult;
import com.stylefixer.api.FixerPlugin;
import com.stylefixer.api.StyleFixer;
import com.stylefixer.api.error.FixerError;
import com.stylefixer.api.error.Severity;
import com.stylefixer.config.FixerConfig;
import com.stylefixer.plugins.FileType;
import com.stylefixer.util.LoggerUtil;
import com.stylefixer.util.PathFilter;

/**
 * Thread-safe entry point of the style fixer.
 * This class delegates each file to the plugin registered for its file type and
 * processes directory trees in parallel, isolating failures to the file they occur in.
 */
public class StyleFixerEngine implements StyleFixer, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(StyleFixerEngine.class);

    private final Map<FileType, FixerPlugin> plugins = new ConcurrentHashMap<>();
    private final FixerConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    /**
     * Creates a new engine with the provided configuration.
     */
    public StyleFixerEngine(FixerConfig config) {
        this.config = config;
        logger.info("Style fixer initialized with configuration");
    }

    /**
     * Registers a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, FixerPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.info("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Fixes a single source using the appropriate plugin.
     */
    @Override
    public FixResult fixFile(Path filePath, String sourceCode) {
        return _process(filePath, sourceCode, Mode.FIX);
    }

    /**
     * Reports the violations in a single source without changing it.
     */
    @Override
    public FixResult analyzeFile(Path filePath, String sourceCode) {
        return _process(filePath, sourceCode, Mode.ANALYZE);
    }

    private FixResult _process(Path filePath, String sourceCode, Mode mode) {
        FileType fileType = FileType.detect(filePath);
        FixerPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FixResult.builder()
                    .successful(false)
                    .originalCode(sourceCode)
                    .fixedCode(sourceCode)
                    .addError(new FixerError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            FixResult result = mode == Mode.FIX
                    ? plugin.fix(filePath, sourceCode)
                    : plugin.analyze(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Successfully processed: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to process: " + filePath + " - " +
                        result.getErrors().stream()
                                .filter(e -> e.getSeverity().isFailure())
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (Exception e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error processing file: " + filePath, e);

            return _failure(sourceCode, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Fixes every supported file below {@code directory} and writes the changed ones back.
     */
    @Override
    public Map<Path, FixResult> fixDirectory(Path directory) {
        return fixDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Fixes a directory with a specified thread count.
     */
    public Map<Path, FixResult> fixDirectory(Path directory, int threadCount) {
        try {
            return fixFiles(findFiles(directory, null), threadCount, true);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new TreeMap<>();
        }
    }

    /**
     * Fixes the given files in parallel. A file whose fix fails is reported in its own result and
     * never written; the other files are unaffected.
     *
     * @param writeChanges whether successfully fixed files that changed are written back
     */
    public Map<Path, FixResult> fixFiles(List<Path> files, int threadCount, boolean writeChanges) {
        return _processFiles(files, threadCount, writeChanges ? Mode.FIX_AND_WRITE : Mode.FIX);
    }

    /**
     * Analyzes the given files in parallel.
     */
    public Map<Path, FixResult> analyzeFiles(List<Path> files, int threadCount) {
        return _processFiles(files, threadCount, Mode.ANALYZE);
    }

    /**
     * Lists the supported files at {@code path}, honoring the configured {@code ignoreFiles}
     * patterns and an optional include pattern. A regular file is returned as is.
     */
    public List<Path> findFiles(Path path, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        if (!Files.isDirectory(path)) {
            logger.warning("Path is not a directory: " + path);
            return List.of();
        }

        List<String> ignorePatterns = config.getGeneralConfig("ignoreFiles", new ArrayList<String>());
        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(file -> plugins.containsKey(FileType.detect(file)))
                    .filter(file -> PathFilter.matchesIncludePattern(file, includePattern))
                    .filter(file -> !PathFilter.isIgnored(file, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Map<Path, FixResult> _processFiles(List<Path> files, int threadCount, Mode mode) {
        ConcurrentHashMap<Path, FixResult> results = new ConcurrentHashMap<>();
        logger.info("Processing " + files.size() + " files with " + threadCount + " threads");

        if (files.isEmpty()) {
            return new TreeMap<>(results);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : files) {
                executor.submit(() -> results.put(file, _processFile(file, mode)));
            }

            // Shutdown executor and wait for all tasks to complete
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " files");
        return new TreeMap<>(results);
    }

    private FixResult _processFile(Path file, Mode mode) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return _failure(null, "Failed to read file: " + e.getMessage());
        }

        FixResult result = mode == Mode.ANALYZE ? analyzeFile(file, content) : fixFile(file, content);
        if (mode == Mode.FIX_AND_WRITE && result.isSuccessful() && result.isChanged()) {
            try {
                Files.writeString(file, result.getFixedCode(), StandardCharsets.UTF_8);
                logger.info("Fixed: " + file);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to write file: " + file, e);
                return _failure(content, "Failed to write file: " + e.getMessage());
            }
        }
        return result;
    }

    private static FixResult _failure(String sourceCode, String message) {
        return FixResult.builder()
                .successful(false)
                .originalCode(sourceCode)
                .fixedCode(sourceCode)
                .addError(new FixerError(Severity.FATAL, message, 1, 1))
                .build();
    }

    /**
     * Gets the number of files processed.
     */
    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    /**
     * Gets the number of successfully processed files.
     */
    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the number of files that could not be processed.
     */
    public int getErrorCount() {
        return errorCount.get();
    }

    /**
     * Checks if a plugin is registered for the given file type.
     */
    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes all plugins and releases resources.
     */
    @Override
    public void close() throws Exception {
        logger.info("Closing style fixer: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        // Close all plugins that implement AutoCloseable
        for (Map.Entry<FileType, FixerPlugin> entry : plugins.entrySet()) {
            FixerPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    logger.fine("Closing plugin for file type: " + entry.getKey());
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    // Keep the first exception but continue closing other plugins
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }

    private enum Mode {
        FIX,
        FIX_AND_WRITE,
        ANALYZE
    }
}
