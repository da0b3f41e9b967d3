package com.stylefixer.cli;

import com.stylefixer.api.FixResult;
import com.stylefixer.api.error.FixerError;
import com.stylefixer.api.error.Severity;
import com.stylefixer.config.ConfigurationLoader;
import com.stylefixer.config.FixerConfig;
import com.stylefixer.core.StyleFixerEngine;
import com.stylefixer.plugins.FileType;
import com.stylefixer.plugins.csharp.CSharpStyleFixer;
import com.stylefixer.util.ErrorFormatter;
import com.stylefixer.util.LoggerUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface of the style fixer.
 */
public class StyleFixerCli {
    private static final Logger logger = LoggerUtil.getLogger(StyleFixerCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".stylefixer.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args) {
        // Check for color disabling early
        boolean useColors = !_hasOption(args, "--no-color");
        errorFormatter = new ErrorFormatter(useColors);

        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        // Configure logging level based on verbose flag
        boolean verbose = _hasOption(args, "--verbose");
        LoggerUtil.setConsoleLevel(verbose ? Level.FINE : Level.INFO);
        for (LoggerUtil.Area area : LoggerUtil.Area.values()) {
            LoggerUtil.setLevel(area, verbose ? Level.FINE : area.getDefaultLevel());
        }

        try {
            String command = args[0];

            switch (command) {
                case "fix":
                    return _fixFiles(args);
                case "check":
                    return _checkFiles(args);
                case "analyze":
                    return _analyzeFiles(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_FAILURE;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace();
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private static void _printVersion() {
        System.out.println("Style Fixer version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Style Fixer CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  stylefixer init [--force]         - Initialize configuration file");
        System.out.println("  stylefixer fix <path>             - Fix rule violations in path");
        System.out.println("  stylefixer check <path>           - Check files without changing them");
        System.out.println("  stylefixer analyze <path>         - Report every rule violation");
        System.out.println("  stylefixer --help|-h              - Show this help");
        System.out.println("  stylefixer --version|-v           - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (simplified)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include files matching pattern");
        System.out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        System.out.println("  --force                           - Force overwrite (with init command)");
    }

    private static int _fixFiles(String[] args) throws Exception {
        Path path = _targetPath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");

        try (StyleFixerEngine engine = _createEngine(_loadConfig(args))) {
            List<Path> files = engine.findFiles(path, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to fix");

            Instant start = Instant.now();
            Map<Path, FixResult> results = engine.fixFiles(files, _threads(args), true);
            Duration duration = Duration.between(start, Instant.now());

            int fixedCount = 0;
            int unchangedCount = 0;
            int errorCount = 0;
            int appliedCount = 0;
            Map<Path, List<FixerError>> errorsByFile = new LinkedHashMap<>();

            for (Map.Entry<Path, FixResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FixResult result = entry.getValue();

                if (!result.isSuccessful()) {
                    _printError("Failed to fix: " + file);
                    result.getErrors().stream()
                            .filter(e -> e.getSeverity().isFailure())
                            .forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                    errorsByFile.put(file, result.getErrors());
                    errorCount++;
                    continue;
                }

                appliedCount += result.getAppliedFixes().size();
                if (result.isChanged()) {
                    _printSuccess("Fixed: " + file);
                    fixedCount++;

                    if (!ciMode && verbose) {
                        _printInfo("  Applied fixes:");
                        result.getAppliedFixes().forEach(f ->
                                _printInfo("    - " + f.getRuleId() + " line " + f.getStartLine() + ": " + f.getDescription()));
                    }
                } else {
                    if (verbose) {
                        _printInfo("  Already clean: " + file);
                    }
                    unchangedCount++;
                }

                if (result.getErrors().stream().anyMatch(e -> e.getSeverity() == Severity.WARNING)) {
                    errorsByFile.put(file, result.getErrors());
                }
            }

            System.out.println("\nFix complete in " + _formatDuration(duration) + ":");
            System.out.println("  Processed files: " + results.size());
            System.out.println("  Fixed files: " + fixedCount);
            System.out.println("  Unchanged files: " + unchangedCount);
            System.out.println("  Files with errors: " + errorCount);
            System.out.println("  Applied fixes: " + appliedCount);

            if (!errorsByFile.isEmpty() && !ciMode) {
                System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            return errorCount > 0 ? EXIT_FAILURE : EXIT_OK;
        }
    }

    private static int _checkFiles(String[] args) throws Exception {
        Path path = _targetPath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");

        try (StyleFixerEngine engine = _createEngine(_loadConfig(args))) {
            List<Path> files = engine.findFiles(path, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to check");

            Instant start = Instant.now();
            Map<Path, FixResult> results = engine.fixFiles(files, _threads(args), false);
            Duration duration = Duration.between(start, Instant.now());

            int nonCompliantCount = 0;
            int errorCount = 0;
            Map<Path, List<FixerError>> errorsByFile = new LinkedHashMap<>();

            for (Map.Entry<Path, FixResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FixResult result = entry.getValue();

                if (!result.isSuccessful()) {
                    _printError("Could not check: " + file);
                    errorsByFile.put(file, result.getErrors());
                    errorCount++;
                } else if (result.isChanged()) {
                    _printWarning("File needs fixing: " + file);
                    nonCompliantCount++;

                    if (verbose) {
                        System.out.println("  Fixes that would be applied:");
                        result.getAppliedFixes().forEach(f ->
                                _printInfo("    - " + f.getRuleId() + " line " + f.getStartLine() + ": " + f.getDescription()));
                    }
                } else if (verbose) {
                    _printSuccess("  OK: " + file);
                }
            }

            System.out.println("\nCheck complete in " + _formatDuration(duration) + ":");
            System.out.println("  Checked files: " + results.size());
            System.out.println("  Files needing fixes: " + nonCompliantCount);
            System.out.println("  Files with processing errors: " + errorCount);

            if (!errorsByFile.isEmpty() && !ciMode) {
                System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            return nonCompliantCount > 0 || errorCount > 0 ? EXIT_FAILURE : EXIT_OK;
        }
    }

    private static int _analyzeFiles(String[] args) throws Exception {
        Path path = _targetPath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");

        try (StyleFixerEngine engine = _createEngine(_loadConfig(args))) {
            List<Path> files = engine.findFiles(path, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to analyze");

            Instant start = Instant.now();
            Map<Path, FixResult> results = engine.analyzeFiles(files, _threads(args));
            Duration duration = Duration.between(start, Instant.now());

            int issueCount = 0;
            Map<Path, List<FixerError>> errorsByFile = new LinkedHashMap<>();

            for (Map.Entry<Path, FixResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                List<FixerError> errors = entry.getValue().getErrors();

                if (!errors.isEmpty()) {
                    errorsByFile.put(file, errors);
                    issueCount += errors.size();

                    if (!ciMode) {
                        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, file + ":"));

                        Map<Severity, List<FixerError>> errorsBySeverity = errorFormatter.groupBySeverity(errors);
                        for (Severity severity : Severity.values()) {
                            _printErrorsBySeverity(errorsBySeverity, severity);
                        }
                    }
                } else if (verbose) {
                    _printSuccess("  No issues found: " + file);
                }
            }

            int filesWithErrors = _countFilesWith(errorsByFile, Severity.FATAL) + _countFilesWith(errorsByFile, Severity.ERROR);
            int filesWithWarnings = _countFilesWith(errorsByFile, Severity.WARNING);

            System.out.println("\nAnalysis complete in " + _formatDuration(duration) + ":");
            System.out.println("  Files analyzed: " + results.size());
            System.out.println("  Total issues found: " + issueCount);
            System.out.println("  Files with errors: " + filesWithErrors);
            System.out.println("  Files with violations: " + filesWithWarnings);

            if (!errorsByFile.isEmpty() && !ciMode) {
                System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            if (ciMode) {
                System.out.println("RESULT:files=" + results.size() +
                        ";errors=" + filesWithErrors +
                        ";violations=" + filesWithWarnings +
                        ";issues=" + issueCount);
            }

            return filesWithErrors > 0 ? EXIT_FAILURE : EXIT_OK;
        }
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_OK;
        }

        FixerConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static Path _targetPath(String[] args) {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return null;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return null;
        }
        return path;
    }

    private static FixerConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static StyleFixerEngine _createEngine(FixerConfig config) {
        StyleFixerEngine engine = new StyleFixerEngine(config);
        engine.registerPlugin(FileType.CSHARP, new CSharpStyleFixer());
        return engine;
    }

    private static int _threads(String[] args) {
        String threadsStr = _getOptionValue(args, "--threads");
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return Math.max(1, threads);
    }

    private static int _countFilesWith(Map<Path, List<FixerError>> errorsByFile, Severity severity) {
        return (int) errorsByFile.values().stream()
                .filter(errors -> errors.stream().anyMatch(e -> e.getSeverity() == severity))
                .count();
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static void _printErrorsBySeverity(Map<Severity, List<FixerError>> errorsBySeverity, Severity severity) {
        if (errorsBySeverity.containsKey(severity)) {
            for (FixerError error : errorsBySeverity.get(severity)) {
                switch (severity) {
                    case FATAL:
                    case ERROR:
                        _printError("  " + errorFormatter.formatError(error));
                        break;
                    case WARNING:
                        _printWarning("  " + errorFormatter.formatError(error));
                        break;
                    case INFO:
                        _printInfo("  " + errorFormatter.formatError(error));
                        break;
                }
            }
        }
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
