package com.stylefixer.util;

import com.stylefixer.api.error.FixerError;
import com.stylefixer.api.error.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Renders fixer errors and per-file summaries for the console.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use ANSI colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one error as {@code SEVERITY [rule]: message (Line l, Column c)}.
     */
    public String formatError(FixerError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr);
        if (error.getRuleId() != null) {
            sb.append(" [").append(error.getRuleId()).append("]");
        }
        sb.append(": ").append(error.getMessage());
        sb.append(" (Line ").append(error.getLine()).append(", Column ").append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a summary of error counts per file followed by the totals.
     */
    public String formatErrorSummary(Map<Path, List<FixerError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        for (Map.Entry<Path, List<FixerError>> entry : fileErrors.entrySet()) {
            List<FixerError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = _countBySeverity(errors);
            counts.forEach((severity, count) -> totals.merge(severity, count, Long::sum));

            sb.append(entry.getKey().getFileName()).append(": ").append(_formatCounts(counts)).append("\n");
        }

        sb.append("\nTotal: ").append(_formatCounts(totals));
        return sb.toString();
    }

    /**
     * Groups errors by severity.
     */
    public Map<Severity, List<FixerError>> groupBySeverity(List<FixerError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FixerError::getSeverity,
                () -> new EnumMap<>(Severity.class), Collectors.toList()));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private static Map<Severity, Long> _countBySeverity(List<FixerError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FixerError::getSeverity,
                () -> new EnumMap<>(Severity.class), Collectors.counting()));
    }

    private String _formatCounts(Map<Severity, Long> counts) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Map.Entry<Severity, Long> entry : counts.entrySet()) {
            long count = entry.getValue();
            switch (entry.getKey()) {
                case FATAL -> joiner.add(colorize(ANSI_RED, count + " fatal"));
                case ERROR -> joiner.add(colorize(ANSI_RED, count + " errors"));
                case WARNING -> joiner.add(colorize(ANSI_YELLOW, count + " warnings"));
                case INFO -> joiner.add(colorize(ANSI_BLUE, count + " info"));
            }
        }
        return joiner.toString();
    }
}
