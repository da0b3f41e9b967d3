package com.stylefixer.api.error;

/**
 * A finding or failure reported for one file, positioned by one-based line and column.
 */
public class FixerError {
    private final Severity severity;
    private final String ruleId;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FixerError(Severity severity, String message, int line, int column) {
        this(severity, null, message, line, column, null);
    }

    public FixerError(Severity severity, String ruleId, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.ruleId = ruleId;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    public Severity getSeverity() { return severity; }

    /** Rule that produced the finding, {@code null} for failures not tied to a rule. */
    public String getRuleId() { return ruleId; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return severity + (ruleId == null ? "" : " " + ruleId) + " [" + line + ":" + column + "] " + message;
    }
}
