package com.stylefixer.api;

/**
 * A rule violation that was rewritten, with the one-based lines it covered before the rewrite.
 */
public class AppliedFix {
    private final String ruleId;
    private final int startLine;
    private final int endLine;
    private final String description;

    public AppliedFix(String ruleId, int startLine, int endLine, String description) {
        this.ruleId = ruleId;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    public String getRuleId() { return ruleId; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }
}
