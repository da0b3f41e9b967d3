package com.stylefixer.rewrite;

import com.stylefixer.syntax.SyntaxTrivia;

/**
 * Indent unit and line-ending fallback used when synthesizing text.
 */
public final class IndentationSettings {
    public static final IndentationSettings DEFAULT = new IndentationSettings(4, 4, false, "\r\n");

    private final int indentSize;
    private final int tabSize;
    private final boolean useTabs;
    private final String newLine;

    public IndentationSettings(int indentSize, int tabSize, boolean useTabs, String newLine) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        if (tabSize < 1) {
            throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
        }
        if (newLine == null || newLine.isEmpty()) {
            throw new IllegalArgumentException("newLine must not be empty");
        }
        this.indentSize = indentSize;
        this.tabSize = tabSize;
        this.useTabs = useTabs;
        this.newLine = newLine;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public int getTabSize() {
        return tabSize;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    public String getNewLine() {
        return newLine;
    }

    /**
     * Line break used when the document offers no evidence of its own.
     */
    public SyntaxTrivia getNewLineTrivia() {
        return SyntaxTrivia.endOfLine(newLine);
    }

    public IndentationSettings withUseTabs(boolean tabs) {
        return new IndentationSettings(indentSize, tabSize, tabs, newLine);
    }

    public IndentationSettings withNewLine(String lineEnding) {
        return new IndentationSettings(indentSize, tabSize, useTabs, lineEnding);
    }

    @Override
    public String toString() {
        return "IndentationSettings{indentSize=" + indentSize + ", tabSize=" + tabSize + ", useTabs=" + useTabs
                + ", newLine=" + newLine.replace("\r", "\\r").replace("\n", "\\n") + "}";
    }
}
