package com.stylefixer.syntax;

/**
 * One physical line of a {@link SourceText}, with its line terminator.
 */
public final class TextLine {
    private final SourceText text;
    private final int lineNumber;
    private final int start;
    private final int end;
    private final int endIncludingLineBreak;

    TextLine(SourceText text, int lineNumber, int start, int end, int endIncludingLineBreak) {
        this.text = text;
        this.lineNumber = lineNumber;
        this.start = start;
        this.end = end;
        this.endIncludingLineBreak = endIncludingLineBreak;
    }

    /**
     * Zero-based line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getStart() {
        return start;
    }

    /**
     * End of the line's content, excluding the terminator.
     */
    public int getEnd() {
        return end;
    }

    public int getEndIncludingLineBreak() {
        return endIncludingLineBreak;
    }

    /**
     * Length of the terminator: 0 on the last line of a file without a final line break.
     */
    public int getLineBreakLength() {
        return endIncludingLineBreak - end;
    }

    public String getLineBreak() {
        return text.toString(end, endIncludingLineBreak);
    }

    public String getContent() {
        return text.toString(start, end);
    }

    @Override
    public String toString() {
        return getContent();
    }
}
