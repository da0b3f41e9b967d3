package com.stylefixer.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw source text split into physical lines.
 *
 * <p>Recognised line terminators are {@code \r\n}, {@code \n}, {@code \r}, and the Unicode next-line,
 * line-separator and paragraph-separator characters.
 */
public final class SourceText {
    private final String content;
    private final List<TextLine> lines;

    private SourceText(String content) {
        this.content = content;
        this.lines = Collections.unmodifiableList(splitLines());
    }

    public static SourceText from(String content) {
        return new SourceText(content);
    }

    public static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2028' || c == '\u2029';
    }

    public int length() {
        return content.length();
    }

    public char charAt(int position) {
        return content.charAt(position);
    }

    public String toString(int start, int end) {
        return content.substring(start, end);
    }

    public List<TextLine> getLines() {
        return lines;
    }

    public int getLineCount() {
        return lines.size();
    }

    public TextLine getLine(int lineNumber) {
        return lines.get(lineNumber);
    }

    /**
     * Zero-based number of the line containing {@code position}. A position equal to the text length
     * belongs to the last line.
     */
    public int getLineNumber(int position) {
        if (position < 0 || position > content.length()) {
            throw new IndexOutOfBoundsException("Position " + position + " outside text of length " + content.length());
        }
        int low = 0;
        int high = lines.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lines.get(mid).getStart() <= position) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    public TextLine getLineAt(int position) {
        return lines.get(getLineNumber(position));
    }

    /**
     * Zero-based column of {@code position} within its line.
     */
    public int getColumn(int position) {
        return position - getLineAt(position).getStart();
    }

    private List<TextLine> splitLines() {
        List<TextLine> result = new ArrayList<>();
        int lineStart = 0;
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (isLineBreak(c)) {
                int breakEnd = i + 1;
                if (c == '\r' && breakEnd < content.length() && content.charAt(breakEnd) == '\n') {
                    breakEnd++;
                }
                result.add(new TextLine(this, result.size(), lineStart, i, breakEnd));
                lineStart = breakEnd;
                i = breakEnd;
            } else {
                i++;
            }
        }
        result.add(new TextLine(this, result.size(), lineStart, content.length(), content.length()));
        return result;
    }

    @Override
    public String toString() {
        return content;
    }
}
