package com.stylefixer.syntax;

/**
 * Half-open character range {@code [start, end)} in a source text.
 */
public final class TextSpan {
    private final int start;
    private final int end;

    public TextSpan(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static TextSpan fromBounds(int start, int end) {
        return new TextSpan(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLength() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int position) {
        return position >= start && position < end;
    }

    public boolean contains(TextSpan span) {
        return span.start >= start && span.end <= end;
    }

    public boolean overlapsWith(TextSpan span) {
        return Math.max(start, span.start) < Math.min(end, span.end);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TextSpan)) {
            return false;
        }
        TextSpan other = (TextSpan) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
