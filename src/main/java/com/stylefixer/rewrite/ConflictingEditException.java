package com.stylefixer.rewrite;

import com.stylefixer.syntax.SyntaxElement;

/**
 * Two fixes computed against the same snapshot touch the same or nested tree positions.
 */
public class ConflictingEditException extends Exception {
    private final transient SyntaxElement first;
    private final transient SyntaxElement second;

    public ConflictingEditException(SyntaxElement first, SyntaxElement second) {
        super(first.equals(second)
                ? "Two fixes replace the same element " + first
                : "Fix for " + second + " overlaps fix for " + first);
        this.first = first;
        this.second = second;
    }

    public SyntaxElement getFirst() {
        return first;
    }

    public SyntaxElement getSecond() {
        return second;
    }
}
