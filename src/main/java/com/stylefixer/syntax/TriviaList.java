package com.stylefixer.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable, ordered list of trivia attached to one side of a token.
 *
 * <p>All transforms return a new list and keep the relative order of the trivia they retain.
 */
public final class TriviaList implements Iterable<SyntaxTrivia> {
    public static final TriviaList EMPTY = new TriviaList(Collections.emptyList());

    private final List<SyntaxTrivia> items;

    private TriviaList(List<SyntaxTrivia> items) {
        this.items = items;
    }

    public static TriviaList of(SyntaxTrivia... trivia) {
        return of(List.of(trivia));
    }

    public static TriviaList of(List<SyntaxTrivia> trivia) {
        if (trivia.isEmpty()) {
            return EMPTY;
        }
        return new TriviaList(Collections.unmodifiableList(new ArrayList<>(trivia)));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public SyntaxTrivia get(int index) {
        return items.get(index);
    }

    public SyntaxTrivia first() {
        return items.isEmpty() ? null : items.get(0);
    }

    public SyntaxTrivia last() {
        return items.isEmpty() ? null : items.get(items.size() - 1);
    }

    public List<SyntaxTrivia> asList() {
        return items;
    }

    public boolean any(TriviaKind kind) {
        for (SyntaxTrivia trivia : items) {
            if (trivia.isKind(kind)) {
                return true;
            }
        }
        return false;
    }

    public TriviaList add(SyntaxTrivia trivia) {
        return insert(items.size(), trivia);
    }

    public TriviaList addAll(TriviaList other) {
        if (other.isEmpty()) {
            return this;
        }
        List<SyntaxTrivia> copy = new ArrayList<>(items);
        copy.addAll(other.items);
        return of(copy);
    }

    public TriviaList insert(int index, SyntaxTrivia trivia) {
        List<SyntaxTrivia> copy = new ArrayList<>(items);
        copy.add(index, trivia);
        return of(copy);
    }

    /**
     * Removes the trivia in {@code [start, end)}.
     */
    public TriviaList removeRange(int start, int end) {
        List<SyntaxTrivia> copy = new ArrayList<>(items);
        copy.subList(start, end).clear();
        return of(copy);
    }

    /**
     * Returns the trivia in {@code [start, end)}.
     */
    public TriviaList subList(int start, int end) {
        return of(items.subList(start, end));
    }

    public TriviaList withoutLeadingWhitespace() {
        return withoutLeadingWhitespace(true);
    }

    /**
     * Drops whitespace (and, if requested, line breaks) from the start of the list.
     */
    public TriviaList withoutLeadingWhitespace(boolean endOfLineIsWhitespace) {
        int start = 0;
        while (start < items.size() && isWhitespace(items.get(start), endOfLineIsWhitespace)) {
            start++;
        }
        return start == 0 ? this : subList(start, items.size());
    }

    public TriviaList withoutTrailingWhitespace() {
        return withoutTrailingWhitespace(true);
    }

    /**
     * Drops whitespace (and, if requested, line breaks) from the end of the list.
     */
    public TriviaList withoutTrailingWhitespace(boolean endOfLineIsWhitespace) {
        int end = items.size();
        while (end > 0 && isWhitespace(items.get(end - 1), endOfLineIsWhitespace)) {
            end--;
        }
        return end == items.size() ? this : subList(0, end);
    }

    /**
     * Drops structured trivia such as preprocessor directives.
     */
    public TriviaList withoutStructuredTrivia() {
        List<SyntaxTrivia> kept = new ArrayList<>(items.size());
        for (SyntaxTrivia trivia : items) {
            if (!trivia.hasStructure()) {
                kept.add(trivia);
            }
        }
        return kept.size() == items.size() ? this : of(kept);
    }

    public int getFullWidth() {
        int width = 0;
        for (SyntaxTrivia trivia : items) {
            width += trivia.getFullWidth();
        }
        return width;
    }

    public String toFullString() {
        StringBuilder sb = new StringBuilder();
        writeTo(sb);
        return sb.toString();
    }

    void writeTo(StringBuilder sb) {
        for (SyntaxTrivia trivia : items) {
            sb.append(trivia.getText());
        }
    }

    @Override
    public Iterator<SyntaxTrivia> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TriviaList && items.equals(((TriviaList) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }

    private static boolean isWhitespace(SyntaxTrivia trivia, boolean endOfLineIsWhitespace) {
        return trivia.isKind(TriviaKind.WHITESPACE)
                || (endOfLineIsWhitespace && trivia.isKind(TriviaKind.END_OF_LINE));
    }
}
