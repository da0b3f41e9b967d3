package com.stylefixer.syntax;

import java.util.Objects;

/**
 * A single piece of trivia: whitespace, a line break, a comment, a directive or skipped text.
 *
 * <p>Trivia values are immutable and carry no position. End-of-line trivia keeps its exact text so
 * that LF, CRLF and the rarer one-character terminators survive a rewrite unchanged.
 */
public final class SyntaxTrivia {
    public static final SyntaxTrivia LINE_FEED = endOfLine("\n");
    public static final SyntaxTrivia CARRIAGE_RETURN_LINE_FEED = endOfLine("\r\n");

    private final TriviaKind kind;
    private final String text;
    private final GreenNode structure;
    private final boolean formattingExempt;

    private SyntaxTrivia(TriviaKind kind, String text, GreenNode structure, boolean formattingExempt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.structure = structure;
        this.formattingExempt = formattingExempt;
    }

    public static SyntaxTrivia create(TriviaKind kind, String text) {
        if (kind == TriviaKind.STRUCTURED) {
            throw new IllegalArgumentException("Structured trivia must be created from its structure");
        }
        return new SyntaxTrivia(kind, text, null, false);
    }

    public static SyntaxTrivia whitespace(String text) {
        return create(TriviaKind.WHITESPACE, text);
    }

    public static SyntaxTrivia endOfLine(String text) {
        return create(TriviaKind.END_OF_LINE, text);
    }

    public static SyntaxTrivia structured(GreenNode structure) {
        return new SyntaxTrivia(TriviaKind.STRUCTURED, structure.toFullString(), structure, false);
    }

    public TriviaKind getKind() {
        return kind;
    }

    public boolean isKind(TriviaKind kind) {
        return this.kind == kind;
    }

    public String getText() {
        return text;
    }

    public int getFullWidth() {
        return text.length();
    }

    public boolean hasStructure() {
        return structure != null;
    }

    /**
     * Parsed subtree of structured trivia, {@code null} for plain trivia.
     */
    public GreenNode getStructure() {
        return structure;
    }

    /**
     * Whether a formatting pass must leave this trivia alone.
     */
    public boolean isFormattingExempt() {
        return formattingExempt;
    }

    public SyntaxTrivia withFormattingExempt(boolean exempt) {
        if (exempt == formattingExempt) {
            return this;
        }
        return new SyntaxTrivia(kind, text, structure, exempt);
    }

    public SyntaxTrivia withStructure(GreenNode newStructure) {
        if (kind != TriviaKind.STRUCTURED) {
            throw new IllegalStateException("Only structured trivia has a structure");
        }
        return new SyntaxTrivia(kind, newStructure.toFullString(), newStructure, formattingExempt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxTrivia)) {
            return false;
        }
        SyntaxTrivia other = (SyntaxTrivia) o;
        return kind == other.kind && formattingExempt == other.formattingExempt && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, formattingExempt);
    }

    @Override
    public String toString() {
        return kind + "[" + text.replace("\r", "\\r").replace("\n", "\\n") + "]";
    }
}
