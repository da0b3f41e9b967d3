package com.stylefixer.syntax;

/**
 * Position-free, immutable syntax data shared between tree snapshots.
 *
 * <p>A green element knows its kind, its text and its children, but not where it sits. Positions,
 * parents and identity are supplied by the {@link SourceTree} snapshot that indexes it, so the same
 * green value may appear in many snapshots, or several times in one.
 */
public abstract class GreenElement {
    private final SyntaxKind kind;
    private final boolean formattingExempt;

    GreenElement(SyntaxKind kind, boolean formattingExempt) {
        this.kind = kind;
        this.formattingExempt = formattingExempt;
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean isKind(SyntaxKind kind) {
        return this.kind == kind;
    }

    /**
     * Whether a formatting pass must leave this element alone.
     */
    public boolean isFormattingExempt() {
        return formattingExempt;
    }

    public abstract boolean isToken();

    public abstract int getFullWidth();

    public abstract TriviaList getLeadingTrivia();

    public abstract TriviaList getTrailingTrivia();

    public abstract GreenElement withLeadingTrivia(TriviaList trivia);

    public abstract GreenElement withTrailingTrivia(TriviaList trivia);

    public abstract GreenElement withFormattingExempt(boolean exempt);

    abstract void writeTo(StringBuilder sb);

    /**
     * Source text including leading and trailing trivia.
     */
    public String toFullString() {
        StringBuilder sb = new StringBuilder(getFullWidth());
        writeTo(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return toFullString();
    }
}
