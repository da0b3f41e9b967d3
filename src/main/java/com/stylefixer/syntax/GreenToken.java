package com.stylefixer.syntax;

import java.util.Objects;

/**
 * A token with its leading and trailing trivia.
 */
public final class GreenToken extends GreenElement {
    private final String text;
    private final TriviaList leadingTrivia;
    private final TriviaList trailingTrivia;

    public GreenToken(SyntaxKind kind, String text, TriviaList leadingTrivia, TriviaList trailingTrivia) {
        this(kind, text, leadingTrivia, trailingTrivia, false);
    }

    public GreenToken(SyntaxKind kind, String text, TriviaList leadingTrivia, TriviaList trailingTrivia,
                      boolean formattingExempt) {
        super(kind, formattingExempt);
        if (!kind.isToken()) {
            throw new IllegalArgumentException("Not a token kind: " + kind);
        }
        this.text = Objects.requireNonNull(text, "text");
        this.leadingTrivia = Objects.requireNonNull(leadingTrivia, "leadingTrivia");
        this.trailingTrivia = Objects.requireNonNull(trailingTrivia, "trailingTrivia");
    }

    /**
     * Creates a token of a fixed-text kind without trivia.
     */
    public static GreenToken of(SyntaxKind kind) {
        if (kind.getText() == null) {
            throw new IllegalArgumentException("Kind has no fixed text: " + kind);
        }
        return new GreenToken(kind, kind.getText(), TriviaList.EMPTY, TriviaList.EMPTY);
    }

    @Override
    public boolean isToken() {
        return true;
    }

    public String getText() {
        return text;
    }

    public int getWidth() {
        return text.length();
    }

    @Override
    public int getFullWidth() {
        return leadingTrivia.getFullWidth() + text.length() + trailingTrivia.getFullWidth();
    }

    @Override
    public TriviaList getLeadingTrivia() {
        return leadingTrivia;
    }

    @Override
    public TriviaList getTrailingTrivia() {
        return trailingTrivia;
    }

    @Override
    public GreenToken withLeadingTrivia(TriviaList trivia) {
        return new GreenToken(getKind(), text, trivia, trailingTrivia, isFormattingExempt());
    }

    @Override
    public GreenToken withTrailingTrivia(TriviaList trivia) {
        return new GreenToken(getKind(), text, leadingTrivia, trivia, isFormattingExempt());
    }

    /**
     * Re-labels the token, used when an identifier turns out to be a contextual keyword.
     */
    public GreenToken withKind(SyntaxKind kind) {
        return new GreenToken(kind, text, leadingTrivia, trailingTrivia, isFormattingExempt());
    }

    @Override
    public GreenToken withFormattingExempt(boolean exempt) {
        if (exempt == isFormattingExempt()) {
            return this;
        }
        return new GreenToken(getKind(), text, leadingTrivia, trailingTrivia, exempt);
    }

    @Override
    void writeTo(StringBuilder sb) {
        leadingTrivia.writeTo(sb);
        sb.append(text);
        trailingTrivia.writeTo(sb);
    }
}
