package com.stylefixer.syntax;

/**
 * A token at one position of a {@link SourceTree}.
 */
public final class SyntaxToken extends SyntaxElement {

    SyntaxToken(SourceTree tree, int index) {
        super(tree, index);
    }

    @Override
    public GreenToken getGreen() {
        return (GreenToken) tree.greenAt(index);
    }

    @Override
    public boolean isToken() {
        return true;
    }

    public String getText() {
        return getGreen().getText();
    }

    @Override
    public TextSpan getSpan() {
        int start = tree.fullStartOf(index) + getGreen().getLeadingTrivia().getFullWidth();
        return new TextSpan(start, start + getGreen().getWidth());
    }

    @Override
    public SyntaxToken getFirstToken() {
        return this;
    }

    @Override
    public SyntaxToken getLastToken() {
        return this;
    }

    /**
     * Token before this one in document order, or {@code null} for the first token.
     */
    public SyntaxToken getPreviousToken() {
        return tree.tokenAtOrdinal(tree.tokenOrdinalOf(index) - 1);
    }

    /**
     * Token after this one in document order, or {@code null} for the end-of-file token.
     */
    public SyntaxToken getNextToken() {
        return tree.tokenAtOrdinal(tree.tokenOrdinalOf(index) + 1);
    }

    /**
     * Zero-based line on which the token's text starts.
     */
    public int getLine() {
        return tree.getText().getLineNumber(getSpan().getStart());
    }

    /**
     * Whether only whitespace precedes the token on its physical line.
     */
    public boolean isFirstOnLine() {
        SourceText text = tree.getText();
        int start = getSpan().getStart();
        for (int i = text.getLineAt(start).getStart(); i < start; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t' && c != '\f' && c != '\u000B') {
                return false;
            }
        }
        return true;
    }
}
