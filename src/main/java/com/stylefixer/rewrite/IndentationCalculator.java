package com.stylefixer.rewrite;

import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SyntaxElement;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaList;

/**
 * Computes indentation from the structure that encloses a token, never from the whitespace already
 * in front of it.
 *
 * <p>A construct with a braced body adds one step for everything strictly between its braces. A
 * statement that embeds another statement adds one step for a non-block body, except for the
 * {@code if} that directly follows an {@code else}.
 */
public final class IndentationCalculator {

    private IndentationCalculator() {
    }

    public static int computeIndentSteps(SyntaxToken token) {
        int steps = 0;
        SyntaxElement child = token;
        for (SyntaxNode parent = token.getParent(); parent != null; parent = parent.getParent()) {
            switch (parent.getKind().getIndentationRole()) {
                case BRACED_BODY:
                    if (isBetweenBraces(parent, child)) {
                        steps++;
                    }
                    break;
                case EMBEDDED_STATEMENT:
                    if (isEmbeddedStatement(parent, child)) {
                        steps++;
                    }
                    break;
                default:
                    break;
            }
            child = parent;
        }
        return steps;
    }

    /**
     * Renders {@code steps} indentation levels. Zero steps is an empty list.
     */
    public static TriviaList renderIndentation(int steps, IndentationSettings settings) {
        if (steps <= 0) {
            return TriviaList.EMPTY;
        }
        int columns = steps * settings.getIndentSize();
        StringBuilder sb = new StringBuilder(columns);
        if (settings.isUseTabs()) {
            sb.append("\t".repeat(columns / settings.getTabSize()));
            sb.append(" ".repeat(columns % settings.getTabSize()));
        } else {
            sb.append(" ".repeat(columns));
        }
        return TriviaList.of(SyntaxTrivia.whitespace(sb.toString()).withFormattingExempt(true));
    }

    public static TriviaList indentationFor(SyntaxToken token, IndentationSettings settings) {
        return renderIndentation(computeIndentSteps(token), settings);
    }

    /**
     * Returns the first token whose text starts on the same line as {@code token}'s text, which may be
     * {@code token} itself.
     */
    public static SyntaxToken firstTokenOnLine(SyntaxToken token) {
        SourceText text = token.getTree().getText();
        int line = text.getLineNumber(token.getSpan().getStart());
        SyntaxToken first = token;
        for (SyntaxToken previous = token.getPreviousToken(); previous != null; previous = previous.getPreviousToken()) {
            if (text.getLineNumber(previous.getSpan().getStart()) != line) {
                break;
            }
            first = previous;
        }
        return first;
    }

    private static boolean isBetweenBraces(SyntaxNode parent, SyntaxElement child) {
        SyntaxToken open = parent.getChildToken(SyntaxKind.OPEN_BRACE);
        SyntaxToken close = parent.getChildToken(SyntaxKind.CLOSE_BRACE);
        if (open == null) {
            return false;
        }
        int index = child.getIndex();
        return index > open.getIndex() && (close == null || index < close.getIndex());
    }

    private static boolean isEmbeddedStatement(SyntaxNode parent, SyntaxElement child) {
        if (!child.getKind().isStatement() || child.isKind(SyntaxKind.BLOCK)) {
            return false;
        }
        return !(parent.isKind(SyntaxKind.ELSE_CLAUSE) && child.isKind(SyntaxKind.IF_STATEMENT));
    }
}
