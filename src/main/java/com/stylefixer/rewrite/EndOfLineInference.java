package com.stylefixer.rewrite;

import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TextLine;
import com.stylefixer.syntax.TriviaList;

/**
 * Picks the line break to use for text inserted at a token, preferring the closest evidence in the
 * document over the configured default.
 *
 * <p>Evidence is consulted in this order: the token's own leading trivia, the previous token's
 * trailing trivia, the terminator of the token's physical line, the terminator of the line before,
 * and finally {@link IndentationSettings#getNewLine()}.
 */
public final class EndOfLineInference {

    private EndOfLineInference() {
    }

    public static SyntaxTrivia inferEndOfLine(SyntaxToken token, SourceText text, IndentationSettings settings) {
        SyntaxTrivia preceding = precedingEndOfLine(token);
        if (preceding != null) {
            return preceding;
        }

        int lineNumber = text.getLineNumber(token.getSpan().getStart());
        if (lineNumber >= 0 && lineNumber < text.getLineCount()) {
            SyntaxTrivia following = endOfLineForLine(text.getLine(lineNumber));
            if (following != null) {
                return following;
            }
        }

        if (lineNumber > 0) {
            SyntaxTrivia previous = endOfLineForLine(text.getLine(lineNumber - 1));
            if (previous != null) {
                return previous;
            }
        }

        return settings.getNewLineTrivia();
    }

    private static SyntaxTrivia precedingEndOfLine(SyntaxToken token) {
        SyntaxTrivia leading = TriviaClassifier.lastEndOfLine(token.getLeadingTrivia());
        if (leading != null) {
            return leading;
        }
        SyntaxToken previous = token.getPreviousToken();
        if (previous == null) {
            return null;
        }
        TriviaList trailing = previous.getTrailingTrivia();
        return TriviaClassifier.lastEndOfLine(trailing);
    }

    private static SyntaxTrivia endOfLineForLine(TextLine line) {
        switch (line.getLineBreakLength()) {
            case 2:
                return SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED;
            case 1:
                String lineBreak = line.getLineBreak();
                return "\n".equals(lineBreak) ? SyntaxTrivia.LINE_FEED : SyntaxTrivia.endOfLine(lineBreak);
            default:
                return null;
        }
    }
}
