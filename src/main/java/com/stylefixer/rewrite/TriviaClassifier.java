package com.stylefixer.rewrite;

import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaKind;
import com.stylefixer.syntax.TriviaList;

/**
 * Classifies the trivia attached to tokens: line breaks, whitespace runs, comments and blank lines.
 */
public final class TriviaClassifier {

    private TriviaClassifier() {
    }

    public static boolean isEndOfLine(SyntaxTrivia trivia) {
        return trivia.isKind(TriviaKind.END_OF_LINE);
    }

    public static boolean isWhitespace(SyntaxTrivia trivia) {
        return trivia.isKind(TriviaKind.WHITESPACE);
    }

    public static boolean isComment(SyntaxTrivia trivia) {
        return trivia.isKind(TriviaKind.SINGLE_LINE_COMMENT) || trivia.isKind(TriviaKind.MULTI_LINE_COMMENT);
    }

    /**
     * Index of the first trivia of the first line that holds anything besides whitespace. Blank lines
     * before it occupy {@code [0, result)}. When no line holds anything else, the result is the start
     * of the last, unterminated line.
     */
    public static int indexOfFirstNonBlankLine(TriviaList list) {
        int lineStart = 0;
        for (int i = 0; i < list.size(); i++) {
            SyntaxTrivia trivia = list.get(i);
            if (isEndOfLine(trivia)) {
                lineStart = i + 1;
            } else if (!isWhitespace(trivia)) {
                return lineStart;
            }
        }
        return lineStart;
    }

    /**
     * Index of the first trivia that is not whitespace, or -1. Line breaks count as whitespace only
     * when {@code endOfLineIsWhitespace} is set.
     */
    public static int indexOfFirstNonWhitespace(TriviaList list, boolean endOfLineIsWhitespace) {
        for (int i = 0; i < list.size(); i++) {
            SyntaxTrivia trivia = list.get(i);
            if (isWhitespace(trivia) || (endOfLineIsWhitespace && isEndOfLine(trivia))) {
                continue;
            }
            return i;
        }
        return -1;
    }

    public static int lastIndexOfEndOfLine(TriviaList list) {
        for (int i = list.size() - 1; i >= 0; i--) {
            if (isEndOfLine(list.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Last line break in the list, or {@code null}.
     */
    public static SyntaxTrivia lastEndOfLine(TriviaList list) {
        int index = lastIndexOfEndOfLine(list);
        return index < 0 ? null : list.get(index);
    }
}
