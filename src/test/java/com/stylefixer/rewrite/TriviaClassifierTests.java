package com.stylefixer.rewrite;

import com.stylefixer.syntax.SyntaxTrivia;
import com.stylefixer.syntax.TriviaKind;
import com.stylefixer.syntax.TriviaList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriviaClassifierTests {
    private static final SyntaxTrivia INDENT = SyntaxTrivia.whitespace("    ");
    private static final SyntaxTrivia COMMENT = SyntaxTrivia.create(TriviaKind.SINGLE_LINE_COMMENT, "// note");
    private static final SyntaxTrivia BLOCK_COMMENT = SyntaxTrivia.create(TriviaKind.MULTI_LINE_COMMENT, "/* x */");

    @Test
    void testClassification() {
        assertTrue(TriviaClassifier.isEndOfLine(SyntaxTrivia.LINE_FEED));
        assertTrue(TriviaClassifier.isWhitespace(INDENT));
        assertFalse(TriviaClassifier.isWhitespace(SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED));
        assertTrue(TriviaClassifier.isComment(COMMENT));
        assertTrue(TriviaClassifier.isComment(BLOCK_COMMENT));
        assertFalse(TriviaClassifier.isComment(INDENT));
    }

    @Test
    void testFirstNonBlankLineSkipsBlankLines() {
        TriviaList list = TriviaList.of(SyntaxTrivia.LINE_FEED, INDENT, SyntaxTrivia.LINE_FEED, INDENT, COMMENT,
                SyntaxTrivia.LINE_FEED, INDENT);

        assertEquals(3, TriviaClassifier.indexOfFirstNonBlankLine(list));
    }

    @Test
    void testFirstNonBlankLineOfBlankTriviaIsLastLine() {
        TriviaList list = TriviaList.of(SyntaxTrivia.LINE_FEED, SyntaxTrivia.LINE_FEED, INDENT);

        assertEquals(2, TriviaClassifier.indexOfFirstNonBlankLine(list));
        assertEquals(0, TriviaClassifier.indexOfFirstNonBlankLine(TriviaList.EMPTY));
    }

    @Test
    void testFirstNonWhitespaceHonoursLineBreakFlag() {
        TriviaList list = TriviaList.of(INDENT, SyntaxTrivia.LINE_FEED, COMMENT);

        assertEquals(1, TriviaClassifier.indexOfFirstNonWhitespace(list, false));
        assertEquals(2, TriviaClassifier.indexOfFirstNonWhitespace(list, true));
        assertEquals(-1, TriviaClassifier.indexOfFirstNonWhitespace(TriviaList.of(INDENT), true));
    }

    @Test
    void testLastEndOfLine() {
        TriviaList list = TriviaList.of(SyntaxTrivia.LINE_FEED, COMMENT, SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED, INDENT);

        assertEquals(2, TriviaClassifier.lastIndexOfEndOfLine(list));
        assertSame(SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED, TriviaClassifier.lastEndOfLine(list));
        assertNull(TriviaClassifier.lastEndOfLine(TriviaList.of(COMMENT)));
    }
}
