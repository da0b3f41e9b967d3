package com.stylefixer.syntax;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SourceTextTests {

    @Test
    void testSplitsOnEveryLineTerminator() {
        SourceText text = SourceText.from("a\r\nb\nc\rd\u2028e\u2029f\u0085g");

        assertEquals(7, text.getLineCount());
        assertEquals("\r\n", text.getLine(0).getLineBreak());
        assertEquals("\n", text.getLine(1).getLineBreak());
        assertEquals("\r", text.getLine(2).getLineBreak());
        assertEquals("\u2028", text.getLine(3).getLineBreak());
        assertEquals("\u2029", text.getLine(4).getLineBreak());
        assertEquals("\u0085", text.getLine(5).getLineBreak());
        assertEquals(0, text.getLine(6).getLineBreakLength());
        assertEquals("g", text.getLine(6).getContent());
    }

    @Test
    void testLineNumberAndColumn() {
        SourceText text = SourceText.from("ab\r\ncd\n");

        assertEquals(0, text.getLineNumber(1));
        assertEquals(0, text.getLineNumber(3));
        assertEquals(1, text.getLineNumber(4));
        assertEquals(1, text.getColumn(5));
        assertEquals(2, text.getLineNumber(text.length()));
    }

    @Test
    void testEmptyTextHasOneLine() {
        SourceText text = SourceText.from("");

        assertEquals(1, text.getLineCount());
        assertEquals(0, text.getLineNumber(0));
    }
}
