package com.stylefixer.rewrite;

import com.stylefixer.plugins.csharp.parser.CSharpParser;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.SyntaxTrivia;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EndOfLineInferenceTests {
    private static final IndentationSettings LF_DEFAULT = IndentationSettings.DEFAULT.withNewLine("\n");

    @Test
    void testLeadingTriviaOfTokenWins() {
        assertEquals(SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED,
                infer("class C { void M() { a();\n\r\n b(); }\n}", LF_DEFAULT));
    }

    @Test
    void testTrailingTriviaOfPreviousToken() {
        assertEquals(SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED,
                infer("class C { void M() { a();\r\n b(); }\n}", LF_DEFAULT));
    }

    @Test
    void testTerminatorOfCurrentLine() {
        assertEquals(SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED,
                infer("class C { void M() { a(); b(); }\r\n}", LF_DEFAULT));
    }

    @Test
    void testTerminatorOfPreviousLine() {
        assertEquals(SyntaxTrivia.LINE_FEED,
                infer("class C\n{ void M() { a(); b(); } }", IndentationSettings.DEFAULT));
    }

    @Test
    void testFallsBackToSettings() {
        String source = "class C { void M() { a(); b(); } }";

        assertEquals(SyntaxTrivia.CARRIAGE_RETURN_LINE_FEED, infer(source, IndentationSettings.DEFAULT));
        assertEquals(SyntaxTrivia.LINE_FEED, infer(source, LF_DEFAULT));
    }

    private static SyntaxTrivia infer(String source, IndentationSettings settings) {
        SourceTree tree = CSharpParser.parse(source);
        SyntaxToken token = tree.getTokens().stream()
                .filter(t -> t.getText().equals("b"))
                .findFirst()
                .orElseThrow();
        return EndOfLineInference.inferEndOfLine(token, tree.getText(), settings);
    }
}
