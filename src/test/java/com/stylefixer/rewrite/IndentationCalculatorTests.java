package com.stylefixer.rewrite;

import com.stylefixer.plugins.csharp.parser.CSharpParser;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.TriviaList;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndentationCalculatorTests {
    private static final String SOURCE = String.join("\n",
            "namespace N",
            "{",
            "class C",
            "{",
            "void M()",
            "{",
            "if (x)",
            "y();",
            "else if (z)",
            "w();",
            "else",
            "{",
            "v();",
            "}",
            "}",
            "}",
            "}");

    private final SourceTree tree = CSharpParser.parse(SOURCE);

    @Test
    void testBracedBodiesAddOneStepEach() {
        assertEquals(0, steps("namespace"));
        assertEquals(1, steps("class"));
        assertEquals(2, steps("void"));
        assertEquals(3, steps("if"));
        assertEquals(4, steps("v"));
    }

    @Test
    void testBracesSitAtTheLevelOfTheirOwner() {
        List<SyntaxToken> openBraces = ofText("{");

        assertEquals(0, IndentationCalculator.computeIndentSteps(openBraces.get(0)));
        assertEquals(2, IndentationCalculator.computeIndentSteps(openBraces.get(2)));
        assertEquals(3, IndentationCalculator.computeIndentSteps(openBraces.get(3)));
    }

    @Test
    void testEmbeddedStatementAddsOneStep() {
        assertEquals(4, steps("y"));
    }

    @Test
    void testElseIfDoesNotNest() {
        assertEquals(3, steps("else"));
        assertEquals(4, steps("w"));
    }

    @Test
    void testFirstTokenOnLine() {
        SourceTree lambda = CSharpParser.parse("class C\n{\n    void M()\n    {\n"
                + "        g = (c, d) => { c++; return c; };\n    }\n}\n");
        SyntaxToken returnKeyword = lambda.getTokens().stream()
                .filter(token -> token.getText().equals("return"))
                .findFirst().orElseThrow();

        SyntaxToken first = IndentationCalculator.firstTokenOnLine(returnKeyword);

        assertEquals("g", first.getText());
        assertEquals(2, IndentationCalculator.computeIndentSteps(first));
        assertEquals(3, IndentationCalculator.computeIndentSteps(returnKeyword));
        assertEquals(first, IndentationCalculator.firstTokenOnLine(first));
    }

    @Test
    void testRenderSpaces() {
        TriviaList indentation = IndentationCalculator.renderIndentation(2, IndentationSettings.DEFAULT);

        assertEquals("        ", indentation.toFullString());
        assertTrue(indentation.first().isFormattingExempt());
    }

    @Test
    void testRenderTabsWithRemainder() {
        IndentationSettings settings = new IndentationSettings(3, 4, true, "\n");

        assertEquals("   ", IndentationCalculator.renderIndentation(1, settings).toFullString());
        assertEquals("\t\t ", IndentationCalculator.renderIndentation(3, settings).toFullString());
        assertEquals("\t", IndentationCalculator.renderIndentation(1, new IndentationSettings(4, 4, true, "\n"))
                .toFullString());
    }

    @Test
    void testRenderZeroStepsIsEmpty() {
        assertSame(TriviaList.EMPTY, IndentationCalculator.renderIndentation(0, IndentationSettings.DEFAULT));
    }

    private int steps(String text) {
        return IndentationCalculator.computeIndentSteps(ofText(text).get(0));
    }

    private List<SyntaxToken> ofText(String text) {
        return tree.getTokens().stream()
                .filter(token -> token.getText().equals(text))
                .collect(Collectors.toList());
    }
}
