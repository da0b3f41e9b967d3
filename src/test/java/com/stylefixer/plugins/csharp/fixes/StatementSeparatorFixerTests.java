package com.stylefixer.plugins.csharp.fixes;

import com.stylefixer.api.Diagnostic;
import com.stylefixer.plugins.csharp.analyzers.MultipleStatementsAnalyzer;
import com.stylefixer.plugins.csharp.parser.CSharpParser;
import com.stylefixer.rewrite.BatchFixCoordinator;
import com.stylefixer.rewrite.CancellationToken;
import com.stylefixer.rewrite.ConflictingEditException;
import com.stylefixer.rewrite.IndentationSettings;
import com.stylefixer.rewrite.ReplacementMap;
import com.stylefixer.syntax.GreenElement;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.SyntaxTrivia;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementSeparatorFixerTests {
    private final MultipleStatementsAnalyzer analyzer = new MultipleStatementsAnalyzer();
    private final StatementSeparatorFixer fixer = new StatementSeparatorFixer();

    @ParameterizedTest
    @ValueSource(strings = {"\n", "\r\n"})
    void testFixesEveryStatementOnAnOccupiedLine(String lineEnding) throws ConflictingEditException {
        String source = lines(lineEnding,
                "",
                "using System;",
                "class ClassName",
                "{",
                "    public static void Foo(string a, string b)",
                "    {",
                "        int i = 5; int j = 6, k = 3; if(true)",
                "        {",
                "            i++;",
                "        }",
                "        else",
                "        {",
                "            j++;",
                "        } Foo(\"a\", \"b\");",
                "",
                "        Func<int, int, int> g = (c, d) => { c++; return c + d; };",
                "    }",
                "}",
                "");
        String expected = lines(lineEnding,
                "",
                "using System;",
                "class ClassName",
                "{",
                "    public static void Foo(string a, string b)",
                "    {",
                "        int i = 5;",
                "        int j = 6, k = 3;",
                "        if(true)",
                "        {",
                "            i++;",
                "        }",
                "        else",
                "        {",
                "            j++;",
                "        }",
                "        Foo(\"a\", \"b\");",
                "",
                "        Func<int, int, int> g = (c, d) => { c++;",
                "        return c + d; };",
                "    }",
                "}",
                "");

        SourceTree tree = CSharpParser.parse(source);
        List<Diagnostic> diagnostics = analyzer.analyze(tree);

        assertEquals(4, diagnostics.size());
        assertEquals(expected, fixAll(tree, diagnostics).toFullString());
    }

    @Test
    void testEmptyStatementAfterBlock() throws ConflictingEditException {
        String source = lines("\n",
                "class Program",
                "{",
                "    static void Main(string[] args)",
                "    {",
                "        {",
                "        };",
                "    }",
                "}");
        String expected = lines("\n",
                "class Program",
                "{",
                "    static void Main(string[] args)",
                "    {",
                "        {",
                "        }",
                "        ;",
                "    }",
                "}");

        SourceTree tree = CSharpParser.parse(source);

        assertEquals(expected, fixAll(tree, analyzer.analyze(tree)).toFullString());
    }

    @Test
    void testOnlyTwoTokensChangeAndBothAreExempt() {
        SourceTree tree = CSharpParser.parse("class C\n{\n    void M()\n    {\n        a(); b();\n    }\n}\n");
        SyntaxNode second = statements(tree).get(1);

        Optional<ReplacementMap> fix = fixer.computeFix(second, tree.getText(), IndentationSettings.DEFAULT);

        assertTrue(fix.isPresent());
        ReplacementMap map = fix.get();
        assertEquals(2, map.size());
        for (SyntaxToken token : tree.getTokens()) {
            List<GreenElement> replacement = map.get(token);
            if (replacement != null) {
                assertTrue(replacement.get(0).isFormattingExempt());
                assertTrue(replacement.get(0).getLeadingTrivia().asList().stream()
                        .allMatch(SyntaxTrivia::isFormattingExempt));
            }
        }

        SourceTree fixed = map.applyTo(tree);
        assertEquals("class C\n{\n    void M()\n    {\n        a();\n        b();\n    }\n}\n", fixed.toFullString());
        long exemptTokens = fixed.getTokens().stream().filter(t -> t.getGreen().isFormattingExempt()).count();
        assertEquals(2, exemptTokens);
    }

    @Test
    void testStatementInsideLambdaTakesIndentationOfItsLine() throws ConflictingEditException {
        SourceTree tree = CSharpParser.parse("class C\n{\n    void M()\n    {\n"
                + "        Func<int, int, int> g = (c, d) => { c++; return c + d; };\n    }\n}\n");

        SourceTree fixed = fixAll(tree, analyzer.analyze(tree));

        assertEquals("class C\n{\n    void M()\n    {\n"
                + "        Func<int, int, int> g = (c, d) => { c++;\n"
                + "        return c + d; };\n    }\n}\n", fixed.toFullString());
    }

    @Test
    void testTrailingCommentIsKept() throws ConflictingEditException {
        SourceTree tree = CSharpParser.parse("class C\n{\n    void M()\n    {\n        a(); /* first */ b();\n    }\n}\n");

        SourceTree fixed = fixAll(tree, analyzer.analyze(tree));

        assertEquals("class C\n{\n    void M()\n    {\n        a(); /* first */\n        b();\n    }\n}\n",
                fixed.toFullString());
    }

    @Test
    void testFirstStatementOfBlockIsNotApplicable() {
        SourceTree tree = CSharpParser.parse("class C { void M() { a(); } }");

        Optional<ReplacementMap> fix = fixer.computeFix(statements(tree).get(0), tree.getText(),
                IndentationSettings.DEFAULT);

        assertFalse(fix.isPresent());
    }

    @Test
    void testStatementAlreadyOnItsOwnLineIsNotApplicable() {
        SourceTree tree = CSharpParser.parse("class C { void M() { a();\n b(); } }");

        Optional<ReplacementMap> fix = fixer.computeFix(statements(tree).get(1), tree.getText(),
                IndentationSettings.DEFAULT);

        assertFalse(fix.isPresent());
    }

    @Test
    void testEmbeddedStatementIsNotApplicable() {
        SourceTree tree = CSharpParser.parse("class C { void M() { if (x) a(); } }");

        Optional<ReplacementMap> fix = fixer.computeFix(statements(tree).get(0), tree.getText(),
                IndentationSettings.DEFAULT);

        assertFalse(fix.isPresent());
    }

    @Test
    void testEmptyStatementsOnOneLineConflict() {
        SourceTree tree = CSharpParser.parse("class C\n{\n    void M()\n    {\n        a(); ; ;\n    }\n}\n");
        List<Diagnostic> diagnostics = analyzer.analyze(tree);

        assertEquals(2, diagnostics.size());
        assertThrows(ConflictingEditException.class, () -> fixAll(tree, diagnostics));
    }

    @Test
    void testTabIndentation() throws ConflictingEditException {
        SourceTree tree = CSharpParser.parse("class C\n{\n\tvoid M()\n\t{\n\t\ta(); b();\n\t}\n}\n");
        IndentationSettings tabs = new IndentationSettings(4, 4, true, "\n");

        SourceTree fixed = new BatchFixCoordinator(tree, fixer, tabs, null)
                .fixAll(analyzer.analyze(tree), CancellationToken.NONE);

        assertEquals("class C\n{\n\tvoid M()\n\t{\n\t\ta();\n\t\tb();\n\t}\n}\n", fixed.toFullString());
    }

    private SourceTree fixAll(SourceTree tree, List<Diagnostic> diagnostics) throws ConflictingEditException {
        return new BatchFixCoordinator(tree, fixer, IndentationSettings.DEFAULT, null)
                .fixAll(diagnostics, CancellationToken.NONE);
    }

    private static List<SyntaxNode> statements(SourceTree tree) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode node : tree.getRoot().getDescendantNodes()) {
            if (node.isKind(SyntaxKind.EXPRESSION_STATEMENT)) {
                result.add(node);
            }
        }
        return result;
    }

    private static String lines(String lineEnding, String... lines) {
        return String.join(lineEnding, lines);
    }
}
