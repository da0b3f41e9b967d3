package com.stylefixer.plugins.csharp.fixes;

import com.stylefixer.plugins.csharp.analyzers.CombinedDeclarationAnalyzer;
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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeclarationSplitterTests {
    private final DeclarationSplitter splitter = new DeclarationSplitter();

    @ParameterizedTest
    @ValueSource(strings = {"\n", "\r\n"})
    void testSplitsField(String lineEnding) throws ConflictingEditException {
        String source = String.join(lineEnding,
                "class C",
                "{",
                "    private int a, b = 2;",
                "}",
                "");
        String expected = String.join(lineEnding,
                "class C",
                "{",
                "    private int a;",
                "    private int b = 2;",
                "}",
                "");

        assertEquals(expected, fixAll(source, false));
    }

    @Test
    void testSplitsEventField() throws ConflictingEditException {
        String source = "class C\n{\n    public event EventHandler Opened, Closed, Changed;\n}\n";

        assertEquals("class C\n{\n"
                        + "    public event EventHandler Opened;\n"
                        + "    public event EventHandler Closed;\n"
                        + "    public event EventHandler Changed;\n"
                        + "}\n",
                fixAll(source, false));
    }

    @Test
    void testSplitsLocalDeclarationInBlock() throws ConflictingEditException {
        String source = "class C\n{\n    void M()\n    {\n        int j = 6, k = 3;\n    }\n}\n";

        assertEquals("class C\n{\n    void M()\n    {\n        int j = 6;\n        int k = 3;\n    }\n}\n",
                fixAll(source, true));
    }

    @Test
    void testLocalsAreLeftAloneByDefault() throws ConflictingEditException {
        String source = "class C\n{\n    void M()\n    {\n        int j = 6, k = 3;\n    }\n}\n";

        assertEquals(source, fixAll(source, false));
    }

    @Test
    void testLeadingCommentIsRepeatedAfterBlankLine() throws ConflictingEditException {
        String source = String.join("\n",
                "class C",
                "{",
                "    int x;",
                "",
                "    // the values",
                "    int a, b;",
                "}",
                "");
        String expected = String.join("\n",
                "class C",
                "{",
                "    int x;",
                "",
                "    // the values",
                "    int a;",
                "",
                "    // the values",
                "    int b;",
                "}",
                "");

        assertEquals(expected, fixAll(source, false));
    }

    @Test
    void testDirectivesStayWithFirstDeclaration() throws ConflictingEditException {
        String source = "class C\n{\n#region Fields\n    int a, b;\n#endregion\n}\n";

        assertEquals("class C\n{\n#region Fields\n    int a;\n    int b;\n#endregion\n}\n", fixAll(source, false));
    }

    @Test
    void testCommentAfterCommaStaysOnFirstLine() throws ConflictingEditException {
        String source = "class C\n{\n    int a, // first\n        b;\n}\n";

        assertEquals("class C\n{\n    int a; // first\n    int b;\n}\n", fixAll(source, false));
    }

    @Test
    void testMisindentedDeclarationIsReindented() throws ConflictingEditException {
        String source = "class C\n{\n            string s, t;\n}\n";

        assertEquals("class C\n{\n            string s;\n    string t;\n}\n", fixAll(source, false));
    }

    @Test
    void testReplacementsAreFormattingExempt() {
        SourceTree tree = CSharpParser.parse("class C\n{\n    int a, b;\n}\n");
        SyntaxNode field = field(tree);

        Optional<ReplacementMap> fix = splitter.computeFix(field, tree.getText(), IndentationSettings.DEFAULT);

        assertTrue(fix.isPresent());
        List<GreenElement> replacements = fix.get().get(field);
        assertEquals(2, replacements.size());
        for (GreenElement replacement : replacements) {
            assertTrue(replacement.isFormattingExempt());
        }
    }

    @Test
    void testSingleDeclaratorIsNotApplicable() {
        SourceTree tree = CSharpParser.parse("class C\n{\n    int a;\n}\n");

        assertFalse(splitter.computeFix(field(tree), tree.getText(), IndentationSettings.DEFAULT).isPresent());
    }

    @Test
    void testLocalOutsideBlockIsNotApplicable() {
        SourceTree tree = CSharpParser.parse("class C { void M() { if (x) y(); } }");
        SyntaxNode statement = tree.getRoot().getDescendantNodes().stream()
                .filter(node -> node.isKind(SyntaxKind.EXPRESSION_STATEMENT))
                .findFirst()
                .orElseThrow();

        assertFalse(splitter.computeFix(statement, tree.getText(), IndentationSettings.DEFAULT).isPresent());
    }

    private String fixAll(String source, boolean includeLocals) throws ConflictingEditException {
        SourceTree tree = CSharpParser.parse(source);
        CombinedDeclarationAnalyzer analyzer = new CombinedDeclarationAnalyzer(includeLocals);
        return new BatchFixCoordinator(tree, splitter, IndentationSettings.DEFAULT, null)
                .fixAll(analyzer.analyze(tree), CancellationToken.NONE)
                .toFullString();
    }

    private static SyntaxNode field(SourceTree tree) {
        return tree.getRoot().getDescendantNodes().stream()
                .filter(node -> node.isKind(SyntaxKind.FIELD_DECLARATION))
                .findFirst()
                .orElseThrow();
    }
}
