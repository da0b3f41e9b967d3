package com.stylefixer.plugins.csharp.parser;

import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;
import com.stylefixer.syntax.SyntaxToken;
import com.stylefixer.syntax.TextSpan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CSharpParserTests {
    private static final String PROGRAM = String.join("\n",
            "using System;",
            "using System.Linq;",
            "",
            "namespace Demo",
            "{",
            "    // Holds a few members",
            "    public class Program",
            "    {",
            "        private int a, b;",
            "        public event EventHandler Changed, Closed;",
            "        public int Count { get; set; } = 3;",
            "",
            "        public Program(int value)",
            "        {",
            "            a = value;",
            "        }",
            "",
            "#region Methods",
            "        public static void Main(string[] args)",
            "        {",
            "            int i = 5; int j = 6, k = 3;",
            "            if (i > j) { i++; } else if (j > k) j--; else { }",
            "            for (int n = 0; n < 3; n++) { Console.WriteLine(n); }",
            "            foreach (var arg in args) Console.WriteLine(arg);",
            "            Func<int, int, int> g = (c, d) => { c++; return c + d; };",
            "            var q = from x in args where x.Length > 1 orderby x descending select x;",
            "            var m = args.Select(s => s.Length);",
            "            string name = args.Length > 0 ? args[0] : \"none\";",
            "            while (false) ;",
            "        }",
            "#endregion",
            "    }",
            "}",
            "");

    @ParameterizedTest
    @ValueSource(strings = {"\n", "\r\n"})
    void testRoundTripIsByteForByte(String lineEnding) {
        String source = PROGRAM.replace("\n", lineEnding);

        SourceTree tree = CSharpParser.parse(source);

        assertEquals(source, tree.toFullString());
        assertEquals(source.length(), tree.getRoot().getFullSpan().getLength());
    }

    @Test
    void testDeclarationShapes() {
        SourceTree tree = CSharpParser.parse(PROGRAM);
        SyntaxNode root = tree.getRoot();

        List<SyntaxNode> fields = ofKind(root, SyntaxKind.FIELD_DECLARATION);
        assertEquals(1, fields.size());
        SyntaxNode declaration = fields.get(0).getChildNode(SyntaxKind.VARIABLE_DECLARATION);
        assertNotNull(declaration);
        assertEquals(2, ofKind(declaration, SyntaxKind.VARIABLE_DECLARATOR).size());

        assertEquals(1, ofKind(root, SyntaxKind.EVENT_FIELD_DECLARATION).size());
        assertEquals(1, ofKind(root, SyntaxKind.PROPERTY_DECLARATION).size());
        assertEquals(1, ofKind(root, SyntaxKind.CONSTRUCTOR_DECLARATION).size());
        assertEquals(1, ofKind(root, SyntaxKind.METHOD_DECLARATION).size());
    }

    @Test
    void testStatementsAndExpressions() {
        SyntaxNode root = CSharpParser.parse(PROGRAM).getRoot();

        assertEquals(6, ofKind(root, SyntaxKind.LOCAL_DECLARATION_STATEMENT).size());
        assertEquals(2, ofKind(root, SyntaxKind.IF_STATEMENT).size());
        assertEquals(1, ofKind(root, SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION).size());
        assertEquals(1, ofKind(root, SyntaxKind.SIMPLE_LAMBDA_EXPRESSION).size());
        assertEquals(1, ofKind(root, SyntaxKind.QUERY_EXPRESSION).size());
        assertEquals(1, ofKind(root, SyntaxKind.WHERE_CLAUSE).size());
        assertEquals(1, ofKind(root, SyntaxKind.SELECT_CLAUSE).size());
        assertEquals(1, ofKind(root, SyntaxKind.EMPTY_STATEMENT).size());

        SyntaxNode lambda = ofKind(root, SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION).get(0);
        assertNotNull(lambda.getChildNode(SyntaxKind.BLOCK));
    }

    @Test
    void testContextualKeywordsAreReclassifiedInQueries() {
        SyntaxNode root = CSharpParser.parse(PROGRAM).getRoot();

        List<SyntaxKind> queryTokens = ofKind(root, SyntaxKind.QUERY_EXPRESSION).get(0).getDescendantTokens().stream()
                .map(SyntaxToken::getKind)
                .collect(Collectors.toList());

        assertTrue(queryTokens.contains(SyntaxKind.FROM_KEYWORD));
        assertTrue(queryTokens.contains(SyntaxKind.SELECT_KEYWORD));
        assertTrue(queryTokens.contains(SyntaxKind.DESCENDING_KEYWORD));
    }

    @Test
    void testDirectivesStayInTrivia() {
        SourceTree tree = CSharpParser.parse(PROGRAM);

        long directives = tree.getTokens().stream()
                .filter(token -> token.getLeadingTrivia().asList().stream().anyMatch(t -> t.hasStructure()))
                .count();
        assertEquals(2, directives);
    }

    @Test
    void testTokenNavigation() {
        SourceTree tree = CSharpParser.parse("class C { void M() { a(); b(); } }");
        List<SyntaxToken> tokens = tree.getTokens();

        SyntaxToken first = tokens.get(0);
        assertEquals(SyntaxKind.CLASS_KEYWORD, first.getKind());
        assertEquals(null, first.getPreviousToken());
        assertEquals(tokens.get(1), first.getNextToken());
        assertTrue(first.isFirstOnLine());
        assertFalse(tokens.get(1).isFirstOnLine());
        assertEquals(SyntaxKind.END_OF_FILE, tokens.get(tokens.size() - 1).getKind());
    }

    @Test
    void testFindNodeReturnsStatementForItsSpan() {
        String source = "class C { void M() { a(); b(); } }";
        SourceTree tree = CSharpParser.parse(source);
        int start = source.indexOf("b()");

        SyntaxNode node = tree.findNode(new TextSpan(start, start + "b();".length()));

        assertEquals(SyntaxKind.EXPRESSION_STATEMENT, node.getKind());
        assertEquals(start, node.getSpan().getStart());
        assertEquals("b();".length(), node.getSpan().getLength());
    }

    @Test
    void testSyntaxErrorCarriesLineAndColumn() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> CSharpParser.parse("class C\n{\n    void M() { a( ; }\n}"));

        assertEquals(3, e.getLine());
        assertEquals(19, e.getColumn());
    }

    @Test
    void testMissingCloseBraceFails() {
        assertThrows(SyntaxException.class, () -> CSharpParser.parse("class C { void M() { a();"));
    }

    private static List<SyntaxNode> ofKind(SyntaxNode root, SyntaxKind kind) {
        return root.getDescendantNodes().stream()
                .filter(node -> node.isKind(kind))
                .collect(Collectors.toList());
    }
}
