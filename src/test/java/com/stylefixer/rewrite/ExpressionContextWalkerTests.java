package com.stylefixer.rewrite;

import com.stylefixer.plugins.csharp.parser.CSharpParser;
import com.stylefixer.semantics.MethodSymbol;
import com.stylefixer.semantics.QueryClauseInfo;
import com.stylefixer.semantics.SymbolInfo;
import com.stylefixer.semantics.SymbolResolver;
import com.stylefixer.semantics.TypeSymbol;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.SyntaxKind;
import com.stylefixer.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionContextWalkerTests {
    private static final TypeSymbol EXPRESSION = TypeSymbol.definition("Expression", 1);
    private static final TypeSymbol FUNC = TypeSymbol.definition("Func", 2);
    private static final TypeSymbol INT = TypeSymbol.named("int");
    private static final TypeSymbol BOOL = TypeSymbol.named("bool");
    private static final TypeSymbol QUERYABLE = TypeSymbol.definition("IQueryable", 1);

    private static final String SOURCE = String.join("\n",
            "class C",
            "{",
            "    void M()",
            "    {",
            "        var a = items.Where(x => x > 1);",
            "        var b = from i in items where i > 2 select i + 1;",
            "    }",
            "}");

    private final SourceTree tree = CSharpParser.parse(SOURCE);

    @Test
    void testLambdaConvertedToExpressionTree() {
        SyntaxNode lambda = first(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION);
        SyntaxNode body = lambda.getChildNode(SyntaxKind.BINARY_EXPRESSION);
        StubResolver resolver = new StubResolver();
        resolver.convertedTypes.put(lambda, EXPRESSION.construct(FUNC.construct(INT, BOOL)));

        assertTrue(ExpressionContextWalker.isInTranslatedExpressionContext(body, EXPRESSION, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testLambdaConvertedToDelegateIsNotTranslated() {
        SyntaxNode lambda = first(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION);
        StubResolver resolver = new StubResolver();
        resolver.convertedTypes.put(lambda, FUNC.construct(INT, BOOL));

        assertFalse(ExpressionContextWalker.isInTranslatedExpressionContext(lambda, EXPRESSION, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testProjectionWithAnyCandidateTakingExpressionTree() {
        SyntaxNode select = first(SyntaxKind.SELECT_CLAUSE);
        SyntaxNode projected = select.getChildNode(SyntaxKind.BINARY_EXPRESSION);
        StubResolver resolver = new StubResolver();
        resolver.symbolInfos.put(select, SymbolInfo.ambiguous(List.of(
                MethodSymbol.of("Select", FUNC.construct(INT, INT)),
                MethodSymbol.of("Select", EXPRESSION.construct(FUNC.construct(INT, INT))))));

        assertTrue(ExpressionContextWalker.isInTranslatedExpressionContext(projected, EXPRESSION, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testQueryClauseOperationTakingExpressionTree() {
        SyntaxNode where = first(SyntaxKind.WHERE_CLAUSE);
        StubResolver resolver = new StubResolver();
        resolver.queryInfos.put(where, new QueryClauseInfo(SymbolInfo.NONE,
                SymbolInfo.resolved(MethodSymbol.of("Where", EXPRESSION.construct(FUNC.construct(INT, BOOL))))));

        assertTrue(ExpressionContextWalker.isInTranslatedExpressionContext(where, EXPRESSION, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testQueryClauseCastIsConsulted() {
        SyntaxNode from = first(SyntaxKind.FROM_CLAUSE);
        StubResolver resolver = new StubResolver();
        resolver.queryInfos.put(from, new QueryClauseInfo(
                SymbolInfo.resolved(MethodSymbol.of("Cast", EXPRESSION.construct(QUERYABLE.construct(INT)))),
                SymbolInfo.NONE));

        assertTrue(ExpressionContextWalker.isInTranslatedExpressionContext(from, EXPRESSION, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testFirstParameterOnlyCounts() {
        SyntaxNode where = first(SyntaxKind.WHERE_CLAUSE);
        StubResolver resolver = new StubResolver();
        resolver.queryInfos.put(where, new QueryClauseInfo(SymbolInfo.NONE, SymbolInfo.resolved(
                MethodSymbol.of("Where", QUERYABLE.construct(INT), EXPRESSION.construct(FUNC.construct(INT, BOOL))))));

        assertFalse(ExpressionContextWalker.isInTranslatedExpressionContext(where, EXPRESSION, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testMissingMarkerTypeIsNeverTranslated() {
        SyntaxNode lambda = first(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION);
        StubResolver resolver = new StubResolver();
        resolver.convertedTypes.put(lambda, EXPRESSION.construct(FUNC.construct(INT, BOOL)));

        assertFalse(ExpressionContextWalker.isInTranslatedExpressionContext(lambda, null, resolver,
                CancellationToken.NONE));
    }

    @Test
    void testUnresolvedTreeIsNotTranslated() {
        for (SyntaxNode node : tree.getRoot().getDescendantNodes()) {
            assertFalse(ExpressionContextWalker.isInTranslatedExpressionContext(node, EXPRESSION,
                    SymbolResolver.NONE, CancellationToken.NONE));
        }
    }

    @Test
    void testCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(CancellationException.class, () -> ExpressionContextWalker.isInTranslatedExpressionContext(
                first(SyntaxKind.WHERE_CLAUSE), EXPRESSION, SymbolResolver.NONE, token));
    }

    private SyntaxNode first(SyntaxKind kind) {
        for (SyntaxNode node : tree.getRoot().getDescendantNodes()) {
            if (node.isKind(kind)) {
                return node;
            }
        }
        throw new AssertionError("No " + kind + " in test source");
    }

    private static final class StubResolver implements SymbolResolver {
        private final Map<SyntaxNode, TypeSymbol> convertedTypes = new HashMap<>();
        private final Map<SyntaxNode, SymbolInfo> symbolInfos = new HashMap<>();
        private final Map<SyntaxNode, QueryClauseInfo> queryInfos = new HashMap<>();

        @Override
        public TypeSymbol getConvertedType(SyntaxNode node) {
            return convertedTypes.get(node);
        }

        @Override
        public SymbolInfo getSymbolInfo(SyntaxNode node) {
            return symbolInfos.getOrDefault(node, SymbolInfo.NONE);
        }

        @Override
        public QueryClauseInfo getQueryClauseInfo(SyntaxNode node) {
            return queryInfos.getOrDefault(node, QueryClauseInfo.NONE);
        }
    }
}
