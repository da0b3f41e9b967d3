package com.stylefixer.rewrite;

import com.stylefixer.semantics.MethodSymbol;
import com.stylefixer.semantics.QueryClauseInfo;
import com.stylefixer.semantics.Symbol;
import com.stylefixer.semantics.SymbolInfo;
import com.stylefixer.semantics.SymbolResolver;
import com.stylefixer.semantics.TypeSymbol;
import com.stylefixer.syntax.SyntaxNode;

/**
 * Decides whether a node sits inside a lambda or query clause that is converted to an expression
 * tree (a data representation of the code) instead of being compiled to executable code.
 *
 * <p>Exposed for rules whose rewrites would change the meaning of an expression tree and must
 * therefore skip nodes inside one. Neither SA1107 nor SA1132 needs it, since statements and
 * declarations cannot occur in an expression tree.
 */
public final class ExpressionContextWalker {

    private ExpressionContextWalker() {
    }

    /**
     * Walks {@code node} and its ancestors and returns true at the first lambda or query clause bound
     * to {@code expressionType}. Always false when no marker type is supplied.
     *
     * @param expressionType unparameterized definition of the expression-tree wrapper type
     */
    public static boolean isInTranslatedExpressionContext(SyntaxNode node, TypeSymbol expressionType,
                                                          SymbolResolver resolver, CancellationToken cancellationToken) {
        if (expressionType == null) {
            return false;
        }
        TypeSymbol marker = expressionType.getOriginalDefinition();
        for (SyntaxNode current = node; current != null; current = current.getParent()) {
            cancellationToken.throwIfCancellationRequested();
            boolean translated = switch (current.getKind().getExpressionContextRole()) {
                case LAMBDA -> isMarker(resolver.getConvertedType(current), marker);
                case PROJECTION -> anyTakesExpressionTree(resolver.getSymbolInfo(current), marker);
                case QUERY_CLAUSE -> {
                    QueryClauseInfo info = resolver.getQueryClauseInfo(current);
                    yield anyTakesExpressionTree(info.getCastInfo(), marker)
                            || anyTakesExpressionTree(info.getOperationInfo(), marker);
                }
                case NONE -> false;
            };
            if (translated) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyTakesExpressionTree(SymbolInfo info, TypeSymbol marker) {
        if (info == null) {
            return false;
        }
        // Every candidate counts: one match is enough to make the context unsafe.
        for (Symbol symbol : info.getAllSymbols()) {
            if (takesExpressionTree(symbol, marker)) {
                return true;
            }
        }
        return false;
    }

    private static boolean takesExpressionTree(Symbol symbol, TypeSymbol marker) {
        if (!(symbol instanceof MethodSymbol)) {
            return false;
        }
        MethodSymbol method = (MethodSymbol) symbol;
        return !method.getParameterTypes().isEmpty() && isMarker(method.getParameterTypes().get(0), marker);
    }

    private static boolean isMarker(TypeSymbol type, TypeSymbol marker) {
        return type != null && marker.equals(type.getOriginalDefinition());
    }
}
