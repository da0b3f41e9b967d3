package com.stylefixer.semantics;

import com.stylefixer.syntax.SyntaxNode;

/**
 * Name resolution supplied by the host. Implementations return {@code NONE} values, never {@code null},
 * for nodes they cannot resolve.
 */
public interface SymbolResolver {

    /**
     * Type an expression (typically a lambda) is converted to, or {@code null}.
     */
    TypeSymbol getConvertedType(SyntaxNode node);

    SymbolInfo getSymbolInfo(SyntaxNode node);

    QueryClauseInfo getQueryClauseInfo(SyntaxNode node);

    /**
     * A resolver that knows nothing.
     */
    SymbolResolver NONE = new SymbolResolver() {
        @Override
        public TypeSymbol getConvertedType(SyntaxNode node) {
            return null;
        }

        @Override
        public SymbolInfo getSymbolInfo(SyntaxNode node) {
            return SymbolInfo.NONE;
        }

        @Override
        public QueryClauseInfo getQueryClauseInfo(SyntaxNode node) {
            return QueryClauseInfo.NONE;
        }
    };
}
