package com.stylefixer.semantics;

/**
 * Resolution of a query clause: the implicit cast of its range variable and the query method it calls.
 */
public final class QueryClauseInfo {
    public static final QueryClauseInfo NONE = new QueryClauseInfo(SymbolInfo.NONE, SymbolInfo.NONE);

    private final SymbolInfo castInfo;
    private final SymbolInfo operationInfo;

    public QueryClauseInfo(SymbolInfo castInfo, SymbolInfo operationInfo) {
        this.castInfo = castInfo == null ? SymbolInfo.NONE : castInfo;
        this.operationInfo = operationInfo == null ? SymbolInfo.NONE : operationInfo;
    }

    public SymbolInfo getCastInfo() {
        return castInfo;
    }

    public SymbolInfo getOperationInfo() {
        return operationInfo;
    }
}
