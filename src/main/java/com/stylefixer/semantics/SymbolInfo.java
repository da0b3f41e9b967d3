package com.stylefixer.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of resolving one node: the bound symbol, or the candidates when resolution was ambiguous.
 */
public final class SymbolInfo {
    public static final SymbolInfo NONE = new SymbolInfo(null, Collections.emptyList());

    private final Symbol symbol;
    private final List<Symbol> candidateSymbols;

    private SymbolInfo(Symbol symbol, List<Symbol> candidateSymbols) {
        this.symbol = symbol;
        this.candidateSymbols = candidateSymbols;
    }

    public static SymbolInfo resolved(Symbol symbol) {
        return new SymbolInfo(symbol, Collections.emptyList());
    }

    public static SymbolInfo ambiguous(List<? extends Symbol> candidates) {
        return new SymbolInfo(null, Collections.unmodifiableList(new ArrayList<>(candidates)));
    }

    /**
     * Bound symbol, {@code null} when unresolved or ambiguous.
     */
    public Symbol getSymbol() {
        return symbol;
    }

    public List<Symbol> getCandidateSymbols() {
        return candidateSymbols;
    }

    /**
     * The bound symbol followed by every candidate.
     */
    public List<Symbol> getAllSymbols() {
        List<Symbol> all = new ArrayList<>(candidateSymbols.size() + 1);
        if (symbol != null) {
            all.add(symbol);
        }
        all.addAll(candidateSymbols);
        return all;
    }
}
