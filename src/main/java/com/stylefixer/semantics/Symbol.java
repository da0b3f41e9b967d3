package com.stylefixer.semantics;

/**
 * Something a name or an expression can resolve to.
 */
public interface Symbol {

    String getName();
}
