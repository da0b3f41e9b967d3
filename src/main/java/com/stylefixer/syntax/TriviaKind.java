package com.stylefixer.syntax;

/**
 * Kinds of non-semantic text attached to tokens.
 */
public enum TriviaKind {
    WHITESPACE,
    END_OF_LINE,
    SINGLE_LINE_COMMENT,
    MULTI_LINE_COMMENT,
    /** Trivia with a parsed subtree, such as a preprocessor directive. */
    STRUCTURED,
    /** Characters the lexer skipped. */
    OTHER
}
