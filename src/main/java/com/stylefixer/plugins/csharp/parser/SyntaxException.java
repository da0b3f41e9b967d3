package com.stylefixer.plugins.csharp.parser;

/**
 * Source text that the C# front end cannot read. Line and column are one-based.
 */
public class SyntaxException extends RuntimeException {
    private final int line;
    private final int column;

    public SyntaxException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
