package com.elara.pine.parser;

/** Fatal tokenization failure. There is no recovery below token granularity. */
public class LexError extends RuntimeException {
    private final int line;
    private final int column;

    public LexError(String message, int line, int column) {
        super("[line " + line + ":" + column + "] " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
}
