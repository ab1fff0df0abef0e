package com.elara.pine.parser;

/** Line/column (1-based) of the token a node starts at. */
public final class SourceLocation {
    public final int line;
    public final int column;

    public SourceLocation(int line, int column) {
        this.line = line;
        this.column = column;
    }

    static SourceLocation of(Token token) {
        return new SourceLocation(token.line, token.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
