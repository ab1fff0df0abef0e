package com.elara.pine.parser;

/**
 * One lexical token. {@code lexeme} is the raw source text, {@code literal} the decoded value
 * (string contents with escapes resolved, parsed number, boolean) or null.
 * {@code start}/{@code end} are character offsets into the normalized source.
 */
public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    public final int column;
    public final int start;
    public final int end;

    Token(TokenType type, String lexeme, Object literal, int line, int column, int start, int end) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.start = start;
        this.end = end;
    }

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "' @" + line + ":" + column + ")";
    }
}
