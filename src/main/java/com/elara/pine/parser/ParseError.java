package com.elara.pine.parser;

/**
 * Syntax error. Thrown inside the parser to unwind to the nearest statement boundary,
 * then recorded in {@link ParseResult#errors()}; never escapes {@link Parser#parse()}.
 */
public class ParseError extends RuntimeException {
    private final String detail;
    private final int line;
    private final int column;
    private final String tokenText;

    public ParseError(String detail, int line, int column, String tokenText) {
        super(format(detail, line, column, tokenText));
        this.detail = detail;
        this.line = line;
        this.column = column;
        this.tokenText = tokenText;
    }

    private static String format(String detail, int line, int column, String tokenText) {
        String where;
        if (tokenText == null || tokenText.isEmpty()) where = " at end";
        else if (tokenText.equals("\n")) where = " at end of line";
        else where = " at '" + tokenText + "'";
        return "[line " + line + ":" + column + "] Error" + where + ": " + detail;
    }

    /** Message without the location prefix. */
    public String getDetail() { return detail; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getTokenText() { return tokenText; }
}
