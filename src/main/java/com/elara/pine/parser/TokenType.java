package com.elara.pine.parser;

public enum TokenType {
    // Literals and names
    IDENTIFIER, NUMBER, STRING, BOOLEAN, COLOR, NA,

    // Words and symbols matched by value
    KEYWORD, OPERATOR,

    // Punctuation
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, COLON, DOT,

    // Layout
    NEWLINE, INDENT, DEDENT, EOF
}
