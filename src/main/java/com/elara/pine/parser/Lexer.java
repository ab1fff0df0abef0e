package com.elara.pine.parser;

import com.elara.pine.debug.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indentation-aware tokenizer.
 *
 * - Line endings are normalized to '\n'; line and column are 1-based
 * - NEWLINE ends a logical line; INDENT/DEDENT bracket indented blocks (tab = 4 spaces)
 * - Blank and comment-only lines never change the indentation level
 * - Line breaks inside () or [] are ignored, so argument lists may span lines
 * - Any malformed input throws {@link LexError}
 */
public class Lexer {
    private static final int TAB_WIDTH = 4;
    private static final Pattern VERSION_PRAGMA = Pattern.compile("^//\\s*@version\\s*=\\s*(\\d+)");

    private static final Set<String> KEYWORDS;
    private static final Set<String> WORD_OPERATORS;
    private static final Set<String> TWO_CHAR_OPERATORS;
    private static final String ONE_CHAR_OPERATORS = "?+-*/%><=";

    static {
        KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
                "if", "else", "for", "while", "do", "switch",
                "var", "varip", "const", "let",
                "return", "break", "continue",
                "export", "import", "type", "method", "in")));
        WORD_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("and", "or", "not")));
        TWO_CHAR_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
                "==", "!=", ">=", "<=", "=>", ":=", "+=", "-=", "*=", "/=", "%=")));
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private int groupingDepth = 0;
    private Integer version = null;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source.replace("\r\n", "\n").replace('\r', '\n');
        indentStack.push(0);
    }

    public List<Token> tokenize() {
        measureIndent();
        while (!isAtEnd()) {
            markStart();
            scanToken();
        }
        markStart();
        if (!tokens.isEmpty() && last().type != TokenType.NEWLINE) {
            addToken(TokenType.NEWLINE, null, "");
        }
        while (indentStack.size() > 1) {
            indentStack.pop();
            addToken(TokenType.DEDENT, null, "");
        }
        addToken(TokenType.EOF, null, "");
        Debug.get().t("Lexer", tokens.size() + " tokens, version " + (version == null ? "default" : version));
        return tokens;
    }

    /** Script version from a {@code //@version=N} pragma, or null when absent. Valid after tokenize(). */
    public Integer version() {
        return version;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': groupingDepth++; addToken(TokenType.LPAREN); break;
            case ')': groupingDepth = Math.max(0, groupingDepth - 1); addToken(TokenType.RPAREN); break;
            case '[': groupingDepth++; addToken(TokenType.LBRACKET); break;
            case ']': groupingDepth = Math.max(0, groupingDepth - 1); addToken(TokenType.RBRACKET); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.':
                if (isDigit(peek())) number();
                else addToken(TokenType.DOT);
                break;
            case ' ': case '\t':
                break;
            case '\n':
                newline();
                break;
            case '"': case '\'':
                string(c);
                break;
            case '#':
                color();
                break;
            case '/':
                if (peek() == '/') lineComment();
                else if (peek() == '*') blockComment();
                else operator(c);
                break;
            case ':':
                if (peek() == '=') operator(c);
                else addToken(TokenType.COLON);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else operator(c);
        }
    }

    // -------------------------
    // Layout
    // -------------------------

    private void newline() {
        if (groupingDepth > 0) return;
        if (!tokens.isEmpty() && last().type != TokenType.NEWLINE) {
            addToken(TokenType.NEWLINE, null, "\n");
        }
        measureIndent();
    }

    private void measureIndent() {
        int indent = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            indent += (advance() == '\t') ? TAB_WIDTH : 1;
        }
        if (isAtEnd() || peek() == '\n') return;
        if (peek() == '/' && peekNext() == '/') return;

        markStart();
        int top = indentStack.peek();
        if (indent > top) {
            indentStack.push(indent);
            addToken(TokenType.INDENT, null, "");
            return;
        }
        while (indent < indentStack.peek()) {
            indentStack.pop();
            addToken(TokenType.DEDENT, null, "");
        }
        if (indent != indentStack.peek()) {
            throw error("Inconsistent dedent: indentation " + indent
                    + " does not match any enclosing block level.");
        }
    }

    // -------------------------
    // Comments
    // -------------------------

    private void lineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
        Matcher m = VERSION_PRAGMA.matcher(source.substring(start, current));
        if (m.find() && version == null) {
            version = Integer.valueOf(m.group(1));
        }
    }

    private void blockComment() {
        advance(); // '*'
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) throw error("Unterminated block comment.");
            char c = advance();
            if (c == '/' && peek() == '*') {
                advance();
                depth++;
            } else if (c == '*' && peek() == '/') {
                advance();
                depth--;
            }
        }
    }

    // -------------------------
    // Literals
    // -------------------------

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        if (text.equals("true") || text.equals("false")) {
            addToken(TokenType.BOOLEAN, Boolean.valueOf(text));
        } else if (text.equals("na")) {
            addToken(TokenType.NA);
        } else if (WORD_OPERATORS.contains(text)) {
            addToken(TokenType.OPERATOR);
        } else if (KEYWORDS.contains(text)) {
            addToken(TokenType.KEYWORD);
        } else {
            addToken(TokenType.IDENTIFIER);
        }
    }

    private void number() {
        boolean leadingDot = source.charAt(start) == '.';
        while (isDigit(peek())) advance();
        if (!leadingDot && peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            boolean signed = (sign == '+' || sign == '-');
            char firstDigit = signed ? peekAt(2) : sign;
            if (isDigit(firstDigit)) {
                advance();
                if (signed) advance();
                while (isDigit(peek())) advance();
            }
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, Double.valueOf(text.startsWith(".") ? "0" + text : text));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) throw error("Unterminated string literal.");
            char c = advance();
            if (c == quote) break;
            if (c == '\n') throw error("Unterminated string literal: unescaped newline in string.");
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (isAtEnd()) throw error("Unterminated string literal.");
            char e = advance();
            switch (e) {
                case 'n': value.append('\n'); break;
                case 't': value.append('\t'); break;
                case 'r': value.append('\r'); break;
                case '0': value.append('\0'); break;
                case 'b': value.append('\b'); break;
                case 'f': value.append('\f'); break;
                case 'v': value.append('\u000B'); break;
                case 'x': value.append(hexEscape(2)); break;
                case 'u': value.append(hexEscape(4)); break;
                case '\n': break; // line continuation
                default: value.append(e); // \\ \" \' and unknown escapes keep the character
            }
        }
        addToken(TokenType.STRING, value.toString());
    }

    private char hexEscape(int digits) {
        int code = 0;
        for (int i = 0; i < digits; i++) {
            char h = peek();
            if (!isHexDigit(h)) throw error("Invalid escape sequence: expected " + digits + " hex digits.");
            advance();
            code = code * 16 + Character.digit(h, 16);
        }
        return (char) code;
    }

    private void color() {
        while (isHexDigit(peek())) advance();
        if (current - start == 1) throw error("Invalid color literal: expected hex digits after '#'.");
        addToken(TokenType.COLOR, source.substring(start, current));
    }

    private void operator(char c) {
        if (!isAtEnd() && TWO_CHAR_OPERATORS.contains("" + c + peek())) {
            advance();
            addToken(TokenType.OPERATOR);
        } else if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
            addToken(TokenType.OPERATOR);
        } else {
            throw error("Unexpected character: '" + c + "'");
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return peekAt(1); }
    private char peekAt(int offset) {
        return (current + offset >= source.length()) ? '\0' : source.charAt(current + offset);
    }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isHexDigit(char c) { return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F'); }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private Token last() { return tokens.get(tokens.size() - 1); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        addToken(type, literal, source.substring(start, current));
    }
    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, startLine, startColumn, start, current));
    }

    private LexError error(String msg) {
        return new LexError(msg, startLine, startColumn);
    }
}
