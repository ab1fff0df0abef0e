import org.junit.jupiter.api.Test;

import com.elara.pine.parser.LexError;
import com.elara.pine.parser.Lexer;
import com.elara.pine.parser.Token;
import com.elara.pine.parser.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PineLexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static long count(List<Token> tokens, TokenType type) {
        return tokens.stream().filter(t -> t.type == type).count();
    }

    @Test
    public void indentsAndDedentsBalanceForNestedBlocks() {
        List<Token> tokens = lex(
                "if a\n" +
                "    if b\n" +
                "        x := 1\n" +
                "y = 2\n");

        assertEquals(2, count(tokens, TokenType.INDENT));
        assertEquals(2, count(tokens, TokenType.DEDENT));

        int depth = 0;
        for (Token t : tokens) {
            if (t.type == TokenType.INDENT) depth++;
            if (t.type == TokenType.DEDENT) depth--;
            assertTrue(depth >= 0, "nesting depth went negative at " + t);
        }
        assertEquals(0, depth);
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    public void closesOpenBlocksAtEndOfInput() {
        List<Token> tokens = lex("if a\n    x := 1");
        int n = tokens.size();
        assertEquals(TokenType.EOF, tokens.get(n - 1).type);
        assertEquals(TokenType.DEDENT, tokens.get(n - 2).type);
        assertEquals(TokenType.NEWLINE, tokens.get(n - 3).type);
    }

    @Test
    public void unterminatedStringReportsItsStart() {
        LexError e = assertThrows(LexError.class, () -> lex("x = 1\ny = \"abc"));
        assertEquals(2, e.getLine());
        assertEquals(5, e.getColumn());
        assertTrue(e.getMessage().startsWith("[line 2:5]"), e.getMessage());
        assertTrue(e.getMessage().contains("Unterminated string"), e.getMessage());
    }

    @Test
    public void newlineInsideStringIsRejected() {
        LexError e = assertThrows(LexError.class, () -> lex("s = \"ab\ncd\"\n"));
        assertTrue(e.getMessage().contains("unescaped newline"), e.getMessage());
    }

    @Test
    public void unterminatedBlockCommentReportsItsStart() {
        LexError e = assertThrows(LexError.class, () -> lex("x = 1\n/* never\nclosed"));
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
        assertTrue(e.getMessage().contains("Unterminated block comment"), e.getMessage());
    }

    @Test
    public void blockCommentsNest() {
        List<Token> tokens = lex("x = 1 /* outer /* inner */ still comment */ + 2\n");
        assertEquals(1, tokens.stream().filter(t -> t.is(TokenType.OPERATOR, "+")).count());
    }

    @Test
    public void decodesStringEscapes() {
        List<Token> tokens = lex("s = \"a\\nb\\\"c\\u0041\"\n");
        Token str = tokens.get(2);
        assertEquals(TokenType.STRING, str.type);
        assertEquals("a\nb\"cA", str.literal);
    }

    @Test
    public void recognisesMultiCharacterOperators() {
        List<Token> tokens = lex("a := b != c and d >= e\n");
        assertTrue(tokens.get(1).is(TokenType.OPERATOR, ":="));
        assertTrue(tokens.get(3).is(TokenType.OPERATOR, "!="));
        assertTrue(tokens.get(5).is(TokenType.OPERATOR, "and"));
        assertTrue(tokens.get(7).is(TokenType.OPERATOR, ">="));
    }

    @Test
    public void classifiesLiterals() {
        List<Token> tokens = lex("x = [1.5, true, na, #FF0000, 'q']\n");
        assertEquals(TokenType.NUMBER, tokens.get(3).type);
        assertEquals(1.5, tokens.get(3).literal);
        assertEquals(TokenType.BOOLEAN, tokens.get(5).type);
        assertEquals(TokenType.NA, tokens.get(7).type);
        assertEquals(TokenType.COLOR, tokens.get(9).type);
        assertEquals(TokenType.STRING, tokens.get(11).type);
    }

    @Test
    public void lineBreaksInsideParenthesesAreIgnored() {
        List<Token> tokens = lex(
                "plot(close,\n" +
                "     color = color.red)\n");
        assertEquals(0, count(tokens, TokenType.INDENT));
        assertEquals(1, count(tokens, TokenType.NEWLINE));
    }

    @Test
    public void commentLinesDoNotChangeIndentation() {
        List<Token> tokens = lex(
                "if a\n" +
                "// note at column one\n" +
                "    x := 1\n" +
                "\n" +
                "    y := 2\n");
        assertEquals(1, count(tokens, TokenType.INDENT));
        assertEquals(1, count(tokens, TokenType.DEDENT));
    }

    @Test
    public void tabCountsAsFourSpaces() {
        assertDoesNotThrow(() -> lex("if a\n\tx := 1\n    y := 2\n"));
    }

    @Test
    public void inconsistentDedentIsAnError() {
        LexError e = assertThrows(LexError.class, () -> lex("if a\n    x := 1\n  y := 2\n"));
        assertTrue(e.getMessage().contains("Inconsistent dedent"), e.getMessage());
    }

    @Test
    public void unexpectedCharacterFailsFast() {
        LexError e = assertThrows(LexError.class, () -> lex("x = 1 @ 2\n"));
        assertTrue(e.getMessage().contains("Unexpected character: '@'"), e.getMessage());
        assertEquals(7, e.getColumn());
    }

    @Test
    public void recordsVersionPragma() {
        Lexer lexer = new Lexer("//@version=4\nx = 1\n");
        lexer.tokenize();
        assertEquals(Integer.valueOf(4), lexer.version());

        Lexer plain = new Lexer("x = 1\n");
        plain.tokenize();
        assertNull(plain.version());
    }
}
