package nl.bytesoflife.xdot.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DotLexerTest {

    private final DotLexer lexer = new DotLexer();

    @Test
    void punctuationAndEdgeOperators() {
        List<Token> tokens = lexer.tokenize("{ } [ ] ; , = : -> --");

        assertEquals(List.of(TokenType.LBRACE, TokenType.RBRACE, TokenType.LBRACKET, TokenType.RBRACKET,
                        TokenType.SEMICOLON, TokenType.COMMA, TokenType.EQUALS, TokenType.COLON,
                        TokenType.EDGE_OP, TokenType.EDGE_OP, TokenType.EOF),
                tokens.stream().map(Token::type).toList());
        assertEquals("->", tokens.get(8).value());
        assertEquals("--", tokens.get(9).value());
    }

    @Test
    void identifiersAndNumerals() {
        List<Token> tokens = lexer.tokenize("node_1 -3.5 .75 42 héllo");

        assertEquals("node_1", tokens.get(0).value());
        assertEquals("-3.5", tokens.get(1).value());
        assertEquals(".75", tokens.get(2).value());
        assertEquals("42", tokens.get(3).value());
        assertEquals("héllo", tokens.get(4).value());
        assertTrue(tokens.subList(0, 5).stream().allMatch(t -> t.type() == TokenType.ID));
    }

    @Test
    void quotedStringKeepsEscapes() {
        List<Token> tokens = lexer.tokenize("\"say \\\"hi\\\" \\l\"");

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("say \\\"hi\\\" \\l", tokens.get(0).value());
        assertEquals("say \"hi\" \\l", DotLexer.unescapeQuotes(tokens.get(0).value()));
    }

    @Test
    void lineContinuationIsRemoved() {
        List<Token> tokens = lexer.tokenize("\"c 7 -#000000 e 27 \\\n18 27 18 \"");

        assertEquals("c 7 -#000000 e 27 18 27 18 ", tokens.get(0).value());
    }

    @Test
    void concatenatedStrings() {
        List<Token> tokens = lexer.tokenize("\"abc\" + \"def\" x");

        assertEquals("abcdef", tokens.get(0).value());
        assertEquals("x", tokens.get(1).value());
    }

    @Test
    void htmlStringNests() {
        List<Token> tokens = lexer.tokenize("<<b>bold</b>> x");

        assertEquals(TokenType.HTML, tokens.get(0).type());
        assertEquals("<b>bold</b>", tokens.get(0).value());
    }

    @Test
    void commentsAreSkipped() {
        List<Token> tokens = lexer.tokenize("# preprocessor\na // line\n/* block\n */ b");

        assertEquals(3, tokens.size());
        assertEquals("a", tokens.get(0).value());
        assertEquals("b", tokens.get(1).value());
        assertEquals(4, tokens.get(1).line());
    }

    @Test
    void keywordsIgnoreCase() {
        Token token = lexer.tokenize("DiGraph").get(0);

        assertTrue(token.isKeyword("digraph"));
        assertFalse(new Token(TokenType.STRING, "digraph", 1).isKeyword("digraph"));
    }

    @Test
    void unterminatedStringReportsLine() {
        DotLexer.LexerException e = assertThrows(DotLexer.LexerException.class,
                () -> lexer.tokenize("a\nb \"open"));
        assertEquals(2, e.getLine());
    }

    @Test
    void unexpectedCharacter() {
        assertThrows(DotLexer.LexerException.class, () -> lexer.tokenize("a ! b"));
    }
}
