package nl.bytesoflife.xdot.lexer;

/**
 * Token types of the DOT language.
 */
public enum TokenType {
    ID,             // identifier or numeral
    STRING,         // double-quoted string
    HTML,           // <...> string
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    EQUALS,
    COLON,
    EDGE_OP,        // -> or --
    EOF
}
