package nl.bytesoflife.xdot.lexer;

/**
 * A token from a DOT document with the line it started on.
 */
public record Token(TokenType type, String value, int line) {

    /**
     * True for any token that can be used as an identifier: plain IDs, quoted and HTML strings.
     */
    public boolean isIdentifier() {
        return type == TokenType.ID || type == TokenType.STRING || type == TokenType.HTML;
    }

    /**
     * True if this is an unquoted keyword, compared case-insensitively as DOT does.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.ID && value.equalsIgnoreCase(keyword);
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line;
    }
}
