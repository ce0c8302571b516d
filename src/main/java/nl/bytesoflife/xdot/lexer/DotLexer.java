package nl.bytesoflife.xdot.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for DOT documents as written by Graphviz.
 *
 * <p>Quoted strings keep their escape sequences (including {@code \"}) so that
 * xdot drawing attributes reach the attribute interpreter unchanged; only
 * backslash-newline line continuations are removed. Use {@link #unescapeQuotes}
 * for values that are plain text, such as node names.
 */
public class DotLexer {

    private String input;
    private int pos;
    private int line;

    public List<Token> tokenize(String content) {
        this.input = content;
        this.pos = 0;
        this.line = 1;

        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", line));
                return tokens;
            }

            char c = input.charAt(pos);
            int startLine = line;
            switch (c) {
                case '{' -> tokens.add(single(TokenType.LBRACE, startLine));
                case '}' -> tokens.add(single(TokenType.RBRACE, startLine));
                case '[' -> tokens.add(single(TokenType.LBRACKET, startLine));
                case ']' -> tokens.add(single(TokenType.RBRACKET, startLine));
                case ';' -> tokens.add(single(TokenType.SEMICOLON, startLine));
                case ',' -> tokens.add(single(TokenType.COMMA, startLine));
                case '=' -> tokens.add(single(TokenType.EQUALS, startLine));
                case ':' -> tokens.add(single(TokenType.COLON, startLine));
                case '"' -> tokens.add(new Token(TokenType.STRING, readQuotedConcatenation(), startLine));
                case '<' -> tokens.add(new Token(TokenType.HTML, readHtml(), startLine));
                default -> {
                    if (c == '-' && pos + 1 < input.length()
                            && (input.charAt(pos + 1) == '>' || input.charAt(pos + 1) == '-')) {
                        tokens.add(new Token(TokenType.EDGE_OP, input.substring(pos, pos + 2), startLine));
                        pos += 2;
                    } else if (isNumeralStart(c)) {
                        tokens.add(new Token(TokenType.ID, readNumeral(), startLine));
                    } else if (isIdStart(c)) {
                        tokens.add(new Token(TokenType.ID, readId(), startLine));
                    } else {
                        throw new LexerException("Unexpected character '" + c + "'", startLine);
                    }
                }
            }
        }
    }

    /**
     * Replace {@code \"} with {@code "}. DOT defines no other escape for plain strings.
     */
    public static String unescapeQuotes(String value) {
        return value == null ? null : value.replace("\\\"", "\"");
    }

    private Token single(TokenType type, int startLine) {
        String value = String.valueOf(input.charAt(pos));
        pos++;
        return new Token(type, value, startLine);
    }

    private String readQuotedConcatenation() {
        StringBuilder sb = new StringBuilder(readQuoted());
        // "abc" + "def" is a single string in DOT
        while (true) {
            int mark = pos;
            int markLine = line;
            skipWhitespaceAndComments();
            if (pos < input.length() && input.charAt(pos) == '+') {
                pos++;
                skipWhitespaceAndComments();
                if (pos < input.length() && input.charAt(pos) == '"') {
                    sb.append(readQuoted());
                    continue;
                }
                throw new LexerException("Expected string after '+'", line);
            }
            pos = mark;
            line = markLine;
            return sb.toString();
        }
    }

    private String readQuoted() {
        int startLine = line;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            if (c == '\\' && pos + 1 < input.length()) {
                char next = input.charAt(pos + 1);
                if (next == '\n') {
                    // line continuation
                    pos += 2;
                    line++;
                    continue;
                }
                if (next == '\r' && pos + 2 < input.length() && input.charAt(pos + 2) == '\n') {
                    pos += 3;
                    line++;
                    continue;
                }
                sb.append(c).append(next);
                pos += 2;
                continue;
            }
            if (c == '\n') {
                line++;
            }
            sb.append(c);
            pos++;
        }
        throw new LexerException("Unterminated quoted string", startLine);
    }

    private String readHtml() {
        int startLine = line;
        int depth = 0;
        int start = pos + 1;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    pos++;
                    return input.substring(start, pos - 1);
                }
            } else if (c == '\n') {
                line++;
            }
            pos++;
        }
        throw new LexerException("Unterminated HTML string", startLine);
    }

    private String readNumeral() {
        int start = pos;
        if (input.charAt(pos) == '-') pos++;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private String readId() {
        int start = pos;
        while (pos < input.length() && isIdPart(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
                skipToEndOfLine();
            } else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '*') {
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new LexerException("Unterminated comment", line);
                }
                for (int i = pos; i < end; i++) {
                    if (input.charAt(i) == '\n') line++;
                }
                pos = end + 2;
            } else if (c == '#' && atLineStart()) {
                // C preprocessor output lines
                skipToEndOfLine();
            } else {
                break;
            }
        }
    }

    private void skipToEndOfLine() {
        while (pos < input.length() && input.charAt(pos) != '\n') {
            pos++;
        }
    }

    private boolean atLineStart() {
        for (int i = pos - 1; i >= 0; i--) {
            char c = input.charAt(i);
            if (c == '\n') return true;
            if (!Character.isWhitespace(c)) return false;
        }
        return true;
    }

    private boolean isNumeralStart(char c) {
        if (Character.isDigit(c)) return true;
        if (c == '.' || c == '-') {
            return pos + 1 < input.length()
                    && (Character.isDigit(input.charAt(pos + 1)) || input.charAt(pos + 1) == '.');
        }
        return false;
    }

    private static boolean isIdStart(char c) {
        return Character.isLetter(c) || c == '_' || c >= 0x80;
    }

    private static boolean isIdPart(char c) {
        return isIdStart(c) || Character.isDigit(c);
    }

    public static class LexerException extends RuntimeException {
        private final int line;

        public LexerException(String message, int line) {
            super(message + " at line " + line);
            this.line = line;
        }

        public int getLine() {
            return line;
        }
    }
}
