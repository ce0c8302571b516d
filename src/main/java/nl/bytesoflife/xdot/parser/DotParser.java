package nl.bytesoflife.xdot.parser;

import nl.bytesoflife.xdot.layout.AnnotatedLayout;
import nl.bytesoflife.xdot.layout.LayoutEdge;
import nl.bytesoflife.xdot.layout.LayoutNode;
import nl.bytesoflife.xdot.layout.LayoutSubgraph;
import nl.bytesoflife.xdot.lexer.DotLexer;
import nl.bytesoflife.xdot.lexer.Token;
import nl.bytesoflife.xdot.lexer.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the DOT documents written by the layout engine.
 *
 * <p>Attribute defaults ({@code node [...]}, {@code edge [...]}) are applied the way
 * Graphviz applies them and are scoped to the enclosing subgraph. Subgraphs are
 * flattened: their nodes and edges belong to the layout, and the graph attributes
 * set inside each subgraph are kept separately so cluster drawings can be rendered.
 */
public class DotParser {

    private List<Token> tokens;
    private int pos;

    private Map<String, Map<String, String>> nodes;
    private List<LayoutEdge> edges;
    private List<LayoutSubgraph> subgraphs;
    private int anonymousSubgraphs;

    public AnnotatedLayout parse(String content) {
        try {
            this.tokens = new DotLexer().tokenize(content);
        } catch (DotLexer.LexerException e) {
            throw new ParseException(e.getMessage(), e.getLine());
        }
        this.pos = 0;
        this.nodes = new LinkedHashMap<>();
        this.edges = new ArrayList<>();
        this.subgraphs = new ArrayList<>();
        this.anonymousSubgraphs = 0;

        if (peek().isKeyword("strict")) {
            next();
        }
        boolean directed;
        Token kind = next();
        if (kind.isKeyword("digraph")) {
            directed = true;
        } else if (kind.isKeyword("graph")) {
            directed = false;
        } else {
            throw new ParseException("Expected 'graph' or 'digraph' but found '" + kind.value() + "'", kind.line());
        }

        String name = "";
        if (peek().isIdentifier()) {
            name = DotLexer.unescapeQuotes(next().value());
        }

        Scope root = new Scope(null);
        expect(TokenType.LBRACE);
        parseStatements(root);
        expect(TokenType.RBRACE);
        if (peek().type() != TokenType.EOF) {
            throw new ParseException("Unexpected content after graph: '" + peek().value() + "'", peek().line());
        }

        List<LayoutNode> layoutNodes = new ArrayList<>(nodes.size());
        for (Map.Entry<String, Map<String, String>> entry : nodes.entrySet()) {
            layoutNodes.add(new LayoutNode(entry.getKey(), entry.getValue()));
        }
        return new AnnotatedLayout(name, directed, root.graphAttributes, subgraphs, layoutNodes, edges);
    }

    private void parseStatements(Scope scope) {
        while (peek().type() != TokenType.RBRACE && peek().type() != TokenType.EOF) {
            parseStatement(scope);
            if (peek().type() == TokenType.SEMICOLON) {
                next();
            }
        }
    }

    private void parseStatement(Scope scope) {
        Token token = peek();

        if (token.isKeyword("graph") && peekAt(1).type() == TokenType.LBRACKET) {
            next();
            scope.graphAttributes.putAll(parseAttributeLists());
            return;
        }
        if (token.isKeyword("node") && peekAt(1).type() == TokenType.LBRACKET) {
            next();
            scope.nodeDefaults.putAll(parseAttributeLists());
            return;
        }
        if (token.isKeyword("edge") && peekAt(1).type() == TokenType.LBRACKET) {
            next();
            scope.edgeDefaults.putAll(parseAttributeLists());
            return;
        }

        // ID '=' ID sets a graph attribute
        if (token.isIdentifier() && !token.isKeyword("subgraph") && peekAt(1).type() == TokenType.EQUALS) {
            String key = next().value();
            next();
            scope.graphAttributes.put(key, expectIdentifier().value());
            return;
        }

        boolean subgraph = token.isKeyword("subgraph") || token.type() == TokenType.LBRACE;
        List<String> tail = parseEndpoint(scope);
        if (peek().type() == TokenType.EDGE_OP) {
            parseEdgeChain(scope, tail);
        } else if (!subgraph && peek().type() == TokenType.LBRACKET) {
            nodes.get(tail.get(0)).putAll(parseAttributeLists());
        }
    }

    private void parseEdgeChain(Scope scope, List<String> first) {
        List<List<String>> chain = new ArrayList<>();
        chain.add(first);
        while (peek().type() == TokenType.EDGE_OP) {
            next();
            chain.add(parseEndpoint(scope));
        }
        Map<String, String> explicit = peek().type() == TokenType.LBRACKET
                ? parseAttributeLists()
                : Map.of();

        for (int i = 0; i + 1 < chain.size(); i++) {
            for (String source : chain.get(i)) {
                for (String destination : chain.get(i + 1)) {
                    Map<String, String> attributes = new LinkedHashMap<>(scope.edgeDefaults);
                    attributes.putAll(explicit);
                    edges.add(new LayoutEdge(source, destination, attributes));
                }
            }
        }
    }

    /**
     * Parse a node id or a subgraph; returns the names of the nodes it stands for.
     */
    private List<String> parseEndpoint(Scope scope) {
        Token token = peek();
        if (token.isKeyword("subgraph") || token.type() == TokenType.LBRACE) {
            return parseSubgraph(scope);
        }
        Token id = expectIdentifier();
        String name = DotLexer.unescapeQuotes(id.value());
        // Ports do not identify nodes
        if (peek().type() == TokenType.COLON) {
            next();
            expectIdentifier();
            if (peek().type() == TokenType.COLON) {
                next();
                expectIdentifier();
            }
        }
        declareNode(scope, name);
        return List.of(name);
    }

    private List<String> parseSubgraph(Scope parent) {
        String name;
        if (peek().isKeyword("subgraph")) {
            next();
            name = peek().isIdentifier() ? DotLexer.unescapeQuotes(next().value()) : anonymousName();
        } else {
            name = anonymousName();
        }

        Scope scope = new Scope(parent);
        // Reserve the slot so subgraphs stay in document order when nested
        int slot = subgraphs.size();
        subgraphs.add(null);

        expect(TokenType.LBRACE);
        parseStatements(scope);
        expect(TokenType.RBRACE);

        subgraphs.set(slot, new LayoutSubgraph(name, scope.graphAttributes));
        parent.members.addAll(scope.members);
        return List.copyOf(scope.members);
    }

    private String anonymousName() {
        return "%" + (++anonymousSubgraphs);
    }

    private void declareNode(Scope scope, String name) {
        nodes.computeIfAbsent(name, n -> new LinkedHashMap<>(scope.nodeDefaults));
        scope.members.add(name);
    }

    private Map<String, String> parseAttributeLists() {
        Map<String, String> attributes = new LinkedHashMap<>();
        while (peek().type() == TokenType.LBRACKET) {
            next();
            while (peek().type() != TokenType.RBRACKET) {
                String key = expectIdentifier().value();
                String value = "true";
                if (peek().type() == TokenType.EQUALS) {
                    next();
                    value = expectIdentifier().value();
                }
                attributes.put(key, value);
                if (peek().type() == TokenType.COMMA || peek().type() == TokenType.SEMICOLON) {
                    next();
                }
            }
            expect(TokenType.RBRACKET);
        }
        return attributes;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (token.type() != type) {
            throw new ParseException("Expected " + type + " but found '" + token.value() + "'", token.line());
        }
        return next();
    }

    private Token expectIdentifier() {
        Token token = peek();
        if (!token.isIdentifier()) {
            throw new ParseException("Expected identifier but found '" + token.value() + "'", token.line());
        }
        return next();
    }

    private static final class Scope {
        final Map<String, String> graphAttributes = new LinkedHashMap<>();
        final Map<String, String> nodeDefaults;
        final Map<String, String> edgeDefaults;
        final Set<String> members = new LinkedHashSet<>();

        Scope(Scope parent) {
            this.nodeDefaults = parent == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parent.nodeDefaults);
            this.edgeDefaults = parent == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parent.edgeDefaults);
        }
    }

    public static class ParseException extends RuntimeException {
        private final int line;

        public ParseException(String message, int line) {
            super(message + " (line " + line + ")");
            this.line = line;
        }

        public int getLine() {
            return line;
        }
    }
}
