package nl.bytesoflife.xdot.parser;

/**
 * The layout output cannot be turned into a graph, for example because positions were never resolved.
 */
public class GraphParseException extends Exception {

    public GraphParseException(String message) {
        super(message);
    }

    public GraphParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
