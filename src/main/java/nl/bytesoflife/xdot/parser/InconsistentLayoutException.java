package nl.bytesoflife.xdot.parser;

/**
 * The layout engine produced output that contradicts itself, such as an edge to a node it never placed.
 */
public class InconsistentLayoutException extends IllegalStateException {

    public InconsistentLayoutException(String message) {
        super(message);
    }
}
