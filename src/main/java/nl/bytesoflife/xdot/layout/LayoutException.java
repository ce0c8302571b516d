package nl.bytesoflife.xdot.layout;

/**
 * The layout program failed, timed out or produced output that could not be read.
 */
public class LayoutException extends Exception {

    public LayoutException(String message) {
        super(message);
    }

    public LayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
