package nl.bytesoflife.xdot.viewer;

/**
 * Keyboard commands understood by {@link DotController}, independent of the toolkit's key codes.
 */
public enum KeyCommand {
    PAN_LEFT,
    PAN_RIGHT,
    PAN_UP,
    PAN_DOWN,
    ZOOM_IN,
    ZOOM_OUT,
    ZOOM_100,
    ZOOM_FIT,
    ABORT,
    RELOAD
}
