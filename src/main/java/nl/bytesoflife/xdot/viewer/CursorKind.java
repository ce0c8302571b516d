package nl.bytesoflife.xdot.viewer;

public enum CursorKind {
    ARROW,
    HAND,
    MOVE
}
