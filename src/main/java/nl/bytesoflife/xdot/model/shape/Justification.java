package nl.bytesoflife.xdot.model.shape;

/**
 * Horizontal text anchor as encoded by the xdot {@code T} operation.
 */
public enum Justification {
    LEFT(-1),
    CENTER(0),
    RIGHT(1);

    private final int code;

    Justification(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Justification fromCode(int code) {
        return switch (code) {
            case -1 -> LEFT;
            case 0 -> CENTER;
            case 1 -> RIGHT;
            default -> throw new IllegalArgumentException("Unknown text justification: " + code);
        };
    }
}
