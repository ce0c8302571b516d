package nl.bytesoflife.xdot.viewer;

/**
 * Pointer position in window pixels with the button and modifier state.
 * Buttons are numbered 1 (left), 2 (middle), 3 (right); 0 means no button.
 */
public record PointerEvent(double x, double y, int button, boolean shift, boolean control) {

    public static PointerEvent at(double x, double y) {
        return new PointerEvent(x, y, 0, false, false);
    }

    public static PointerEvent button(double x, double y, int button) {
        return new PointerEvent(x, y, button, false, false);
    }
}
