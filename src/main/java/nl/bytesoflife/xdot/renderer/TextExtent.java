package nl.bytesoflife.xdot.renderer;

/**
 * Size of a laid out string, in the units of the surface it was measured on.
 */
public record TextExtent(double width, double height) {
}
