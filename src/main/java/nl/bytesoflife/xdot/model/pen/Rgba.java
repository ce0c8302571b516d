package nl.bytesoflife.xdot.model.pen;

import java.util.Locale;

/**
 * A color with red, green, blue and alpha channels, each in the range 0..1.
 */
public record Rgba(double red, double green, double blue, double alpha) {

    public static final Rgba BLACK = new Rgba(0, 0, 0, 1);
    public static final Rgba WHITE = new Rgba(1, 1, 1, 1);
    public static final Rgba TRANSPARENT = new Rgba(1, 1, 1, 0);

    public static Rgba opaque(double red, double green, double blue) {
        return new Rgba(red, green, blue, 1.0);
    }

    /**
     * HSV to RGB with all components in 0..1. Hue wraps around.
     */
    public static Rgba fromHsv(double hue, double saturation, double value) {
        if (saturation == 0.0) {
            return opaque(value, value, value);
        }
        double h = hue * 6.0;
        int sector = (int) Math.floor(h);
        double f = h - sector;
        double p = value * (1.0 - saturation);
        double q = value * (1.0 - saturation * f);
        double t = value * (1.0 - saturation * (1.0 - f));
        return switch (Math.floorMod(sector, 6)) {
            case 0 -> opaque(value, t, p);
            case 1 -> opaque(q, value, p);
            case 2 -> opaque(p, value, t);
            case 3 -> opaque(p, q, value);
            case 4 -> opaque(t, p, value);
            default -> opaque(value, p, q);
        };
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "rgba(%.3f, %.3f, %.3f, %.3f)", red, green, blue, alpha);
    }
}
