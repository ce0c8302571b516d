package nl.bytesoflife.xdot.model.pen;

import java.util.List;

/**
 * Drawing style snapshot attached to a shape.
 * Instances are immutable; the interpreter derives a new pen for every style change.
 */
public record Pen(Rgba color, Rgba fillColor, double lineWidth, double fontSize,
                  String fontName, List<Double> dash) {

    public static final Pen DEFAULT = new Pen(Rgba.BLACK, Rgba.BLACK, 1.0, 14.0, "Times-Roman", List.of());

    static final Rgba HIGHLIGHT_COLOR = new Rgba(1, 0, 0, 1);
    static final Rgba HIGHLIGHT_FILL = new Rgba(1, 0.8, 0.8, 1);

    public Pen {
        dash = List.copyOf(dash);
    }

    public Pen withColor(Rgba color) {
        return new Pen(color, fillColor, lineWidth, fontSize, fontName, dash);
    }

    public Pen withFillColor(Rgba fillColor) {
        return new Pen(color, fillColor, lineWidth, fontSize, fontName, dash);
    }

    public Pen withLineWidth(double lineWidth) {
        return new Pen(color, fillColor, lineWidth, fontSize, fontName, dash);
    }

    public Pen withFont(double fontSize, String fontName) {
        return new Pen(color, fillColor, lineWidth, fontSize, fontName, dash);
    }

    public Pen withDash(List<Double> dash) {
        return new Pen(color, fillColor, lineWidth, fontSize, fontName, dash);
    }

    public boolean isSolid() {
        return dash.isEmpty();
    }

    /**
     * The pen used when the owning element is highlighted: red outline, pale red fill.
     */
    public Pen highlighted() {
        return new Pen(HIGHLIGHT_COLOR, HIGHLIGHT_FILL, lineWidth, fontSize, fontName, dash);
    }
}
