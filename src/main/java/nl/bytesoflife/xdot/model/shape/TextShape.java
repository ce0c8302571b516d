package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.model.pen.Pen;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import nl.bytesoflife.xdot.renderer.TextExtent;
import org.locationtech.jts.geom.Envelope;

/**
 * A single line of text anchored on its baseline point.
 */
public final class TextShape extends StyledShape {

    // Approximate font descent; the layout engine does not report font metrics
    static final double DESCENT = 2.0;

    private final double x;
    private final double y;
    private final Justification justification;
    private final double width;
    private final String text;

    public TextShape(Pen pen, double x, double y, Justification justification, double width, String text) {
        super(pen);
        this.x = x;
        this.y = y;
        this.justification = justification;
        this.width = width;
        this.text = text;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Justification getJustification() {
        return justification;
    }

    public double getWidth() {
        return width;
    }

    public String getText() {
        return text;
    }

    @Override
    public void draw(DrawingSurface surface, boolean highlight) {
        TextExtent extent = surface.measureText(text, pen.fontName(), pen.fontSize());
        double textWidth = extent.width();
        double textHeight = extent.height();
        double descent = DESCENT;

        // The layout engine sized the label with its own font metrics; shrink ours to fit the same box
        double factor = 1.0;
        if (textWidth > width) {
            factor = width / textWidth;
            textWidth = width;
            textHeight *= factor;
            descent *= factor;
        }

        double left = switch (justification) {
            case LEFT -> x;
            case CENTER -> x - 0.5 * textWidth;
            case RIGHT -> x - textWidth;
        };
        double top = y - textHeight + descent;

        surface.drawText(text, left, top, pen.fontName(), pen.fontSize(), factor, selectPen(highlight).color());
    }

    @Override
    public Envelope getEnvelope() {
        double left = switch (justification) {
            case LEFT -> x;
            case CENTER -> x - 0.5 * width;
            case RIGHT -> x - width;
        };
        return new Envelope(left, left + width, y - pen.fontSize(), y + DESCENT);
    }

    @Override
    public String toString() {
        return "TextShape[" + text + " at " + x + "," + y + ", " + justification + "]";
    }
}
