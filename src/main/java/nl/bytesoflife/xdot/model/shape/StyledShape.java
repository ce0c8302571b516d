package nl.bytesoflife.xdot.model.shape;

import nl.bytesoflife.xdot.model.pen.Pen;

/**
 * A shape drawn with a single pen snapshot.
 */
public abstract sealed class StyledShape extends Shape
        permits TextShape, EllipseShape, PolygonShape, BezierShape {

    protected final Pen pen;

    // Derived on first highlighted draw
    private Pen highlightPen;

    protected StyledShape(Pen pen) {
        this.pen = pen;
    }

    public Pen getPen() {
        return pen;
    }

    protected Pen selectPen(boolean highlight) {
        if (!highlight) {
            return pen;
        }
        if (highlightPen == null) {
            highlightPen = pen.highlighted();
        }
        return highlightPen;
    }
}
