package nl.bytesoflife.xdot.renderer;

import nl.bytesoflife.xdot.model.pen.Rgba;

import java.util.List;

/**
 * Primitive vector operations the shapes draw with.
 * Paths are built with moveTo/lineTo/curveTo/closePath and consumed by {@link #fill} or {@link #stroke}.
 */
public interface DrawingSurface {

    void save();

    void restore();

    void translate(double dx, double dy);

    void scale(double sx, double sy);

    void clipRect(double x, double y, double width, double height);

    /**
     * Fill the whole clip area with a color, ignoring the current path.
     */
    void paint(Rgba color);

    void moveTo(double x, double y);

    void lineTo(double x, double y);

    void curveTo(double x1, double y1, double x2, double y2, double x3, double y3);

    void closePath();

    /**
     * Fill the current path with the nonzero winding rule and clear it.
     */
    void fill(Rgba color);

    /**
     * Stroke the current path and clear it. An empty dash list means a solid line.
     */
    void stroke(Rgba color, double lineWidth, List<Double> dash);

    TextExtent measureText(String text, String fontName, double fontSize);

    /**
     * Draw text whose layout box has its top-left corner at (x, y), uniformly scaled around that corner.
     */
    void drawText(String text, double x, double y, String fontName, double fontSize, double scale, Rgba color);
}
