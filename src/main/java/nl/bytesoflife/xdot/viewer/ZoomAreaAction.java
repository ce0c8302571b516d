package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.model.pen.Rgba;
import nl.bytesoflife.xdot.renderer.DrawingSurface;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Rubber band selection; on release the selected rectangle fills the window.
 */
public class ZoomAreaAction extends DragAction {

    static final Rgba BAND_FILL = new Rgba(0.5, 0.5, 1.0, 0.25);
    static final Rgba BAND_OUTLINE = new Rgba(0.5, 0.5, 1.0, 1.0);

    public ZoomAreaAction(DotController controller) {
        super(controller);
    }

    @Override
    protected void drag(double deltaX, double deltaY) {
        controller.requestRepaint();
    }

    @Override
    public void draw(DrawingSurface surface) {
        surface.save();
        rectangle(surface, startX, startY, prevX - startX, prevY - startY);
        surface.fill(BAND_FILL);
        // Half pixel offset keeps the one pixel outline crisp
        rectangle(surface, startX - 0.5, startY - 0.5, prevX - startX + 1, prevY - startY + 1);
        surface.stroke(BAND_OUTLINE, 1.0, List.of());
        surface.restore();
    }

    @Override
    protected void stop() {
        Coordinate first = controller.getViewport().windowToGraph(startX, startY);
        Coordinate second = controller.getViewport().windowToGraph(stopX, stopY);
        controller.getViewport().zoomToArea(first.x, first.y, second.x, second.y);
        controller.requestRepaint();
    }

    @Override
    public void abort() {
        controller.requestRepaint();
    }

    private static void rectangle(DrawingSurface surface, double x, double y, double width, double height) {
        surface.moveTo(x, y);
        surface.lineTo(x + width, y);
        surface.lineTo(x + width, y + height);
        surface.lineTo(x, y + height);
        surface.closePath();
    }
}
