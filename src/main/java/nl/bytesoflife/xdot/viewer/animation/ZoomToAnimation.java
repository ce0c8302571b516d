package nl.bytesoflife.xdot.viewer.animation;

import nl.bytesoflife.xdot.viewer.DotController;
import nl.bytesoflife.xdot.viewer.Viewport;

/**
 * Moves to a target point, zooming out halfway when the target lies far outside the window.
 *
 * <p>The zoom follows {@code target*t + extra*t*(1-t) + source*(1-t)}; {@code extra} is
 * never positive and is chosen so that the middle frame shows both end points.
 */
public class ZoomToAnimation extends MoveToAnimation {

    private final double sourceZoom;
    private final double targetZoom;
    private final double extraZoom;

    public ZoomToAnimation(DotController controller, double targetX, double targetY) {
        super(controller, targetX, targetY);
        Viewport viewport = controller.getViewport();
        this.sourceZoom = viewport.getZoomRatio();
        this.targetZoom = sourceZoom;

        double middleZoom = 0.5 * (sourceZoom + targetZoom);
        double distance = Math.hypot(sourceX - targetX, sourceY - targetY);
        double visible = 0.9 * Math.min(viewport.getWidth(), viewport.getHeight()) / sourceZoom;
        if (distance > 0 && visible > 0) {
            double desiredMiddleZoom = visible / distance;
            this.extraZoom = Math.min(0, 4 * (desiredMiddleZoom - middleZoom));
        } else {
            this.extraZoom = 0;
        }
    }

    public double getExtraZoom() {
        return extraZoom;
    }

    @Override
    protected void animate(double t) {
        controller.getViewport().zoomTo(
                targetZoom * t + extraZoom * t * (1 - t) + sourceZoom * (1 - t));
        super.animate(t);
    }
}
