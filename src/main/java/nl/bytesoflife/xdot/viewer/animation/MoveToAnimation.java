package nl.bytesoflife.xdot.viewer.animation;

import nl.bytesoflife.xdot.viewer.DotController;
import nl.bytesoflife.xdot.viewer.Viewport;

/**
 * Slides the focus to a target point at constant zoom.
 */
public class MoveToAnimation extends LinearAnimation {

    protected final double sourceX;
    protected final double sourceY;
    protected final double targetX;
    protected final double targetY;

    public MoveToAnimation(DotController controller, double targetX, double targetY) {
        super(controller);
        Viewport viewport = controller.getViewport();
        this.sourceX = viewport.getX();
        this.sourceY = viewport.getY();
        this.targetX = targetX;
        this.targetY = targetY;
    }

    @Override
    protected void animate(double t) {
        controller.getViewport().setFocus(
                targetX * t + sourceX * (1 - t),
                targetY * t + sourceY * (1 - t));
        controller.requestRepaint();
    }

    public double getTargetX() {
        return targetX;
    }

    public double getTargetY() {
        return targetY;
    }
}
