package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.renderer.DrawingSurface;

/**
 * What a pointer drag does, chosen when the button goes down. Subclasses react to
 * the pixel delta between consecutive motion events.
 */
public abstract class DragAction {

    protected final DotController controller;

    protected double startX;
    protected double startY;
    protected double prevX;
    protected double prevY;
    protected double stopX;
    protected double stopY;

    protected DragAction(DotController controller) {
        this.controller = controller;
    }

    public void onButtonPress(PointerEvent event) {
        startX = prevX = event.x();
        startY = prevY = event.y();
        start();
    }

    public void onMotion(PointerEvent event) {
        double deltaX = prevX - event.x();
        double deltaY = prevY - event.y();
        drag(deltaX, deltaY);
        prevX = event.x();
        prevY = event.y();
    }

    public void onButtonRelease(PointerEvent event) {
        stopX = event.x();
        stopY = event.y();
        stop();
    }

    /**
     * Draw feedback in window coordinates, on top of the graph.
     */
    public void draw(DrawingSurface surface) {
    }

    protected void start() {
    }

    protected void drag(double deltaX, double deltaY) {
    }

    protected void stop() {
    }

    public void abort() {
    }
}
