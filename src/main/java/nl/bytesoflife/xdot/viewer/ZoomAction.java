package nl.bytesoflife.xdot.viewer;

/**
 * Dragging up or left zooms in, down or right zooms out.
 */
public class ZoomAction extends DragAction {

    static final double ZOOM_PER_PIXEL = 1.005;

    public ZoomAction(DotController controller) {
        super(controller);
    }

    @Override
    protected void drag(double deltaX, double deltaY) {
        Viewport viewport = controller.getViewport();
        viewport.zoomTo(viewport.getZoomRatio() * Math.pow(ZOOM_PER_PIXEL, deltaX + deltaY));
        controller.requestRepaint();
    }

    @Override
    protected void stop() {
        controller.requestRepaint();
    }
}
