package nl.bytesoflife.xdot.viewer;

public class PanAction extends DragAction {

    public PanAction(DotController controller) {
        super(controller);
    }

    @Override
    protected void start() {
        controller.setCursor(CursorKind.MOVE);
    }

    @Override
    protected void drag(double deltaX, double deltaY) {
        controller.getViewport().panBy(deltaX, deltaY);
        controller.requestRepaint();
    }

    @Override
    protected void stop() {
        controller.setCursor(CursorKind.ARROW);
    }

    @Override
    public void abort() {
        stop();
    }
}
