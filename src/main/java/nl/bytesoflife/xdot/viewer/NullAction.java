package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.model.graph.Jump;
import nl.bytesoflife.xdot.model.graph.Url;

import java.util.Set;

/**
 * No button held: hovering highlights whatever a click would activate.
 */
public class NullAction extends DragAction {

    public NullAction(DotController controller) {
        super(controller);
    }

    @Override
    public void onMotion(PointerEvent event) {
        Url url = controller.getUrl(event.x(), event.y());
        if (url != null) {
            controller.setCursor(CursorKind.HAND);
            controller.setHighlight(url.highlight());
            return;
        }
        Jump jump = controller.getJump(event.x(), event.y());
        if (jump != null) {
            controller.setCursor(CursorKind.HAND);
            controller.setHighlight(jump.highlight());
        } else {
            controller.setCursor(CursorKind.ARROW);
            controller.setHighlight(Set.of());
        }
    }
}
