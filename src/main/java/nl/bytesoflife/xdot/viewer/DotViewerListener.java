package nl.bytesoflife.xdot.viewer;

import nl.bytesoflife.xdot.model.graph.Graph;

/**
 * Callbacks from {@link DotController} to the hosting shell. All methods are invoked on the UI thread.
 */
public interface DotViewerListener {

    default void urlClicked(String url, PointerEvent event) {
    }

    default void cursorChanged(CursorKind cursor) {
    }

    default void repaintRequested() {
    }

    default void graphLoaded(Graph graph) {
    }

    default void loadFailed(Throwable error) {
    }

    /**
     * The user asked to read the current input again.
     */
    default void reloadRequested() {
    }
}
