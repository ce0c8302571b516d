package nl.bytesoflife.xdot.layout;

import java.util.concurrent.CompletableFuture;

/**
 * Turns DOT source into an annotated layout.
 *
 * <p>Implementations run asynchronously. Cancelling the returned future abandons the
 * layout and releases whatever resources it holds. Failures complete the future
 * exceptionally, typically with a {@link LayoutException}.
 */
public interface LayoutEngine {

    CompletableFuture<AnnotatedLayout> layout(String dotSource);
}
