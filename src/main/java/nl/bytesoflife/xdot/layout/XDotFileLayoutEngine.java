package nl.bytesoflife.xdot.layout;

import nl.bytesoflife.xdot.parser.DotParser;

import java.util.concurrent.CompletableFuture;

/**
 * Layout engine for input that already carries xdot annotations, such as {@code .xdot} files.
 */
public class XDotFileLayoutEngine implements LayoutEngine {

    @Override
    public CompletableFuture<AnnotatedLayout> layout(String dotSource) {
        CompletableFuture<AnnotatedLayout> future = new CompletableFuture<>();
        try {
            future.complete(new DotParser().parse(dotSource));
        } catch (DotParser.ParseException e) {
            future.completeExceptionally(e);
        }
        return future;
    }
}
