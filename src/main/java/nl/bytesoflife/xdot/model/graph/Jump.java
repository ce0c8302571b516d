package nl.bytesoflife.xdot.model.graph;

import java.util.Set;

/**
 * Result of a jump hit-test: where the view should move and what to highlight meanwhile.
 */
public record Jump(Element item, double x, double y, Set<ElementHandle> highlight) {

    public Jump {
        highlight = Set.copyOf(highlight);
    }

    public Jump(Element item, double x, double y) {
        this(item, x, y, Set.of(item.getHandle()));
    }
}
