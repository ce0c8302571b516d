package nl.bytesoflife.xdot.model.graph;

/**
 * Opaque identity of a node or edge, issued once when a graph is built.
 * Highlight sets hold handles rather than element references.
 */
public record ElementHandle(int index) implements Comparable<ElementHandle> {

    @Override
    public int compareTo(ElementHandle other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
