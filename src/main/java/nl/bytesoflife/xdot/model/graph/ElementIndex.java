package nl.bytesoflife.xdot.model.graph;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * R-tree over element envelopes. Query results come back in insertion order.
 */
public class ElementIndex<E extends Element> {

    private final STRtree tree = new STRtree();
    private int size = 0;
    private boolean built = false;

    public void insert(E element, Envelope envelope) {
        if (built) {
            throw new IllegalStateException("Index is already built");
        }
        if (envelope.isNull()) {
            return;
        }
        tree.insert(envelope, new Entry<>(size++, element));
    }

    public List<E> query(double x, double y) {
        return query(new Envelope(x, x, y, y));
    }

    @SuppressWarnings("unchecked")
    public List<E> query(Envelope searchEnvelope) {
        ensureBuilt();
        List<Entry<E>> hits = new ArrayList<>((List<Entry<E>>) tree.query(searchEnvelope));
        hits.sort(Comparator.comparingInt(Entry::order));
        List<E> elements = new ArrayList<>(hits.size());
        for (Entry<E> hit : hits) {
            elements.add(hit.element());
        }
        return elements;
    }

    public int size() {
        return size;
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }

    private record Entry<E>(int order, E element) {
    }
}
