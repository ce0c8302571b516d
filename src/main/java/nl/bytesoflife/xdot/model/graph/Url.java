package nl.bytesoflife.xdot.model.graph;

import java.util.Set;

/**
 * Result of a URL hit-test: the element hit, its link and the elements to highlight.
 */
public record Url(Element item, String url, Set<ElementHandle> highlight) {

    public Url {
        highlight = Set.copyOf(highlight);
    }

    public Url(Element item, String url) {
        this(item, url, Set.of(item.getHandle()));
    }
}
