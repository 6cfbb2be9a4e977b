package ch.so.agi.scs.model;

import java.util.List;

/**
 * Sub-graph boundary. The children are a logical grouping only: the same elements may be
 * referenced from outside the contour as well.
 */
public final class ScgContour extends ScgElement {
    private final List<Integer> children;

    ScgContour(int index, String id, String identifier, String type, List<Integer> children) {
        super(index, id, identifier, type);
        this.children = List.copyOf(children);
    }

    public List<Integer> getChildren() {
        return children;
    }

    @Override
    public ElementTag getTag() {
        return ElementTag.CONTOUR;
    }
}
