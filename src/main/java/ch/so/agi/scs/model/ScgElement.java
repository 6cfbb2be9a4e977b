package ch.so.agi.scs.model;

import java.util.Objects;

/**
 * Base of the closed SCg element hierarchy. Elements live in an {@link ScgGraph} and are addressed
 * by their index there; the subclasses carry the tag specific data.
 */
public abstract class ScgElement {
    private final int index;
    private final String id;
    private final String identifier;
    private final String type;

    ScgElement(int index, String id, String identifier, String type) {
        this.index = index;
        this.id = Objects.requireNonNull(id, "id is null");
        this.identifier = identifier != null ? identifier : "";
        this.type = type != null ? type : "";
    }

    public abstract ElementTag getTag();

    /** Position of this element in its graph. */
    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    /** Raw identifier as drawn, possibly empty or natural-language text. */
    public String getIdentifier() {
        return identifier;
    }

    public String getType() {
        return type;
    }

    @Override
    public String toString() {
        return getTag() + "{id='" + id + "', identifier='" + identifier + "', type='" + type + "'}";
    }
}
