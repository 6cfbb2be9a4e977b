package ch.so.agi.scs.model;

/**
 * Directed arc or undirected pair. Endpoints are indices into the owning graph; a target may be
 * another connector, which is how a relation applied to a binary edge is drawn.
 */
public final class ScgConnector extends ScgElement {
    private final ElementTag tag;
    private final int source;
    private final int target;
    private final int subject;

    ScgConnector(int index, ElementTag tag, String id, String identifier, String type, int source, int target,
            int subject) {
        super(index, id, identifier, type);
        if (!tag.isConnector()) {
            throw new IllegalArgumentException("Not a connector tag: " + tag);
        }
        this.tag = tag;
        this.source = source;
        this.target = target;
        this.subject = subject;
    }

    @Override
    public ElementTag getTag() {
        return tag;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    /**
     * Endpoint that is the subject of a named relation drawn with this connector. Equals
     * {@link #getSource()} unless the model says otherwise.
     */
    public int getSubject() {
        return subject;
    }

    /** True when the relation has to be read from the target towards the source. */
    public boolean isSubjectTarget() {
        return subject != source && subject == target;
    }
}
