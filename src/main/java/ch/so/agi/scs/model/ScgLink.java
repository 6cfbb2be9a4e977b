package ch.so.agi.scs.model;

/** A node carrying literal content, e.g. a text payload. */
public final class ScgLink extends ScgNode {
    private final String content;

    ScgLink(int index, String id, String identifier, String type, String content) {
        super(index, id, identifier, type);
        this.content = content != null ? content : "";
    }

    public String getContent() {
        return content;
    }

    @Override
    public ElementTag getTag() {
        return ElementTag.LINK;
    }
}
