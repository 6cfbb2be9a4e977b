package ch.so.agi.scs.model;

public class ScgNode extends ScgElement {

    ScgNode(int index, String id, String identifier, String type) {
        super(index, id, identifier, type);
    }

    @Override
    public ElementTag getTag() {
        return ElementTag.NODE;
    }
}
