package ch.so.agi.scs.model;

public final class ScgBus extends ScgElement {

    ScgBus(int index, String id, String identifier, String type) {
        super(index, id, identifier, type);
    }

    @Override
    public ElementTag getTag() {
        return ElementTag.BUS;
    }
}
