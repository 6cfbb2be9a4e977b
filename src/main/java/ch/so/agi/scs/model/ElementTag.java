package ch.so.agi.scs.model;

/** Kind of an SCg element. Each tag belongs to exactly one element class. */
public enum ElementTag {
    NODE,
    LINK,
    ARC,
    PAIR,
    CONTOUR,
    BUS;

    public boolean isConnector() {
        return this == ARC || this == PAIR;
    }
}
