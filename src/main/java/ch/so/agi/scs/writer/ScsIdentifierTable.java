package ch.so.agi.scs.writer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ch.so.agi.scs.model.ScgElement;

/** Resolved identifiers of a graph, indexed like the graph's elements. */
public final class ScsIdentifierTable {
    private static final ScsIdentifier UNRESOLVED = new ScsIdentifier("", "");

    private final List<ScsIdentifier> identifiers;

    ScsIdentifierTable(List<ScsIdentifier> identifiers) {
        this.identifiers = Collections.unmodifiableList(new ArrayList<>(identifiers));
    }

    /** A table without entries; every lookup yields an empty system identifier. */
    public static ScsIdentifierTable empty() {
        return new ScsIdentifierTable(List.of());
    }

    public ScsIdentifier get(ScgElement element) {
        int index = element.getIndex();
        return index < identifiers.size() ? identifiers.get(index) : UNRESOLVED;
    }

    public String systemIdentifier(ScgElement element) {
        return get(element).getSystemIdentifier();
    }

    public int size() {
        return identifiers.size();
    }
}
