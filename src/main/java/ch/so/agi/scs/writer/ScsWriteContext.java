package ch.so.agi.scs.writer;

import java.util.BitSet;

import ch.so.agi.scs.model.ScgContour;
import ch.so.agi.scs.model.ScgElement;

/**
 * Mutable state of one top-level write. Holds the write-once set and the contours the collector has
 * already descended into. Use a fresh context per top-level call; it is not thread-safe.
 */
public final class ScsWriteContext {
    private final BitSet written = new BitSet();
    private final BitSet visitedContours = new BitSet();

    public boolean isWritten(ScgElement element) {
        return written.get(element.getIndex());
    }

    /** Marks the element as written; false if it already was. */
    public boolean markWritten(ScgElement element) {
        if (written.get(element.getIndex())) {
            return false;
        }
        written.set(element.getIndex());
        return true;
    }

    public int writtenCount() {
        return written.cardinality();
    }

    /** Marks the contour as visited by the collector; false if it already was. */
    boolean visit(ScgContour contour) {
        if (visitedContours.get(contour.getIndex())) {
            return false;
        }
        visitedContours.set(contour.getIndex());
        return true;
    }
}
