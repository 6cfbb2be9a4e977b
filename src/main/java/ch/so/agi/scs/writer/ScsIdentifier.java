package ch.so.agi.scs.writer;

import java.util.Objects;

/** Output side identity of one element: its SCs system identifier and an optional main identifier. */
public final class ScsIdentifier {
    private final String systemIdentifier;
    private final String mainIdentifier;

    public ScsIdentifier(String systemIdentifier, String mainIdentifier) {
        this.systemIdentifier = Objects.requireNonNull(systemIdentifier, "systemIdentifier is null");
        this.mainIdentifier = mainIdentifier != null ? mainIdentifier : "";
    }

    public String getSystemIdentifier() {
        return systemIdentifier;
    }

    /** Natural-language label taken verbatim from the drawing, or an empty string. */
    public String getMainIdentifier() {
        return mainIdentifier;
    }

    public boolean hasMainIdentifier() {
        return !mainIdentifier.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScsIdentifier other)) {
            return false;
        }
        return systemIdentifier.equals(other.systemIdentifier) && mainIdentifier.equals(other.mainIdentifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemIdentifier, mainIdentifier);
    }

    @Override
    public String toString() {
        return hasMainIdentifier() ? systemIdentifier + " [" + mainIdentifier + "]" : systemIdentifier;
    }
}
