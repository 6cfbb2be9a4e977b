package ch.so.agi.scs.writer;

/** Writes the {@code nrel_main_idtf} block that links an element to its natural-language label. */
public final class MainIdentifierWriter {
    static final String NREL_MAIN_IDTF = "nrel_main_idtf";

    public void write(ScsBuffer buffer, int depth, String systemIdentifier, String mainIdentifier) {
        buffer.newline();
        buffer.addTabs(depth).append(systemIdentifier).newline();
        buffer.addTabs(depth + 1).append("<= ").append(NREL_MAIN_IDTF).append(": [").append(mainIdentifier)
                .append("];;").newline();
    }
}
