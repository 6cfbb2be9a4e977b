package ch.so.agi.scs.writer;

/** Output buffer with tab indentation. */
public final class ScsBuffer {
    private final StringBuilder sb = new StringBuilder(4_096);

    public ScsBuffer addTabs(int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append('\t');
        }
        return this;
    }

    public ScsBuffer append(String text) {
        sb.append(text);
        return this;
    }

    public ScsBuffer newline() {
        sb.append('\n');
        return this;
    }

    public boolean isEmpty() {
        return sb.length() == 0;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
