package ch.so.agi.scs;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.agi.scs.model.ScgElement;
import ch.so.agi.scs.model.ScgGraph;
import ch.so.agi.scs.types.ScgTypeConverter;
import ch.so.agi.scs.types.TableTypeConverter;
import ch.so.agi.scs.writer.MainIdentifierWriter;
import ch.so.agi.scs.writer.ScsBuffer;
import ch.so.agi.scs.writer.ScsIdentifier;
import ch.so.agi.scs.writer.ScsIdentifierResolver;
import ch.so.agi.scs.writer.ScsIdentifierTable;
import ch.so.agi.scs.writer.ScsWriteContext;
import ch.so.agi.scs.writer.ScsWriter;

public final class Scg2Scs {
    private static final Logger LOG = LoggerFactory.getLogger(Scg2Scs.class);

    private Scg2Scs() {
    }

    /**
     * Renders with default settings. Nodes of nested contours are hoisted into the owning scope;
     * set {@link ScsWriterSettings#setHoistContourNodes(boolean)} to false to declare each node
     * inside the contour body that contains it.
     */
    public static String render(ScgGraph graph) {
        return render(graph, new ScsWriterSettings());
    }

    public static String render(ScgGraph graph, ScsWriterSettings settings) {
        settings = settings != null ? settings : new ScsWriterSettings();
        ScgTypeConverter types = TableTypeConverter.defaults()
                .withOverrides(settings.getNodeTypes(), settings.getConnectorTypes());
        return render(graph, settings, types);
    }

    /**
     * Resolves the identifiers of all elements, writes the root scope and appends a main identifier
     * block for every written element whose raw identifier was natural-language text. Elements the
     * root scope does not reach get no block.
     */
    public static String render(ScgGraph graph, ScsWriterSettings settings, ScgTypeConverter types) {
        Objects.requireNonNull(graph, "ScgGraph is null");
        Objects.requireNonNull(types, "ScgTypeConverter is null");
        settings = settings != null ? settings : new ScsWriterSettings();

        ScsIdentifierTable identifiers = new ScsIdentifierResolver().resolveAll(graph);
        ScsWriter writer = new ScsWriter(graph, identifiers, types, settings.isHoistContourNodes());

        ScsBuffer buffer = new ScsBuffer();
        ScsWriteContext context = new ScsWriteContext();
        writer.write(graph.getRootScope(), 0, context, buffer);

        int mainIdentifiers = 0;
        if (settings.isEmitMainIdentifiers()) {
            MainIdentifierWriter mainIdentifierWriter = new MainIdentifierWriter();
            for (ScgElement element : graph.getElements()) {
                ScsIdentifier identifier = identifiers.get(element);
                if (identifier.hasMainIdentifier() && context.isWritten(element)) {
                    mainIdentifierWriter.write(buffer, 0, identifier.getSystemIdentifier(),
                            identifier.getMainIdentifier());
                    mainIdentifiers++;
                }
            }
        }

        LOG.debug("Wrote {} of {} elements and {} main identifiers", context.writtenCount(), graph.size(),
                mainIdentifiers);
        return buffer.toString();
    }
}
