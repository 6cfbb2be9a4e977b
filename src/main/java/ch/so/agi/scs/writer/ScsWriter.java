package ch.so.agi.scs.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.agi.scs.model.ScgBus;
import ch.so.agi.scs.model.ScgConnector;
import ch.so.agi.scs.model.ScgContour;
import ch.so.agi.scs.model.ScgElement;
import ch.so.agi.scs.model.ScgGraph;
import ch.so.agi.scs.model.ScgLink;
import ch.so.agi.scs.model.ScgNode;
import ch.so.agi.scs.types.ScgTypeConverter;

/**
 * Writes one scope of an SCg graph as SCs text and recurses into its contours.
 * <p>
 * Per scope the output is: node declarations, connectors, then contours and buses. Every element
 * goes through the write-once set of the {@link ScsWriteContext}, so an element reachable through
 * several contours is written exactly once.
 */
public final class ScsWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ScsWriter.class);

    static final String UNKNOWN_NODE_TYPE = "node_";
    static final String DEFAULT_CONNECTOR = "->";
    static final String ELEMENT_END = ";;";

    private final ScgGraph graph;
    private final ScsIdentifierTable identifiers;
    private final ScgTypeConverter types;
    private final boolean hoistContourNodes;
    private final ScgReachabilityCollector collector;
    private final ScgEdgeClassifier classifier;

    /**
     * @param hoistContourNodes declare the nodes of nested contours in the owning scope instead of
     *                          inside the contour body
     */
    public ScsWriter(ScgGraph graph, ScsIdentifierTable identifiers, ScgTypeConverter types,
            boolean hoistContourNodes) {
        this.graph = Objects.requireNonNull(graph, "ScgGraph is null");
        this.identifiers = Objects.requireNonNull(identifiers, "identifiers are null");
        this.types = Objects.requireNonNull(types, "type converter is null");
        this.hoistContourNodes = hoistContourNodes;
        this.collector = new ScgReachabilityCollector(graph);
        this.classifier = new ScgEdgeClassifier(graph);
    }

    /** Writes the root scope of the graph at depth 0 with a fresh context. */
    public String write() {
        ScsBuffer buffer = new ScsBuffer();
        write(graph.getRootScope(), 0, new ScsWriteContext(), buffer);
        return buffer.toString();
    }

    public void write(List<ScgElement> scope, int depth, ScsWriteContext context, ScsBuffer buffer) {
        List<ScgNode> nodes = hoistContourNodes ? collector.collect(scope, context) : directNodes(scope);
        for (ScgNode node : nodes) {
            if (context.markWritten(node)) {
                writeNode(node, depth, buffer);
            }
        }

        ScgEdgeClassifier.Classification edges = classifier.classify(scope);
        LOG.debug("Scope at depth {}: {} nodes, {} connectors ({} complex, {} attribute)", depth, nodes.size(),
                edges.getConnectors().size(), edges.complexCount(), edges.attributeCount());

        for (ScgConnector connector : edges.getConnectors()) {
            if (context.isWritten(connector) || edges.isAttribute(connector)) {
                continue;
            }
            context.markWritten(connector);
            writeConnector(connector, edges, depth, context, buffer);
        }

        for (ScgElement element : scope) {
            if (element instanceof ScgContour contour) {
                if (!context.markWritten(contour)) {
                    continue;
                }
                buffer.addTabs(depth).append(identifier(contour, "contour")).append(" = [*").newline();
                write(graph.getChildren(contour), depth + 1, context, buffer);
                buffer.addTabs(depth).append("*]").append(ELEMENT_END).newline();
            } else if (element instanceof ScgBus bus) {
                if (!context.markWritten(bus)) {
                    continue;
                }
                buffer.addTabs(depth).append(identifier(bus, "bus")).newline();
                buffer.addTabs(depth + 1).append("<- ").append(busType(bus)).append(ELEMENT_END).newline();
            }
        }
    }

    private void writeNode(ScgNode node, int depth, ScsBuffer buffer) {
        buffer.addTabs(depth).append(identifier(node, "node")).newline();
        buffer.addTabs(depth + 1).append("<- ").append(nodeType(node)).append(ELEMENT_END).newline();
        if (node instanceof ScgLink link && !link.getContent().isEmpty()) {
            buffer.addTabs(depth + 1).append("-> [").append(link.getContent()).append("]").append(ELEMENT_END)
                    .newline();
        }
    }

    private void writeConnector(ScgConnector connector, ScgEdgeClassifier.Classification edges, int depth,
            ScsWriteContext context, ScsBuffer buffer) {
        String sourceId = identifier(graph.getSource(connector), "node");
        String targetId = identifier(graph.getTarget(connector), "node");
        String type = connector.getType();

        if (isRelation(type)) {
            if (connector.isSubjectTarget()) {
                statement(buffer, depth, targetId, "<=", type + ":", sourceId);
            } else {
                statement(buffer, depth, sourceId, "=>", type + ":", targetId);
            }
            return;
        }

        String symbol = designation(connector);
        if (edges.isComplex(connector)) {
            Optional<ScgConnector> attribute = edges.findAttributeArc(connector);
            if (attribute.isPresent()) {
                context.markWritten(attribute.get());
                String incidentSource = identifier(graph.getSource(attribute.get()), "node");
                statement(buffer, depth, sourceId, symbol, incidentSource + ":", targetId);
                return;
            }
            LOG.warn("Complex connector {} has no attribute arc in its scope, writing it as binary",
                    connector.getId());
        }
        statement(buffer, depth, sourceId, symbol, targetId);
    }

    private static void statement(ScsBuffer buffer, int depth, String... parts) {
        buffer.addTabs(depth).append(String.join(" ", parts)).append(ELEMENT_END).newline();
    }

    static boolean isRelation(String connectorType) {
        return connectorType.startsWith("nrel_") || connectorType.startsWith("rel_");
    }

    private String nodeType(ScgNode node) {
        Optional<String> keyword = types.nodeTypeKeyword(node.getType());
        if (keyword.isEmpty()) {
            LOG.debug("No SCs keyword for node type '{}' of {}", node.getType(), node.getId());
        }
        return keyword.orElse(UNKNOWN_NODE_TYPE);
    }

    private String busType(ScgBus bus) {
        return types.nodeTypeKeyword(bus.getType())
                .orElse(bus.getType().isEmpty() ? UNKNOWN_NODE_TYPE : bus.getType());
    }

    private String designation(ScgConnector connector) {
        Optional<String> symbol = types.connectorDesignation(connector.getType());
        if (symbol.isEmpty()) {
            LOG.debug("No SCs designation for connector type '{}' of {}", connector.getType(), connector.getId());
        }
        return symbol.orElse(DEFAULT_CONNECTOR);
    }

    /** Resolved identifier, or {@code <kind>_<id>} when the element has none. */
    private String identifier(ScgElement element, String kind) {
        String identifier = identifiers.systemIdentifier(element);
        if (identifier.isEmpty()) {
            return kind + "_" + element.getId().replace('-', '_');
        }
        return identifier;
    }

    private static List<ScgNode> directNodes(List<ScgElement> scope) {
        List<ScgNode> nodes = new ArrayList<>();
        for (ScgElement element : scope) {
            if (element instanceof ScgNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }
}
