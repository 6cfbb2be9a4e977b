package ch.so.agi.scs.writer;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import ch.so.agi.scs.model.ScgConnector;
import ch.so.agi.scs.model.ScgElement;
import ch.so.agi.scs.model.ScgGraph;

/**
 * Finds connectors that end on another connector. The targeted connector is complex and gets a
 * ternary rendering; the connector pointing at it is an attribute arc and is not written on its
 * own.
 */
final class ScgEdgeClassifier {
    private final ScgGraph graph;

    ScgEdgeClassifier(ScgGraph graph) {
        this.graph = graph;
    }

    Classification classify(List<ScgElement> scope) {
        List<ScgConnector> connectors = new ArrayList<>();
        BitSet complexArcs = new BitSet();
        BitSet attributeArcs = new BitSet();
        for (ScgElement element : scope) {
            if (element instanceof ScgConnector connector) {
                connectors.add(connector);
                if (graph.getTarget(connector) instanceof ScgConnector target) {
                    complexArcs.set(target.getIndex());
                    attributeArcs.set(connector.getIndex());
                }
            }
        }
        return new Classification(connectors, complexArcs, attributeArcs);
    }

    static final class Classification {
        private final List<ScgConnector> connectors;
        private final BitSet complexArcs;
        private final BitSet attributeArcs;

        private Classification(List<ScgConnector> connectors, BitSet complexArcs, BitSet attributeArcs) {
            this.connectors = Collections.unmodifiableList(connectors);
            this.complexArcs = complexArcs;
            this.attributeArcs = attributeArcs;
        }

        /** Connectors of the scope in enumeration order. */
        List<ScgConnector> getConnectors() {
            return connectors;
        }

        boolean isComplex(ScgConnector connector) {
            return complexArcs.get(connector.getIndex());
        }

        boolean isAttribute(ScgConnector connector) {
            return attributeArcs.get(connector.getIndex());
        }

        int complexCount() {
            return complexArcs.cardinality();
        }

        int attributeCount() {
            return attributeArcs.cardinality();
        }

        /** First other connector of the scope that targets {@code complex}. */
        Optional<ScgConnector> findAttributeArc(ScgConnector complex) {
            for (ScgConnector candidate : connectors) {
                if (candidate != complex && candidate.getTarget() == complex.getIndex()) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }
    }
}
