package ch.so.agi.scs.writer;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import ch.so.agi.scs.model.ScgContour;
import ch.so.agi.scs.model.ScgElement;
import ch.so.agi.scs.model.ScgGraph;
import ch.so.agi.scs.model.ScgNode;

/**
 * Gathers the nodes of a scope together with the nodes of all contours nested in it. A contour is
 * descended into at most once per {@link ScsWriteContext}.
 */
final class ScgReachabilityCollector {
    private final ScgGraph graph;

    ScgReachabilityCollector(ScgGraph graph) {
        this.graph = graph;
    }

    /** Nodes in discovery order, each once. */
    List<ScgNode> collect(List<ScgElement> scope, ScsWriteContext context) {
        List<ScgNode> nodes = new ArrayList<>();
        collect(scope, context, new BitSet(), nodes);
        return nodes;
    }

    private void collect(List<ScgElement> scope, ScsWriteContext context, BitSet seen, List<ScgNode> nodes) {
        for (ScgElement element : scope) {
            if (element instanceof ScgNode node) {
                if (!seen.get(node.getIndex())) {
                    seen.set(node.getIndex());
                    nodes.add(node);
                }
            } else if (element instanceof ScgContour contour) {
                if (context.visit(contour)) {
                    collect(graph.getChildren(contour), context, seen, nodes);
                }
            }
        }
    }
}
