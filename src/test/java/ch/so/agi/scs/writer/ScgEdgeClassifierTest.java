package ch.so.agi.scs.writer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import ch.so.agi.scs.model.ScgConnector;
import ch.so.agi.scs.model.ScgGraph;

class ScgEdgeClassifierTest {

    @Test
    void arcOntoArcMarksBothSides() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "", "")
                .node("n2", "", "")
                .node("n3", "", "")
                .arc("a1", "", "n1", "n2")
                .arc("a2", "", "n3", "a1")
                .build();
        ScgConnector a1 = (ScgConnector) graph.find("a1").orElseThrow();
        ScgConnector a2 = (ScgConnector) graph.find("a2").orElseThrow();

        ScgEdgeClassifier.Classification edges = new ScgEdgeClassifier(graph).classify(graph.getRootScope());

        assertEquals(2, edges.getConnectors().size());
        assertTrue(edges.isComplex(a1));
        assertFalse(edges.isAttribute(a1));
        assertTrue(edges.isAttribute(a2));
        assertFalse(edges.isComplex(a2));
        assertEquals(1, edges.complexCount());
        assertEquals(1, edges.attributeCount());
        assertSame(a2, edges.findAttributeArc(a1).orElseThrow());
        assertTrue(edges.findAttributeArc(a2).isEmpty());
    }

    @Test
    void plainArcsAreNeitherComplexNorAttribute() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "", "")
                .node("n2", "", "")
                .arc("a1", "", "n1", "n2")
                .pair("p1", "", "n2", "n1")
                .build();

        ScgEdgeClassifier.Classification edges = new ScgEdgeClassifier(graph).classify(graph.getRootScope());

        assertEquals(0, edges.complexCount());
        assertEquals(0, edges.attributeCount());
        assertEquals("a1", edges.getConnectors().get(0).getId());
        assertEquals("p1", edges.getConnectors().get(1).getId());
    }

    @Test
    void firstAttributeArcInEnumerationOrderWins() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "", "")
                .node("n2", "", "")
                .node("n3", "", "")
                .node("n4", "", "")
                .arc("a1", "", "n1", "n2")
                .arc("a2", "", "n3", "a1")
                .arc("a3", "", "n4", "a1")
                .build();
        ScgConnector a1 = (ScgConnector) graph.find("a1").orElseThrow();

        ScgEdgeClassifier.Classification edges = new ScgEdgeClassifier(graph).classify(graph.getRootScope());

        assertEquals("a2", edges.findAttributeArc(a1).orElseThrow().getId());
        assertEquals(2, edges.attributeCount());
    }

    @Test
    void onlyConnectorsOfTheScopeAreClassified() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "", "")
                .node("n2", "", "")
                .node("n3", "", "")
                .arc("a1", "", "n1", "n2")
                .contour("c1", "", "", "a2")
                .arc("a2", "", "n3", "a1")
                .build();
        ScgConnector a1 = (ScgConnector) graph.find("a1").orElseThrow();

        ScgEdgeClassifier.Classification edges = new ScgEdgeClassifier(graph).classify(graph.getRootScope());

        assertFalse(edges.isComplex(a1));
        assertEquals(1, edges.getConnectors().size());
    }
}
