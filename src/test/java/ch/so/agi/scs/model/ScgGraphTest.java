package ch.so.agi.scs.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class ScgGraphTest {

    @Test
    void implicitRootSkipsContourChildren() {
        ScgGraph graph = ScgGraph.builder()
                .contour("c1", "", "", "n1")
                .node("n1", "a", "")
                .node("n2", "b", "")
                .build();

        List<String> root = graph.getRootScope().stream().map(ScgElement::getId).collect(Collectors.toList());
        assertEquals(List.of("c1", "n2"), root);

        ScgContour contour = (ScgContour) graph.find("c1").orElseThrow();
        assertEquals(List.of("n1"),
                graph.getChildren(contour).stream().map(ScgElement::getId).collect(Collectors.toList()));
    }

    @Test
    void explicitRootKeepsGivenOrder() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "a", "")
                .node("n2", "b", "")
                .root("n2", "n1")
                .build();

        assertEquals("n2", graph.getRootScope().get(0).getId());
        assertEquals("n1", graph.getRootScope().get(1).getId());
    }

    @Test
    void connectorsResolveForwardReferences() {
        ScgGraph graph = ScgGraph.builder()
                .arc("a1", "arc/const/pos/perm", "n1", "n2")
                .node("n1", "a", "")
                .node("n2", "b", "")
                .build();

        ScgConnector arc = (ScgConnector) graph.find("a1").orElseThrow();
        assertEquals(ElementTag.ARC, arc.getTag());
        assertEquals("n1", graph.getSource(arc).getId());
        assertEquals("n2", graph.getTarget(arc).getId());
        assertEquals(arc.getSource(), arc.getSubject());
        assertFalse(arc.isSubjectTarget());
    }

    @Test
    void subjectMayBeTheTarget() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "a", "")
                .node("n2", "b", "")
                .connector(ElementTag.PAIR, "p1", "", "nrel_foo", "n2", "n1", "n1")
                .build();

        ScgConnector pair = (ScgConnector) graph.find("p1").orElseThrow();
        assertEquals(ElementTag.PAIR, pair.getTag());
        assertTrue(pair.isSubjectTarget());
    }

    @Test
    void tagFollowsElementClass() {
        ScgGraph graph = ScgGraph.builder()
                .node("n1", "", "")
                .link("l1", "", "", "text")
                .bus("b1", "", "")
                .contour("c1", "", "")
                .build();

        assertEquals(ElementTag.NODE, graph.find("n1").orElseThrow().getTag());
        assertEquals(ElementTag.LINK, graph.find("l1").orElseThrow().getTag());
        assertTrue(graph.find("l1").orElseThrow() instanceof ScgNode);
        assertEquals(ElementTag.BUS, graph.find("b1").orElseThrow().getTag());
        assertEquals(ElementTag.CONTOUR, graph.find("c1").orElseThrow().getTag());
        assertTrue(graph.find("missing").isEmpty());
    }

    @Test
    void rejectsDuplicateIds() {
        ScgGraph.Builder builder = ScgGraph.builder().node("n1", "", "");
        assertThrows(ScgModelException.class, () -> builder.node("n1", "", ""));
    }

    @Test
    void rejectsDanglingReferences() {
        ScgGraph.Builder arcBuilder = ScgGraph.builder()
                .node("n1", "", "")
                .arc("a1", "", "n1", "nowhere");
        ScgModelException ex = assertThrows(ScgModelException.class, arcBuilder::build);
        assertTrue(ex.getMessage().contains("nowhere"));

        ScgGraph.Builder contourBuilder = ScgGraph.builder().contour("c1", "", "", "ghost");
        assertThrows(ScgModelException.class, contourBuilder::build);
    }

    @Test
    void rejectsSubjectOutsideEndpoints() {
        ScgGraph.Builder builder = ScgGraph.builder()
                .node("n1", "", "")
                .node("n2", "", "")
                .node("n3", "", "")
                .connector(ElementTag.ARC, "a1", "", "nrel_foo", "n1", "n2", "n3");
        assertThrows(ScgModelException.class, builder::build);
    }

    @Test
    void rejectsContourContainingItselfWithoutExplicitRoot() {
        ScgGraph.Builder builder = ScgGraph.builder()
                .contour("c1", "", "", "c1", "n1")
                .node("n1", "Пример", "");

        ScgModelException ex = assertThrows(ScgModelException.class, builder::build);
        assertEquals("Contour 'c1' contains itself", ex.getMessage());
    }

    @Test
    void rejectsIndirectContourCycle() {
        ScgGraph.Builder builder = ScgGraph.builder()
                .contour("c1", "one", "", "c2")
                .contour("c2", "two", "", "c3")
                .contour("c3", "three", "", "c1")
                .root("c1");

        ScgModelException ex = assertThrows(ScgModelException.class, builder::build);
        assertTrue(ex.getMessage().contains("contains itself"), ex.getMessage());
    }

    @Test
    void sharedNestedContourIsNotACycle() {
        ScgGraph graph = ScgGraph.builder()
                .contour("c1", "", "", "c3")
                .contour("c2", "", "", "c3")
                .contour("c3", "", "", "n1")
                .node("n1", "", "")
                .build();

        assertEquals(List.of("c1", "c2"),
                graph.getRootScope().stream().map(ScgElement::getId).collect(Collectors.toList()));
    }

    @Test
    void rejectsNonConnectorTagForConnector() {
        assertThrows(IllegalArgumentException.class,
                () -> ScgGraph.builder().connector(ElementTag.NODE, "x", "", "", "a", "b", null));
    }
}
