package com.golizard.termgraph.util;

import com.golizard.termgraph.service.AnnotationKind;
import com.golizard.termgraph.service.BoundaryMarkingResult;
import com.golizard.termgraph.service.BreadthFirstLayeringOracle;
import com.golizard.termgraph.service.TermAnnotation;
import com.golizard.termgraph.service.TermGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 边界标记测试
 */
public class BoundaryMarkerTest {

    private static final String ROOT = "R";

    /**
     * S(1, 注释) -> M(3), S -> N(3), M -> R(0), N -> R
     * 层值手工设置，S 的父术语比 S 更远
     */
    private TermGraph createGraphWithFarParents() {
        TermGraph graph = new TermGraph();
        graph.addEdge("S", "M");
        graph.addEdge("S", "N");
        graph.addEdge("M", ROOT);
        graph.addEdge("N", ROOT);
        setLayer(graph, ROOT, 0);
        setLayer(graph, "S", 1);
        setLayer(graph, "M", 3);
        setLayer(graph, "N", 3);
        graph.getNode("S").addAnnotationIdentifier("P1");
        return graph;
    }

    @Test
    @DisplayName("最远节点没有注释时标记为边界，层值相同保留先访问到的")
    public void testMarksFarthestUnannotatedNode() {
        TermGraph graph = createGraphWithFarParents();

        BoundaryMarkingResult result = BoundaryMarker.markBoundaryNodes(Collections.singletonList(ROOT), graph);

        assertFalse(result.isDisconnected());
        assertEquals(1, result.getMarkedCount());
        assertEquals(AnnotationKind.BOUNDARY, graph.getNode("M").getAnnotation().getKind());
        assertFalse(graph.getNode("N").isAnnotated());
    }

    @Test
    @DisplayName("已有注释的最远节点不会被覆盖为边界")
    public void testAnnotatedFarthestNodeNotOverwritten() {
        TermGraph graph = createGraphWithFarParents();
        graph.getNode("M").setAnnotation(TermAnnotation.transit());

        BoundaryMarkingResult result = BoundaryMarker.markBoundaryNodes(Collections.singletonList(ROOT), graph);

        assertEquals(0, result.getMarkedCount());
        assertEquals(AnnotationKind.TRANSIT, graph.getNode("M").getAnnotation().getKind());
    }

    @Test
    @DisplayName("起点自身最远时不做标记")
    public void testStartNodeIsFarthest() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", ROOT);
        graph.addEdge("X", "A");
        new BreadthFirstLayeringOracle().computeLayers(graph, ROOT);
        graph.getNode("X").addAnnotationIdentifier("P1");

        assertEquals("X", BoundaryMarker.findFarthestNode(ROOT, "X", graph));
        BoundaryMarkingResult result = BoundaryMarker.markBoundaryNodes(Collections.singletonList(ROOT), graph);

        assertEquals(0, result.getMarkedCount());
        assertFalse(graph.getNode("A").isAnnotated());
    }

    @Test
    @DisplayName("哨兵注释节点不作为起点")
    public void testSentinelsAreNotStartNodes() {
        TermGraph graph = createGraphWithFarParents();
        graph.getNode("S").setAnnotation(TermAnnotation.transit());

        BoundaryMarkingResult result = BoundaryMarker.markBoundaryNodes(Collections.singletonList(ROOT), graph);

        assertEquals(0, result.getMarkedCount());
        assertFalse(graph.getNode("M").isAnnotated());
    }

    @Test
    @DisplayName("DFS遇到没有该类别层值的节点时返回断连结果")
    public void testDisconnectionResult() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", "R1");
        graph.addEdge("X", "A");
        graph.addEdge("X", "B");
        graph.addEdge("B", "R2");
        BreadthFirstLayeringOracle oracle = new BreadthFirstLayeringOracle();
        oracle.computeLayers(graph, "R1");
        oracle.computeLayers(graph, "R2");
        graph.getNode("X").addAnnotationIdentifier("P1");

        BoundaryMarkingResult result = BoundaryMarker.markBoundaryNodes(Arrays.asList("R1", "R2"), graph);

        assertTrue(result.isDisconnected());
        assertEquals("X", result.getStartNode());
        assertEquals("R1", result.getOntology());
        assertNull(BoundaryMarker.findFarthestNode("R1", "X", graph));
    }

    private static void setLayer(TermGraph graph, String termId, int layer) {
        graph.getNode(termId).setLayer(ROOT, layer);
    }
}
