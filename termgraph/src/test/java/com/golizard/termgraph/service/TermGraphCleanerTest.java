package com.golizard.termgraph.service;

import com.golizard.termgraph.constants.TermGraphConstants;
import com.golizard.termgraph.exception.GraphCleaningException;
import com.golizard.termgraph.exception.MalformedTermGraphException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 术语图清理编排测试
 *
 * 覆盖场景：
 * 1. 单注释链（兄弟叶子被删除）
 * 2. 多父术语的注释节点（两条路径都保留）
 * 3. 注释节点跨两个类别 -> 断连修复
 * 4. 类别没有注释 -> 只剩根节点
 * 5. 修复次数耗尽、幂等性、并行执行
 */
public class TermGraphCleanerTest {

    private static final Logger log = LoggerFactory.getLogger(TermGraphCleanerTest.class);

    private ExecutorService executor;

    @AfterEach
    public void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private TermGraphCleaner createCleaner() {
        return new TermGraphCleaner(new BreadthFirstLayeringOracle());
    }

    private static Map<String, List<String>> annotate(String identifier, String... termIds) {
        Map<String, List<String>> annotations = new LinkedHashMap<>();
        annotations.put(identifier, Arrays.asList(termIds));
        return annotations;
    }

    /**
     * R <- A <- P <- {X, Y, Z}
     */
    private static TermGraph createChainGraph() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", "R");
        graph.addEdge("P", "A");
        graph.addEdge("X", "P");
        graph.addEdge("Y", "P");
        graph.addEdge("Z", "P");
        return graph;
    }

    @Test
    @DisplayName("场景A：只保留根节点到注释节点的路径")
    public void testSingleAnnotationChain() {
        CleaningResult result = createCleaner().clean(annotate("P1", "X"), createChainGraph(), Collections.singletonList("R"));

        CleanedCategoryGraph category = result.getCategoryGraph("R");
        assertEquals(new HashSet<>(Arrays.asList("R", "A", "P", "X")), category.getGraph().getNodeIds());
        assertEquals(Collections.singletonList("X"), category.getLeaves());
        assertEquals(3, category.getMaxLayer());
        assertEquals(2, category.getRemovedNodeCount());
        assertFalse(result.isRepaired());
        assertEquals(Collections.singletonList("X"), result.getAnnotationMapping().getSelectedNodes().get("P1"));
    }

    @Test
    @DisplayName("场景B：多父术语的注释节点保留两条路径")
    public void testAnnotatedNodeWithTwoParents() {
        TermGraph graph = new TermGraph();
        graph.addEdge("P1", "R");
        graph.addEdge("P2", "R");
        graph.addEdge("X", "P1");
        graph.addEdge("X", "P2");
        graph.addEdge("Y", "P1");

        CleaningResult result = createCleaner().clean(annotate("Q", "X"), graph, Collections.singletonList("R"));

        TermGraph cleaned = result.getCategoryGraph("R").getGraph();
        assertEquals(new HashSet<>(Arrays.asList("R", "P1", "P2", "X")), cleaned.getNodeIds());
        assertTrue(cleaned.hasEdge("X", "P1"));
        assertTrue(cleaned.hasEdge("X", "P2"));
    }

    @Test
    @DisplayName("场景C：注释节点跨两个类别时合成连接节点修复")
    public void testDisconnectionRepairedWithConnector() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", "R1");
        graph.addEdge("X", "A");
        graph.addEdge("X", "B");
        graph.addEdge("B", "R2");

        CleaningResult result = createCleaner().clean(annotate("P1", "X"), graph, Arrays.asList("R1", "R2"));

        String connector = TermGraphConstants.Connector.NODE_ID;
        assertEquals(1, result.getRepairCount());
        assertEquals(Collections.singletonList(connector), result.getCategoryRoots());

        TermGraph cleaned = result.getCategoryGraph(connector).getGraph();
        assertEquals(new HashSet<>(Arrays.asList(connector, "R1", "R2", "A", "B", "X")), cleaned.getNodeIds());
        assertTrue(cleaned.hasEdge("R1", connector));
        assertTrue(cleaned.hasEdge("R2", connector));
        assertEquals(TermGraphConstants.Relation.CONNECTS, cleaned.getEdgeRelation("R1", connector));
        assertEquals(TermGraphConstants.Connector.NODE_TYPE, cleaned.getNode(connector).getType());
        assertEquals(3, result.getCategoryGraph(connector).getMaxLayer());

        assertFalse(graph.hasNode(connector), "输入图不被修改");
    }

    @Test
    @DisplayName("场景D：类别没有注释时只保留根节点")
    public void testCategoryWithoutAnnotationsKeepsRoot() {
        TermGraph graph = createChainGraph();
        graph.addEdge("M", "R2");

        CleaningResult result = createCleaner().clean(annotate("P1", "M"), graph, Arrays.asList("R", "R2"));

        CleanedCategoryGraph empty = result.getCategoryGraph("R");
        assertEquals(Collections.singleton("R"), empty.getGraph().getNodeIds());
        assertTrue(empty.getLeaves().isEmpty());
        assertEquals(0, empty.getMaxLayer());

        assertEquals(new HashSet<>(Arrays.asList("R2", "M")), result.getCategoryGraph("R2").getGraph().getNodeIds());
    }

    @Test
    @DisplayName("修复次数耗尽时抛出异常，携带类别和尝试序号")
    public void testRepairExhaustion() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", "R1");
        graph.addEdge("X", "A");
        graph.addEdge("X", "Z");

        TermGraphCleaner cleaner = new TermGraphCleaner(new BreadthFirstLayeringOracle(), 2, 1000, null);

        GraphCleaningException e = assertThrows(GraphCleaningException.class,
                () -> cleaner.clean(annotate("P1", "X"), graph, Collections.singletonList("R1")));
        log.info("修复耗尽: {}", e.getMessage());
        assertEquals(3, e.getAttempt());
        assertEquals(TermGraphConstants.Connector.NODE_ID + "_2", e.getCategory());
    }

    @Test
    @DisplayName("最大修复次数为0时第一次断连即失败")
    public void testNoRepairAllowed() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", "R1");
        graph.addEdge("X", "A");
        graph.addEdge("X", "B");
        graph.addEdge("B", "R2");

        TermGraphCleaner cleaner = new TermGraphCleaner(new BreadthFirstLayeringOracle(), 0, 1000, null);

        GraphCleaningException e = assertThrows(GraphCleaningException.class,
                () -> cleaner.clean(annotate("P1", "X"), graph, Arrays.asList("R1", "R2")));
        assertEquals(1, e.getAttempt());
        assertEquals("R1", e.getCategory());
    }

    @Test
    @DisplayName("连接节点ID重复时追加序号")
    public void testConnectorIdIsUnique() {
        TermGraph graph = new TermGraph();
        graph.addNode("R1");
        graph.addNode("R2");

        assertEquals(Collections.singletonList("new_connecting_node"),
                TermGraphCleaner.connectCategoryRoots(graph, Arrays.asList("R1", "R2")));
        assertEquals(Collections.singletonList("new_connecting_node_2"),
                TermGraphCleaner.connectCategoryRoots(graph, Collections.singletonList("new_connecting_node")));
        assertTrue(graph.hasEdge("new_connecting_node", "new_connecting_node_2"));
    }

    @Test
    @DisplayName("对清理结果再清理一次结果不变")
    public void testIdempotent() {
        Map<String, List<String>> annotations = annotate("P1", "X");
        TermGraphCleaner cleaner = createCleaner();

        TermGraph first = cleaner.clean(annotations, createChainGraph(), Collections.singletonList("R"))
                .getCategoryGraph("R").getGraph();
        TermGraph second = cleaner.clean(annotations, first, Collections.singletonList("R"))
                .getCategoryGraph("R").getGraph();

        assertEquals(first.getNodeIds(), second.getNodeIds());
        assertEquals(first.getEdgeCount(), second.getEdgeCount());
    }

    @Test
    @DisplayName("每个注释节点都保留，且与根节点连通")
    public void testAnnotatedNodesKeptAndConnected() {
        TermGraph graph = createChainGraph();
        graph.addEdge("W", "A");
        graph.addEdge("V", "W");
        Map<String, List<String>> annotations = new LinkedHashMap<>();
        annotations.put("P1", Collections.singletonList("Z"));
        annotations.put("P2", Arrays.asList("W", "missing"));

        CleaningResult result = createCleaner().clean(annotations, graph, Collections.singletonList("R"));

        TermGraph cleaned = result.getCategoryGraph("R").getGraph();
        Set<String> reachable = cleaned.bfsTraversal("R", false);
        for (String termId : Arrays.asList("Z", "W")) {
            assertTrue(cleaned.hasNode(termId), termId + " 必须保留");
            assertTrue(reachable.contains(termId), termId + " 必须与根节点连通");
        }
        assertFalse(cleaned.hasNode("V"));
        assertFalse(cleaned.hasNode("Y"));
    }

    @Test
    @DisplayName("并行和顺序执行结果相同")
    public void testParallelMatchesSequential() {
        TermGraph graph = createChainGraph();
        graph.addEdge("M", "R2");
        graph.addEdge("N", "M");
        graph.addEdge("O", "M");
        Map<String, List<String>> annotations = new LinkedHashMap<>();
        annotations.put("P1", Collections.singletonList("X"));
        annotations.put("P2", Collections.singletonList("N"));
        List<String> roots = Arrays.asList("R", "R2");

        executor = Executors.newFixedThreadPool(2);
        CleaningResult parallel = new TermGraphCleaner(new BreadthFirstLayeringOracle(), 3, 1000, executor)
                .clean(annotations, graph, roots);
        CleaningResult sequential = createCleaner().clean(annotations, graph, roots);

        assertEquals(new ArrayList<>(sequential.getCategoryGraphs().keySet()),
                new ArrayList<>(parallel.getCategoryGraphs().keySet()));
        for (String root : roots) {
            assertEquals(sequential.getCategoryGraph(root).getGraph().getNodeIds(),
                    parallel.getCategoryGraph(root).getGraph().getNodeIds());
        }
        assertEquals(new HashSet<>(Arrays.asList("R2", "M", "N")), parallel.getCategoryGraph("R2").getGraph().getNodeIds());
    }

    /**
     * R1 <- A <- B <- C(P1)，R2 <- M <- N <- O(P2)
     * 叶子裁剪至少需要两次迭代
     */
    private static TermGraph createTwoChainGraph() {
        TermGraph graph = new TermGraph();
        graph.addEdge("A", "R1");
        graph.addEdge("B", "A");
        graph.addEdge("C", "B");
        graph.addEdge("M", "R2");
        graph.addEdge("N", "M");
        graph.addEdge("O", "N");
        return graph;
    }

    private static Map<String, List<String>> annotateChainEnds() {
        Map<String, List<String>> annotations = new LinkedHashMap<>();
        annotations.put("P1", Collections.singletonList("C"));
        annotations.put("P2", Collections.singletonList("O"));
        return annotations;
    }

    @Test
    @DisplayName("并行类别任务失败时原样抛出原始异常，与顺序执行一致")
    public void testParallelFailureRethrownUnwrapped() {
        executor = Executors.newFixedThreadPool(2);
        TermGraphCleaner parallel = new TermGraphCleaner(new BreadthFirstLayeringOracle(), 3, 1, executor);
        TermGraphCleaner sequential = new TermGraphCleaner(new BreadthFirstLayeringOracle(), 3, 1, null);
        List<String> roots = Arrays.asList("R1", "R2");

        MalformedTermGraphException parallelError = assertThrows(MalformedTermGraphException.class,
                () -> parallel.clean(annotateChainEnds(), createTwoChainGraph(), roots));
        MalformedTermGraphException sequentialError = assertThrows(MalformedTermGraphException.class,
                () -> sequential.clean(annotateChainEnds(), createTwoChainGraph(), roots));

        log.info("并行失败: {}", parallelError.getMessage());
        assertTrue(parallelError.getMessage().contains("R1"));
        assertEquals(sequentialError.getMessage(), parallelError.getMessage());
    }

    @Test
    @DisplayName("一个类别失败后其余未完成的类别任务被取消")
    public void testRemainingCategoryTasksCancelledOnFailure() {
        HoldingExecutor holding = new HoldingExecutor();
        TermGraphCleaner cleaner = new TermGraphCleaner(new BreadthFirstLayeringOracle(), 3, 1, holding);

        assertThrows(MalformedTermGraphException.class,
                () -> cleaner.clean(annotateChainEnds(), createTwoChainGraph(), Arrays.asList("R1", "R2")));

        assertEquals(1, holding.held.size(), "第二个类别的任务未被执行");
        assertTrue(((Future<?>) holding.held.get(0)).isCancelled(), "未完成的任务必须被取消");
    }

    @Test
    @DisplayName("叶子裁剪迭代上限必须为正数")
    public void testNonPositiveLeafPruneIterationsRejected() {
        BreadthFirstLayeringOracle oracle = new BreadthFirstLayeringOracle();

        assertThrows(IllegalArgumentException.class, () -> new TermGraphCleaner(oracle, 3, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new TermGraphCleaner(oracle, 3, -5, null));
        assertThrows(IllegalArgumentException.class, () -> new TermGraphCleaner(oracle, -1, 10, null));
    }

    @Test
    @DisplayName("输入不合法时抛出参数异常")
    public void testInvalidInput() {
        TermGraphCleaner cleaner = createCleaner();
        TermGraph graph = createChainGraph();
        List<String> roots = Collections.singletonList("R");

        assertThrows(IllegalArgumentException.class, () -> cleaner.clean(null, graph, roots));
        assertThrows(IllegalArgumentException.class, () -> cleaner.clean(Collections.emptyMap(), null, roots));
        assertThrows(IllegalArgumentException.class, () -> cleaner.clean(Collections.emptyMap(), graph, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class,
                () -> cleaner.clean(Collections.emptyMap(), graph, Collections.singletonList("GO:missing")));
    }

    /**
     * 只在调用线程上执行第一个任务，之后提交的任务被挂起不执行
     */
    private static class HoldingExecutor extends AbstractExecutorService {
        private final List<Runnable> held = new ArrayList<>();
        private boolean first = true;

        @Override
        public void execute(Runnable command) {
            if (first) {
                first = false;
                command.run();
            } else {
                held.add(command);
            }
        }

        @Override
        public void shutdown() {
        }

        @Override
        public List<Runnable> shutdownNow() {
            return new ArrayList<>(held);
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
