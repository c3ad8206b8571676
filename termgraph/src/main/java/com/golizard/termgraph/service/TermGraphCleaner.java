package com.golizard.termgraph.service;

import com.golizard.termgraph.constants.TermGraphConstants;
import com.golizard.termgraph.exception.GraphCleaningException;
import com.golizard.termgraph.util.AnnotationMapper;
import com.golizard.termgraph.util.BoundaryMarker;
import com.golizard.termgraph.util.CleanedGraphValidator;
import com.golizard.termgraph.util.LayerPruneResult;
import com.golizard.termgraph.util.LeafPruner;
import com.golizard.termgraph.util.OuterLayerPruner;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 术语图清理编排器
 *
 * 每次尝试的流程：
 * 1. 复制基础图 → 注释映射 → 分层 → 边界标记
 * 2. 边界标记返回断连：合成连接节点，把所有类别根节点连到它上面，用它替换根节点后重试
 * 3. 否则按类别执行外层裁剪和叶子裁剪
 *
 * 修复是有界循环，超过最大修复次数后抛出 {@link GraphCleaningException}
 */
@Slf4j
public class TermGraphCleaner {

    private final LayeringOracle layeringOracle;
    private final int maxRepairAttempts;
    private final int maxLeafPruneIterations;

    /** 类别并行线程池，null 表示顺序执行 */
    private final ExecutorService executor;

    public TermGraphCleaner(LayeringOracle layeringOracle) {
        this(layeringOracle,
                TermGraphConstants.Limits.DEFAULT_MAX_REPAIR_ATTEMPTS,
                TermGraphConstants.Limits.DEFAULT_MAX_LEAF_PRUNE_ITERATIONS,
                null);
    }

    public TermGraphCleaner(LayeringOracle layeringOracle, int maxRepairAttempts,
                            int maxLeafPruneIterations, ExecutorService executor) {
        if (layeringOracle == null) {
            throw new IllegalArgumentException("layeringOracle cannot be null");
        }
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must be non-negative");
        }
        if (maxLeafPruneIterations <= 0) {
            throw new IllegalArgumentException("maxLeafPruneIterations must be positive");
        }
        this.layeringOracle = layeringOracle;
        this.maxRepairAttempts = maxRepairAttempts;
        this.maxLeafPruneIterations = maxLeafPruneIterations;
        this.executor = executor;
    }

    /**
     * 执行清理
     *
     * 输入图不会被修改，连接节点添加在内部副本上
     *
     * @param annotationMap 外部标识符 -> 术语ID集合
     * @param graph         术语图
     * @param categoryRoots 类别根节点（有序）
     * @return 每个类别的清理结果
     */
    public CleaningResult clean(Map<String, ? extends Collection<String>> annotationMap,
                                TermGraph graph, List<String> categoryRoots) {
        validateInput(annotationMap, graph, categoryRoots);

        TermGraph baseGraph = graph.copy();
        List<String> roots = new ArrayList<>(new LinkedHashSet<>(categoryRoots));
        int repairCount = 0;

        log.info("【术语图清理】-> 开始清理: 节点数={}, 边数={}, 类别={}, 标识符数={}",
                baseGraph.getNodeCount(), baseGraph.getEdgeCount(), roots, annotationMap.size());

        for (int attempt = 1; ; attempt++) {
            TermGraph working = baseGraph.copy();

            AnnotationMappingResult mapping = AnnotationMapper.mapAnnotations(annotationMap, working);

            Map<String, CategoryLayering> layerings = new LinkedHashMap<>();
            for (String root : roots) {
                layerings.put(root, layeringOracle.computeLayers(working, root));
            }

            BoundaryMarkingResult marking = BoundaryMarker.markBoundaryNodes(roots, working);
            if (marking.isDisconnected()) {
                if (repairCount >= maxRepairAttempts) {
                    log.error("【术语图清理】-> 第 {} 次尝试仍然断连（类别 {}，起点 {}），修复次数已达上限 {}",
                            attempt, marking.getOntology(), marking.getStartNode(), maxRepairAttempts);
                    throw new GraphCleaningException(marking.getOntology(), attempt,
                            "Category " + marking.getOntology() + " is still disconnected at node "
                                    + marking.getStartNode() + " after " + repairCount + " repair attempt(s)");
                }
                repairCount++;
                roots = connectCategoryRoots(baseGraph, roots);
                log.warn("【术语图清理】-> 第 {} 次尝试断连（类别 {}，起点 {}），合成连接节点后重试，新根节点={}",
                        attempt, marking.getOntology(), marking.getStartNode(), roots);
                continue;
            }

            Map<String, CleanedCategoryGraph> categoryGraphs = pruneCategories(working, roots, layerings, attempt);
            log.info("【术语图清理】-> 清理完成: 尝试次数={}, 修复次数={}", attempt, repairCount);
            return new CleaningResult(roots, categoryGraphs, mapping, layerings, repairCount);
        }
    }

    /**
     * 合成连接节点并从每个当前根节点连一条边到它
     *
     * @return 只包含连接节点的新根节点列表
     */
    static List<String> connectCategoryRoots(TermGraph graph, List<String> roots) {
        String connectorId = TermGraphConstants.Connector.NODE_ID;
        int suffix = 1;
        while (graph.hasNode(connectorId)) {
            suffix++;
            connectorId = TermGraphConstants.Connector.NODE_ID + "_" + suffix;
        }

        TermNode connector = new TermNode(connectorId, TermGraphConstants.Connector.NODE_NAME);
        connector.setType(TermGraphConstants.Connector.NODE_TYPE);
        graph.addNode(connector);

        for (String root : roots) {
            graph.addEdge(root, connectorId, TermGraphConstants.Relation.CONNECTS);
        }
        return Collections.singletonList(connectorId);
    }

    /**
     * 按类别裁剪，每个类别独占一份子图副本
     */
    private Map<String, CleanedCategoryGraph> pruneCategories(TermGraph working, List<String> roots,
                                                              Map<String, CategoryLayering> layerings, int attempt) {
        // 子图在提交任务前顺序提取，任务之间不共享可变状态
        Map<String, TermGraph> subgraphs = new LinkedHashMap<>();
        for (String root : roots) {
            subgraphs.put(root, working.subgraph(layerings.get(root).getReachableNodes()));
        }

        Map<String, CleanedCategoryGraph> result = new LinkedHashMap<>();
        if (executor == null || roots.size() < 2) {
            for (String root : roots) {
                result.put(root, cleanCategory(root, subgraphs.get(root), layerings.get(root)));
            }
            return result;
        }

        Map<String, Future<CleanedCategoryGraph>> futures = new LinkedHashMap<>();
        for (String root : roots) {
            TermGraph subgraph = subgraphs.get(root);
            CategoryLayering layering = layerings.get(root);
            futures.put(root, executor.submit(() -> cleanCategory(root, subgraph, layering)));
        }

        for (Map.Entry<String, Future<CleanedCategoryGraph>> entry : futures.entrySet()) {
            try {
                result.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException e) {
                cancelRemaining(futures.values());
                Thread.currentThread().interrupt();
                throw new GraphCleaningException(entry.getKey(), attempt,
                        "Interrupted while cleaning category " + entry.getKey(), e);
            } catch (ExecutionException e) {
                cancelRemaining(futures.values());
                Throwable cause = e.getCause();
                log.error("【术语图清理】-> 类别 {} 清理失败: {}", entry.getKey(), cause.getMessage(), cause);
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new GraphCleaningException(entry.getKey(), attempt,
                        "Failed to clean category " + entry.getKey(), cause);
            }
        }
        return result;
    }

    /**
     * 一个类别失败后取消其余尚未完成的任务
     */
    private static void cancelRemaining(Collection<Future<CleanedCategoryGraph>> futures) {
        for (Future<CleanedCategoryGraph> future : futures) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }

    /**
     * 清理单个类别：外层裁剪 → 叶子裁剪 → 验证
     */
    CleanedCategoryGraph cleanCategory(String root, TermGraph subgraph, CategoryLayering layering) {
        int originalNodeCount = subgraph.getNodeCount();

        LayerPruneResult layerResult = OuterLayerPruner.pruneLayersWithoutAnnotation(
                root, subgraph, layering.getLeaves(), layering.getMaxLayer());

        List<String> leaves = LeafPruner.pruneLeaves(
                root, layerResult.getGraph(), layerResult.getLeaves(), layerResult.getMaxLayer(), maxLeafPruneIterations);

        CleanedGraphValidator.validate(root, layerResult.getGraph());

        log.info("【术语图清理】-> 类别 {}: 原始节点={}, 剩余节点={}, 叶子={}, 最大层={}",
                root, originalNodeCount, layerResult.getGraph().getNodeCount(), leaves.size(), layerResult.getMaxLayer());
        return new CleanedCategoryGraph(root, layerResult.getGraph(), leaves, layerResult.getMaxLayer(), originalNodeCount);
    }

    private static void validateInput(Map<String, ? extends Collection<String>> annotationMap,
                                      TermGraph graph, List<String> categoryRoots) {
        if (annotationMap == null) {
            throw new IllegalArgumentException("annotationMap cannot be null");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (categoryRoots == null || categoryRoots.isEmpty()) {
            throw new IllegalArgumentException("categoryRoots cannot be empty");
        }
        for (String root : categoryRoots) {
            if (!graph.hasNode(root)) {
                throw new IllegalArgumentException("Category root " + root + " is not a node of the term graph");
            }
        }
    }
}
