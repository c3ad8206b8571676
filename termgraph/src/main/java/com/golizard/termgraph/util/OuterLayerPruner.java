package com.golizard.termgraph.util;

import com.golizard.termgraph.service.TermGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 外层裁剪工具类
 *
 * 从最大层开始向根节点方向逐层检查，整层都没有注释的层被整体删除，
 * 同时把新暴露出来的节点加入叶子前沿；遇到第一个包含注释的层即停止
 */
@Slf4j
public class OuterLayerPruner {

    private OuterLayerPruner() {
    }

    /**
     * 执行外层裁剪
     *
     * @param ontology 类别根节点
     * @param graph    类别工作子图（原地修改）
     * @param leaves   初始叶子前沿
     * @param maxLayer 初始最大层值
     * @return 裁剪后的图、叶子前沿和新的最大层值
     */
    public static LayerPruneResult pruneLayersWithoutAnnotation(String ontology, TermGraph graph,
                                                               List<String> leaves, int maxLayer) {
        Set<String> currentLeaves = new LinkedHashSet<>(leaves);
        int originalNodeCount = graph.getNodeCount();
        int dst = maxLayer;

        while (dst > 0) {
            List<String> layerNodes = graph.findNodesAtLayer(ontology, dst, graph.getNodeIds());

            if (annotationInLayer(layerNodes, graph)) {
                int removed = originalNodeCount - graph.getNodeCount();
                log.info("【外层裁剪】-> 类别 {}: 第 {} 层包含注释，停止；移除节点={}", ontology, dst, removed);
                return new LayerPruneResult(graph, new ArrayList<>(currentLeaves), dst, removed);
            }

            for (String termId : layerNodes) {
                addLeaves(currentLeaves, termId, ontology, graph);
                currentLeaves.remove(termId);
                graph.removeNode(termId);
            }
            log.debug("【外层裁剪】-> 类别 {}: 删除第 {} 层，节点数={}", ontology, dst, layerNodes.size());
            dst--;
        }

        // 整个类别没有注释，只剩根节点
        currentLeaves.removeIf(termId -> !graph.hasNode(termId) || !graph.getNode(termId).isAnnotated());
        int removed = originalNodeCount - graph.getNodeCount();
        log.info("【外层裁剪】-> 类别 {}: 没有任何注释，仅保留根节点；移除节点={}", ontology, removed);
        return new LayerPruneResult(graph, new ArrayList<>(currentLeaves), 0, removed);
    }

    /**
     * 层内是否存在带注释的节点（只读检查，可并行）
     */
    static boolean annotationInLayer(List<String> layerNodes, TermGraph graph) {
        return layerNodes.parallelStream().anyMatch(termId -> graph.getNode(termId).isAnnotated());
    }

    /**
     * 节点的所有子术语层值都严格大于节点本身（没有来自更低层的边）
     */
    static boolean noLowerLayerEdge(String termId, String ontology, TermGraph graph) {
        int layer = graph.getNode(termId).requireLayer(ontology);
        for (String child : graph.getChildren(termId)) {
            if (layer >= graph.getNode(child).requireLayer(ontology)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 把待删除节点的邻居（双向）中新暴露出来的节点加入叶子前沿
     */
    private static void addLeaves(Set<String> leaves, String termId, String ontology, TermGraph graph) {
        for (String parent : graph.getParents(termId)) {
            if (!leaves.contains(parent) && noLowerLayerEdge(parent, ontology, graph)) {
                leaves.add(parent);
            }
        }
        for (String child : graph.getChildren(termId)) {
            if (!leaves.contains(child) && noLowerLayerEdge(child, ontology, graph)) {
                leaves.add(child);
            }
        }
    }
}
