package com.golizard.termgraph.util;

import com.golizard.termgraph.exception.MalformedTermGraphException;
import com.golizard.termgraph.service.TermGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 叶子裁剪工具类
 *
 * 从外层裁剪留下的叶子前沿开始，反复删除没有注释的叶子，并把失去全部子术语的父术语提升为新叶子。
 * 有多个子术语的共享父术语只有在所有子术语都在本轮待删除集合中时才会被提升，
 * 保证仍连接着注释节点的祖先不会被删除
 */
@Slf4j
public class LeafPruner {

    private LeafPruner() {
    }

    /**
     * 执行叶子裁剪
     *
     * @param ontology      类别根节点
     * @param graph         外层裁剪后的工作子图（原地修改）
     * @param leaves        外层裁剪后的叶子前沿
     * @param maxLayer      外层裁剪返回的最大层值
     * @param maxIterations 迭代上限，超过视为层值非单调的非法输入
     * @return 最终叶子前沿
     */
    public static List<String> pruneLeaves(String ontology, TermGraph graph, List<String> leaves,
                                           int maxLayer, int maxIterations) {
        Set<String> currentLeaves = new LinkedHashSet<>(leaves);
        List<String> removable = new ArrayList<>();
        int originalNodeCount = graph.getNodeCount();
        int dst = maxLayer;
        int iterations = 0;

        while (dst > 0) {
            if (++iterations > maxIterations) {
                log.error("【叶子裁剪】-> 类别 {}: 迭代 {} 次仍未收敛，当前层={}", ontology, maxIterations, dst);
                throw new MalformedTermGraphException("Leaf pruning of ontology " + ontology
                        + " did not converge after " + maxIterations + " iterations; layer values are not monotonic");
            }

            for (String leaf : graph.findNodesAtLayer(ontology, dst, currentLeaves)) {
                if (!graph.getNode(leaf).isAnnotated() && !removable.contains(leaf)) {
                    removable.add(leaf);
                }
            }
            dst = processLeaves(removable, currentLeaves, ontology, dst, graph);
        }

        log.info("【叶子裁剪】-> 类别 {}: 移除节点={}, 剩余节点={}, 叶子={}",
                ontology, originalNodeCount - graph.getNodeCount(), graph.getNodeCount(), currentLeaves.size());
        return new ArrayList<>(currentLeaves);
    }

    /**
     * 处理待删除叶子，返回新的工作层值
     *
     * 被提升的父术语层值不小于当前层时前沿需要先推进到该层（分支在不同深度汇合）；
     * 本轮没有推进时向根节点退一层
     */
    private static int processLeaves(List<String> removable, Set<String> leaves, String ontology,
                                     int dst, TermGraph graph) {
        boolean updated = false;

        while (!removable.isEmpty()) {
            String leaf = removable.remove(removable.size() - 1);

            for (String parent : graph.getParents(leaf)) {
                boolean promote;
                if (graph.getInDegree(parent) > 1) {
                    promote = !leaves.contains(parent) && allChildrenRemovable(graph.getChildren(parent), removable, leaf);
                } else {
                    promote = true;
                }

                if (promote) {
                    leaves.add(parent);
                    int parentLayer = graph.getNode(parent).requireLayer(ontology);
                    if (parentLayer >= dst) {
                        updated = true;
                        dst = parentLayer;
                    }
                }
            }

            graph.removeNode(leaf);
            leaves.remove(leaf);
            log.debug("【叶子裁剪】-> 删除叶子 {}", leaf);
        }

        return updated ? dst : dst - 1;
    }

    private static boolean allChildrenRemovable(List<String> children, List<String> removable, String leaf) {
        Set<String> removableSet = new HashSet<>(removable);
        removableSet.add(leaf);
        return removableSet.containsAll(children);
    }
}
