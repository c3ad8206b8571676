package com.golizard.termgraph.service;

import com.golizard.termgraph.exception.MalformedTermGraphException;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 默认分层器：从根节点沿子术语方向做 BFS
 *
 * - 层值 = BFS 深度（最短距离）
 * - 叶子 = 可达且在术语图中没有子术语的节点
 */
@Slf4j
public class BreadthFirstLayeringOracle implements LayeringOracle {

    @Override
    public CategoryLayering computeLayers(TermGraph graph, String root) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (!graph.hasNode(root)) {
            throw new MalformedTermGraphException("Category root " + root + " is not a node of the term graph");
        }

        for (TermNode node : graph.getNodes()) {
            node.removeLayer(root);
        }

        Map<String, Integer> depths = new LinkedHashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        depths.put(root, 0);
        queue.offer(root);
        int maxLayer = 0;

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int depth = depths.get(current);
            for (String child : graph.getChildren(current)) {
                if (!depths.containsKey(child)) {
                    depths.put(child, depth + 1);
                    maxLayer = Math.max(maxLayer, depth + 1);
                    queue.offer(child);
                }
            }
        }

        List<String> leaves = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : depths.entrySet()) {
            graph.getNode(entry.getKey()).setLayer(root, entry.getValue());
            if (graph.getInDegree(entry.getKey()) == 0) {
                leaves.add(entry.getKey());
            }
        }

        log.info("【分层】-> 类别 {}: 可达节点={}, 叶子={}, 最大层={}", root, depths.size(), leaves.size(), maxLayer);
        return new CategoryLayering(root, depths.keySet(), leaves, maxLayer);
    }
}
