package com.golizard.termgraph.util;

import com.golizard.termgraph.service.TermGraph;
import com.golizard.termgraph.service.TermNode;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 清理结果验证工具类
 *
 * 验证内容：
 * 1. 类别根节点必须保留
 * 2. 每个剩余节点要么带注释（真实注释或哨兵），要么位于根节点到某个带注释节点的路径上
 *
 * 验证只记录日志，不回滚清理结果
 */
@Slf4j
public class CleanedGraphValidator {

    private CleanedGraphValidator() {
    }

    /**
     * 验证清理后的类别图
     *
     * @return 是否通过验证
     */
    public static boolean validate(String root, TermGraph graph) {
        if (!graph.hasNode(root)) {
            log.error("【清理验证】-> 验证失败: 类别根节点被删除 - {}", root);
            return false;
        }

        List<String> dangling = findDanglingNodes(root, graph);
        if (!dangling.isEmpty()) {
            log.warn("【清理验证】-> 类别 {} 存在 {} 个悬挂的无注释节点: {}", root, dangling.size(), dangling);
            return false;
        }

        log.debug("【清理验证】-> 类别 {} 验证通过 ✅", root);
        return true;
    }

    /**
     * 找出不带注释、且不在“根节点 → 带注释节点”路径上的节点
     *
     * 根节点本身不计入
     */
    public static List<String> findDanglingNodes(String root, TermGraph graph) {
        Set<String> fromRoot = graph.bfsTraversal(root, false);

        // 能到达根节点的带注释节点及其全部祖先都在路径上
        Set<String> onPath = new HashSet<>();
        for (TermNode node : graph.getNodes()) {
            if (node.isAnnotated() && fromRoot.contains(node.getTermId()) && !onPath.contains(node.getTermId())) {
                onPath.addAll(graph.bfsTraversal(node.getTermId(), true));
            }
        }

        List<String> dangling = new ArrayList<>();
        for (TermNode node : graph.getNodes()) {
            String termId = node.getTermId();
            if (termId.equals(root) || node.isAnnotated()) {
                continue;
            }
            if (!onPath.contains(termId) || !fromRoot.contains(termId)) {
                dangling.add(termId);
            }
        }
        return dangling;
    }
}
