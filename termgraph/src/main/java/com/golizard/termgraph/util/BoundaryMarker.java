package com.golizard.termgraph.util;

import com.golizard.termgraph.service.BoundaryMarkingResult;
import com.golizard.termgraph.service.TermAnnotation;
import com.golizard.termgraph.service.TermGraph;
import com.golizard.termgraph.service.TermNode;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 边界标记工具类
 *
 * 从每个带真实注释的节点沿边方向做深度优先遍历，找出层值最大的节点，
 * 若该节点没有注释则标记为边界哨兵。遍历到没有该类别层值的节点说明
 * 分层器的 BFS 与本次 DFS 对可达性的判断不一致（类别根节点不支配注释子图），返回断连结果
 */
@Slf4j
public class BoundaryMarker {

    private BoundaryMarker() {
    }

    /**
     * 为所有类别标记边界节点
     *
     * @param categoryRoots 类别根节点
     * @param graph         已写入层值的术语图
     * @return 标记结果；遇到断连立即返回
     */
    public static BoundaryMarkingResult markBoundaryNodes(List<String> categoryRoots, TermGraph graph) {
        int markedCount = 0;

        for (String ontology : categoryRoots) {
            List<String> startNodes = new ArrayList<>();
            for (TermNode node : graph.getNodes()) {
                if (node.hasLayer(ontology) && node.hasRealAnnotation()) {
                    startNodes.add(node.getTermId());
                }
            }
            log.debug("【边界标记】-> 类别 {} 起点数: {}", ontology, startNodes.size());

            for (String startNode : startNodes) {
                String farthest = findFarthestNode(ontology, startNode, graph);
                if (farthest == null) {
                    log.warn("【边界标记】-> 断连: 从 {} 出发的DFS遇到类别 {} 的BFS未访问节点", startNode, ontology);
                    return BoundaryMarkingResult.disconnected(startNode, ontology);
                }

                TermNode farthestNode = graph.getNode(farthest);
                if (!farthestNode.isAnnotated()) {
                    farthestNode.setAnnotation(TermAnnotation.boundary());
                    markedCount++;
                    log.debug("【边界标记】-> {} 的最远节点 {} 标记为边界", startNode, farthest);
                }
            }
        }

        log.info("【边界标记】-> 完成，新增边界节点: {}", markedCount);
        return BoundaryMarkingResult.marked(markedCount);
    }

    /**
     * 沿边方向DFS，返回层值最大的节点
     *
     * 每条可达边只访问一次；层值相同时保留先访问到的节点
     *
     * @return 最远节点ID；遇到缺少层值的节点时返回 null
     */
    static String findFarthestNode(String ontology, String startNode, TermGraph graph) {
        String farthest = startNode;
        int farthestLayer = graph.getNode(startNode).requireLayer(ontology);

        Set<String> expanded = new HashSet<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        expanded.add(startNode);
        stack.push(graph.getParents(startNode).iterator());

        while (!stack.isEmpty()) {
            Iterator<String> edges = stack.peek();
            if (!edges.hasNext()) {
                stack.pop();
                continue;
            }

            String target = edges.next();
            Integer layer = graph.getNode(target).getLayer(ontology);
            if (layer == null) {
                return null;
            }
            if (layer > farthestLayer) {
                farthest = target;
                farthestLayer = layer;
            }
            if (expanded.add(target)) {
                stack.push(graph.getParents(target).iterator());
            }
        }

        return farthest;
    }
}
