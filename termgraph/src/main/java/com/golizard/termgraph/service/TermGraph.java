package com.golizard.termgraph.service;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 术语图（有向图）
 *
 * 采用邻接表表示，边 source -> target 表示 source 是比 target 更具体的术语（is_a / part_of），
 * 即边的方向由具体术语指向类别根节点
 *
 * 核心功能：
 * 1. 节点和边的管理
 * 2. 双向邻居查询（父节点 = 出边，子节点 = 入边）
 * 3. 按节点集合提取子图
 * 4. 深拷贝（每个类别独占一份节点副本）
 */
@Slf4j
public class TermGraph {

    // ========== 核心数据结构 ==========

    /** 节点存储：termId -> TermNode（保持插入顺序） */
    private final Map<String, TermNode> nodes;

    /** 出边（邻接表）：termId -> [更一般的父术语...] */
    private final Map<String, List<String>> outEdges;

    /** 入边（反向邻接表）：termId -> [更具体的子术语...] */
    private final Map<String, List<String>> inEdges;

    /** 边的关系：key="source->target", value=关系类型（如 is_a） */
    private final Map<String, String> edgeRelations;

    public TermGraph() {
        this.nodes = new LinkedHashMap<>();
        this.outEdges = new HashMap<>();
        this.inEdges = new HashMap<>();
        this.edgeRelations = new HashMap<>();
    }

    // ========== 基础操作 ==========

    /**
     * 添加节点，已存在时替换节点属性但保留边
     */
    public void addNode(TermNode node) {
        if (node == null || node.getTermId() == null) {
            return;
        }
        nodes.put(node.getTermId(), node);
    }

    /**
     * 添加节点（仅ID），已存在时返回已有节点
     */
    public TermNode addNode(String termId) {
        return nodes.computeIfAbsent(termId, TermNode::new);
    }

    /**
     * 检查边是否存在
     */
    public boolean hasEdge(String source, String target) {
        if (source == null || target == null) {
            return false;
        }
        List<String> parents = outEdges.get(source);
        return parents != null && parents.contains(target);
    }

    /**
     * 添加边
     */
    public void addEdge(String source, String target) {
        addEdge(source, target, null);
    }

    /**
     * 添加边（带关系类型）
     *
     * 端点不存在时自动创建节点；自环和重复边跳过
     *
     * @param source   更具体的术语
     * @param target   更一般的术语
     * @param relation 关系类型（如 is_a），null 表示未指定
     */
    public void addEdge(String source, String target, String relation) {
        if (source == null || target == null) {
            return;
        }

        if (source.equals(target)) {
            log.debug("【建图】检测到自环，跳过: {}", source);
            return;
        }

        if (hasEdge(source, target)) {
            log.debug("【建图】边已存在，跳过: {} → {}", source, target);
            return;
        }

        addNode(source);
        addNode(target);

        outEdges.computeIfAbsent(source, k -> new ArrayList<>()).add(target);
        inEdges.computeIfAbsent(target, k -> new ArrayList<>()).add(source);

        if (relation != null && !relation.isEmpty()) {
            edgeRelations.put(edgeKey(source, target), relation);
        }
    }

    /**
     * 获取边的关系类型，未设置时返回 null
     */
    public String getEdgeRelation(String source, String target) {
        if (source == null || target == null) {
            return null;
        }
        return edgeRelations.get(edgeKey(source, target));
    }

    /**
     * 获取节点
     */
    public TermNode getNode(String termId) {
        return nodes.get(termId);
    }

    /**
     * 检查节点是否存在
     */
    public boolean hasNode(String termId) {
        return nodes.containsKey(termId);
    }

    /**
     * 所有节点ID（只读视图，按插入顺序）
     */
    public Set<String> getNodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * 所有节点（只读视图）
     */
    public Collection<TermNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        int count = 0;
        for (List<String> parents : outEdges.values()) {
            count += parents.size();
        }
        return count;
    }

    /**
     * 获取节点的父术语（出边方向，更一般）
     */
    public List<String> getParents(String termId) {
        List<String> parents = outEdges.get(termId);
        return parents != null ? Collections.unmodifiableList(parents) : Collections.emptyList();
    }

    /**
     * 获取节点的子术语（入边方向，更具体）
     */
    public List<String> getChildren(String termId) {
        List<String> children = inEdges.get(termId);
        return children != null ? Collections.unmodifiableList(children) : Collections.emptyList();
    }

    /**
     * 获取节点的入度（子术语数）
     */
    public int getInDegree(String termId) {
        List<String> children = inEdges.get(termId);
        return children != null ? children.size() : 0;
    }

    /**
     * 获取节点的出度（父术语数）
     */
    public int getOutDegree(String termId) {
        List<String> parents = outEdges.get(termId);
        return parents != null ? parents.size() : 0;
    }

    /**
     * 所有边（source, target），按节点插入顺序
     */
    public List<String[]> getEdges() {
        List<String[]> edges = new ArrayList<>();
        for (String source : nodes.keySet()) {
            for (String target : getParents(source)) {
                edges.add(new String[]{source, target});
            }
        }
        return edges;
    }

    /**
     * 移除节点（同时从正反两个邻接表中移除相关边）
     */
    public void removeNode(String termId) {
        if (!nodes.containsKey(termId)) {
            return;
        }

        // 从子术语的父列表中移除
        for (String child : getChildren(termId)) {
            List<String> childParents = outEdges.get(child);
            if (childParents != null) {
                childParents.remove(termId);
            }
            edgeRelations.remove(edgeKey(child, termId));
        }

        // 从父术语的子列表中移除
        for (String parent : getParents(termId)) {
            List<String> parentChildren = inEdges.get(parent);
            if (parentChildren != null) {
                parentChildren.remove(termId);
            }
            edgeRelations.remove(edgeKey(termId, parent));
        }

        nodes.remove(termId);
        outEdges.remove(termId);
        inEdges.remove(termId);
    }

    // ========== 查询与提取 ==========

    /**
     * 在候选集合中查找某类别下层值等于 layer 的节点（保持候选顺序）
     *
     * 不在图中或没有该类别层值的候选节点被忽略
     */
    public List<String> findNodesAtLayer(String ontology, int layer, Collection<String> candidates) {
        List<String> result = new ArrayList<>();
        for (String termId : candidates) {
            TermNode node = nodes.get(termId);
            if (node == null) {
                continue;
            }
            Integer nodeLayer = node.getLayer(ontology);
            if (nodeLayer != null && nodeLayer == layer) {
                result.add(termId);
            }
        }
        return result;
    }

    /**
     * 提取由节点集合诱导的子图（节点为深拷贝，互不共享）
     */
    public TermGraph subgraph(Collection<String> termIds) {
        Set<String> keep = new HashSet<>(termIds);
        TermGraph sub = new TermGraph();

        for (TermNode node : nodes.values()) {
            if (keep.contains(node.getTermId())) {
                sub.addNode(node.copy());
            }
        }

        for (String source : sub.nodes.keySet()) {
            for (String target : getParents(source)) {
                if (keep.contains(target)) {
                    sub.addEdge(source, target, getEdgeRelation(source, target));
                }
            }
        }

        log.debug("【子图提取】节点数={}, 边数={}", sub.getNodeCount(), sub.getEdgeCount());
        return sub;
    }

    /**
     * 深拷贝整张图
     */
    public TermGraph copy() {
        return subgraph(nodes.keySet());
    }

    /**
     * BFS遍历（单向）
     *
     * @param startTermId 起点
     * @param upward      true=向父术语，false=向子术语
     * @return 遍历到的所有节点ID（含起点）
     */
    public Set<String> bfsTraversal(String startTermId, boolean upward) {
        Set<String> visited = new LinkedHashSet<>();
        if (!nodes.containsKey(startTermId)) {
            return visited;
        }
        Queue<String> queue = new ArrayDeque<>();

        queue.offer(startTermId);
        visited.add(startTermId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> neighbors = upward ? getParents(current) : getChildren(current);
            for (String neighbor : neighbors) {
                if (visited.add(neighbor)) {
                    queue.offer(neighbor);
                }
            }
        }

        return visited;
    }

    private static String edgeKey(String source, String target) {
        return source + "->" + target;
    }

    @Override
    public String toString() {
        return "TermGraph{nodes=" + nodes.size() + ", edges=" + getEdgeCount() + "}";
    }
}
