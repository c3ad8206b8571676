package com.golizard.termgraph.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个类别的清理结果
 */
@Getter
public class CleanedCategoryGraph {
    private final String root;
    private final TermGraph graph;
    private final List<String> leaves;
    private final int maxLayer;

    /** 清理前的可达节点数 */
    private final int originalNodeCount;

    public CleanedCategoryGraph(String root, TermGraph graph, List<String> leaves, int maxLayer, int originalNodeCount) {
        this.root = root;
        this.graph = graph;
        this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
        this.maxLayer = maxLayer;
        this.originalNodeCount = originalNodeCount;
    }

    public int getRemovedNodeCount() {
        return originalNodeCount - graph.getNodeCount();
    }
}
