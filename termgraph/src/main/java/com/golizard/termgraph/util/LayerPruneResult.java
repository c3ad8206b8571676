package com.golizard.termgraph.util;

import com.golizard.termgraph.service.TermGraph;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外层裁剪结果
 */
@Getter
public class LayerPruneResult {
    private final TermGraph graph;
    private final List<String> leaves;

    /** 第一个包含注释的层（新的最大层值） */
    private final int maxLayer;

    private final int removedNodeCount;

    public LayerPruneResult(TermGraph graph, List<String> leaves, int maxLayer, int removedNodeCount) {
        this.graph = graph;
        this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
        this.maxLayer = maxLayer;
        this.removedNodeCount = removedNodeCount;
    }
}
