package com.golizard.termgraph.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单个类别的分层结果：可达节点、初始叶子、最大层值
 */
@Getter
public class CategoryLayering {
    private final String root;
    private final Set<String> reachableNodes;
    private final List<String> leaves;
    private final int maxLayer;

    public CategoryLayering(String root, Set<String> reachableNodes, List<String> leaves, int maxLayer) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root;
        this.reachableNodes = Collections.unmodifiableSet(new LinkedHashSet<>(reachableNodes));
        this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
        this.maxLayer = maxLayer;
    }
}
