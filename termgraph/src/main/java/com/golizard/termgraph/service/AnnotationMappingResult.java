package com.golizard.termgraph.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 注释映射结果（用于追溯）
 */
@Getter
public class AnnotationMappingResult {
    /** 外部标识符 -> 图中匹配到的术语节点 */
    private final Map<String, List<String>> selectedNodes;

    /** 在图中没有任何匹配节点的外部标识符 */
    private final Set<String> unmatchedIdentifiers;

    public AnnotationMappingResult(Map<String, List<String>> selectedNodes, Set<String> unmatchedIdentifiers) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        selectedNodes.forEach((id, terms) -> copy.put(id, Collections.unmodifiableList(new ArrayList<>(terms))));
        this.selectedNodes = Collections.unmodifiableMap(copy);
        this.unmatchedIdentifiers = Collections.unmodifiableSet(new LinkedHashSet<>(unmatchedIdentifiers));
    }

    /**
     * 被至少一个标识符命中的节点数
     */
    public int getAnnotatedNodeCount() {
        Set<String> nodes = new LinkedHashSet<>();
        selectedNodes.values().forEach(nodes::addAll);
        return nodes.size();
    }
}
