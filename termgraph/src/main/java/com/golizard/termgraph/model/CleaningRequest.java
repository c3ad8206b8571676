package com.golizard.termgraph.model;

import java.util.List;
import java.util.Map;

/**
 * 术语图清理请求
 */
public class CleaningRequest {
    private List<OntologyTerm> nodes;
    private List<OntologyRelation> edges;

    /**
     * 外部标识符 -> 术语ID列表
     */
    private Map<String, List<String>> annotations;

    /**
     * 类别根节点，为空时使用配置的默认值
     */
    private List<String> categoryRoots;

    public List<OntologyTerm> getNodes() {
        return nodes;
    }

    public void setNodes(List<OntologyTerm> nodes) {
        this.nodes = nodes;
    }

    public List<OntologyRelation> getEdges() {
        return edges;
    }

    public void setEdges(List<OntologyRelation> edges) {
        this.edges = edges;
    }

    public Map<String, List<String>> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(Map<String, List<String>> annotations) {
        this.annotations = annotations;
    }

    public List<String> getCategoryRoots() {
        return categoryRoots;
    }

    public void setCategoryRoots(List<String> categoryRoots) {
        this.categoryRoots = categoryRoots;
    }

    @Override
    public String toString() {
        return "CleaningRequest{nodes=" + (nodes != null ? nodes.size() : 0)
                + ", edges=" + (edges != null ? edges.size() : 0)
                + ", annotations=" + (annotations != null ? annotations.size() : 0)
                + ", categoryRoots=" + categoryRoots + "}";
    }
}
