package com.golizard.termgraph.model;

import java.util.List;

/**
 * 单个类别清理后的图
 */
public class CategoryGraphView {
    private String root;

    /**
     * 类别名称（molecular_function 等）
     */
    private String name;

    private List<CleanedTerm> nodes;
    private List<OntologyRelation> edges;
    private List<String> leaves;
    private int maxLayer;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<CleanedTerm> getNodes() {
        return nodes;
    }

    public void setNodes(List<CleanedTerm> nodes) {
        this.nodes = nodes;
    }

    public List<OntologyRelation> getEdges() {
        return edges;
    }

    public void setEdges(List<OntologyRelation> edges) {
        this.edges = edges;
    }

    public List<String> getLeaves() {
        return leaves;
    }

    public void setLeaves(List<String> leaves) {
        this.leaves = leaves;
    }

    public int getMaxLayer() {
        return maxLayer;
    }

    public void setMaxLayer(int maxLayer) {
        this.maxLayer = maxLayer;
    }
}
