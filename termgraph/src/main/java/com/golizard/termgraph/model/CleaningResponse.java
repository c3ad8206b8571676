package com.golizard.termgraph.model;

import java.util.List;
import java.util.Map;

/**
 * 术语图清理响应
 */
public class CleaningResponse {
    /**
     * 每个类别一张图（按根节点顺序）
     */
    private List<CategoryGraphView> categories;

    /**
     * 最终类别根节点（发生修复时为连接节点）
     */
    private List<String> categoryRoots;

    private Map<String, List<String>> selectedNodes;
    private List<String> unmatchedIdentifiers;
    private int repairCount;

    /**
     * 注释摘要文本
     */
    private String summary;

    public List<CategoryGraphView> getCategories() {
        return categories;
    }

    public void setCategories(List<CategoryGraphView> categories) {
        this.categories = categories;
    }

    public List<String> getCategoryRoots() {
        return categoryRoots;
    }

    public void setCategoryRoots(List<String> categoryRoots) {
        this.categoryRoots = categoryRoots;
    }

    public Map<String, List<String>> getSelectedNodes() {
        return selectedNodes;
    }

    public void setSelectedNodes(Map<String, List<String>> selectedNodes) {
        this.selectedNodes = selectedNodes;
    }

    public List<String> getUnmatchedIdentifiers() {
        return unmatchedIdentifiers;
    }

    public void setUnmatchedIdentifiers(List<String> unmatchedIdentifiers) {
        this.unmatchedIdentifiers = unmatchedIdentifiers;
    }

    public int getRepairCount() {
        return repairCount;
    }

    public void setRepairCount(int repairCount) {
        this.repairCount = repairCount;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }
}
