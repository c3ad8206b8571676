package com.golizard.termgraph.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 术语图清理结果
 */
@Getter
public class CleaningResult {
    /** 最终类别根节点（发生修复时为连接节点） */
    private final List<String> categoryRoots;

    /** 类别根节点 -> 清理后的类别图（按根节点顺序） */
    private final Map<String, CleanedCategoryGraph> categoryGraphs;

    private final AnnotationMappingResult annotationMapping;

    /** 最后一次成功尝试的分层结果 */
    private final Map<String, CategoryLayering> layerings;

    /** 断连修复次数 */
    private final int repairCount;

    public CleaningResult(List<String> categoryRoots,
                          Map<String, CleanedCategoryGraph> categoryGraphs,
                          AnnotationMappingResult annotationMapping,
                          Map<String, CategoryLayering> layerings,
                          int repairCount) {
        this.categoryRoots = Collections.unmodifiableList(new ArrayList<>(categoryRoots));
        this.categoryGraphs = Collections.unmodifiableMap(new LinkedHashMap<>(categoryGraphs));
        this.annotationMapping = annotationMapping;
        this.layerings = Collections.unmodifiableMap(new LinkedHashMap<>(layerings));
        this.repairCount = repairCount;
    }

    public CleanedCategoryGraph getCategoryGraph(String root) {
        return categoryGraphs.get(root);
    }

    public boolean isRepaired() {
        return repairCount > 0;
    }
}
