package com.golizard.termgraph.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 注释摘要
 */
@Getter
public class AnnotationSummary {

    /** 外部标识符总数 */
    private final int totalIdentifiers;

    /** 不重复的术语数 */
    private final int uniqueTermCount;

    /** 类别根节点 -> 该类别下的术语数（术语是根节点或根节点是其祖先） */
    private final Map<String, Integer> categoryTermCounts;

    /** 按出现次数排序的高频术语 */
    private final List<TermFrequency> topTerms;

    /** 文本形式 */
    private final String text;

    public AnnotationSummary(int totalIdentifiers, int uniqueTermCount,
                             Map<String, Integer> categoryTermCounts,
                             List<TermFrequency> topTerms, String text) {
        this.totalIdentifiers = totalIdentifiers;
        this.uniqueTermCount = uniqueTermCount;
        this.categoryTermCounts = Collections.unmodifiableMap(new LinkedHashMap<>(categoryTermCounts));
        this.topTerms = Collections.unmodifiableList(new ArrayList<>(topTerms));
        this.text = text;
    }

    /**
     * 术语出现次数
     */
    @Getter
    public static class TermFrequency {
        private final String termId;
        private final String name;
        private final int count;

        public TermFrequency(String termId, String name, int count) {
            this.termId = termId;
            this.name = name;
            this.count = count;
        }
    }
}
