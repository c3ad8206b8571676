package com.golizard.termgraph.service;

import com.golizard.termgraph.constants.TermGraphConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 注释摘要构建器
 *
 * 统计标识符数、不重复术语数、各类别术语数和高频术语，
 * 只读取图结构，不修改图
 */
@Slf4j
public final class AnnotationSummaryBuilder {

    private static final String UNKNOWN_NAME = "Unknown";

    private AnnotationSummaryBuilder() {}

    public static AnnotationSummary build(Map<String, ? extends Collection<String>> annotationMap,
                                          TermGraph graph, List<String> categoryRoots) {
        if (annotationMap == null || graph == null || categoryRoots == null) {
            throw new IllegalArgumentException("annotationMap, graph and categoryRoots cannot be null");
        }

        // 术语 -> 出现次数（保持首次出现顺序，次数相同时按该顺序排列）
        Map<String, Integer> termCounts = new LinkedHashMap<>();
        for (Collection<String> terms : annotationMap.values()) {
            if (terms == null) {
                continue;
            }
            for (String term : terms) {
                if (term != null) {
                    termCounts.merge(term, 1, Integer::sum);
                }
            }
        }

        Map<String, Integer> categoryCounts = new LinkedHashMap<>();
        for (String root : categoryRoots) {
            categoryCounts.put(root, 0);
        }
        for (String term : termCounts.keySet()) {
            if (!graph.hasNode(term)) {
                continue;
            }
            Set<String> ancestors = graph.bfsTraversal(term, true);
            for (String root : categoryRoots) {
                if (ancestors.contains(root)) {
                    categoryCounts.merge(root, 1, Integer::sum);
                }
            }
        }

        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(termCounts.entrySet());
        sorted.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<AnnotationSummary.TermFrequency> topTerms = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : sorted) {
            if (topTerms.size() >= TermGraphConstants.Limits.SUMMARY_TOP_TERMS) {
                break;
            }
            topTerms.add(new AnnotationSummary.TermFrequency(entry.getKey(), nameOf(graph, entry.getKey()), entry.getValue()));
        }

        String text = render(annotationMap.size(), termCounts.size(), categoryCounts, topTerms, graph);
        log.debug("【注释摘要】-> 标识符={}, 术语={}, 类别统计={}", annotationMap.size(), termCounts.size(), categoryCounts);
        return new AnnotationSummary(annotationMap.size(), termCounts.size(), categoryCounts, topTerms, text);
    }

    private static String render(int totalIdentifiers, int uniqueTerms, Map<String, Integer> categoryCounts,
                                 List<AnnotationSummary.TermFrequency> topTerms, TermGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("GO Annotation Summary:\n");
        sb.append("  - Total identifiers: ").append(totalIdentifiers).append('\n');
        sb.append("  - Total unique GO terms: ").append(uniqueTerms).append('\n');
        sb.append("\nGO Domain Breakdown (based on category roots):\n");
        for (Map.Entry<String, Integer> entry : categoryCounts.entrySet()) {
            sb.append("  - ").append(entry.getKey())
                    .append(" (").append(nameOf(graph, entry.getKey())).append("): ")
                    .append(entry.getValue()).append(" terms\n");
        }
        sb.append("\nTop ").append(TermGraphConstants.Limits.SUMMARY_TOP_TERMS).append(" GO terms by frequency:\n");
        for (AnnotationSummary.TermFrequency term : topTerms) {
            sb.append("  - ").append(term.getTermId())
                    .append(" (").append(term.getName()).append("): ")
                    .append(term.getCount()).append(" annotations\n");
        }
        return sb.toString();
    }

    private static String nameOf(TermGraph graph, String termId) {
        TermNode node = graph.getNode(termId);
        if (node == null || node.getName() == null) {
            return UNKNOWN_NAME;
        }
        return node.getName();
    }
}
