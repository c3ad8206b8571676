package com.golizard.termgraph.util;

import com.golizard.termgraph.service.AnnotationMappingResult;
import com.golizard.termgraph.service.TermGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 注释映射工具类
 *
 * 把外部标识符（如 UniProt ID）挂到它所注释的术语节点上，只增不删
 */
@Slf4j
public class AnnotationMapper {

    private AnnotationMapper() {
    }

    /**
     * 执行注释映射
     *
     * @param annotationMap 外部标识符 -> 术语ID集合
     * @param graph         术语图（节点注释会被修改）
     * @return 标识符 -> 匹配节点的映射，以及未匹配的标识符
     */
    public static AnnotationMappingResult mapAnnotations(Map<String, ? extends Collection<String>> annotationMap,
                                                         TermGraph graph) {
        if (annotationMap == null) {
            throw new IllegalArgumentException("annotationMap cannot be null");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }

        Map<String, List<String>> selectedNodes = new LinkedHashMap<>();
        Set<String> unmatched = new LinkedHashSet<>();

        for (Map.Entry<String, ? extends Collection<String>> entry : annotationMap.entrySet()) {
            String identifier = entry.getKey();
            if (identifier == null || identifier.trim().isEmpty()) {
                log.debug("【注释映射】-> 跳过空标识符");
                continue;
            }

            List<String> matches = findMatchingNodes(graph, identifier, entry.getValue());
            if (matches.isEmpty()) {
                log.warn("【注释映射】-> 标识符 {} 在术语图中没有对应节点", identifier);
                unmatched.add(identifier);
                continue;
            }
            selectedNodes.put(identifier, matches);
        }

        for (Map.Entry<String, List<String>> entry : selectedNodes.entrySet()) {
            for (String termId : entry.getValue()) {
                graph.getNode(termId).addAnnotationIdentifier(entry.getKey());
            }
        }

        log.info("【注释映射】-> 标识符总数={}, 命中={}, 未命中={}",
                annotationMap.size(), selectedNodes.size(), unmatched.size());
        return new AnnotationMappingResult(selectedNodes, unmatched);
    }

    private static List<String> findMatchingNodes(TermGraph graph, String identifier, Collection<String> termIds) {
        List<String> matches = new ArrayList<>();
        if (termIds == null) {
            return matches;
        }
        Set<String> seen = new HashSet<>();
        for (String termId : termIds) {
            if (termId == null || !seen.add(termId)) {
                continue;
            }
            if (graph.hasNode(termId)) {
                matches.add(termId);
            } else {
                log.debug("【注释映射】-> {} 的术语 {} 不在图中", identifier, termId);
            }
        }
        return matches;
    }
}
