package com.golizard.termgraph.service;

import com.golizard.termgraph.constants.TermGraphConstants;
import com.golizard.termgraph.model.CategoryGraphView;
import com.golizard.termgraph.model.CleanedTerm;
import com.golizard.termgraph.model.CleaningRequest;
import com.golizard.termgraph.model.CleaningResponse;
import com.golizard.termgraph.model.OntologyRelation;
import com.golizard.termgraph.model.OntologyTerm;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 术语图转换器
 * 请求模型 -> 内部术语图，清理结果 -> 返回模型
 */
@Slf4j
public final class TermGraphConverters {

    private TermGraphConverters() {}

    /**
     * 由请求中的节点和边构建术语图
     *
     * 边引用的未声明节点会自动创建（只有ID）
     */
    public static TermGraph toTermGraph(List<OntologyTerm> terms, List<OntologyRelation> relations) {
        TermGraph graph = new TermGraph();

        if (terms != null) {
            for (OntologyTerm term : terms) {
                if (term == null || term.getId() == null || term.getId().trim().isEmpty()) {
                    log.warn("【模型转换】-> 跳过没有ID的术语");
                    continue;
                }
                TermNode node = new TermNode(term.getId(), term.getName());
                node.setNamespace(term.getNamespace());
                node.setType("term");
                if (term.isTransit()) {
                    node.setAnnotation(TermAnnotation.transit());
                }
                graph.addNode(node);
            }
        }

        if (relations != null) {
            for (OntologyRelation relation : relations) {
                if (relation == null) {
                    continue;
                }
                graph.addEdge(relation.getSource(), relation.getTarget(), relation.getRelation());
            }
        }

        log.debug("【模型转换】-> 构建术语图: {}", graph);
        return graph;
    }

    public static TermGraph toTermGraph(CleaningRequest request) {
        return toTermGraph(request.getNodes(), request.getEdges());
    }

    /**
     * 单个类别的清理结果 -> 返回模型
     */
    public static CategoryGraphView toCategoryView(CleanedCategoryGraph category) {
        String root = category.getRoot();
        TermGraph graph = category.getGraph();

        List<CleanedTerm> nodes = new ArrayList<>();
        for (TermNode node : graph.getNodes()) {
            CleanedTerm term = new CleanedTerm();
            term.setId(node.getTermId());
            term.setName(node.getName());
            term.setType(node.getType());
            term.setLayer(node.getLayer(root));
            term.setAnnotationKind(node.getAnnotation().getKind().name());
            if (node.hasRealAnnotation()) {
                term.setIdentifiers(new ArrayList<>(node.getAnnotation().getIdentifiers()));
            }
            nodes.add(term);
        }

        List<OntologyRelation> edges = new ArrayList<>();
        for (String[] edge : graph.getEdges()) {
            edges.add(new OntologyRelation(edge[0], edge[1], graph.getEdgeRelation(edge[0], edge[1])));
        }

        CategoryGraphView view = new CategoryGraphView();
        view.setRoot(root);
        view.setName(TermGraphConstants.Category.displayName(root));
        view.setNodes(nodes);
        view.setEdges(edges);
        view.setLeaves(new ArrayList<>(category.getLeaves()));
        view.setMaxLayer(category.getMaxLayer());
        return view;
    }

    /**
     * 清理结果 -> 返回模型
     *
     * @param summary 注释摘要，可以为 null
     */
    public static CleaningResponse toResponse(CleaningResult result, AnnotationSummary summary) {
        List<CategoryGraphView> categories = new ArrayList<>();
        for (CleanedCategoryGraph category : result.getCategoryGraphs().values()) {
            categories.add(toCategoryView(category));
        }

        Map<String, List<String>> selectedNodes = new LinkedHashMap<>();
        result.getAnnotationMapping().getSelectedNodes()
                .forEach((id, termIds) -> selectedNodes.put(id, new ArrayList<>(termIds)));

        CleaningResponse response = new CleaningResponse();
        response.setCategories(categories);
        response.setCategoryRoots(new ArrayList<>(result.getCategoryRoots()));
        response.setSelectedNodes(selectedNodes);
        response.setUnmatchedIdentifiers(new ArrayList<>(result.getAnnotationMapping().getUnmatchedIdentifiers()));
        response.setRepairCount(result.getRepairCount());
        response.setSummary(summary != null ? summary.getText() : null);
        return response;
    }
}
