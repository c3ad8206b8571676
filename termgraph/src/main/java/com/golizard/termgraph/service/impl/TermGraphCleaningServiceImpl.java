package com.golizard.termgraph.service.impl;

import com.golizard.termgraph.config.TermGraphConfig;
import com.golizard.termgraph.constants.TermGraphConstants;
import com.golizard.termgraph.model.CleaningRequest;
import com.golizard.termgraph.model.CleaningResponse;
import com.golizard.termgraph.service.*;
import com.golizard.termgraph.util.AnnotationMapLoader;
import com.golizard.termgraph.util.OboTermGraphReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * 术语图清理服务实现类
 * 负责请求转换、默认类别根节点和结果报告，清理本身交给 {@link TermGraphCleaner}
 */
@Slf4j
@Service
public class TermGraphCleaningServiceImpl {

    @Autowired
    private TermGraphCleaner termGraphCleaner;

    @Autowired
    private TermGraphConfig termGraphConfig;

    /**
     * 清理请求中的术语图
     *
     * @param request 清理请求（节点、边、注释映射、可选的类别根节点）
     * @return 每个类别清理后的图和注释追溯信息
     */
    public CleaningResponse cleanTermGraph(CleaningRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Map<String, List<String>> annotations = annotationsOf(request);

        long startTime = System.currentTimeMillis();
        TermGraph graph = TermGraphConverters.toTermGraph(request);
        List<String> roots = resolveRoots(request.getCategoryRoots());

        CleaningResult result = clean(annotations, graph, roots);
        AnnotationSummary summary = AnnotationSummaryBuilder.build(annotations, graph, roots);

        log.info("【清理服务】-> 请求处理完成，耗时: {}ms", System.currentTimeMillis() - startTime);
        return TermGraphConverters.toResponse(result, summary);
    }

    /**
     * 生成注释摘要（不清理）
     */
    public AnnotationSummary summarize(CleaningRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        TermGraph graph = TermGraphConverters.toTermGraph(request);
        return AnnotationSummaryBuilder.build(annotationsOf(request), graph, resolveRoots(request.getCategoryRoots()));
    }

    /**
     * 清理术语图，categoryRoots 为空时使用配置的默认类别根节点
     */
    public CleaningResult clean(Map<String, ? extends Collection<String>> annotations,
                                TermGraph graph, List<String> categoryRoots) {
        List<String> roots = resolveRoots(categoryRoots);
        CleaningResult result = termGraphCleaner.clean(annotations, graph, roots);
        logGraphInfo(result);
        return result;
    }

    /**
     * 从 OBO 本体文件和 JSON 注释文件清理
     */
    public CleaningResult cleanFromFiles(Path oboFile, Path annotationFile, List<String> categoryRoots) throws IOException {
        TermGraph graph = OboTermGraphReader.read(oboFile);
        Map<String, List<String>> annotations = AnnotationMapLoader.load(annotationFile);
        return clean(annotations, graph, categoryRoots);
    }

    private List<String> resolveRoots(List<String> categoryRoots) {
        if (categoryRoots != null && !categoryRoots.isEmpty()) {
            return categoryRoots;
        }
        List<String> configured = termGraphConfig.getCategoryRoots();
        if (configured == null || configured.isEmpty()) {
            return TermGraphConstants.Category.DEFAULT_ROOTS;
        }
        return configured;
    }

    private static Map<String, List<String>> annotationsOf(CleaningRequest request) {
        return request.getAnnotations() != null ? request.getAnnotations() : Collections.emptyMap();
    }

    /**
     * 输出每个类别的图信息
     */
    private void logGraphInfo(CleaningResult result) {
        for (CleanedCategoryGraph category : result.getCategoryGraphs().values()) {
            log.info("【清理服务】-> 类别 {} ({}): 节点数={}, 边数={}, 叶子数={}, 最大层={}, 移除节点数={}",
                    category.getRoot(),
                    TermGraphConstants.Category.displayName(category.getRoot()),
                    category.getGraph().getNodeCount(),
                    category.getGraph().getEdgeCount(),
                    category.getLeaves().size(),
                    category.getMaxLayer(),
                    category.getRemovedNodeCount());
        }
        if (!result.getAnnotationMapping().getUnmatchedIdentifiers().isEmpty()) {
            log.warn("【清理服务】-> {} 个标识符未匹配到任何术语",
                    result.getAnnotationMapping().getUnmatchedIdentifiers().size());
        }
        if (result.isRepaired()) {
            log.warn("【清理服务】-> 清理过程中执行了 {} 次断连修复", result.getRepairCount());
        }
    }
}
