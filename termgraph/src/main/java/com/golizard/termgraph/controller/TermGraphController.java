package com.golizard.termgraph.controller;

import com.golizard.termgraph.model.CleaningRequest;
import com.golizard.termgraph.model.CleaningResponse;
import com.golizard.termgraph.service.AnnotationSummary;
import com.golizard.termgraph.service.impl.TermGraphCleaningServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

/**
 * 术语图清理REST API控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/term-graph")
public class TermGraphController {

    @Autowired
    private TermGraphCleaningServiceImpl cleaningService;

    /**
     * 清理术语图
     *
     * @param request 节点、边、注释映射和可选的类别根节点
     * @return 每个类别清理后的图
     */
    @PostMapping("/clean")
    public CleaningResponse clean(@RequestBody CleaningRequest request) {
        log.info("收到术语图清理请求: {}", request);

        if (request == null || request.getNodes() == null || request.getNodes().isEmpty()) {
            log.error("【输入验证失败】-> 术语列表为空");
            throw new IllegalArgumentException("nodes cannot be empty");
        }

        return cleaningService.cleanTermGraph(request);
    }

    /**
     * 注释摘要
     */
    @PostMapping("/summary")
    public AnnotationSummary summary(@RequestBody CleaningRequest request) {
        log.info("收到注释摘要请求: {}", request);
        return cleaningService.summarize(request);
    }
}
