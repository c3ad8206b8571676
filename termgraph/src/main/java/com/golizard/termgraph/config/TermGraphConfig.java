package com.golizard.termgraph.config;

import com.golizard.termgraph.constants.TermGraphConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 术语图清理配置类
 */
@Configuration
@ConfigurationProperties(prefix = "term-graph")
public class TermGraphConfig {

    /**
     * 断连修复最大次数，超过后清理失败
     */
    private int maxRepairAttempts = TermGraphConstants.Limits.DEFAULT_MAX_REPAIR_ATTEMPTS;

    /**
     * 叶子裁剪最大迭代次数
     */
    private int maxLeafPruneIterations = TermGraphConstants.Limits.DEFAULT_MAX_LEAF_PRUNE_ITERATIONS;

    /**
     * 是否并行清理各类别
     */
    private boolean parallelCategories = true;

    /**
     * 类别并行线程数
     */
    private int categoryThreads = TermGraphConstants.Limits.DEFAULT_CATEGORY_THREADS;

    /**
     * 请求未指定时使用的类别根节点
     */
    private List<String> categoryRoots = new ArrayList<>(TermGraphConstants.Category.DEFAULT_ROOTS);

    // Getters and Setters
    public int getMaxRepairAttempts() {
        return maxRepairAttempts;
    }

    public void setMaxRepairAttempts(int maxRepairAttempts) {
        this.maxRepairAttempts = maxRepairAttempts;
    }

    public int getMaxLeafPruneIterations() {
        return maxLeafPruneIterations;
    }

    public void setMaxLeafPruneIterations(int maxLeafPruneIterations) {
        this.maxLeafPruneIterations = maxLeafPruneIterations;
    }

    public boolean isParallelCategories() {
        return parallelCategories;
    }

    public void setParallelCategories(boolean parallelCategories) {
        this.parallelCategories = parallelCategories;
    }

    public int getCategoryThreads() {
        return categoryThreads;
    }

    public void setCategoryThreads(int categoryThreads) {
        this.categoryThreads = categoryThreads;
    }

    public List<String> getCategoryRoots() {
        return categoryRoots;
    }

    public void setCategoryRoots(List<String> categoryRoots) {
        this.categoryRoots = categoryRoots;
    }
}
