package com.golizard.termgraph.config;

import com.golizard.termgraph.service.BreadthFirstLayeringOracle;
import com.golizard.termgraph.service.LayeringOracle;
import com.golizard.termgraph.service.TermGraphCleaner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 清理引擎配置类
 * 配置分层器、类别并行线程池和清理编排器
 */
@Configuration
public class CleaningEngineConfig {

    /**
     * 默认分层器（BFS）
     */
    @Bean
    public LayeringOracle layeringOracle() {
        return new BreadthFirstLayeringOracle();
    }

    /**
     * 类别并行清理线程池
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService termGraphCleaningExecutor(TermGraphConfig config) {
        return Executors.newFixedThreadPool(Math.max(1, config.getCategoryThreads()));
    }

    /**
     * 清理编排器，关闭并行时不使用线程池
     */
    @Bean
    public TermGraphCleaner termGraphCleaner(LayeringOracle layeringOracle,
                                             TermGraphConfig config,
                                             ExecutorService termGraphCleaningExecutor) {
        return new TermGraphCleaner(
                layeringOracle,
                config.getMaxRepairAttempts(),
                config.getMaxLeafPruneIterations(),
                config.isParallelCategories() ? termGraphCleaningExecutor : null
        );
    }
}
