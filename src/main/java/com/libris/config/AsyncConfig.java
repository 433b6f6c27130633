package com.libris.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 批量嵌入与导入审查使用的有界线程池
 * 
 * 调用方按波次提交任务并等待整波完成,线程池大小只是上限,
 * 真正的并发度由 libris.review.wave-size / libris.embedding.batch-size 控制
 *
 * @author libris
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final DuplicateDetectionConfig duplicateDetectionConfig;

    @Bean(name = "dedupTaskExecutor")
    public ThreadPoolTaskExecutor dedupTaskExecutor() {
        DuplicateDetectionConfig.ExecutorConfig config = duplicateDetectionConfig.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("dedup-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
