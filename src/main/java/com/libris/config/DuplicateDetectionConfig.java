package com.libris.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 重复检测与语义检索配置类
 *
 * @author libris
 * @since 2024-11-02
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "libris")
public class DuplicateDetectionConfig {

    /**
     * 三级级联检测配置
     */
    private DetectionConfig detection = new DetectionConfig();

    /**
     * 嵌入生成配置
     */
    private EmbeddingConfig embedding = new EmbeddingConfig();

    /**
     * 语义检索配置
     */
    private SearchConfig search = new SearchConfig();

    /**
     * 导入审查配置
     */
    private ReviewConfig review = new ReviewConfig();

    /**
     * 线程池配置
     */
    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class DetectionConfig {
        /**
         * 相似度阈值
         */
        private Double threshold = 0.8;

        /**
         * 最多返回的候选数量
         */
        private Integer maxCandidates = 5;

        /**
         * 结构检测候选池扩展因子（候选池大小 = maxCandidates * candidatePoolFactor）
         */
        private Integer candidatePoolFactor = 5;

        /**
         * 语义检测检索扩展因子（检索数量 = maxCandidates * semanticOverfetchFactor）
         */
        private Integer semanticOverfetchFactor = 2;

        private Boolean enableExact = true;

        private Boolean enableStructural = true;

        private Boolean enableSemantic = true;

        /**
         * 结构匹配置信度
         */
        private Double structuralConfidence = 0.8;

        /**
         * 语义匹配置信度
         */
        private Double semanticConfidence = 0.85;

        /**
         * 相似度严格大于该值时建议合并
         */
        private Double mergeThreshold = 0.9;
    }

    @Data
    public static class EmbeddingConfig {
        /**
         * 默认嵌入提供方（providers 中的 key）
         */
        private String defaultProvider = "openai-small";

        /**
         * 估算 token 时每个 token 对应的字符数
         */
        private Integer charsPerToken = 4;

        /**
         * 批量嵌入每波数量
         */
        private Integer batchSize = 100;

        private Integer connectTimeoutSeconds = 30;

        private Integer readTimeoutSeconds = 60;

        /**
         * 支持的嵌入模型目录
         */
        private Map<String, ProviderSpec> providers = defaultProviders();

        private static Map<String, ProviderSpec> defaultProviders() {
            Map<String, ProviderSpec> providers = new LinkedHashMap<>();
            providers.put("openai-small", new ProviderSpec("openai", "text-embedding-3-small", 1536, 8191, 0.00002 / 1000));
            providers.put("openai-large", new ProviderSpec("openai", "text-embedding-3-large", 3072, 8191, 0.00013 / 1000));
            providers.put("openai-ada", new ProviderSpec("openai", "text-embedding-ada-002", 1536, 8191, 0.0001 / 1000));
            return providers;
        }
    }

    /**
     * 单个嵌入模型的规格，维度在 (provider, model) 内固定
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderSpec {
        private String name;
        private String model;
        private Integer dimensions;
        private Integer maxTokens;
        private Double costPerToken;
    }

    @Data
    public static class SearchConfig {
        private Integer defaultLimit = 10;

        private Double defaultThreshold = 0.7;
    }

    @Data
    public static class ReviewConfig {
        /**
         * 最高相似度严格大于该值时标记为 duplicate_detected
         */
        private Double duplicateCutoff = 0.95;

        /**
         * 每波并发审查的条目数
         */
        private Integer waveSize = 5;
    }

    @Data
    public static class ExecutorConfig {
        private Integer corePoolSize = 4;

        private Integer maxPoolSize = 16;

        private Integer queueCapacity = 200;
    }
}
