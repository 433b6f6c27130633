package com.libris.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * 嵌入服务 HTTP 客户端配置
 * 
 * 嵌入调用本身不做重试(spring.ai.retry.max-attempts=1),
 * 超时是唯一的取消手段:
 * - 连接超时: libris.embedding.connect-timeout-seconds
 * - 读取超时: libris.embedding.read-timeout-seconds
 *
 * @author libris
 */
@Configuration
@RequiredArgsConstructor
public class OpenAIConfig {

    private final DuplicateDetectionConfig duplicateDetectionConfig;

    /**
     * 配置 RestClient 自定义器,会被 Spring AI 的 OpenAI 自动配置使用
     */
    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestFactory(clientHttpRequestFactory());
    }

    private ClientHttpRequestFactory clientHttpRequestFactory() {
        DuplicateDetectionConfig.EmbeddingConfig embedding = duplicateDetectionConfig.getEmbedding();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(embedding.getConnectTimeoutSeconds()));
        factory.setReadTimeout(Duration.ofSeconds(embedding.getReadTimeoutSeconds()));
        return factory;
    }
}
