package com.libris.service.impl;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.lang.Assert;
import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import com.libris.config.DuplicateDetectionConfig;
import com.libris.exception.DimensionMismatchException;
import com.libris.exception.EmbeddingProviderException;
import com.libris.model.dto.EmbedItemDTO;
import com.libris.model.vo.EmbeddingResultVO;
import com.libris.service.EmbeddingService;
import com.libris.service.EmbeddingStoreService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingOptionsBuilder;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 嵌入生成服务实现
 * 
 * 基于 Spring AI EmbeddingModel, 按提供方目录选择模型:
 * 1. 按 maxTokens * charsPerToken 估算字符上限并截断
 * 2. 调用嵌入模型
 * 3. 校验返回维度与目录一致
 *
 * @author libris
 */
@Slf4j
@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    private static final String OPENAI_PROVIDER = "openai";
    private static final String TRUNCATION_SUFFIX = "...";

    /**
     * Spring AI 错误处理器的异常消息格式: "{status} - {body}"
     */
    private static final String STATUS_PREFIX_REGEX = "^(\\d{3}) - ";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStoreService embeddingStoreService;
    private final DuplicateDetectionConfig duplicateDetectionConfig;
    private final Executor taskExecutor;

    public EmbeddingServiceImpl(EmbeddingModel embeddingModel,
                                EmbeddingStoreService embeddingStoreService,
                                DuplicateDetectionConfig duplicateDetectionConfig,
                                @Qualifier("dedupTaskExecutor") Executor taskExecutor) {
        this.embeddingModel = embeddingModel;
        this.embeddingStoreService = embeddingStoreService;
        this.duplicateDetectionConfig = duplicateDetectionConfig;
        this.taskExecutor = taskExecutor;
    }

    @Override
    public EmbeddingResultVO generate(String text) {
        return generate(text, null);
    }

    @Override
    public EmbeddingResultVO generate(String text, String providerId) {
        Assert.notBlank(text, "嵌入文本不能为空");

        DuplicateDetectionConfig.ProviderSpec spec = getProviderSpec(providerId);
        if (!OPENAI_PROVIDER.equals(spec.getName())) {
            throw new EmbeddingProviderException(spec.getName(), "嵌入提供方未实现");
        }

        String input = truncate(text, spec.getMaxTokens());
        EmbeddingResponse response;
        try {
            response = embeddingModel.call(new EmbeddingRequest(List.of(input),
                EmbeddingOptionsBuilder.builder().withModel(spec.getModel()).build()));
        } catch (NonTransientAiException | TransientAiException e) {
            throw new EmbeddingProviderException(spec.getName(), parseStatusCode(e.getMessage()), e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw new EmbeddingProviderException(spec.getName(), e.getStatusCode().value(), e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new EmbeddingProviderException(spec.getName(), null, e.getMessage(), e);
        }

        if (response == null || CollUtil.isEmpty(response.getResults())
            || response.getResult().getOutput() == null || response.getResult().getOutput().length == 0) {
            throw new EmbeddingProviderException(spec.getName(), "嵌入模型返回空向量");
        }

        float[] vector = response.getResult().getOutput();
        if (spec.getDimensions() != null && vector.length != spec.getDimensions()) {
            throw new DimensionMismatchException(spec.getDimensions(), vector.length);
        }

        int tokenCount = extractTokenCount(response);
        log.debug("嵌入生成完成: provider={}, model={}, chars={}, tokens={}",
            spec.getName(), spec.getModel(), input.length(), tokenCount);

        return EmbeddingResultVO.builder()
            .vector(vector)
            .tokenCount(tokenCount)
            .dimensions(vector.length)
            .provider(spec.getName())
            .model(spec.getModel())
            .build();
    }

    @Override
    public EmbeddingResultVO embedItem(Long itemId, Long ownerId, String content, String providerId) {
        EmbeddingResultVO result = generate(content, providerId);
        embeddingStoreService.upsert(itemId, ownerId, result);
        return result;
    }

    @Override
    public int batchEmbedItems(List<EmbedItemDTO> items, String providerId, Integer batchSize) {
        if (CollUtil.isEmpty(items)) {
            return 0;
        }
        int waveSize = batchSize != null && batchSize > 0
            ? batchSize
            : duplicateDetectionConfig.getEmbedding().getBatchSize();

        log.info("批量嵌入开始: items={}, waveSize={}", items.size(), waveSize);
        int succeeded = 0;
        for (List<EmbedItemDTO> wave : CollUtil.split(items, waveSize)) {
            List<CompletableFuture<Boolean>> futures = new ArrayList<>();
            for (EmbedItemDTO item : wave) {
                futures.add(CompletableFuture.supplyAsync(() -> embedQuietly(item, providerId), taskExecutor));
            }
            // 等待整波完成再开始下一波
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<Boolean> future : futures) {
                if (Boolean.TRUE.equals(future.join())) {
                    succeeded++;
                }
            }
        }
        log.info("批量嵌入完成: total={}, succeeded={}", items.size(), succeeded);
        return succeeded;
    }

    @Override
    public DuplicateDetectionConfig.ProviderSpec getProviderSpec(String providerId) {
        String resolvedId = StrUtil.blankToDefault(providerId, duplicateDetectionConfig.getEmbedding().getDefaultProvider());
        DuplicateDetectionConfig.ProviderSpec spec = duplicateDetectionConfig.getEmbedding().getProviders().get(resolvedId);
        if (spec == null) {
            throw new EmbeddingProviderException(resolvedId, "不支持的嵌入提供方");
        }
        return spec;
    }

    private boolean embedQuietly(EmbedItemDTO item, String providerId) {
        try {
            embedItem(item.getItemId(), item.getOwnerId(), item.getContent(), providerId);
            return true;
        } catch (RuntimeException e) {
            log.error("条目嵌入失败: itemId={}, error={}", item.getItemId(), e.getMessage());
            return false;
        }
    }

    /**
     * 按约每 token 若干字符估算并截断
     */
    private String truncate(String text, Integer maxTokens) {
        if (maxTokens == null || maxTokens <= 0) {
            return text;
        }
        int maxChars = maxTokens * duplicateDetectionConfig.getEmbedding().getCharsPerToken();
        if (text.length() <= maxChars) {
            return text;
        }
        log.debug("嵌入文本超长, 截断: length={}, maxChars={}", text.length(), maxChars);
        return text.substring(0, maxChars) + TRUNCATION_SUFFIX;
    }

    private Integer parseStatusCode(String message) {
        if (StrUtil.isBlank(message)) {
            return null;
        }
        String status = ReUtil.getGroup1(STATUS_PREFIX_REGEX, message);
        return status == null ? null : Integer.valueOf(status);
    }

    private int extractTokenCount(EmbeddingResponse response) {
        if (response.getMetadata() == null) {
            return 0;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return 0;
        }
        Number total = usage.getTotalTokens();
        return total == null ? 0 : total.intValue();
    }
}
