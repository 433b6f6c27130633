package com.libris.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libris.config.DuplicateDetectionConfig;
import com.libris.exception.DimensionMismatchException;
import com.libris.mapper.SemanticSearchMapper;
import com.libris.model.dto.SemanticSearchDTO;
import com.libris.model.entity.SemanticSearchDO;
import com.libris.model.enums.SimilarityAlgorithm;
import com.libris.model.vo.EmbeddingResultVO;
import com.libris.model.vo.EmbeddingVectorVO;
import com.libris.model.vo.SemanticSearchResultVO;
import com.libris.model.vo.SimilarityResultVO;
import com.libris.service.EmbeddingService;
import com.libris.service.EmbeddingStoreService;
import com.libris.service.SemanticSearchService;
import com.libris.utils.VectorMathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 语义检索服务实现
 * 
 * 流程：
 * 1. 读取用户范围内的候选向量（排除 excludeIds）
 * 2. 计算与查询向量的余弦相似度
 * 3. 过滤低于阈值的结果
 * 4. 按相似度降序排序, 相同时按条目ID升序
 * 5. 截取前 limit 个
 *
 * 文本检索会写入 semantic_searches 历史, 写入失败只记录日志
 *
 * 维度不一致的候选向量单独跳过, 存储异常直接向上抛出
 *
 * @author libris
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticSearchServiceImpl implements SemanticSearchService {

    /**
     * 相似度降序, 条目ID升序
     */
    public static final Comparator<SimilarityResultVO> BY_SIMILARITY_DESC = Comparator
        .comparing(SimilarityResultVO::getSimilarity, Comparator.reverseOrder())
        .thenComparing(SimilarityResultVO::getItemId);

    private final EmbeddingStoreService embeddingStoreService;
    private final EmbeddingService embeddingService;
    private final DuplicateDetectionConfig duplicateDetectionConfig;
    private final SemanticSearchMapper semanticSearchMapper;
    private final ObjectMapper objectMapper;

    @Override
    public List<SimilarityResultVO> rank(float[] queryVector, Long ownerId, SemanticSearchDTO options) {
        int limit = resolveLimit(options);
        double threshold = resolveThreshold(options);
        Collection<Long> excludeIds = options != null && options.getExcludeIds() != null
            ? options.getExcludeIds()
            : Collections.emptyList();

        List<EmbeddingVectorVO> candidates = embeddingStoreService.queryByOwner(ownerId, excludeIds);
        Set<Long> excluded = new HashSet<>(excludeIds);

        List<SimilarityResultVO> results = new ArrayList<>();
        for (EmbeddingVectorVO candidate : candidates) {
            // 存储层已排除, 这里再兜底一次
            if (excluded.contains(candidate.getItemId())) {
                continue;
            }
            double similarity;
            try {
                similarity = VectorMathUtils.cosine(queryVector, candidate.getVector());
            } catch (DimensionMismatchException e) {
                // 其他提供方/模型生成的向量, 只跳过该条目
                log.warn("向量维度不一致, 跳过该条目: itemId={}, expected={}, actual={}",
                    candidate.getItemId(), e.getExpected(), e.getActual());
                continue;
            }
            if (similarity >= threshold) {
                results.add(SimilarityResultVO.builder()
                    .itemId(candidate.getItemId())
                    .similarity(similarity)
                    .build());
            }
        }

        List<SimilarityResultVO> ranked = results.stream()
            .sorted(BY_SIMILARITY_DESC)
            .limit(limit)
            .collect(Collectors.toList());

        log.debug("语义排序完成: ownerId={}, candidates={}, aboveThreshold={}, returned={}",
            ownerId, candidates.size(), results.size(), ranked.size());
        return ranked;
    }

    @Override
    public SemanticSearchResultVO search(String queryText, Long ownerId, SemanticSearchDTO options) {
        long startTime = System.currentTimeMillis();

        EmbeddingResultVO queryEmbedding = embeddingService.generate(queryText,
            options != null ? options.getProviderId() : null);
        List<SimilarityResultVO> results = rank(queryEmbedding.getVector(), ownerId, options);

        long executionTime = System.currentTimeMillis() - startTime;
        log.info("语义检索完成: ownerId={}, results={}, time={}ms", ownerId, results.size(), executionTime);

        recordSearch(ownerId, queryText, queryEmbedding.getVector(), results, resolveThreshold(options), executionTime);

        return SemanticSearchResultVO.builder()
            .results(results)
            .queryEmbedding(queryEmbedding.getVector())
            .executionTimeMs(executionTime)
            .build();
    }

    @Override
    public List<SimilarityResultVO> findSimilarToItem(Long itemId, Long ownerId, SemanticSearchDTO options) {
        float[] vector = embeddingStoreService.get(itemId);
        if (vector == null) {
            log.info("条目尚无向量, 无法查找相似条目: itemId={}", itemId);
            return new ArrayList<>();
        }

        Set<Long> excludeIds = new HashSet<>();
        excludeIds.add(itemId);
        if (options != null && options.getExcludeIds() != null) {
            excludeIds.addAll(options.getExcludeIds());
        }

        SemanticSearchDTO request = SemanticSearchDTO.builder()
            .limit(options != null ? options.getLimit() : null)
            .threshold(options != null ? options.getThreshold() : null)
            .excludeIds(excludeIds)
            .build();
        return rank(vector, ownerId, request);
    }

    /**
     * 保存检索历史
     */
    private void recordSearch(Long ownerId, String queryText, float[] queryVector, List<SimilarityResultVO> results,
                              double threshold, long executionTime) {
        try {
            semanticSearchMapper.insert(SemanticSearchDO.builder()
                .userId(ownerId)
                .query(queryText)
                .queryEmbedding(objectMapper.writeValueAsString(queryVector))
                .results(objectMapper.writeValueAsString(results))
                .resultCount(results.size())
                .algorithm(SimilarityAlgorithm.COSINE.name().toLowerCase(Locale.ROOT))
                .threshold(threshold)
                .executionTime(executionTime)
                .build());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("保存语义检索历史失败: ownerId={}, error={}", ownerId, e.getMessage());
        }
    }

    private int resolveLimit(SemanticSearchDTO options) {
        if (options != null && options.getLimit() != null) {
            return Math.max(0, options.getLimit());
        }
        return duplicateDetectionConfig.getSearch().getDefaultLimit();
    }

    private double resolveThreshold(SemanticSearchDTO options) {
        if (options != null && options.getThreshold() != null) {
            return options.getThreshold();
        }
        return duplicateDetectionConfig.getSearch().getDefaultThreshold();
    }
}
