package com.libris.service.impl;

import cn.hutool.core.lang.Assert;
import com.libris.config.DuplicateDetectionConfig;
import com.libris.model.dto.DuplicateDetectionDTO;
import com.libris.model.dto.SemanticSearchDTO;
import com.libris.model.enums.DuplicateMatchType;
import com.libris.model.enums.RecommendedAction;
import com.libris.model.vo.*;
import com.libris.service.ContentLibraryService;
import com.libris.service.DuplicateDetectionService;
import com.libris.service.EmbeddingService;
import com.libris.service.SemanticSearchService;
import com.libris.utils.ContentNormalizeUtils;
import com.libris.utils.StructuralFingerprintUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 重复检测服务实现 - 三级级联策略
 * 
 * 检测顺序（按成本从低到高）：
 * 1. 精确匹配（归一化内容相等）- 命中即返回, 跳过后两级, 省去嵌入调用
 * 2. 结构相似度（结构指纹加权）- 从用户条目中超量取候选再过滤
 * 3. 语义相似度（嵌入 + 余弦）- 排除结构阶段已命中的条目
 * 
 * 结构与语义结果合并: 同一条目保留相似度更高的一条,
 * 按相似度降序（相同时按条目ID升序）截取前 maxCandidates 个
 *
 * @author libris
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateDetectionServiceImpl implements DuplicateDetectionService {

    private static final Comparator<DuplicateMatchVO> BY_SIMILARITY_DESC = Comparator
        .comparing(DuplicateMatchVO::getSimilarity, Comparator.reverseOrder())
        .thenComparing(DuplicateMatchVO::getExistingItemId);

    private final ContentLibraryService contentLibraryService;
    private final EmbeddingService embeddingService;
    private final SemanticSearchService semanticSearchService;
    private final DuplicateDetectionConfig duplicateDetectionConfig;

    @Override
    public List<DuplicateMatchVO> checkForDuplicates(String content, String name, Long ownerId, DuplicateDetectionDTO options) {
        Assert.notNull(ownerId, "用户ID不能为空");
        DuplicateDetectionDTO config = resolveOptions(options);
        String text = content == null ? "" : content;

        log.info("重复检测开始: ownerId={}, name={}, threshold={}, maxCandidates={}",
            ownerId, name, config.getThreshold(), config.getMaxCandidates());

        // 阶段1: 精确匹配
        if (config.getEnableExact()) {
            List<DuplicateMatchVO> exactMatches = findExactDuplicates(text, ownerId, config.getMaxCandidates());
            if (!exactMatches.isEmpty()) {
                log.info("精确匹配命中, 跳过结构与语义检测: ownerId={}, matches={}", ownerId, exactMatches.size());
                return exactMatches;
            }
        }

        List<DuplicateMatchVO> matches = new ArrayList<>();

        // 阶段2: 结构相似度
        if (config.getEnableStructural()) {
            matches.addAll(findStructuralDuplicates(text, ownerId, config));
        }

        // 阶段3: 语义相似度, 排除已命中的条目
        if (config.getEnableSemantic()) {
            Set<Long> excludeIds = matches.stream()
                .map(DuplicateMatchVO::getExistingItemId)
                .collect(Collectors.toSet());
            matches.addAll(findSemanticDuplicates(text, ownerId, config, excludeIds));
        }

        List<DuplicateMatchVO> fused = fuse(matches, config.getMaxCandidates());
        log.info("重复检测完成: ownerId={}, rawMatches={}, returned={}", ownerId, matches.size(), fused.size());
        return fused;
    }

    @Override
    public DuplicateSummaryVO getDuplicateSummary(String content, String name, Long ownerId, DuplicateDetectionDTO options) {
        List<DuplicateMatchVO> matches = checkForDuplicates(content, name, ownerId, options);
        if (matches.isEmpty()) {
            return DuplicateSummaryVO.builder()
                .hasDuplicates(false)
                .duplicateCount(0)
                .highestSimilarity(0.0)
                .recommendedAction(RecommendedAction.IMPORT)
                .matches(matches)
                .build();
        }

        DuplicateMatchVO best = matches.get(0);
        RecommendedAction action;
        if (best.getMatchType() == DuplicateMatchType.EXACT) {
            action = RecommendedAction.SKIP;
        } else if (Boolean.TRUE.equals(best.getShouldMerge())) {
            action = RecommendedAction.MERGE;
        } else {
            action = RecommendedAction.REVIEW;
        }

        return DuplicateSummaryVO.builder()
            .hasDuplicates(true)
            .duplicateCount(matches.size())
            .highestSimilarity(best.getSimilarity())
            .recommendedAction(action)
            .matches(matches)
            .build();
    }

    /**
     * 阶段1: 归一化内容完全一致
     */
    private List<DuplicateMatchVO> findExactDuplicates(String content, Long ownerId, int maxCandidates) {
        try {
            String normalized = ContentNormalizeUtils.normalize(content);
            List<ItemRefVO> items = contentLibraryService.findExactContentMatches(ownerId, normalized);

            Map<Long, ItemRefVO> unique = new TreeMap<>();
            for (ItemRefVO item : items) {
                unique.putIfAbsent(item.getId(), item);
            }

            return unique.values().stream()
                .limit(maxCandidates)
                .map(item -> DuplicateMatchVO.builder()
                    .existingItemId(item.getId())
                    .similarity(1.0)
                    .matchType(DuplicateMatchType.EXACT)
                    .confidence(1.0)
                    .shouldMerge(true)
                    .canonicalId(item.resolveCanonicalId())
                    .build())
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.warn("精确匹配检测失败, 继续后续阶段: ownerId={}, error={}", ownerId, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * 阶段2: 结构指纹相似度
     */
    private List<DuplicateMatchVO> findStructuralDuplicates(String content, Long ownerId, DuplicateDetectionDTO config) {
        try {
            int poolSize = config.getMaxCandidates() * config.getCandidatePoolFactor();
            List<ItemRefVO> candidates = contentLibraryService.listOwnerItems(ownerId, poolSize);
            StructuralFingerprintVO fingerprint = StructuralFingerprintUtils.extract(content);
            DuplicateDetectionConfig.DetectionConfig defaults = duplicateDetectionConfig.getDetection();

            List<DuplicateMatchVO> matches = new ArrayList<>();
            for (ItemRefVO candidate : candidates) {
                double similarity = StructuralFingerprintUtils.similarity(fingerprint,
                    StructuralFingerprintUtils.extract(candidate.getContent()));
                if (similarity >= config.getThreshold()) {
                    matches.add(DuplicateMatchVO.builder()
                        .existingItemId(candidate.getId())
                        .similarity(similarity)
                        .matchType(DuplicateMatchType.STRUCTURAL)
                        .confidence(defaults.getStructuralConfidence())
                        .shouldMerge(similarity > defaults.getMergeThreshold())
                        .canonicalId(candidate.resolveCanonicalId())
                        .build());
                }
            }

            List<DuplicateMatchVO> result = matches.stream()
                .sorted(BY_SIMILARITY_DESC)
                .limit(config.getMaxCandidates())
                .collect(Collectors.toList());
            log.info("结构检测: ownerId={}, pool={}, matches={}", ownerId, candidates.size(), result.size());
            return result;
        } catch (RuntimeException e) {
            log.warn("结构检测失败, 该阶段无结果: ownerId={}, error={}", ownerId, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * 阶段3: 嵌入语义相似度
     */
    private List<DuplicateMatchVO> findSemanticDuplicates(String content, Long ownerId, DuplicateDetectionDTO config,
                                                          Set<Long> excludeIds) {
        try {
            EmbeddingResultVO embedding = embeddingService.generate(content);
            DuplicateDetectionConfig.DetectionConfig defaults = duplicateDetectionConfig.getDetection();

            List<SimilarityResultVO> similarities = semanticSearchService.rank(embedding.getVector(), ownerId,
                SemanticSearchDTO.builder()
                    .limit(config.getMaxCandidates() * defaults.getSemanticOverfetchFactor())
                    .threshold(config.getThreshold())
                    .excludeIds(excludeIds)
                    .build());
            if (similarities.isEmpty()) {
                return new ArrayList<>();
            }

            // 条目可能已被删除, 只保留仍存在的
            List<Long> itemIds = similarities.stream()
                .map(SimilarityResultVO::getItemId)
                .collect(Collectors.toList());
            Map<Long, ItemRefVO> itemLookup = contentLibraryService.findByIds(ownerId, itemIds).stream()
                .collect(Collectors.toMap(ItemRefVO::getId, Function.identity(), (a, b) -> a));

            List<DuplicateMatchVO> result = similarities.stream()
                .filter(sim -> itemLookup.containsKey(sim.getItemId()))
                .map(sim -> DuplicateMatchVO.builder()
                    .existingItemId(sim.getItemId())
                    .similarity(sim.getSimilarity())
                    .matchType(DuplicateMatchType.SEMANTIC)
                    .confidence(defaults.getSemanticConfidence())
                    .shouldMerge(sim.getSimilarity() > defaults.getMergeThreshold())
                    .canonicalId(itemLookup.get(sim.getItemId()).resolveCanonicalId())
                    .build())
                .limit(config.getMaxCandidates())
                .collect(Collectors.toList());
            log.info("语义检测: ownerId={}, ranked={}, matches={}", ownerId, similarities.size(), result.size());
            return result;
        } catch (RuntimeException e) {
            log.warn("语义检测失败, 该阶段无结果: ownerId={}, error={}", ownerId, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * 合并多阶段结果: 同一条目保留相似度最高的一条, 排序后截断
     */
    private List<DuplicateMatchVO> fuse(List<DuplicateMatchVO> matches, int maxCandidates) {
        Map<Long, DuplicateMatchVO> best = new LinkedHashMap<>();
        for (DuplicateMatchVO match : matches) {
            best.merge(match.getExistingItemId(), match,
                (existing, incoming) -> incoming.getSimilarity() > existing.getSimilarity() ? incoming : existing);
        }
        return best.values().stream()
            .sorted(BY_SIMILARITY_DESC)
            .limit(maxCandidates)
            .collect(Collectors.toList());
    }

    /**
     * 合并调用参数与 libris.detection.* 默认值
     */
    private DuplicateDetectionDTO resolveOptions(DuplicateDetectionDTO options) {
        DuplicateDetectionConfig.DetectionConfig defaults = duplicateDetectionConfig.getDetection();
        DuplicateDetectionDTO given = options != null ? options : new DuplicateDetectionDTO();

        DuplicateDetectionDTO resolved = DuplicateDetectionDTO.builder()
            .threshold(Optional.ofNullable(given.getThreshold()).orElse(defaults.getThreshold()))
            .enableExact(Optional.ofNullable(given.getEnableExact()).orElse(defaults.getEnableExact()))
            .enableStructural(Optional.ofNullable(given.getEnableStructural()).orElse(defaults.getEnableStructural()))
            .enableSemantic(Optional.ofNullable(given.getEnableSemantic()).orElse(defaults.getEnableSemantic()))
            .maxCandidates(Optional.ofNullable(given.getMaxCandidates()).orElse(defaults.getMaxCandidates()))
            .candidatePoolFactor(Optional.ofNullable(given.getCandidatePoolFactor()).orElse(defaults.getCandidatePoolFactor()))
            .build();

        Assert.isTrue(resolved.getThreshold() >= 0.0 && resolved.getThreshold() <= 1.0,
            "相似度阈值必须在 0-1 之间: {}", resolved.getThreshold());
        Assert.isTrue(resolved.getMaxCandidates() >= 1, "maxCandidates 必须大于 0: {}", resolved.getMaxCandidates());
        Assert.isTrue(resolved.getCandidatePoolFactor() >= 1, "candidatePoolFactor 必须大于 0: {}",
            resolved.getCandidatePoolFactor());
        return resolved;
    }
}
