package com.libris.service.impl;

import cn.hutool.core.collection.CollUtil;
import com.libris.config.DuplicateDetectionConfig;
import com.libris.model.dto.DuplicateDetectionDTO;
import com.libris.model.dto.StagedItemDTO;
import com.libris.model.enums.StagedItemStatus;
import com.libris.model.vo.DuplicateMatchVO;
import com.libris.model.vo.StagedItemReviewVO;
import com.libris.service.DuplicateDetectionService;
import com.libris.service.ImportReviewService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 导入审查服务实现
 *
 * @author libris
 */
@Slf4j
@Service
public class ImportReviewServiceImpl implements ImportReviewService {

    private final DuplicateDetectionService duplicateDetectionService;
    private final DuplicateDetectionConfig duplicateDetectionConfig;
    private final Executor taskExecutor;

    public ImportReviewServiceImpl(DuplicateDetectionService duplicateDetectionService,
                                   DuplicateDetectionConfig duplicateDetectionConfig,
                                   @Qualifier("dedupTaskExecutor") Executor taskExecutor) {
        this.duplicateDetectionService = duplicateDetectionService;
        this.duplicateDetectionConfig = duplicateDetectionConfig;
        this.taskExecutor = taskExecutor;
    }

    @Override
    public StagedItemReviewVO reviewStagedItem(Long ownerId, StagedItemDTO stagedItem, DuplicateDetectionDTO options) {
        List<DuplicateMatchVO> matches = duplicateDetectionService.checkForDuplicates(
            stagedItem.getContent(), stagedItem.getName(), ownerId, options);

        double highest = matches.stream()
            .mapToDouble(DuplicateMatchVO::getSimilarity)
            .max()
            .orElse(0.0);
        StagedItemStatus status = highest > duplicateDetectionConfig.getReview().getDuplicateCutoff()
            ? StagedItemStatus.DUPLICATE_DETECTED
            : StagedItemStatus.PENDING;

        log.debug("暂存条目审查: stagedItemId={}, highest={}, status={}",
            stagedItem.getStagedItemId(), highest, status.getValue());

        return StagedItemReviewVO.builder()
            .stagedItemId(stagedItem.getStagedItemId())
            .status(status)
            .highestSimilarity(highest)
            .matches(matches)
            .build();
    }

    @Override
    public List<StagedItemReviewVO> reviewStagedItems(Long ownerId, List<StagedItemDTO> stagedItems, DuplicateDetectionDTO options) {
        if (CollUtil.isEmpty(stagedItems)) {
            return new ArrayList<>();
        }
        int waveSize = Math.max(1, duplicateDetectionConfig.getReview().getWaveSize());
        log.info("批量导入审查开始: ownerId={}, items={}, waveSize={}", ownerId, stagedItems.size(), waveSize);

        List<StagedItemReviewVO> results = new ArrayList<>(stagedItems.size());
        for (List<StagedItemDTO> wave : CollUtil.split(stagedItems, waveSize)) {
            List<CompletableFuture<StagedItemReviewVO>> futures = new ArrayList<>();
            for (StagedItemDTO item : wave) {
                futures.add(CompletableFuture.supplyAsync(() -> reviewQuietly(ownerId, item, options), taskExecutor));
            }
            // 等待整波完成再开始下一波
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<StagedItemReviewVO> future : futures) {
                results.add(future.join());
            }
        }

        long duplicates = results.stream()
            .filter(r -> r.getStatus() == StagedItemStatus.DUPLICATE_DETECTED)
            .count();
        log.info("批量导入审查完成: ownerId={}, items={}, duplicates={}", ownerId, results.size(), duplicates);
        return results;
    }

    /**
     * 单条审查失败时保留为待审, 不影响同批其他条目
     */
    private StagedItemReviewVO reviewQuietly(Long ownerId, StagedItemDTO item, DuplicateDetectionDTO options) {
        try {
            return reviewStagedItem(ownerId, item, options);
        } catch (RuntimeException e) {
            log.warn("暂存条目审查失败, 保留为待审: stagedItemId={}, error={}", item.getStagedItemId(), e.getMessage());
            return StagedItemReviewVO.builder()
                .stagedItemId(item.getStagedItemId())
                .status(StagedItemStatus.PENDING)
                .highestSimilarity(0.0)
                .matches(new ArrayList<>())
                .build();
        }
    }
}
