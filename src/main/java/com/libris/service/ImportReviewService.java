package com.libris.service;

import com.libris.model.dto.DuplicateDetectionDTO;
import com.libris.model.dto.StagedItemDTO;
import com.libris.model.vo.StagedItemReviewVO;

import java.util.List;

/**
 * 导入审查服务
 * 对暂存条目逐个做重复检测, 最高相似度超过阈值时标记为 duplicate_detected
 *
 * @author libris
 */
public interface ImportReviewService {

    /**
     * 审查单个暂存条目
     *
     * @param ownerId    用户ID
     * @param stagedItem 暂存条目
     * @param options    检测参数, 可为空
     * @return 审查结果
     */
    StagedItemReviewVO reviewStagedItem(Long ownerId, StagedItemDTO stagedItem, DuplicateDetectionDTO options);

    /**
     * 分波审查一批暂存条目, 每波完成后再开始下一波, 以限制对嵌入服务的并发压力
     *
     * @param ownerId     用户ID
     * @param stagedItems 暂存条目
     * @param options     检测参数, 可为空
     * @return 审查结果, 顺序与输入一致
     */
    List<StagedItemReviewVO> reviewStagedItems(Long ownerId, List<StagedItemDTO> stagedItems, DuplicateDetectionDTO options);
}
