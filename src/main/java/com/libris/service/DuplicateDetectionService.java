package com.libris.service;

import com.libris.model.dto.DuplicateDetectionDTO;
import com.libris.model.vo.DuplicateMatchVO;
import com.libris.model.vo.DuplicateSummaryVO;

import java.util.List;

/**
 * 重复检测服务
 * 
 * 精确 → 结构 → 语义 三级级联, 精确命中时直接返回;
 * 任一阶段失败只会减少结果, 不会向调用方抛出异常
 *
 * @author libris
 */
public interface DuplicateDetectionService {

    /**
     * 检查内容是否与用户已有条目重复
     *
     * @param content 待导入内容
     * @param name    待导入条目名称
     * @param ownerId 用户ID
     * @param options 检测参数, 可为空
     * @return 按相似度降序的匹配列表, existingItemId 不重复
     */
    List<DuplicateMatchVO> checkForDuplicates(String content, String name, Long ownerId, DuplicateDetectionDTO options);

    /**
     * 生成重复检测摘要及推荐操作
     *
     * @param content 待导入内容
     * @param name    待导入条目名称
     * @param ownerId 用户ID
     * @param options 检测参数, 可为空
     * @return 摘要
     */
    DuplicateSummaryVO getDuplicateSummary(String content, String name, Long ownerId, DuplicateDetectionDTO options);
}
