package com.libris.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重复检测参数
 * 为 null 的字段使用 libris.detection.* 的默认值
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateDetectionDTO {

    /**
     * 相似度阈值（0-1）
     */
    private Double threshold;

    private Boolean enableExact;

    private Boolean enableStructural;

    private Boolean enableSemantic;

    /**
     * 最多返回的候选数量
     */
    private Integer maxCandidates;

    /**
     * 结构检测候选池扩展因子
     */
    private Integer candidatePoolFactor;
}
