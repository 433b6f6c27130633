package com.libris.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

/**
 * 语义检索参数
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticSearchDTO {

    /**
     * 返回数量上限, 为空时使用 libris.search.default-limit
     */
    private Integer limit;

    /**
     * 最低相似度, 为空时使用 libris.search.default-threshold
     */
    private Double threshold;

    /**
     * 排除的条目ID
     */
    private Collection<Long> excludeIds;

    /**
     * 嵌入提供方（仅文本检索使用）
     */
    private String providerId;
}
