package com.libris.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 语义检索历史实体
 * 每次文本检索记录一条, 供统计与导出使用
 *
 * @author libris
 * @since 2024-11-20
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("semantic_searches")
public class SemanticSearchDO {

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private Long userId;

    /**
     * 查询文本
     */
    private String query;

    /**
     * 查询向量（JSON 数组）
     */
    private String queryEmbedding;

    /**
     * 检索结果（JSON）
     */
    private String results;

    private Integer resultCount;

    /**
     * 相似度算法, 如 cosine
     */
    private String algorithm;

    private Double threshold;

    /**
     * 耗时（毫秒）
     */
    private Long executionTime;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;
}
