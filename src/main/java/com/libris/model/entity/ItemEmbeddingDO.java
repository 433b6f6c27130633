package com.libris.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 条目向量实体
 * 以 itemId 为主键, 每个条目只保留一条有效向量
 *
 * @author libris
 * @since 2024-11-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("item_embeddings")
public class ItemEmbeddingDO {

    /**
     * 条目ID
     */
    @TableId(type = IdType.INPUT)
    private Long itemId;

    /**
     * 所属用户ID（冗余, 便于按用户范围检索）
     */
    private Long userId;

    /**
     * 提供方名称
     */
    private String provider;

    /**
     * 模型名称
     */
    private String model;

    /**
     * 向量维度
     */
    private Integer dimensions;

    /**
     * 向量（JSON 数组）
     */
    private String embedding;

    /**
     * 消耗 token 数
     */
    private Integer tokenCount;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
