package com.libris.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 内容条目实体类（文档、提示词、模板）
 * 
 * 由外部内容库维护, 重复检测只读
 *
 * @author libris
 * @since 2024-11-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("content_items")
public class ContentItemDO implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 条目ID
     */
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /**
     * 所属用户ID
     */
    private Long userId;

    /**
     * 条目名称
     */
    private String name;

    /**
     * 原始文本内容
     */
    private String content;

    /**
     * 归一化内容（小写、合并空白、去标点）, 用于精确匹配
     */
    private String normalizedContent;

    /**
     * 是否为规范条目
     */
    private Boolean isCanonical;

    /**
     * 非规范条目指向的规范条目ID
     */
    private Long canonicalId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;

    @TableLogic
    private Integer isDeleted;
}
