package com.libris.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 条目向量
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "条目向量")
public class EmbeddingVectorVO {

    @Schema(description = "条目ID")
    private Long itemId;

    @Schema(description = "所属用户ID")
    private Long ownerId;

    @Schema(description = "提供方名称")
    private String provider;

    @Schema(description = "模型名称")
    private String model;

    @Schema(description = "向量维度")
    private Integer dimensions;

    @Schema(description = "向量")
    private float[] vector;

    @Schema(description = "消耗 token 数")
    private Integer tokenCount;

    @Schema(description = "更新时间")
    private LocalDateTime updatedAt;
}
