package com.libris.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 嵌入生成结果
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "嵌入生成结果")
public class EmbeddingResultVO {

    @Schema(description = "向量")
    private float[] vector;

    @Schema(description = "消耗 token 数")
    private Integer tokenCount;

    @Schema(description = "向量维度")
    private Integer dimensions;

    @Schema(description = "提供方名称")
    private String provider;

    @Schema(description = "模型名称")
    private String model;
}
