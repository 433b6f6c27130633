package com.libris.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 用户向量统计
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "用户向量统计")
public class EmbeddingStatsVO {

    @Schema(description = "向量总数")
    private Integer totalEmbeddings;

    @Schema(description = "按提供方统计")
    private Map<String, Integer> byProvider;

    @Schema(description = "平均维度")
    private Double averageDimensions;

    @Schema(description = "总 token 数")
    private Long totalTokens;
}
