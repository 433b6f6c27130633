package com.libris.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 文本语义检索结果
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "文本语义检索结果")
public class SemanticSearchResultVO {

    @Schema(description = "相似条目列表")
    private List<SimilarityResultVO> results;

    @Schema(description = "查询向量")
    private float[] queryEmbedding;

    @Schema(description = "耗时(毫秒)")
    private Long executionTimeMs;
}
