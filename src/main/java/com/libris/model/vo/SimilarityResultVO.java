package com.libris.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 语义相似结果
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "语义相似结果")
public class SimilarityResultVO {

    @Schema(description = "条目ID")
    private Long itemId;

    @Schema(description = "相似度（越大越相似）")
    private Double similarity;

    @Schema(description = "距离（可选）")
    private Double distance;
}
