package com.libris.model.vo;

import com.libris.model.enums.RecommendedAction;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 重复检测摘要（导入审查使用）
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "重复检测摘要")
public class DuplicateSummaryVO {

    @Schema(description = "是否存在重复")
    private Boolean hasDuplicates;

    @Schema(description = "重复数量")
    private Integer duplicateCount;

    @Schema(description = "最高相似度")
    private Double highestSimilarity;

    @Schema(description = "推荐操作")
    private RecommendedAction recommendedAction;

    @Schema(description = "匹配列表")
    private List<DuplicateMatchVO> matches;
}
