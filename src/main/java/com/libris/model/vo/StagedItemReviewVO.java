package com.libris.model.vo;

import com.libris.model.enums.StagedItemStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 暂存条目审查结果
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "暂存条目审查结果")
public class StagedItemReviewVO {

    @Schema(description = "暂存条目ID")
    private Long stagedItemId;

    @Schema(description = "审查状态")
    private StagedItemStatus status;

    @Schema(description = "最高相似度")
    private Double highestSimilarity;

    @Schema(description = "匹配列表")
    private List<DuplicateMatchVO> matches;
}
