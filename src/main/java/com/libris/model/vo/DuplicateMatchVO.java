package com.libris.model.vo;

import com.libris.model.enums.DuplicateMatchType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重复匹配
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "重复匹配")
public class DuplicateMatchVO {

    @Schema(description = "已有条目ID")
    private Long existingItemId;

    @Schema(description = "相似度")
    private Double similarity;

    @Schema(description = "匹配类型")
    private DuplicateMatchType matchType;

    @Schema(description = "置信度")
    private Double confidence;

    @Schema(description = "是否建议合并")
    private Boolean shouldMerge;

    @Schema(description = "规范条目ID")
    private Long canonicalId;
}
