package com.libris.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 导入流水线中的暂存条目
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedItemDTO {

    private Long stagedItemId;

    private String name;

    private String content;
}
