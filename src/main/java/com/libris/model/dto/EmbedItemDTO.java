package com.libris.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 批量嵌入的单个条目
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedItemDTO {

    private Long itemId;

    private Long ownerId;

    private String content;
}
