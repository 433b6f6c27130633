package com.libris.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已有条目引用
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemRefVO {

    private Long id;

    /**
     * 原始内容, 仅结构检测需要
     */
    private String content;

    private Boolean isCanonical;

    private Long canonicalId;

    /**
     * 解析规范条目ID: 自身是规范条目则返回自身, 否则返回记录的 canonicalId, 都没有时回退到自身
     */
    public Long resolveCanonicalId() {
        if (Boolean.TRUE.equals(isCanonical)) {
            return id;
        }
        return canonicalId != null ? canonicalId : id;
    }
}
