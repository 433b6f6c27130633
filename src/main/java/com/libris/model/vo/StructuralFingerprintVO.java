package com.libris.model.vo;

import com.libris.model.enums.StructuralElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * 文本结构指纹, 按需计算, 不持久化
 *
 * @author libris
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuralFingerprintVO {

    private Set<StructuralElement> elements;

    /**
     * 字符数
     */
    private Integer length;

    private Integer wordCount;

    private Integer lineCount;

    private Boolean hasCode;

    private Boolean hasLinks;

    private Boolean hasHeaders;
}
