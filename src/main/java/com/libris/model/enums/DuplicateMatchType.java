package com.libris.model.enums;

/**
 * 重复匹配类型（对应级联的三个阶段）
 *
 * @author libris
 */
public enum DuplicateMatchType {
    EXACT,
    STRUCTURAL,
    SEMANTIC
}
