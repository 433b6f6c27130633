package com.libris.model.enums;

/**
 * 结构指纹中的结构元素标签
 *
 * @author libris
 */
public enum StructuralElement {
    NUMBERED_LIST,
    BULLET_LIST,
    HEADERS,
    VARIABLES,
    CODE_BLOCKS,
    LINKS,
    TABLES,
    QUOTES
}
