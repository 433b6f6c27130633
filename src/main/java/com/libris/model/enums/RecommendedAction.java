package com.libris.model.enums;

/**
 * 导入审查的推荐操作
 *
 * @author libris
 */
public enum RecommendedAction {
    /**
     * 未发现重复, 直接导入
     */
    IMPORT,
    /**
     * 建议与已有条目合并
     */
    MERGE,
    /**
     * 完全相同, 跳过
     */
    SKIP,
    /**
     * 需要人工审查
     */
    REVIEW
}
