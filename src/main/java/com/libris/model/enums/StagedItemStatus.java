package com.libris.model.enums;

/**
 * 暂存条目审查状态
 *
 * @author libris
 */
public enum StagedItemStatus {
    PENDING("pending"),
    DUPLICATE_DETECTED("duplicate_detected");

    private final String value;

    StagedItemStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
