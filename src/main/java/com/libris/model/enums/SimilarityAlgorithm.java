package com.libris.model.enums;

/**
 * 向量相似度算法
 *
 * @author libris
 */
public enum SimilarityAlgorithm {
    COSINE,
    EUCLIDEAN,
    DOT_PRODUCT,
    MANHATTAN
}
