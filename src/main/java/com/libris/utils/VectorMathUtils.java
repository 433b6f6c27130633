package com.libris.utils;

import com.libris.exception.DimensionMismatchException;
import com.libris.model.enums.SimilarityAlgorithm;

/**
 * 向量相似度计算工具类
 *
 * 功能：
 * - 余弦相似度（语义检索统一使用）
 * - 欧氏距离相似度 1 / (1 + d)
 * - 点积（未归一化）
 * - 曼哈顿距离相似度 1 / (1 + Σ|aᵢ − bᵢ|)
 *
 * 所有函数满足对称性 f(a, b) == f(b, a), 维度不一致时抛出 {@link DimensionMismatchException}
 *
 * @author libris
 */
public final class VectorMathUtils {

    private VectorMathUtils() {
    }

    /**
     * 按算法计算相似度
     *
     * @param a         向量A
     * @param b         向量B
     * @param algorithm 相似度算法
     * @return 相似度
     */
    public static double similarity(float[] a, float[] b, SimilarityAlgorithm algorithm) {
        switch (algorithm) {
            case COSINE:
                return cosine(a, b);
            case EUCLIDEAN:
                return euclideanSimilarity(a, b);
            case DOT_PRODUCT:
                return dotProduct(a, b);
            case MANHATTAN:
                return manhattanSimilarity(a, b);
            default:
                throw new IllegalArgumentException("不支持的相似度算法: " + algorithm);
        }
    }

    /**
     * 余弦相似度
     * 任一向量模长为 0 时返回 0（不视为错误）
     */
    public static double cosine(float[] a, float[] b) {
        checkDimensions(a, b);

        double dot = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            norm1 += (double) a[i] * a[i];
            norm2 += (double) b[i] * b[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }

        double cosine = dot / Math.sqrt(norm1 * norm2);
        // 浮点误差可能略微越界
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    /**
     * 欧氏距离相似度, 取值 (0, 1]
     */
    public static double euclideanSimilarity(float[] a, float[] b) {
        return 1.0 / (1.0 + euclideanDistance(a, b));
    }

    public static double euclideanDistance(float[] a, float[] b) {
        checkDimensions(a, b);

        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * 点积, 由调用方自行解释量纲
     */
    public static double dotProduct(float[] a, float[] b) {
        checkDimensions(a, b);

        double product = 0.0;
        for (int i = 0; i < a.length; i++) {
            product += (double) a[i] * b[i];
        }
        return product;
    }

    /**
     * 曼哈顿距离相似度, 取值 (0, 1]
     */
    public static double manhattanSimilarity(float[] a, float[] b) {
        return 1.0 / (1.0 + manhattanDistance(a, b));
    }

    public static double manhattanDistance(float[] a, float[] b) {
        checkDimensions(a, b);

        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs((double) a[i] - b[i]);
        }
        return sum;
    }

    private static void checkDimensions(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("向量不能为空");
        }
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
    }
}
