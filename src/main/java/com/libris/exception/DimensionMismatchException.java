package com.libris.exception;

/**
 * 两个向量维度不一致时抛出, 只影响当次比较
 *
 * @author libris
 */
public class DimensionMismatchException extends SimilarityEngineException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("向量维度不匹配: expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
