package com.libris.exception;

/**
 * 相似度引擎异常基类
 * 
 * 向量计算、嵌入生成、向量存储的异常都继承自该类,
 * 便于在级联检测边界统一捕获
 *
 * @author libris
 */
public class SimilarityEngineException extends RuntimeException {

    public SimilarityEngineException(String message) {
        super(message);
    }

    public SimilarityEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
