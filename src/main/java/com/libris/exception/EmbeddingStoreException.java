package com.libris.exception;

/**
 * 向量或内容条目读写失败
 *
 * @author libris
 */
public class EmbeddingStoreException extends SimilarityEngineException {

    public EmbeddingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
