package com.libris.exception;

/**
 * 嵌入提供方调用失败
 *
 * @author libris
 */
public class EmbeddingProviderException extends SimilarityEngineException {

    /**
     * 提供方名称, 如 openai
     */
    private final String provider;

    /**
     * 下游 HTTP 状态码, 未知时为 null
     */
    private final Integer statusCode;

    public EmbeddingProviderException(String provider, String message) {
        this(provider, null, message, null);
    }

    public EmbeddingProviderException(String provider, Integer statusCode, String message, Throwable cause) {
        super("嵌入提供方[" + provider + "]调用失败" + (statusCode != null ? "(status=" + statusCode + ")" : "") + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
