package com.libris.service;

import com.libris.config.DuplicateDetectionConfig;
import com.libris.model.dto.EmbedItemDTO;
import com.libris.model.vo.EmbeddingResultVO;

import java.util.List;

/**
 * 嵌入生成服务
 * 
 * 不做重试, 失败统一抛出 {@link com.libris.exception.EmbeddingProviderException}
 *
 * @author libris
 */
public interface EmbeddingService {

    /**
     * 使用默认提供方生成嵌入
     *
     * @param text 文本
     * @return 嵌入结果
     */
    EmbeddingResultVO generate(String text);

    /**
     * 生成嵌入, 超出模型 token 上限的文本会先截断
     *
     * @param text       文本
     * @param providerId 提供方ID（libris.embedding.providers 的 key）, 为空时使用默认提供方
     * @return 嵌入结果
     */
    EmbeddingResultVO generate(String text, String providerId);

    /**
     * 生成并保存条目向量
     *
     * @param itemId     条目ID
     * @param ownerId    所属用户ID
     * @param content    条目内容
     * @param providerId 提供方ID, 可为空
     * @return 嵌入结果
     */
    EmbeddingResultVO embedItem(Long itemId, Long ownerId, String content, String providerId);

    /**
     * 分波批量生成并保存向量, 每波并发执行并等待完成后再开始下一波
     * 单个条目失败只记录日志, 不影响其他条目
     *
     * @param items      条目列表
     * @param providerId 提供方ID, 可为空
     * @param batchSize  每波数量, 为空时使用 libris.embedding.batch-size
     * @return 成功数量
     */
    int batchEmbedItems(List<EmbedItemDTO> items, String providerId, Integer batchSize);

    /**
     * 获取提供方规格
     *
     * @param providerId 提供方ID, 为空时使用默认提供方
     * @return 规格
     */
    DuplicateDetectionConfig.ProviderSpec getProviderSpec(String providerId);
}
