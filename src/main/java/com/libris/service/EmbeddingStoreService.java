package com.libris.service;

import com.libris.model.vo.EmbeddingResultVO;
import com.libris.model.vo.EmbeddingStatsVO;
import com.libris.model.vo.EmbeddingVectorVO;

import java.util.Collection;
import java.util.List;

/**
 * 向量存储服务
 * 每个条目只保留一条有效向量, 重新生成时覆盖旧向量
 *
 * @author libris
 */
public interface EmbeddingStoreService {

    /**
     * 写入或覆盖条目向量
     *
     * @param itemId  条目ID
     * @param ownerId 所属用户ID
     * @param result  嵌入生成结果
     */
    void upsert(Long itemId, Long ownerId, EmbeddingResultVO result);

    /**
     * 获取条目向量
     *
     * @param itemId 条目ID
     * @return 向量, 不存在时返回 null
     */
    float[] get(Long itemId);

    /**
     * 获取条目向量及元数据
     *
     * @param itemId 条目ID
     * @return 向量记录, 不存在时返回 null
     */
    EmbeddingVectorVO getVector(Long itemId);

    /**
     * 查询用户范围内的全部向量
     *
     * @param ownerId    用户ID
     * @param excludeIds 排除的条目ID, 可为空
     * @return 向量列表
     */
    List<EmbeddingVectorVO> queryByOwner(Long ownerId, Collection<Long> excludeIds);

    /**
     * 删除条目向量, 不存在时不报错
     *
     * @param itemId 条目ID
     */
    void delete(Long itemId);

    /**
     * 用户向量统计
     *
     * @param ownerId 用户ID
     * @return 统计信息
     */
    EmbeddingStatsVO getStats(Long ownerId);
}
