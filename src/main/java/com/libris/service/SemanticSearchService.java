package com.libris.service;

import com.libris.model.dto.SemanticSearchDTO;
import com.libris.model.vo.SemanticSearchResultVO;
import com.libris.model.vo.SimilarityResultVO;

import java.util.List;

/**
 * 语义检索服务
 * 统一使用余弦相似度, 结果按相似度降序、条目ID升序排列
 *
 * @author libris
 */
public interface SemanticSearchService {

    /**
     * 对用户范围内的向量按与查询向量的相似度排序
     *
     * @param queryVector 查询向量
     * @param ownerId     用户ID
     * @param options     检索参数, 可为空
     * @return 相似条目
     */
    List<SimilarityResultVO> rank(float[] queryVector, Long ownerId, SemanticSearchDTO options);

    /**
     * 文本语义检索: 先生成查询向量再排序
     *
     * @param queryText 查询文本
     * @param ownerId   用户ID
     * @param options   检索参数, 可为空
     * @return 检索结果（含查询向量与耗时）
     */
    SemanticSearchResultVO search(String queryText, Long ownerId, SemanticSearchDTO options);

    /**
     * 查找与已有条目相似的条目（排除自身）
     *
     * @param itemId  条目ID
     * @param ownerId 用户ID
     * @param options 检索参数, 可为空
     * @return 相似条目, 条目尚无向量时为空
     */
    List<SimilarityResultVO> findSimilarToItem(Long itemId, Long ownerId, SemanticSearchDTO options);
}
