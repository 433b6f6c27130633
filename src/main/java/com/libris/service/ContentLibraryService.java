package com.libris.service;

import com.libris.model.vo.ItemRefVO;

import java.util.Collection;
import java.util.List;

/**
 * 内容库读取服务（重复检测只读访问已有条目）
 *
 * @author libris
 */
public interface ContentLibraryService {

    /**
     * 查找归一化内容完全一致的条目
     *
     * @param ownerId           用户ID
     * @param normalizedContent 归一化后的内容
     * @return 命中的条目引用
     */
    List<ItemRefVO> findExactContentMatches(Long ownerId, String normalizedContent);

    /**
     * 列出用户的条目（含内容）, 最多 limit 条
     *
     * @param ownerId 用户ID
     * @param limit   数量上限
     * @return 条目引用
     */
    List<ItemRefVO> listOwnerItems(Long ownerId, int limit);

    /**
     * 按ID批量查询用户的条目, 不属于该用户或已删除的条目不返回
     *
     * @param ownerId 用户ID
     * @param ids     条目ID
     * @return 条目引用（不含内容）
     */
    List<ItemRefVO> findByIds(Long ownerId, Collection<Long> ids);
}
