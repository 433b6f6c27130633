package com.libris.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.libris.model.entity.ItemEmbeddingDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 条目向量 Mapper
 *
 * @author libris
 * @since 2024-11-02
 */
@Mapper
public interface ItemEmbeddingMapper extends BaseMapper<ItemEmbeddingDO> {
}
