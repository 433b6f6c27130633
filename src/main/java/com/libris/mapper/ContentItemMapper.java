package com.libris.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.libris.model.entity.ContentItemDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 内容条目 Mapper
 *
 * @author libris
 * @since 2024-11-02
 */
@Mapper
public interface ContentItemMapper extends BaseMapper<ContentItemDO> {
}
