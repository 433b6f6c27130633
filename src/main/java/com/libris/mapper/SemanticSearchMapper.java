package com.libris.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.libris.model.entity.SemanticSearchDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 语义检索历史 Mapper
 *
 * @author libris
 * @since 2024-11-20
 */
@Mapper
public interface SemanticSearchMapper extends BaseMapper<SemanticSearchDO> {
}
