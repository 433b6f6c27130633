package com.libris.service.impl;

import cn.hutool.core.collection.CollUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libris.exception.EmbeddingStoreException;
import com.libris.mapper.ItemEmbeddingMapper;
import com.libris.model.entity.ItemEmbeddingDO;
import com.libris.model.vo.EmbeddingResultVO;
import com.libris.model.vo.EmbeddingStatsVO;
import com.libris.model.vo.EmbeddingVectorVO;
import com.libris.service.EmbeddingStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 向量存储服务实现
 * 向量以 JSON 数组形式存放在 item_embeddings.embedding 列
 *
 * @author libris
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingStoreServiceImpl implements EmbeddingStoreService {

    private final ItemEmbeddingMapper itemEmbeddingMapper;
    private final ObjectMapper objectMapper;

    @Override
    public void upsert(Long itemId, Long ownerId, EmbeddingResultVO result) {
        ItemEmbeddingDO record = ItemEmbeddingDO.builder()
            .itemId(itemId)
            .userId(ownerId)
            .provider(result.getProvider())
            .model(result.getModel())
            .dimensions(result.getVector().length)
            .embedding(writeVector(result.getVector()))
            .tokenCount(result.getTokenCount())
            .updateTime(LocalDateTime.now())
            .build();

        try {
            if (itemEmbeddingMapper.selectById(itemId) == null) {
                try {
                    itemEmbeddingMapper.insert(record);
                } catch (DuplicateKeyException e) {
                    // 并发写入同一条目, 退化为覆盖
                    itemEmbeddingMapper.updateById(record);
                }
            } else {
                itemEmbeddingMapper.updateById(record);
            }
            log.debug("向量已写入: itemId={}, provider={}, model={}, dimensions={}",
                itemId, record.getProvider(), record.getModel(), record.getDimensions());
        } catch (RuntimeException e) {
            throw new EmbeddingStoreException("写入向量失败: itemId=" + itemId, e);
        }
    }

    @Override
    public float[] get(Long itemId) {
        EmbeddingVectorVO vector = getVector(itemId);
        return vector == null ? null : vector.getVector();
    }

    @Override
    public EmbeddingVectorVO getVector(Long itemId) {
        ItemEmbeddingDO record;
        try {
            record = itemEmbeddingMapper.selectById(itemId);
        } catch (RuntimeException e) {
            throw new EmbeddingStoreException("读取向量失败: itemId=" + itemId, e);
        }
        return record == null ? null : toVector(record);
    }

    @Override
    public List<EmbeddingVectorVO> queryByOwner(Long ownerId, Collection<Long> excludeIds) {
        LambdaQueryWrapper<ItemEmbeddingDO> wrapper = new LambdaQueryWrapper<ItemEmbeddingDO>()
            .eq(ItemEmbeddingDO::getUserId, ownerId);
        if (CollUtil.isNotEmpty(excludeIds)) {
            wrapper.notIn(ItemEmbeddingDO::getItemId, excludeIds);
        }

        List<ItemEmbeddingDO> records;
        try {
            records = itemEmbeddingMapper.selectList(wrapper);
        } catch (RuntimeException e) {
            throw new EmbeddingStoreException("查询用户向量失败: ownerId=" + ownerId, e);
        }

        return records.stream()
            .map(this::toVector)
            .collect(Collectors.toList());
    }

    @Override
    public void delete(Long itemId) {
        try {
            int deleted = itemEmbeddingMapper.deleteById(itemId);
            if (deleted == 0) {
                log.debug("条目无向量, 跳过删除: itemId={}", itemId);
            }
        } catch (RuntimeException e) {
            throw new EmbeddingStoreException("删除向量失败: itemId=" + itemId, e);
        }
    }

    @Override
    public EmbeddingStatsVO getStats(Long ownerId) {
        List<ItemEmbeddingDO> records;
        try {
            records = itemEmbeddingMapper.selectList(new LambdaQueryWrapper<ItemEmbeddingDO>()
                .select(ItemEmbeddingDO::getItemId, ItemEmbeddingDO::getProvider,
                    ItemEmbeddingDO::getDimensions, ItemEmbeddingDO::getTokenCount)
                .eq(ItemEmbeddingDO::getUserId, ownerId));
        } catch (RuntimeException e) {
            throw new EmbeddingStoreException("统计用户向量失败: ownerId=" + ownerId, e);
        }

        Map<String, Integer> byProvider = new TreeMap<>();
        long totalDimensions = 0;
        long totalTokens = 0;
        for (ItemEmbeddingDO record : records) {
            byProvider.merge(record.getProvider(), 1, Integer::sum);
            totalDimensions += record.getDimensions() == null ? 0 : record.getDimensions();
            totalTokens += record.getTokenCount() == null ? 0 : record.getTokenCount();
        }

        return EmbeddingStatsVO.builder()
            .totalEmbeddings(records.size())
            .byProvider(byProvider)
            .averageDimensions(records.isEmpty() ? 0.0 : (double) totalDimensions / records.size())
            .totalTokens(totalTokens)
            .build();
    }

    private EmbeddingVectorVO toVector(ItemEmbeddingDO record) {
        return EmbeddingVectorVO.builder()
            .itemId(record.getItemId())
            .ownerId(record.getUserId())
            .provider(record.getProvider())
            .model(record.getModel())
            .dimensions(record.getDimensions())
            .vector(readVector(record))
            .tokenCount(record.getTokenCount())
            .updatedAt(record.getUpdateTime())
            .build();
    }

    private String writeVector(float[] vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new EmbeddingStoreException("向量序列化失败", e);
        }
    }

    private float[] readVector(ItemEmbeddingDO record) {
        try {
            return objectMapper.readValue(record.getEmbedding(), float[].class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EmbeddingStoreException("向量反序列化失败: itemId=" + record.getItemId(), e);
        }
    }
}
