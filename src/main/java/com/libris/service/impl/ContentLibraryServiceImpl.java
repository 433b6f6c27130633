package com.libris.service.impl;

import cn.hutool.core.collection.CollUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.libris.exception.EmbeddingStoreException;
import com.libris.mapper.ContentItemMapper;
import com.libris.model.entity.ContentItemDO;
import com.libris.model.vo.ItemRefVO;
import com.libris.service.ContentLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 内容库读取服务实现
 * 
 * 返回的条目引用中 canonicalId 已展开到最终的规范条目,
 * 不会指向另一个别名条目
 *
 * @author libris
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentLibraryServiceImpl implements ContentLibraryService {

    private final ContentItemMapper contentItemMapper;

    // 别名链最大展开深度
    private static final int MAX_CANONICAL_DEPTH = 8;

    @Override
    public List<ItemRefVO> findExactContentMatches(Long ownerId, String normalizedContent) {
        List<ContentItemDO> items = query("查询精确匹配条目失败: ownerId=" + ownerId, () ->
            contentItemMapper.selectList(new LambdaQueryWrapper<ContentItemDO>()
                .eq(ContentItemDO::getUserId, ownerId)
                .eq(ContentItemDO::getNormalizedContent, normalizedContent)
                .orderByAsc(ContentItemDO::getId)));
        return toRefs(ownerId, items, false);
    }

    @Override
    public List<ItemRefVO> listOwnerItems(Long ownerId, int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<ContentItemDO> items = query("查询用户条目失败: ownerId=" + ownerId, () ->
            contentItemMapper.selectList(new LambdaQueryWrapper<ContentItemDO>()
                .eq(ContentItemDO::getUserId, ownerId)
                .orderByDesc(ContentItemDO::getUpdateTime)
                .last("limit " + limit)));
        return toRefs(ownerId, items, true);
    }

    @Override
    public List<ItemRefVO> findByIds(Long ownerId, Collection<Long> ids) {
        if (CollUtil.isEmpty(ids)) {
            return new ArrayList<>();
        }
        List<ContentItemDO> items = query("按ID查询条目失败: ownerId=" + ownerId, () ->
            contentItemMapper.selectList(new LambdaQueryWrapper<ContentItemDO>()
                .select(ContentItemDO::getId, ContentItemDO::getUserId,
                    ContentItemDO::getIsCanonical, ContentItemDO::getCanonicalId)
                .eq(ContentItemDO::getUserId, ownerId)
                .in(ContentItemDO::getId, ids)));
        return toRefs(ownerId, items, false);
    }

    /**
     * 转换为条目引用, 并展开 canonicalId 别名链
     */
    private List<ItemRefVO> toRefs(Long ownerId, List<ContentItemDO> items, boolean withContent) {
        if (CollUtil.isEmpty(items)) {
            return new ArrayList<>();
        }

        List<ItemRefVO> refs = items.stream()
            .map(item -> ItemRefVO.builder()
                .id(item.getId())
                .content(withContent ? item.getContent() : null)
                .isCanonical(item.getIsCanonical())
                .canonicalId(item.getCanonicalId())
                .build())
            .collect(Collectors.toList());

        flattenCanonicalChains(ownerId, refs);
        return refs;
    }

    /**
     * 若 canonicalId 指向的条目本身也是别名, 继续沿链查找直到规范条目
     */
    private void flattenCanonicalChains(Long ownerId, List<ItemRefVO> refs) {
        Map<Long, ContentItemDO> targets = new HashMap<>();
        Set<Long> pending = refs.stream()
            .filter(ref -> !Boolean.TRUE.equals(ref.getIsCanonical()) && ref.getCanonicalId() != null)
            .map(ItemRefVO::getCanonicalId)
            .collect(Collectors.toSet());

        for (int depth = 0; depth < MAX_CANONICAL_DEPTH && !pending.isEmpty(); depth++) {
            Set<Long> toLoad = pending;
            List<ContentItemDO> loaded = query("查询规范条目失败: ownerId=" + ownerId, () ->
                contentItemMapper.selectList(new LambdaQueryWrapper<ContentItemDO>()
                    .select(ContentItemDO::getId, ContentItemDO::getIsCanonical, ContentItemDO::getCanonicalId)
                    .eq(ContentItemDO::getUserId, ownerId)
                    .in(ContentItemDO::getId, toLoad)));
            pending = new HashSet<>();
            for (ContentItemDO target : loaded) {
                targets.put(target.getId(), target);
                Long next = target.getCanonicalId();
                if (!Boolean.TRUE.equals(target.getIsCanonical()) && next != null && !targets.containsKey(next)) {
                    pending.add(next);
                }
            }
        }

        for (ItemRefVO ref : refs) {
            if (Boolean.TRUE.equals(ref.getIsCanonical()) || ref.getCanonicalId() == null) {
                continue;
            }
            Long current = ref.getCanonicalId();
            Set<Long> visited = new HashSet<>();
            while (visited.add(current)) {
                ContentItemDO target = targets.get(current);
                if (target == null || Boolean.TRUE.equals(target.getIsCanonical()) || target.getCanonicalId() == null) {
                    break;
                }
                current = target.getCanonicalId();
            }
            ref.setCanonicalId(current);
        }
    }

    private List<ContentItemDO> query(String errorMessage, Supplier<List<ContentItemDO>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw new EmbeddingStoreException(errorMessage, e);
        }
    }
}
