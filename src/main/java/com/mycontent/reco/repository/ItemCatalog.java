package com.mycontent.reco.repository;

import com.mycontent.reco.domain.DomainModels.ItemInfo;

import java.util.*;

/**
 * Article metadata in catalog order. Lookups never fail: unknown articles get
 * a synthesized {@link ItemInfo#placeholder(long)} record.
 */
public class ItemCatalog {
    private final List<ItemInfo> items;
    private final Map<Long, ItemInfo> byId;

    public ItemCatalog(List<ItemInfo> rows) {
        Map<Long, ItemInfo> index = new LinkedHashMap<>();
        for (ItemInfo row : rows) {
            index.putIfAbsent(row.articleId(), row);
        }
        this.byId = Collections.unmodifiableMap(index);
        this.items = List.copyOf(index.values());
    }

    public ItemInfo infoOf(long articleId) {
        ItemInfo info = byId.get(articleId);
        return info == null ? ItemInfo.placeholder(articleId) : info;
    }

    public boolean contains(long articleId) {
        return byId.containsKey(articleId);
    }

    public List<ItemInfo> first(int n) {
        if (n <= 0) return List.of();
        return items.subList(0, Math.min(n, items.size()));
    }

    public List<Long> articleIds() {
        return items.stream().map(ItemInfo::articleId).toList();
    }

    public int size() {
        return items.size();
    }
}
