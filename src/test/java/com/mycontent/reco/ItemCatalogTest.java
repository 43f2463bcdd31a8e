package com.mycontent.reco;

import com.mycontent.reco.domain.DomainModels.CategoryId;
import com.mycontent.reco.domain.DomainModels.ItemInfo;
import com.mycontent.reco.repository.ItemCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ItemCatalogTest {

    private final ItemCatalog catalog = new ItemCatalog(List.of(
            ItemInfo.withDefaults(10, "Weather", CategoryId.of(3), 250),
            ItemInfo.withDefaults(20, "  ", null, null),
            ItemInfo.withDefaults(30, null, CategoryId.of(7), 40),
            ItemInfo.withDefaults(10, "Duplicate", CategoryId.of(9), 1)
    ));

    @Test
    void returnsKnownArticle() {
        ItemInfo info = catalog.infoOf(10);
        assertEquals("Weather", info.title());
        assertEquals(3, info.category().value());
        assertEquals(250, info.wordsCount());
    }

    @Test
    void fillsMissingFieldsWithDefaults() {
        ItemInfo sparse = catalog.infoOf(20);
        assertEquals("Article 20", sparse.title());
        assertEquals(CategoryId.UNKNOWN, sparse.category());
        assertEquals("unknown", sparse.category().json());
        assertEquals(0, sparse.wordsCount());
        assertEquals("Article 30", catalog.infoOf(30).title());
    }

    @Test
    void synthesizesUnknownArticle() {
        ItemInfo unknown = catalog.infoOf(555);
        assertEquals(ItemInfo.placeholder(555), unknown);
        assertEquals("Article 555", unknown.title());
        assertFalse(catalog.contains(555));
    }

    @Test
    void keepsFirstRowAndCatalogOrder() {
        assertEquals(3, catalog.size());
        assertEquals(List.of(10L, 20L, 30L), catalog.articleIds());
        assertEquals(List.of(10L, 20L), catalog.first(2).stream().map(ItemInfo::articleId).toList());
        assertEquals(3, catalog.first(10).size());
        assertTrue(catalog.first(0).isEmpty());
    }
}
