package com.mycontent.reco;

import com.mycontent.reco.domain.DomainModels.ClickEvent;
import com.mycontent.reco.domain.DomainModels.ScoredItem;
import com.mycontent.reco.repository.InteractionLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InteractionLogTest {

    @Test
    void historyIsMostRecentFirstAndDistinct() {
        InteractionLog log = new InteractionLog(List.of(
                new ClickEvent(1, 10, 100L),
                new ClickEvent(1, 20, 300L),
                new ClickEvent(2, 10, 150L),
                new ClickEvent(1, 10, 400L),
                new ClickEvent(1, 30, 200L)
        ));

        assertEquals(List.of(10L, 20L, 30L), log.historyOf(1));
        assertEquals(List.of(10L), log.historyOf(2));
    }

    @Test
    void historyKeepsReadOrderWithoutTimestamps() {
        InteractionLog log = new InteractionLog(List.of(
                new ClickEvent(5, 3, null),
                new ClickEvent(5, 1, 900L),
                new ClickEvent(5, 3, null),
                new ClickEvent(5, 2, null)
        ));

        assertEquals(List.of(3L, 1L, 2L), log.historyOf(5));
    }

    @Test
    void unknownUserAndEmptyLogHaveNoHistory() {
        InteractionLog log = new InteractionLog(List.of(new ClickEvent(1, 10, null)));
        assertTrue(log.historyOf(99).isEmpty());
        assertTrue(InteractionLog.empty().historyOf(1).isEmpty());
        assertTrue(InteractionLog.empty().popularityRanking(5).isEmpty());
    }

    @Test
    void popularityIsByCountThenArticleId() {
        InteractionLog log = new InteractionLog(List.of(
                new ClickEvent(1, 30, null),
                new ClickEvent(2, 30, null),
                new ClickEvent(3, 20, null),
                new ClickEvent(1, 10, null),
                new ClickEvent(4, 20, null),
                new ClickEvent(5, 40, null),
                new ClickEvent(6, 30, null)
        ));

        List<ScoredItem> ranking = log.popularityRanking(3);
        assertEquals(List.of(30L, 20L, 10L), ranking.stream().map(ScoredItem::articleId).toList());
        assertEquals(List.of(3.0, 2.0, 1.0), ranking.stream().map(ScoredItem::score).toList());
        assertEquals(4, log.popularityRanking(50).size());
        assertTrue(log.popularityRanking(0).isEmpty());
    }

    @Test
    void samplesKnownUsersInFirstSeenOrder() {
        InteractionLog log = new InteractionLog(List.of(
                new ClickEvent(8, 1, null),
                new ClickEvent(3, 1, null),
                new ClickEvent(8, 2, null),
                new ClickEvent(5, 1, null)
        ));

        assertEquals(List.of(8L, 3L), log.sampleUserIds(2));
        assertEquals(List.of(8L, 3L, 5L), log.sampleUserIds(10));
        assertFalse(log.isEmpty());
    }

    @Test
    void emptyLogSamplesPlaceholderRange() {
        InteractionLog log = InteractionLog.empty();
        assertTrue(log.isEmpty());
        assertEquals(List.of(1L, 2L, 3L, 4L), log.sampleUserIds(4));
        assertTrue(log.sampleUserIds(0).isEmpty());
    }

    @Test
    void placeholderRangeIsCappedAtOneHundred() {
        List<Long> ids = InteractionLog.empty().sampleUserIds(Integer.MAX_VALUE);

        assertEquals(100, ids.size());
        assertEquals(1L, ids.get(0));
        assertEquals(100L, ids.get(99));
    }
}
