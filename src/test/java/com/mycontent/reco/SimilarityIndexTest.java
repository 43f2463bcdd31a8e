package com.mycontent.reco;

import com.mycontent.reco.domain.DomainModels.ScoredItem;
import com.mycontent.reco.parser.EmbeddingSource;
import com.mycontent.reco.recommendation.SimilarityIndex;
import com.mycontent.reco.repository.EmbeddingStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityIndexTest {

    private static SimilarityIndex index(List<Long> ids, double[]... vectors) {
        return new SimilarityIndex(new EmbeddingStore(ids, List.of(vectors), EmbeddingSource.Layout.MAPPING));
    }

    @Test
    void returnsNearestNeighborsWithoutQueryItem() {
        SimilarityIndex index = index(List.of(1L, 2L, 3L),
                new double[]{1, 0}, new double[]{1, 0}, new double[]{0, 1});

        List<ScoredItem> neighbors = index.neighborsOf(1, 2);

        assertEquals(2, neighbors.size());
        assertEquals(2L, neighbors.get(0).articleId());
        assertEquals(1.0, neighbors.get(0).score(), 1e-12);
        assertEquals(3L, neighbors.get(1).articleId());
        assertEquals(0.0, neighbors.get(1).score(), 1e-12);
    }

    @Test
    void neverReturnsQueryItemAndRespectsK() {
        SimilarityIndex index = index(List.of(1L, 2L, 3L, 4L, 5L),
                new double[]{1, 2, 3}, new double[]{-1, 0.5, 2}, new double[]{3, -2, 0},
                new double[]{1, 2, 3}, new double[]{-4, -4, -1});

        for (long id = 1; id <= 5; id++) {
            for (int k = 0; k <= 6; k++) {
                List<ScoredItem> neighbors = index.neighborsOf(id, k);
                long query = id;
                assertTrue(neighbors.size() <= k);
                assertTrue(neighbors.stream().noneMatch(n -> n.articleId() == query));
                neighbors.forEach(n -> assertTrue(n.score() >= -1.0 && n.score() <= 1.0));
                for (int i = 1; i < neighbors.size(); i++) {
                    assertTrue(neighbors.get(i - 1).score() >= neighbors.get(i).score());
                }
            }
        }
    }

    @Test
    void duplicateVectorStaysAsNeighbor() {
        SimilarityIndex index = index(List.of(7L, 3L, 9L),
                new double[]{2, 2}, new double[]{1, 1}, new double[]{1, -1});

        List<ScoredItem> neighbors = index.neighborsOf(7, 1);
        assertEquals(1, neighbors.size());
        assertEquals(3L, neighbors.get(0).articleId());
        assertEquals(1.0, neighbors.get(0).score(), 1e-12);
    }

    @Test
    void oppositeVectorsScoreMinusOne() {
        SimilarityIndex index = index(List.of(1L, 2L), new double[]{1, 1}, new double[]{-3, -3});
        assertEquals(-1.0, index.neighborsOf(1, 5).get(0).score(), 1e-12);
    }

    @Test
    void zeroVectorHasZeroSimilarity() {
        SimilarityIndex index = index(List.of(1L, 2L), new double[]{0, 0}, new double[]{1, 0});
        assertEquals(0.0, index.neighborsOf(1, 1).get(0).score());
        assertEquals(0.0, index.similarity(2, 1));
    }

    @Test
    void equalScoresAreOrderedByArticleId() {
        SimilarityIndex index = index(List.of(1L, 30L, 20L, 10L),
                new double[]{1, 0}, new double[]{0, 1}, new double[]{0, 1}, new double[]{0, 1});

        assertEquals(List.of(10L, 20L, 30L), index.neighborsOf(1, 3).stream().map(ScoredItem::articleId).toList());
    }

    @Test
    void unknownArticleGivesEmptyResult() {
        SimilarityIndex index = index(List.of(1L, 2L), new double[]{1, 0}, new double[]{0, 1});
        assertTrue(index.neighborsOf(404, 5).isEmpty());
        assertFalse(index.contains(404));
    }

    @Test
    void kLargerThanStoreReturnsEveryOtherArticle() {
        SimilarityIndex index = index(List.of(1L, 2L, 3L),
                new double[]{1, 0}, new double[]{1, 1}, new double[]{0, 1});

        assertEquals(List.of(2L, 3L), index.neighborsOf(1, 3).stream().map(ScoredItem::articleId).toList());
        assertEquals(List.of(2L, 3L), index.neighborsOf(1, 1_500_000_000).stream().map(ScoredItem::articleId).toList());
        assertEquals(List.of(2L, 3L), index.neighborsOf(1, Integer.MAX_VALUE).stream().map(ScoredItem::articleId).toList());
    }

    @Test
    void singleArticleStoreHasNoNeighbors() {
        SimilarityIndex index = index(List.of(1L), new double[]{1, 0});
        assertTrue(index.neighborsOf(1, Integer.MAX_VALUE).isEmpty());
    }
}
