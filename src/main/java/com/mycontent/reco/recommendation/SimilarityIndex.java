package com.mycontent.reco.recommendation;

import com.mycontent.reco.domain.DomainModels.ScoredItem;
import com.mycontent.reco.repository.EmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public class SimilarityIndex {
    private static final Logger log = LoggerFactory.getLogger(SimilarityIndex.class);

    static final Comparator<ScoredItem> BY_SCORE_THEN_ID =
            Comparator.comparingDouble(ScoredItem::score).reversed().thenComparingLong(ScoredItem::articleId);

    private final EmbeddingStore store;
    private final double[][] unitVectors;

    public SimilarityIndex(EmbeddingStore store) {
        this.store = store;
        this.unitVectors = new double[store.size()][];
        for (int row = 0; row < store.size(); row++) {
            unitVectors[row] = normalize(store.vectorOf(store.articleIdAt(row)));
        }
    }

    public List<ScoredItem> neighborsOf(long articleId, int k) {
        OptionalInt queryRow = store.rowOf(articleId);
        if (queryRow.isEmpty()) {
            log.warn("Article {} not found in embeddings", articleId);
            return List.of();
        }
        int limit = Math.min(k, unitVectors.length - 1);
        if (limit <= 0) return List.of();

        double[] query = unitVectors[queryRow.getAsInt()];
        PriorityQueue<ScoredItem> top = new PriorityQueue<>(limit + 1, BY_SCORE_THEN_ID.reversed());
        for (int row = 0; row < unitVectors.length; row++) {
            if (row == queryRow.getAsInt()) continue;
            top.add(new ScoredItem(store.articleIdAt(row), similarity(query, unitVectors[row])));
            if (top.size() > limit) top.poll();
        }

        List<ScoredItem> result = new ArrayList<>(top);
        result.sort(BY_SCORE_THEN_ID);
        return result;
    }

    public double similarity(long first, long second) {
        OptionalInt a = store.rowOf(first);
        OptionalInt b = store.rowOf(second);
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        return similarity(unitVectors[a.getAsInt()], unitVectors[b.getAsInt()]);
    }

    public boolean contains(long articleId) {
        return store.contains(articleId);
    }

    private static double similarity(double[] a, double[] b) {
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
        }
        return Math.max(-1.0, Math.min(1.0, dot));
    }

    // zero vectors stay zero, giving similarity 0 against everything
    private static double[] normalize(double[] vector) {
        double norm = 0.0;
        for (double v : vector) norm += v * v;
        norm = Math.sqrt(norm);
        if (norm == 0.0) return vector;
        double[] unit = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            unit[i] = vector[i] / norm;
        }
        return unit;
    }
}
