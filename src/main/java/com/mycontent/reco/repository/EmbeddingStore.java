package com.mycontent.reco.repository;

import com.mycontent.reco.exception.ItemNotFoundException;
import com.mycontent.reco.parser.EmbeddingSource;

import java.util.*;

/**
 * Dense vector per article. Row {@code i} of the matrix belongs to
 * {@code articleIds().get(i)}; the identifier to row mapping covers rows
 * {@code 0..size()-1} exactly once.
 */
public class EmbeddingStore {
    private final List<Long> articleIds;
    private final Map<Long, Integer> rowById;
    private final double[][] matrix;
    private final int dimension;
    private final EmbeddingSource.Layout layout;

    public EmbeddingStore(List<Long> articleIds, List<double[]> vectors, EmbeddingSource.Layout layout) {
        if (articleIds.size() != vectors.size()) {
            throw new IllegalArgumentException(articleIds.size() + " ids for " + vectors.size() + " vectors");
        }
        this.articleIds = List.copyOf(articleIds);
        this.layout = layout;
        this.dimension = vectors.isEmpty() ? 0 : vectors.get(0).length;
        this.matrix = new double[vectors.size()][];
        Map<Long, Integer> rows = new HashMap<>();
        for (int i = 0; i < vectors.size(); i++) {
            if (vectors.get(i).length != dimension) {
                throw new IllegalArgumentException("Row " + i + " has dimension " + vectors.get(i).length + ", expected " + dimension);
            }
            if (rows.put(this.articleIds.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate article id " + this.articleIds.get(i));
            }
            matrix[i] = vectors.get(i).clone();
        }
        this.rowById = Collections.unmodifiableMap(rows);
    }

    public static EmbeddingStore from(EmbeddingSource source, List<Long> catalogOrder) {
        return new EmbeddingStore(source.resolveIds(catalogOrder), source.vectors(), source.layout());
    }

    public double[] vectorOf(long articleId) {
        Integer row = rowById.get(articleId);
        if (row == null) throw new ItemNotFoundException(articleId);
        return matrix[row].clone();
    }

    public OptionalInt rowOf(long articleId) {
        Integer row = rowById.get(articleId);
        return row == null ? OptionalInt.empty() : OptionalInt.of(row);
    }

    public boolean contains(long articleId) {
        return rowById.containsKey(articleId);
    }

    public long articleIdAt(int row) {
        return articleIds.get(row);
    }

    public List<Long> articleIds() {
        return articleIds;
    }

    public int size() {
        return matrix.length;
    }

    public int dimension() {
        return dimension;
    }

    public EmbeddingSource.Layout layout() {
        return layout;
    }
}
