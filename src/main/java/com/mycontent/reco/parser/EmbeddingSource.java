package com.mycontent.reco.parser;

import java.util.List;

public interface EmbeddingSource {

    enum Layout { MAPPING, PAIRED, BARE_MATRIX }

    Layout layout();

    List<double[]> vectors();

    List<Long> resolveIds(List<Long> catalogOrder);

    record Mapped(List<Long> ids, List<double[]> vectors) implements EmbeddingSource {
        @Override
        public Layout layout() {
            return Layout.MAPPING;
        }

        @Override
        public List<Long> resolveIds(List<Long> catalogOrder) {
            return ids;
        }
    }

    record Paired(List<Long> ids, List<double[]> vectors) implements EmbeddingSource {
        @Override
        public Layout layout() {
            return Layout.PAIRED;
        }

        @Override
        public List<Long> resolveIds(List<Long> catalogOrder) {
            return ids;
        }
    }

    record BareMatrix(List<double[]> vectors) implements EmbeddingSource {
        @Override
        public Layout layout() {
            return Layout.BARE_MATRIX;
        }

        @Override
        public List<Long> resolveIds(List<Long> catalogOrder) {
            return List.copyOf(catalogOrder.subList(0, Math.min(vectors.size(), catalogOrder.size())));
        }
    }
}
