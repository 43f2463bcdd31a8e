package com.mycontent.reco.validation;

import com.mycontent.reco.parser.EmbeddingSource;
import com.mycontent.reco.parser.ParserDtos.ArtifactError;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class EmbeddingSourceValidator {
    public List<ArtifactError> validate(EmbeddingSource source, List<Long> catalogOrder, String artifact) {
        List<ArtifactError> errors = new ArrayList<>();
        List<double[]> vectors = source.vectors();

        if (vectors.isEmpty()) {
            errors.add(new ArtifactError("EMPTY_ARTIFACT", "No embedding rows", 0, artifact));
            return errors;
        }

        int dimension = vectors.get(0).length;
        if (dimension == 0) {
            errors.add(new ArtifactError("ZERO_DIMENSION", "Embedding vectors have no components", 0, artifact));
        }
        for (int row = 0; row < vectors.size(); row++) {
            double[] vector = vectors.get(row);
            if (vector.length != dimension) {
                errors.add(new ArtifactError("DIMENSION_MISMATCH",
                        "Row " + row + " has " + vector.length + " components, expected " + dimension, 0, artifact));
            }
            if (Arrays.stream(vector).anyMatch(v -> !Double.isFinite(v))) {
                errors.add(new ArtifactError("NON_FINITE", "Row " + row + " contains NaN or infinite values", 0, artifact));
            }
        }

        switch (source.layout()) {
            case PAIRED -> {
                int ids = source.resolveIds(catalogOrder).size();
                if (ids != vectors.size()) {
                    errors.add(new ArtifactError("ID_COUNT_MISMATCH",
                            ids + " ids for " + vectors.size() + " vectors", 0, artifact));
                }
            }
            case BARE_MATRIX -> {
                if (vectors.size() > catalogOrder.size()) {
                    errors.add(new ArtifactError("CATALOG_TOO_SHORT",
                            vectors.size() + " vectors but only " + catalogOrder.size() + " catalog articles to assign ids from", 0, artifact));
                }
            }
            case MAPPING -> {
            }
        }

        duplicates(source.resolveIds(catalogOrder)).forEach(id -> errors.add(
                new ArtifactError("DUPLICATE_ID", "Article id appears more than once: " + id, 0, artifact)));
        return errors;
    }

    private List<Long> duplicates(List<Long> ids) {
        Map<Long, Long> counts = ids.stream().collect(Collectors.groupingBy(id -> id, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream().filter(e -> e.getValue() > 1).map(Map.Entry::getKey).toList();
    }
}
