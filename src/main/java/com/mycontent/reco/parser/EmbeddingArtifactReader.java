package com.mycontent.reco.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mycontent.reco.exception.ArtifactLoadException;
import com.mycontent.reco.parser.ParserDtos.ArtifactError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class EmbeddingArtifactReader {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingArtifactReader.class);
    private static final Set<String> PAIRED_FIELDS = Set.of("ids", "vectors");

    private final ObjectMapper objectMapper;

    public EmbeddingArtifactReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EmbeddingSource read(Path path) {
        String artifact = path.getFileName().toString();
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ArtifactLoadException(artifact, e.getMessage(), e);
        }
        EmbeddingSource source = parse(root, artifact);
        log.info("Embeddings artifact {} detected as {} ({} rows)", artifact, source.layout(), source.vectors().size());
        return source;
    }

    EmbeddingSource parse(JsonNode root, String artifact) {
        List<ArtifactError> errors = new ArrayList<>();
        EmbeddingSource source;
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ArtifactLoadException(artifact, List.of(new ArtifactError("EMPTY_ARTIFACT", "No JSON content", 0, artifact)));
        } else if (root.isArray()) {
            source = new EmbeddingSource.BareMatrix(readMatrix(root, "$", artifact, errors));
        } else if (root.isObject() && isPaired(root)) {
            source = new EmbeddingSource.Paired(readIds(root.get("ids"), artifact, errors),
                    readMatrix(root.get("vectors"), "$.vectors", artifact, errors));
        } else if (root.isObject()) {
            source = readMapping(root, artifact, errors);
        } else {
            throw new ArtifactLoadException(artifact, List.of(new ArtifactError("UNRECOGNIZED_SHAPE",
                    "Expected a JSON object or array but found " + root.getNodeType(), 0, artifact)));
        }
        if (!errors.isEmpty()) {
            throw new ArtifactLoadException(artifact, errors);
        }
        return source;
    }

    private boolean isPaired(JsonNode root) {
        Set<String> fields = new HashSet<>();
        root.fieldNames().forEachRemaining(fields::add);
        return fields.equals(PAIRED_FIELDS);
    }

    private EmbeddingSource.Mapped readMapping(JsonNode root, String artifact, List<ArtifactError> errors) {
        List<Long> ids = new ArrayList<>();
        List<double[]> vectors = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Long id = parseId(field.getKey());
            if (id == null) {
                errors.add(new ArtifactError("UNRECOGNIZED_SHAPE", "Object key is not an article id: " + field.getKey(), 0, artifact));
                continue;
            }
            double[] vector = readVector(field.getValue(), "$." + field.getKey(), artifact, errors);
            if (vector != null) {
                ids.add(id);
                vectors.add(vector);
            }
        }
        return new EmbeddingSource.Mapped(ids, vectors);
    }

    private List<Long> readIds(JsonNode node, String artifact, List<ArtifactError> errors) {
        List<Long> ids = new ArrayList<>();
        if (!node.isArray()) {
            errors.add(new ArtifactError("UNRECOGNIZED_SHAPE", "$.ids must be an array", 0, artifact));
            return ids;
        }
        for (int i = 0; i < node.size(); i++) {
            JsonNode id = node.get(i);
            if (id.canConvertToLong() && id.isIntegralNumber()) {
                ids.add(id.asLong());
            } else if (id.isTextual() && parseId(id.asText()) != null) {
                ids.add(parseId(id.asText()));
            } else {
                errors.add(new ArtifactError("INVALID_ID", "$.ids[" + i + "] is not an article id: " + id, 0, artifact));
            }
        }
        return ids;
    }

    private List<double[]> readMatrix(JsonNode node, String pointer, String artifact, List<ArtifactError> errors) {
        List<double[]> rows = new ArrayList<>();
        if (!node.isArray()) {
            errors.add(new ArtifactError("UNRECOGNIZED_SHAPE", pointer + " must be an array of vectors", 0, artifact));
            return rows;
        }
        for (int i = 0; i < node.size(); i++) {
            double[] vector = readVector(node.get(i), pointer + "[" + i + "]", artifact, errors);
            if (vector != null) rows.add(vector);
        }
        return rows;
    }

    private double[] readVector(JsonNode node, String pointer, String artifact, List<ArtifactError> errors) {
        if (!node.isArray()) {
            errors.add(new ArtifactError("UNRECOGNIZED_SHAPE", pointer + " must be a numeric array", 0, artifact));
            return null;
        }
        double[] vector = new double[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                errors.add(new ArtifactError("NON_NUMERIC", pointer + "[" + i + "] is not a number: " + value, 0, artifact));
                return null;
            }
            vector[i] = value.doubleValue();
        }
        return vector;
    }

    private Long parseId(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
