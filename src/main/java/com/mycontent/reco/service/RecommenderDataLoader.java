package com.mycontent.reco.service;

import com.mycontent.reco.config.RecommenderProperties;
import com.mycontent.reco.domain.DomainModels.CategoryId;
import com.mycontent.reco.domain.DomainModels.ClickEvent;
import com.mycontent.reco.domain.DomainModels.ItemInfo;
import com.mycontent.reco.exception.ArtifactLoadException;
import com.mycontent.reco.parser.CsvTableReader;
import com.mycontent.reco.parser.EmbeddingArtifactReader;
import com.mycontent.reco.parser.EmbeddingSource;
import com.mycontent.reco.parser.ParserDtos.ArtifactError;
import com.mycontent.reco.parser.ParserDtos.CsvTable;
import com.mycontent.reco.repository.EmbeddingStore;
import com.mycontent.reco.repository.InteractionLog;
import com.mycontent.reco.repository.ItemCatalog;
import com.mycontent.reco.validation.EmbeddingSourceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;

@Service
public class RecommenderDataLoader {
    private static final Logger log = LoggerFactory.getLogger(RecommenderDataLoader.class);

    private final EmbeddingArtifactReader embeddingReader;
    private final CsvTableReader csvReader;
    private final EmbeddingSourceValidator validator;
    private final RecommenderProperties properties;

    public RecommenderDataLoader(EmbeddingArtifactReader embeddingReader,
                                 CsvTableReader csvReader,
                                 EmbeddingSourceValidator validator,
                                 RecommenderProperties properties) {
        this.embeddingReader = embeddingReader;
        this.csvReader = csvReader;
        this.validator = validator;
        this.properties = properties;
    }

    public LoadedData load() {
        log.info("Loading recommender data from {}", Path.of(properties.dataPath()).toAbsolutePath());

        ItemCatalog catalog = loadCatalog(properties.metadataPath());
        log.info("{} articles loaded from metadata", catalog.size());

        EmbeddingStore store = loadEmbeddings(properties.embeddingsPath(), catalog.articleIds());
        log.info("{} embeddings loaded (dimension: {}, layout: {})", store.size(), store.dimension(), store.layout());

        InteractionLog interactions = loadClicks(properties.clicksPath());
        log.info("Recommender data ready");
        return new LoadedData(store, catalog, interactions);
    }

    ItemCatalog loadCatalog(Path path) {
        String artifact = path.getFileName().toString();
        if (!Files.isRegularFile(path)) {
            throw new ArtifactLoadException(artifact, List.of(new ArtifactError("MISSING_ARTIFACT", "File not found: " + path, 0, artifact)));
        }
        CsvTable table = csvReader.read(path);
        List<ArtifactError> errors = new ArrayList<>();

        OptionalInt idColumn = table.column("article_id");
        if (idColumn.isEmpty()) {
            throw new ArtifactLoadException(artifact, List.of(new ArtifactError("MISSING_COLUMN", "Column article_id is required", 1, artifact)));
        }
        OptionalInt titleColumn = table.column("title");
        OptionalInt categoryColumn = table.column("category_id");
        OptionalInt wordsColumn = table.column("words_count");

        List<ItemInfo> rows = new ArrayList<>();
        for (int r = 0; r < table.size(); r++) {
            int line = table.lines().get(r);
            Long id = parseLong(table.cell(r, idColumn.getAsInt()));
            if (id == null) {
                errors.add(new ArtifactError("INVALID_ID", "article_id is not an integer: '" + table.cell(r, idColumn.getAsInt()) + "'", line, artifact));
                continue;
            }
            String title = titleColumn.isPresent() ? table.cell(r, titleColumn.getAsInt()).trim() : null;

            CategoryId category = CategoryId.UNKNOWN;
            String rawCategory = categoryColumn.isPresent() ? table.cell(r, categoryColumn.getAsInt()).trim() : "";
            if (!rawCategory.isEmpty()) {
                Long value = parseLong(rawCategory);
                if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
                    errors.add(new ArtifactError("INVALID_CATEGORY", "category_id is not an integer: '" + rawCategory + "'", line, artifact));
                    continue;
                }
                category = CategoryId.of(value.intValue());
            }

            Integer words = null;
            String rawWords = wordsColumn.isPresent() ? table.cell(r, wordsColumn.getAsInt()).trim() : "";
            if (!rawWords.isEmpty()) {
                Long value = parseLong(rawWords);
                if (value == null || value < 0 || value > Integer.MAX_VALUE) {
                    errors.add(new ArtifactError("INVALID_WORDS_COUNT", "words_count is not a non-negative integer: '" + rawWords + "'", line, artifact));
                    continue;
                }
                words = value.intValue();
            }
            rows.add(ItemInfo.withDefaults(id, title, category, words));
        }
        if (!errors.isEmpty()) {
            throw new ArtifactLoadException(artifact, errors);
        }
        return new ItemCatalog(rows);
    }

    EmbeddingStore loadEmbeddings(Path path, List<Long> catalogOrder) {
        String artifact = path.getFileName().toString();
        if (!Files.isRegularFile(path)) {
            throw new ArtifactLoadException(artifact, List.of(new ArtifactError("MISSING_ARTIFACT", "File not found: " + path, 0, artifact)));
        }
        EmbeddingSource source = embeddingReader.read(path);
        if (source.layout() == EmbeddingSource.Layout.BARE_MATRIX) {
            log.warn("Embeddings carry no article ids, assigning the first {} catalog ids by position", source.vectors().size());
        }
        List<ArtifactError> errors = validator.validate(source, catalogOrder, artifact);
        if (!errors.isEmpty()) {
            throw new ArtifactLoadException(artifact, errors);
        }
        return EmbeddingStore.from(source, catalogOrder);
    }

    InteractionLog loadClicks(Path folder) {
        if (!Files.isDirectory(folder)) {
            log.warn("Clicks folder not found: {}", folder);
            return InteractionLog.empty();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                    .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".csv"))
                    .sorted()
                    .limit(Math.max(properties.maxClickFiles(), 0))
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list clicks folder {}: {}", folder, e.getMessage());
            return InteractionLog.empty();
        }
        if (files.isEmpty()) {
            log.warn("No CSV file found in {}", folder);
            return InteractionLog.empty();
        }

        List<ClickEvent> events = new ArrayList<>();
        int loadedFiles = 0;
        for (Path file : files) {
            try {
                events.addAll(readClickFile(file));
                loadedFiles++;
            } catch (ArtifactLoadException e) {
                log.warn("Skipping clicks file {}: {}", file.getFileName(), e.getMessage());
            }
        }

        if (loadedFiles == 0) {
            log.warn("No clicks file could be loaded");
            return InteractionLog.empty();
        }
        InteractionLog interactions = new InteractionLog(events);
        log.info("{} clicks loaded from {} of {} files ({} users)", interactions.eventCount(), loadedFiles, files.size(), interactions.userCount());
        return interactions;
    }

    List<ClickEvent> readClickFile(Path file) {
        String artifact = file.getFileName().toString();
        CsvTable table = csvReader.read(file);
        OptionalInt userColumn = table.column("user_id");
        OptionalInt articleColumn = table.column("click_article_id");
        OptionalInt timestampColumn = table.column("click_timestamp");
        if (userColumn.isEmpty() || articleColumn.isEmpty()) {
            throw new ArtifactLoadException(artifact, List.of(new ArtifactError("MISSING_COLUMN",
                    "Columns user_id and click_article_id are required", 1, artifact)));
        }

        List<ClickEvent> events = new ArrayList<>(table.size());
        for (int r = 0; r < table.size(); r++) {
            Long userId = parseLong(table.cell(r, userColumn.getAsInt()));
            Long articleId = parseLong(table.cell(r, articleColumn.getAsInt()));
            if (userId == null || articleId == null) {
                throw new ArtifactLoadException(artifact, List.of(new ArtifactError("INVALID_ROW",
                        "user_id and click_article_id must be integers", table.lines().get(r), artifact)));
            }
            Long timestamp = timestampColumn.isPresent() ? parseLong(table.cell(r, timestampColumn.getAsInt())) : null;
            events.add(new ClickEvent(userId, articleId, timestamp));
        }
        return events;
    }

    private Long parseLong(String raw) {
        if (raw == null) return null;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public record LoadedData(EmbeddingStore embeddings, ItemCatalog catalog, InteractionLog interactions) {}
}
