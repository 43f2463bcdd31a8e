package com.mycontent.reco.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "recommender")
public record RecommenderProperties(@DefaultValue("data") String dataPath,
                                    @DefaultValue("articles_embeddings.json") String embeddingsFile,
                                    @DefaultValue("articles_metadata.csv") String metadataFile,
                                    @DefaultValue("clicks") String clicksDir,
                                    @DefaultValue("10") int maxClickFiles,
                                    @DefaultValue("5") int seedHistoryLimit,
                                    @DefaultValue("20") int neighborsPerSeed,
                                    @DefaultValue("5") int defaultTopN,
                                    @DefaultValue("100") int sampleUserLimit) {

    public static RecommenderProperties defaults(String dataPath) {
        return new RecommenderProperties(dataPath, "articles_embeddings.json", "articles_metadata.csv", "clicks",
                10, 5, 20, 5, 100);
    }

    public Path embeddingsPath() {
        return Path.of(dataPath).resolve(embeddingsFile);
    }

    public Path metadataPath() {
        return Path.of(dataPath).resolve(metadataFile);
    }

    public Path clicksPath() {
        return Path.of(dataPath).resolve(clicksDir);
    }
}
