package com.mycontent.reco.config;

import com.mycontent.reco.recommendation.SimilarityIndex;
import com.mycontent.reco.repository.EmbeddingStore;
import com.mycontent.reco.repository.InteractionLog;
import com.mycontent.reco.repository.ItemCatalog;
import com.mycontent.reco.service.RecommenderDataLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RecommenderProperties.class)
public class RecommenderConfiguration {

    @Bean
    public RecommenderDataLoader.LoadedData recommenderData(RecommenderDataLoader loader) {
        return loader.load();
    }

    @Bean
    public EmbeddingStore embeddingStore(RecommenderDataLoader.LoadedData data) {
        return data.embeddings();
    }

    @Bean
    public ItemCatalog itemCatalog(RecommenderDataLoader.LoadedData data) {
        return data.catalog();
    }

    @Bean
    public InteractionLog interactionLog(RecommenderDataLoader.LoadedData data) {
        return data.interactions();
    }

    @Bean
    public SimilarityIndex similarityIndex(EmbeddingStore embeddingStore) {
        return new SimilarityIndex(embeddingStore);
    }
}
