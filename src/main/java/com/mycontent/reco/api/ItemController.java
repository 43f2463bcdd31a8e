package com.mycontent.reco.api;

import com.mycontent.reco.recommendation.RecommendationModels;
import com.mycontent.reco.recommendation.RecommendationService;
import com.mycontent.reco.repository.EmbeddingStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/items")
public class ItemController {
    private final RecommendationService recommendationService;
    private final EmbeddingStore embeddingStore;

    public ItemController(RecommendationService recommendationService, EmbeddingStore embeddingStore) {
        this.recommendationService = recommendationService;
        this.embeddingStore = embeddingStore;
    }

    @GetMapping("/{articleId}/similar")
    public ResponseEntity<RecommendationModels.SimilarArticlesResponse> similar(@PathVariable long articleId,
                                                                               @RequestParam(defaultValue = "10") int k) {
        return ResponseEntity.ok(recommendationService.similarArticles(articleId, k));
    }

    @GetMapping("/{articleId}/embedding")
    public ResponseEntity<EmbeddingView> embedding(@PathVariable long articleId) {
        double[] vector = embeddingStore.vectorOf(articleId);
        return ResponseEntity.ok(new EmbeddingView(articleId, vector.length, vector));
    }

    public record EmbeddingView(long articleId, int dimension, double[] vector) {}
}
