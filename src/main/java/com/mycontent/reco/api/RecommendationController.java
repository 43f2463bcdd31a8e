package com.mycontent.reco.api;

import com.mycontent.reco.recommendation.RecommendationModels;
import com.mycontent.reco.recommendation.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class RecommendationController {
    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/recommend")
    public ResponseEntity<RecommendationModels.RecommendationResponse> recommend(@RequestParam("user_id") long userId,
                                                                                @RequestParam(name = "top_n", required = false) Integer topN) {
        return ResponseEntity.ok(topN == null
                ? recommendationService.recommend(userId)
                : recommendationService.recommend(userId, topN));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy", "service", "My Content Recommendation API"));
    }
}
