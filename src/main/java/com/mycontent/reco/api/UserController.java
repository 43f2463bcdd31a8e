package com.mycontent.reco.api;

import com.mycontent.reco.config.RecommenderProperties;
import com.mycontent.reco.recommendation.RecommendationModels;
import com.mycontent.reco.recommendation.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
public class UserController {
    private final RecommendationService recommendationService;
    private final RecommenderProperties properties;

    public UserController(RecommendationService recommendationService, RecommenderProperties properties) {
        this.recommendationService = recommendationService;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<RecommendationModels.SampleUsersResponse> users(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(recommendationService.sampleUsers(limit == null ? properties.sampleUserLimit() : limit));
    }

    @GetMapping("/{userId}/history")
    public ResponseEntity<RecommendationModels.UserHistoryResponse> history(@PathVariable long userId,
                                                                           @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(recommendationService.history(userId, limit));
    }
}
