package com.mycontent.reco.recommendation;

import com.mycontent.reco.domain.DomainModels.CategoryId;
import com.mycontent.reco.domain.DomainModels.ItemInfo;

import java.util.List;

public class RecommendationModels {
    public enum Strategy { SIMILARITY, POPULARITY, CATALOG_ORDER }

    public record RecommendationEntry(long articleId,
                                      String title,
                                      CategoryId category,
                                      int wordsCount,
                                      double recommendationScore) {
        public static RecommendationEntry of(ItemInfo info, double score) {
            return new RecommendationEntry(info.articleId(), info.title(), info.category(), info.wordsCount(), score);
        }
    }

    public record RecommendationResponse(long userId,
                                         List<RecommendationEntry> recommendations,
                                         int count,
                                         Strategy strategy) {
        public RecommendationResponse(long userId, List<RecommendationEntry> recommendations, Strategy strategy) {
            this(userId, List.copyOf(recommendations), recommendations.size(), strategy);
        }
    }

    public record SimilarArticlesResponse(long articleId, List<RecommendationEntry> similar, int count) {}

    public record UserHistoryResponse(long userId, int total, List<ItemInfo> items) {}

    public record SampleUsersResponse(List<Long> userIds, boolean placeholder) {}
}
