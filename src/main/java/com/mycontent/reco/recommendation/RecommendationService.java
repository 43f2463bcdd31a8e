package com.mycontent.reco.recommendation;

import com.mycontent.reco.config.RecommenderProperties;
import com.mycontent.reco.domain.DomainModels.ItemInfo;
import com.mycontent.reco.domain.DomainModels.ScoredItem;
import com.mycontent.reco.recommendation.RecommendationModels.RecommendationEntry;
import com.mycontent.reco.recommendation.RecommendationModels.RecommendationResponse;
import com.mycontent.reco.recommendation.RecommendationModels.SampleUsersResponse;
import com.mycontent.reco.recommendation.RecommendationModels.SimilarArticlesResponse;
import com.mycontent.reco.recommendation.RecommendationModels.Strategy;
import com.mycontent.reco.recommendation.RecommendationModels.UserHistoryResponse;
import com.mycontent.reco.repository.InteractionLog;
import com.mycontent.reco.repository.ItemCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final ItemCatalog catalog;
    private final InteractionLog interactions;
    private final SimilarityIndex similarityIndex;
    private final RecommenderProperties properties;

    public RecommendationService(ItemCatalog catalog,
                                 InteractionLog interactions,
                                 SimilarityIndex similarityIndex,
                                 RecommenderProperties properties) {
        this.catalog = catalog;
        this.interactions = interactions;
        this.similarityIndex = similarityIndex;
        this.properties = properties;
    }

    public RecommendationResponse recommend(long userId, int topN) {
        if (topN <= 0) {
            return new RecommendationResponse(userId, List.of(), Strategy.SIMILARITY);
        }

        List<Long> history = interactions.historyOf(userId);
        if (history.isEmpty()) {
            log.debug("No history for user {}, using fallback recommendations", userId);
            return fallback(userId, topN);
        }

        Set<Long> alreadyRead = new HashSet<>(history);
        Map<Long, Double> scores = new LinkedHashMap<>();
        for (long seed : history.subList(0, Math.min(properties.seedHistoryLimit(), history.size()))) {
            for (ScoredItem neighbor : similarityIndex.neighborsOf(seed, properties.neighborsPerSeed())) {
                if (!alreadyRead.contains(neighbor.articleId())) {
                    scores.merge(neighbor.articleId(), neighbor.score(), Double::sum);
                }
            }
        }

        List<RecommendationEntry> entries = scores.entrySet().stream()
                .map(e -> new ScoredItem(e.getKey(), e.getValue()))
                .sorted(SimilarityIndex.BY_SCORE_THEN_ID)
                .limit(topN)
                .map(s -> RecommendationEntry.of(catalog.infoOf(s.articleId()), s.score()))
                .toList();
        return new RecommendationResponse(userId, entries, Strategy.SIMILARITY);
    }

    public RecommendationResponse recommend(long userId) {
        return recommend(userId, properties.defaultTopN());
    }

    public SimilarArticlesResponse similarArticles(long articleId, int k) {
        List<RecommendationEntry> similar = similarityIndex.neighborsOf(articleId, k).stream()
                .map(s -> RecommendationEntry.of(catalog.infoOf(s.articleId()), s.score()))
                .toList();
        return new SimilarArticlesResponse(articleId, similar, similar.size());
    }

    public UserHistoryResponse history(long userId, int limit) {
        List<Long> history = interactions.historyOf(userId);
        List<ItemInfo> items = history.stream()
                .limit(Math.max(limit, 0))
                .map(catalog::infoOf)
                .toList();
        return new UserHistoryResponse(userId, history.size(), items);
    }

    public SampleUsersResponse sampleUsers(int limit) {
        if (interactions.isEmpty()) {
            log.warn("No click data, returning placeholder user ids 1..{}", limit);
        }
        return new SampleUsersResponse(interactions.sampleUserIds(limit), interactions.isEmpty());
    }

    private RecommendationResponse fallback(long userId, int topN) {
        if (interactions.isEmpty()) {
            List<ItemInfo> first = catalog.first(topN);
            List<RecommendationEntry> entries = new ArrayList<>(first.size());
            for (int i = 0; i < first.size(); i++) {
                entries.add(RecommendationEntry.of(first.get(i), topN - i));
            }
            return new RecommendationResponse(userId, entries, Strategy.CATALOG_ORDER);
        }

        List<RecommendationEntry> entries = interactions.popularityRanking(topN).stream()
                .map(p -> RecommendationEntry.of(catalog.infoOf(p.articleId()), p.score()))
                .toList();
        return new RecommendationResponse(userId, entries, Strategy.POPULARITY);
    }
}
