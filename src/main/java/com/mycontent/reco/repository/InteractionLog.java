package com.mycontent.reco.repository;

import com.mycontent.reco.domain.DomainModels.ClickEvent;
import com.mycontent.reco.domain.DomainModels.ScoredItem;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Click history, indexed once at construction. A user's history is ordered
 * most recent first when all of their clicks carry a timestamp, otherwise in
 * the order the clicks were read.
 */
public class InteractionLog {
    private static final InteractionLog EMPTY = new InteractionLog(List.of());
    static final int MAX_PLACEHOLDER_USERS = 100;

    private final int eventCount;
    private final Map<Long, List<Long>> historyByUser;
    private final List<ScoredItem> popularity;

    public InteractionLog(List<ClickEvent> events) {
        this.eventCount = events.size();

        Map<Long, List<ClickEvent>> byUser = events.stream()
                .collect(Collectors.groupingBy(ClickEvent::userId, LinkedHashMap::new, Collectors.toList()));
        Map<Long, List<Long>> histories = new LinkedHashMap<>();
        byUser.forEach((userId, clicks) -> histories.put(userId, distinctHistory(clicks)));
        this.historyByUser = Collections.unmodifiableMap(histories);

        Map<Long, Long> counts = events.stream()
                .collect(Collectors.groupingBy(ClickEvent::articleId, Collectors.counting()));
        this.popularity = counts.entrySet().stream()
                .sorted(Map.Entry.<Long, Long>comparingByValue().reversed().thenComparing(Map.Entry.<Long, Long>comparingByKey()))
                .map(e -> new ScoredItem(e.getKey(), e.getValue()))
                .toList();
    }

    public static InteractionLog empty() {
        return EMPTY;
    }

    public List<Long> historyOf(long userId) {
        return historyByUser.getOrDefault(userId, List.of());
    }

    public List<ScoredItem> popularityRanking(int topN) {
        if (topN <= 0) return List.of();
        return popularity.subList(0, Math.min(topN, popularity.size()));
    }

    /**
     * Known user ids in first-seen order. An empty log yields the placeholder
     * range {@code 1..min(limit, 100)}; check {@link #isEmpty()} before treating them as real users.
     */
    public List<Long> sampleUserIds(int limit) {
        if (limit <= 0) return List.of();
        if (isEmpty()) {
            return LongStream.rangeClosed(1, Math.min(limit, MAX_PLACEHOLDER_USERS)).boxed().toList();
        }
        return historyByUser.keySet().stream().limit(limit).toList();
    }

    public boolean isEmpty() {
        return eventCount == 0;
    }

    public int eventCount() {
        return eventCount;
    }

    public int userCount() {
        return historyByUser.size();
    }

    private static List<Long> distinctHistory(List<ClickEvent> clicks) {
        List<ClickEvent> ordered = clicks;
        if (clicks.stream().allMatch(c -> c.clickTimestamp() != null)) {
            ordered = clicks.stream()
                    .sorted(Comparator.comparing(ClickEvent::clickTimestamp).reversed())
                    .toList();
        }
        return ordered.stream().map(ClickEvent::articleId).distinct().toList();
    }
}
