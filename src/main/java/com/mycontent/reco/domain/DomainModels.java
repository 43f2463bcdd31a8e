package com.mycontent.reco.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public class DomainModels {
    public static final String UNKNOWN_CATEGORY = "unknown";
    public static final int DEFAULT_WORDS_COUNT = 0;

    public record ItemInfo(long articleId, String title, CategoryId category, int wordsCount) {
        public static ItemInfo placeholder(long articleId) {
            return new ItemInfo(articleId, defaultTitle(articleId), CategoryId.UNKNOWN, DEFAULT_WORDS_COUNT);
        }

        public static ItemInfo withDefaults(long articleId, String title, CategoryId category, Integer wordsCount) {
            return new ItemInfo(articleId,
                    title == null || title.isBlank() ? defaultTitle(articleId) : title,
                    category == null ? CategoryId.UNKNOWN : category,
                    wordsCount == null ? DEFAULT_WORDS_COUNT : wordsCount);
        }
    }

    public record CategoryId(Integer value) {
        public static final CategoryId UNKNOWN = new CategoryId(null);

        public static CategoryId of(int value) {
            return new CategoryId(value);
        }

        public boolean known() {
            return value != null;
        }

        @JsonValue
        public Object json() {
            return value == null ? UNKNOWN_CATEGORY : value;
        }
    }

    public record ClickEvent(long userId, long articleId, Long clickTimestamp) {}

    public record ScoredItem(long articleId, double score) {}

    public static String defaultTitle(long articleId) {
        return "Article " + articleId;
    }
}
