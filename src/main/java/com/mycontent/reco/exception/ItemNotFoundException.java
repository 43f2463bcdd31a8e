package com.mycontent.reco.exception;

public class ItemNotFoundException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    private final long articleId;

    public ItemNotFoundException(long articleId) {
        super("Article not found in embeddings: " + articleId);
        this.articleId = articleId;
    }

    public long getArticleId() {
        return articleId;
    }
}
