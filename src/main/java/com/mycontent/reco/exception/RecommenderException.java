package com.mycontent.reco.exception;

public class RecommenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RecommenderException(String message) {
        super(message);
    }

    public RecommenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
