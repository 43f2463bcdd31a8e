package com.mycontent.reco.exception;

import com.mycontent.reco.parser.ParserDtos.ArtifactError;

import java.util.List;
import java.util.stream.Collectors;

public class ArtifactLoadException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    private final transient List<ArtifactError> errors;

    public ArtifactLoadException(String artifact, List<ArtifactError> errors) {
        super("Invalid artifact " + artifact + ": " + errors.stream()
                .map(ArtifactError::describe)
                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public ArtifactLoadException(String artifact, String message, Throwable cause) {
        super("Cannot load artifact " + artifact + ": " + message, cause);
        this.errors = List.of(new ArtifactError("UNREADABLE", message, 0, artifact));
    }

    public List<ArtifactError> getErrors() {
        return errors;
    }
}
