package com.sharpskill.search.exception;

import lombok.Getter;

@Getter
public class CorpusLoadException extends RuntimeException {
    private final String location;

    public CorpusLoadException(String location, Throwable cause) {
        super("Failed to load skill corpus from " + location, cause);
        this.location = location;
    }
}
