package com.sharpskill.search.exception;

import lombok.Getter;

@Getter
public class ReloadThrottledException extends RuntimeException {
    private final String key;

    public ReloadThrottledException(String key) {
        super("Too many reload requests for '" + key + "', try again later");
        this.key = key;
    }
}
