package com.sharpskill.search.exception;

public class TokenizationException extends RuntimeException {

    public TokenizationException(String message) {
        super(message);
    }
}
