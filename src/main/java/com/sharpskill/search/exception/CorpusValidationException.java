package com.sharpskill.search.exception;

import lombok.Getter;

import java.util.List;

/**
 * A document batch was rejected as a whole. The previously published index
 * stays in effect.
 */
@Getter
public class CorpusValidationException extends RuntimeException {
    private final List<String> violations;

    public CorpusValidationException(List<String> violations) {
        super("Skill corpus rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
