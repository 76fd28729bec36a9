package com.sharpskill.search.model;

public record PostingEntry(
    String term,
    String documentId,
    IndexField field,
    double weight
) {
    public PostingEntry {
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Posting weight must be positive: " + weight);
        }
    }
}
