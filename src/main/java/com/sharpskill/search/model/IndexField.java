package com.sharpskill.search.model;

/**
 * Document fields that contribute postings. {@code body} is deliberately absent.
 */
public enum IndexField {
    TRIGGER_TERM,
    NAME,
    TAG,
    DESCRIPTION
}
