package com.sharpskill.search.model;

public record IndexWarning(
    String documentId,
    String message
) {}
