package com.sharpskill.search.event;

public record CorpusRefreshRequestedEvent(String reason) {}
