package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    @JsonProperty("error_code") String errorCode,
    String message,
    int status,
    long timestamp,
    List<String> details
) {}
