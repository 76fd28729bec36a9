package com.sharpskill.search.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param defaultLimit may be left unset, in which case every qualifying match is returned
 */
@Validated
@ConfigurationProperties(prefix = "app.skills.search")
public record SearchProperties(
    @NotNull @Min(1) @Max(100_000) Integer maxQueryLength,
    @NotNull @PositiveOrZero Double defaultMinScore,
    @Min(1) Integer defaultLimit
) {}
