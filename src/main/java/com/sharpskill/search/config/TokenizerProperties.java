package com.sharpskill.search.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app.skills.tokenizer")
public record TokenizerProperties(
    @NotNull @Min(1) Integer minTokenLength,
    @NotNull Boolean stemming,
    Map<String, String> aliases
) {
    public TokenizerProperties {
        aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }
}
