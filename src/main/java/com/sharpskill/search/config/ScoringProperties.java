package com.sharpskill.search.config;

import com.sharpskill.search.model.IndexField;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Field weights and phrase bonus used at index and match time. Field weights
 * must keep the order trigger term > name > tag > description.
 */
@Validated
@ConfigurationProperties(prefix = "app.skills.scoring")
public record ScoringProperties(
    @NotNull @Positive Double triggerTermWeight,
    @NotNull @Positive Double nameWeight,
    @NotNull @Positive Double tagWeight,
    @NotNull @Positive Double descriptionWeight,
    @NotNull @Positive Double phraseBonus
) {

    public double weightFor(IndexField field) {
        return switch (field) {
            case TRIGGER_TERM -> triggerTermWeight;
            case NAME -> nameWeight;
            case TAG -> tagWeight;
            case DESCRIPTION -> descriptionWeight;
        };
    }

    @AssertTrue(message = "field weights must descend from trigger term to name to tag to description")
    public boolean isFieldOrderRespected() {
        if (triggerTermWeight == null || nameWeight == null || tagWeight == null || descriptionWeight == null) {
            return true;
        }
        return triggerTermWeight > nameWeight && nameWeight > tagWeight && tagWeight > descriptionWeight;
    }
}
