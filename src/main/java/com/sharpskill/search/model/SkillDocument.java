package com.sharpskill.search.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One skill reference entry. The {@code id} is always derived from the name
 * and never supplied by callers; use {@link #of} to construct.
 */
public record SkillDocument(
    String id,
    String name,
    String description,
    Set<String> triggerTerms,
    Set<String> tags,
    String category,
    String compatibilityNote,
    String body
) {

    public static final String DEFAULT_CATEGORY = "general";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    public SkillDocument {
        triggerTerms = cleanSet(triggerTerms);
        tags = cleanSet(tags);
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
        compatibilityNote = compatibilityNote == null ? "" : compatibilityNote;
        body = body == null ? "" : body;
    }

    public static SkillDocument of(
        String name,
        String description,
        Collection<String> triggerTerms,
        Collection<String> tags,
        String category,
        String compatibilityNote,
        String body
    ) {
        String trimmedName = name == null ? null : name.trim();
        return new SkillDocument(
            deriveId(trimmedName),
            trimmedName,
            description == null ? null : description.trim(),
            triggerTerms == null ? null : new LinkedHashSet<>(triggerTerms),
            tags == null ? null : new LinkedHashSet<>(tags),
            category,
            compatibilityNote,
            body
        );
    }

    /**
     * Kebab-case form of a skill name: {@code "Cloudflare Workers"} becomes
     * {@code "cloudflare-workers"}. Letters and digits of any script are kept,
     * matching what the tokenizer treats as alphanumeric. Returns an empty
     * string when no letter or digit remains and {@code null} for a
     * {@code null} name.
     */
    public static String deriveId(String name) {
        if (name == null) {
            return null;
        }
        return NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT))
            .replaceAll("-")
            .replaceAll("^-+|-+$", "");
    }

    private static Set<String> cleanSet(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        Set<String> cleaned = new LinkedHashSet<>();
        values.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .forEach(cleaned::add);
        return Collections.unmodifiableSet(cleaned);
    }
}
