package com.sharpskill.search.model;

import com.sharpskill.search.exception.CorpusValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable set of skill documents keyed by id.
 * <p>
 * A batch is accepted or rejected as a whole: {@link #of} collects every
 * violation before failing so that callers can fix a corpus in one pass.
 */
public final class DocumentStore {

    public static final int MAX_DESCRIPTION_LENGTH = 1024;

    private static final DocumentStore EMPTY = new DocumentStore(Map.of());

    private final Map<String, SkillDocument> documents;

    private DocumentStore(Map<String, SkillDocument> documents) {
        this.documents = documents;
    }

    public static DocumentStore empty() {
        return EMPTY;
    }

    public static DocumentStore of(Collection<SkillDocument> batch) {
        if (batch == null || batch.isEmpty()) {
            return EMPTY;
        }

        List<String> violations = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Map<String, SkillDocument> byId = new LinkedHashMap<>();

        int position = 0;
        for (SkillDocument doc : batch) {
            String label = "document #" + position++;
            if (doc == null) {
                violations.add(label + ": document is null");
                continue;
            }
            if (doc.name() != null && !doc.name().isBlank()) {
                label = label + " '" + doc.name() + "'";
            }

            if (doc.name() == null || doc.name().isBlank()) {
                violations.add(label + ": missing name");
            } else if (doc.id() == null || doc.id().isEmpty()) {
                violations.add(label + ": name has no alphanumeric characters");
            }

            String description = doc.description();
            if (description == null || description.isBlank()) {
                violations.add(label + ": missing description");
            } else if (description.length() > MAX_DESCRIPTION_LENGTH) {
                violations.add(label + ": description longer than " + MAX_DESCRIPTION_LENGTH + " characters");
            } else if (description.indexOf('<') >= 0 || description.indexOf('>') >= 0) {
                violations.add(label + ": description contains markup");
            }

            if (doc.id() != null && !doc.id().isEmpty()) {
                if (!seen.add(doc.id())) {
                    violations.add(label + ": duplicate id '" + doc.id() + "'");
                } else {
                    byId.put(doc.id(), doc);
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new CorpusValidationException(violations);
        }
        return new DocumentStore(Collections.unmodifiableMap(byId));
    }

    /**
     * Store restricted to the given ids, in the original order. Used to drop
     * documents the indexer had to skip.
     */
    public DocumentStore retainOnly(Set<String> ids) {
        if (ids.containsAll(documents.keySet())) {
            return this;
        }
        Map<String, SkillDocument> kept = new LinkedHashMap<>();
        documents.forEach((id, doc) -> {
            if (ids.contains(id)) {
                kept.put(id, doc);
            }
        });
        return kept.isEmpty() ? EMPTY : new DocumentStore(Collections.unmodifiableMap(kept));
    }

    public Optional<SkillDocument> findById(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    public Collection<SkillDocument> all() {
        return documents.values();
    }

    public Set<String> ids() {
        return documents.keySet();
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
