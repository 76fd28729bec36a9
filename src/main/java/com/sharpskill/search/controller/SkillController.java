package com.sharpskill.search.controller;

import com.sharpskill.search.exception.SkillNotFoundException;
import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.service.SkillRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Read access to the documents of the current snapshot, so a caller can
 * fetch the body of a skill it selected.
 */
@RestController
@RequestMapping("/skills")
@RequiredArgsConstructor
public class SkillController {

    private final SkillRegistry registry;

    @GetMapping
    public ResponseEntity<List<SkillSummaryResponse>> listSkills() {
        var skills = registry.current().documents().all().stream()
            .map(SkillSummaryResponse::from)
            .sorted(Comparator.comparing(SkillSummaryResponse::name).thenComparing(SkillSummaryResponse::id))
            .toList();
        return ResponseEntity.ok(skills);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SkillDetailResponse> getSkill(@PathVariable String id) {
        IndexSnapshot snapshot = registry.current();
        return snapshot.documents().findById(id)
            .map(doc -> ResponseEntity.ok(SkillDetailResponse.from(doc, snapshot.generation())))
            .orElseThrow(() -> new SkillNotFoundException(id));
    }
}
