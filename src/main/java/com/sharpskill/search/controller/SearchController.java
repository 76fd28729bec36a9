package com.sharpskill.search.controller;

import com.sharpskill.search.service.SkillSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

    private final SkillSearchService searchService;

    @GetMapping
    public ResponseEntity<SkillSearchResponse> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "top_k", required = false) Integer topK,
        @RequestParam(name = "min_score", required = false) Double minScore,
        @RequestParam(name = "category", required = false) String category) {

        var ranked = searchService.search(
            query,
            Optional.ofNullable(topK),
            Optional.ofNullable(minScore),
            Optional.ofNullable(category)
        );
        return ResponseEntity.ok(SkillSearchResponse.from(ranked));
    }
}
