package com.sharpskill.search.controller;

import com.sharpskill.search.service.SkillAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /admin/skills          replace the corpus with the posted batch
 * POST /admin/skills/refresh  rebuild from the configured corpus source in the background
 * GET  /admin/generation      current index generation
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final SkillAdminService adminService;

    @PostMapping("/skills")
    public ResponseEntity<ReloadResponse> reload(@Valid @RequestBody ReloadRequest request) {
        var documents = request.skills().stream()
            .map(skill -> skill == null ? null : skill.toDocument())
            .toList();
        return ResponseEntity.ok(ReloadResponse.from(adminService.reload(documents)));
    }

    @PostMapping("/skills/refresh")
    public ResponseEntity<GenerationResponse> refresh() {
        adminService.requestRefresh("admin request");
        return ResponseEntity.accepted().body(GenerationResponse.from(adminService.current()));
    }

    @GetMapping("/generation")
    public ResponseEntity<GenerationResponse> generation() {
        return ResponseEntity.ok(GenerationResponse.from(adminService.current()));
    }
}
