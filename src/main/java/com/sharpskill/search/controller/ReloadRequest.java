package com.sharpskill.search.controller;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ReloadRequest(
    @NotNull List<SkillDocumentRequest> skills
) {}
