package com.sharpskill.search.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharpskill.search.SkillFixtures;
import com.sharpskill.search.exception.CorpusValidationException;
import com.sharpskill.search.exception.ReloadThrottledException;
import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.model.SkillDocument;
import com.sharpskill.search.model.SkillIndex;
import com.sharpskill.search.service.LexicalTokenizer;
import com.sharpskill.search.service.SkillAdminService;
import com.sharpskill.search.service.SkillIndexerImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    private static final Instant BUILT_AT = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SkillAdminService adminService;

    @Test
    @DisplayName("POST /admin/skills should rebuild the index and report counts")
    void reload_ShouldReturnNewGeneration() throws Exception {
        SkillIndex index = new SkillIndexerImpl(new LexicalTokenizer(SkillFixtures.tokenizer()), SkillFixtures.scoring())
            .build(List.of(SkillFixtures.husky()));
        when(adminService.reload(anyList())).thenReturn(new IndexSnapshot(2, index, BUILT_AT));

        ReloadRequest request = new ReloadRequest(List.of(new SkillDocumentRequest(
            "husky",
            "Manage git hooks so linters and tests run automatically before commits and pushes.",
            List.of("husky", "git hooks", "pre-commit"),
            List.of("git", "tooling"),
            "developer-tooling",
            null,
            null
        )));

        mockMvc.perform(post("/admin/skills")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.generation").value(2))
            .andExpect(jsonPath("$.document_count").value(1))
            .andExpect(jsonPath("$.term_count").value(index.termCount()))
            .andExpect(jsonPath("$.posting_count").value(index.postingCount()))
            .andExpect(jsonPath("$.skipped", hasSize(0)));

        verify(adminService).reload(argThat((List<SkillDocument> docs) ->
            docs.size() == 1 && docs.get(0).id().equals("husky") && docs.get(0).triggerTerms().contains("pre-commit")));
    }

    @Test
    @DisplayName("POST /admin/skills should return 400 with every violation for a rejected batch")
    void reload_ShouldReturn400_WhenCorpusInvalid() throws Exception {
        when(adminService.reload(anyList())).thenThrow(new CorpusValidationException(List.of(
            "document #0 'zod': missing description",
            "document #1 'zod': duplicate id 'zod'"
        )));

        String body = """
            {"skills": [{"name": "zod"}, {"name": "zod", "description": "Schemas."}]}
            """;

        mockMvc.perform(post("/admin/skills")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_CORPUS"))
            .andExpect(jsonPath("$.details", hasSize(2)));
    }

    @Test
    @DisplayName("POST /admin/skills should return 400 when the skills list is absent")
    void reload_ShouldReturn400_WhenSkillsMissing() throws Exception {
        mockMvc.perform(post("/admin/skills")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"))
            .andExpect(jsonPath("$.details[0]").value(startsWith("skills: ")));

        verifyNoInteractions(adminService);
    }

    @Test
    @DisplayName("POST /admin/skills should return 429 when reloads are throttled")
    void reload_ShouldReturn429_WhenThrottled() throws Exception {
        when(adminService.reload(anyList())).thenThrow(new ReloadThrottledException("admin-reload"));

        mockMvc.perform(post("/admin/skills")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"skills\": []}"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error_code").value("RELOAD_THROTTLED"));
    }

    @Test
    @DisplayName("POST /admin/skills/refresh should accept the request and report the active generation")
    void refresh_ShouldReturn202() throws Exception {
        when(adminService.current()).thenReturn(new IndexSnapshot(4, SkillIndex.empty(), BUILT_AT));

        mockMvc.perform(post("/admin/skills/refresh"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.generation").value(4));

        verify(adminService).requestRefresh("admin request");
    }

    @Test
    @DisplayName("POST /admin/skills/refresh should return 429 when throttled")
    void refresh_ShouldReturn429_WhenThrottled() throws Exception {
        doThrow(new ReloadThrottledException("admin-reload")).when(adminService).requestRefresh(anyString());

        mockMvc.perform(post("/admin/skills/refresh"))
            .andExpect(status().isTooManyRequests());
    }

    @Test
    @DisplayName("GET /admin/generation should omit built_at before the first build")
    void generation_ShouldReportEmptyState() throws Exception {
        when(adminService.current()).thenReturn(IndexSnapshot.empty());

        mockMvc.perform(get("/admin/generation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.generation").value(0))
            .andExpect(jsonPath("$.document_count").value(0))
            .andExpect(jsonPath("$.built_at").doesNotExist());
    }
}
