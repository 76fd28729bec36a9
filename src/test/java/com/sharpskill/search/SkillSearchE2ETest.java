package com.sharpskill.search;

import com.sharpskill.search.controller.ErrorResponse;
import com.sharpskill.search.controller.GenerationResponse;
import com.sharpskill.search.controller.ReloadResponse;
import com.sharpskill.search.controller.SkillDetailResponse;
import com.sharpskill.search.controller.SkillSearchResponse;
import com.sharpskill.search.controller.SkillSearchResultItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.skills.corpus.location=classpath:skills/test-corpus.json",
        "app.skills.corpus.load-on-startup=true",
        "app.skills.admin.reloads-per-minute=1000"
    }
)
class SkillSearchE2ETest {

    @Autowired
    private TestRestTemplate restTemplate;

    @BeforeEach
    void waitForStartupLoad() {
        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
            assertThat(generation().generation()).isPositive());
    }

    @Test
    @DisplayName("E2E: search, fetch, reload and refresh against a live index")
    void skillSelectionLifecycle() {
        // 1. Startup corpus is searchable
        SkillSearchResponse hooks = search("set up a pre-commit hook to run linters");
        assertThat(hooks.results())
            .extracting(SkillSearchResultItem::skillId)
            .startsWith("husky");
        assertThat(hooks.results().get(0).matchedTerms()).contains("pre-commit");

        SkillSearchResponse e2e = search("run end to end tests in ci&top_k=1");
        assertThat(e2e.results()).extracting(SkillSearchResultItem::skillId).containsExactly("cypress");

        // 2. The selected skill body can be fetched
        ResponseEntity<SkillDetailResponse> detail = restTemplate.getForEntity("/skills/husky", SkillDetailResponse.class);
        assertThat(detail.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(detail.getBody().body()).contains("npx husky init");

        // 3. A rejected batch leaves the active generation untouched
        long before = generation().generation();
        Map<String, Object> duplicate = Map.of("skills", List.of(
            Map.of("name", "zod", "description", "Schemas."),
            Map.of("name", "Zod", "description", "Schemas again.")
        ));
        ResponseEntity<ErrorResponse> rejected = restTemplate.postForEntity("/admin/skills", duplicate, ErrorResponse.class);
        assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(rejected.getBody().errorCode()).isEqualTo("INVALID_CORPUS");
        assertThat(generation().generation()).isEqualTo(before);
        assertThat(search("set up a pre-commit hook").generation()).isEqualTo(before);

        // 4. A valid batch replaces the whole corpus
        Map<String, Object> replacement = Map.of("skills", List.of(Map.of(
            "name", "terraform",
            "description", "Provision cloud infrastructure as code with Terraform modules.",
            "trigger_terms", List.of("terraform", "infrastructure as code"),
            "category", "infrastructure"
        )));
        ResponseEntity<ReloadResponse> reloaded = restTemplate.postForEntity("/admin/skills", replacement, ReloadResponse.class);
        assertThat(reloaded.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(reloaded.getBody().generation()).isEqualTo(before + 1);
        assertThat(reloaded.getBody().documentCount()).isEqualTo(1);

        assertThat(search("set up a pre-commit hook").results()).isEmpty();
        assertThat(search("deploy with tf").results())
            .extracting(SkillSearchResultItem::skillId)
            .containsExactly("terraform");

        // 5. A refresh restores the configured corpus in the background
        ResponseEntity<GenerationResponse> accepted =
            restTemplate.postForEntity("/admin/skills/refresh", null, GenerationResponse.class);
        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
            GenerationResponse current = generation();
            assertThat(current.generation()).isEqualTo(before + 2);
            assertThat(current.documentCount()).isEqualTo(3);
        });
        assertThat(search("set up a pre-commit hook").results())
            .extracting(SkillSearchResultItem::skillId)
            .startsWith("husky");
    }

    @Test
    @DisplayName("E2E: invalid requests are reported with error codes")
    void invalidRequests() {
        ResponseEntity<ErrorResponse> blank = restTemplate.getForEntity("/search?q=   ", ErrorResponse.class);
        assertThat(blank.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(blank.getBody().errorCode()).isEqualTo("EMPTY_QUERY");

        ResponseEntity<ErrorResponse> topK = restTemplate.getForEntity("/search?q=git&top_k=0", ErrorResponse.class);
        assertThat(topK.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(topK.getBody().errorCode()).isEqualTo("INVALID_QUERY");

        ResponseEntity<ErrorResponse> missing = restTemplate.getForEntity("/skills/nope", ErrorResponse.class);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(missing.getBody().errorCode()).isEqualTo("RESOURCE_NOT_FOUND");
    }

    private SkillSearchResponse search(String query) {
        ResponseEntity<SkillSearchResponse> response =
            restTemplate.getForEntity("/search?q=" + query, SkillSearchResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return response.getBody();
    }

    private GenerationResponse generation() {
        return restTemplate.getForEntity("/admin/generation", GenerationResponse.class).getBody();
    }
}
