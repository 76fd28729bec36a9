package com.sharpskill.search.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharpskill.search.exception.CorpusLoadException;
import com.sharpskill.search.model.SkillDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@Slf4j
@Repository
public class JsonSkillCorpusRepository implements SkillCorpusRepository {

    private static final TypeReference<List<SkillRecord>> RECORDS = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public JsonSkillCorpusRepository(
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper,
        @Value("${app.skills.corpus.location:classpath:skills/corpus.json}") String location
    ) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @Override
    @Retryable(retryFor = CorpusLoadException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public List<SkillDocument> loadAll() {
        log.debug("Reading skill corpus from {}", location);
        try (InputStream in = open()) {
            List<SkillRecord> records = objectMapper.readValue(in, RECORDS);
            if (records == null) {
                return List.of();
            }
            log.info("Read {} skill records from {}", records.size(), location);
            return records.stream()
                .map(r -> r == null ? null : r.toDocument())
                .toList();
        } catch (IOException e) {
            throw new CorpusLoadException(location, e);
        }
    }

    @Override
    @Retryable(retryFor = CorpusLoadException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public String fingerprint() {
        try (InputStream in = open()) {
            return DigestUtils.md5DigestAsHex(in);
        } catch (IOException e) {
            throw new CorpusLoadException(location, e);
        }
    }

    @Override
    public String location() {
        return location;
    }

    private InputStream open() throws IOException {
        Resource resource = resourceLoader.getResource(location);
        return resource.getInputStream();
    }
}
