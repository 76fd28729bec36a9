package com.sharpskill.search.config;

import com.sharpskill.search.infra.InMemoryRpmRateLimiter;
import com.sharpskill.search.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("reloadLimiter")
    public RateLimiter reloadLimiter(@Value("${app.skills.admin.reloads-per-minute:6}") int reloadsPerMinute) {
        return new InMemoryRpmRateLimiter(reloadsPerMinute);
    }
}
