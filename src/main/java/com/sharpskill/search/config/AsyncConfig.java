package com.sharpskill.search.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    // Unlimited so that submitting never blocks the caller; rebuilds serialize on the registry lock.
    @Bean(name = "indexRebuildExecutor")
    public Executor indexRebuildExecutor() {
        return new SimpleAsyncTaskExecutor("index-rebuild-");
    }
}
