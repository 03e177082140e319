package com.vendinghive.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AsyncConfig {

    /**
     * ApiLogService 비동기 저장용
     */
    @Bean(name = "apiLogExecutor")
    public ThreadPoolTaskExecutor apiLogExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("api-log-");
        executor.initialize();
        return executor;
    }

    /**
     * provider 동시 호출용 (검색당 provider 수만큼 작업 제출)
     */
    @Bean(name = "providerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor(LocatorProperties properties) {
        return Executors.newFixedThreadPool(properties.getProviders().getThreads(),
                new CustomizableThreadFactory("provider-"));
    }
}
