package com.vendinghive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendinghive.config.LocatorProperties;
import com.vendinghive.exception.MalformedRecordException;
import com.vendinghive.exception.SearchCancelledException;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.ProviderSource;
import com.vendinghive.service.cache.LocatorCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 모든 provider 를 동시에 호출하고 결과를 정규화
 * provider 하나의 실패/타임아웃은 providerErrors 에만 기록하고 나머지 결과는 그대로 사용
 */
@Slf4j
@Component
public class CandidateCollector {

    private final List<LocationProvider> providers;
    private final Map<ProviderSource, RecordNormalizer> normalizers = new EnumMap<>(ProviderSource.class);
    private final ExecutorService executor;
    private final LocatorCacheService cacheService;
    private final Duration timeout;
    private final double corruptionThreshold;

    public CandidateCollector(List<LocationProvider> providers,
                              List<RecordNormalizer> normalizers,
                              @Qualifier("providerExecutor") ExecutorService executor,
                              LocatorCacheService cacheService,
                              LocatorProperties properties) {
        this.providers = List.copyOf(providers);
        normalizers.forEach(normalizer -> this.normalizers.put(normalizer.source(), normalizer));
        this.executor = executor;
        this.cacheService = cacheService;
        this.timeout = properties.getProviders().getTimeout();
        this.corruptionThreshold = properties.getProviders().getCorruptionThreshold();
    }

    public CollectedCandidates collect(ProviderQuery query) {
        List<Callable<List<JsonNode>>> tasks = new ArrayList<>();
        for (LocationProvider provider : providers) {
            tasks.add(() -> fetchWithCache(provider, query));
        }

        List<Future<List<JsonNode>>> futures;
        try {
            // 타임아웃이 지나면 끝나지 않은 작업은 취소됨
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("Search cancelled while waiting for providers", e);
        }

        List<CandidateLocation> candidates = new ArrayList<>();
        Map<String, String> providerErrors = new TreeMap<>();
        for (int i = 0; i < futures.size(); i++) {
            ProviderSource source = providers.get(i).source();
            Future<List<JsonNode>> future = futures.get(i);

            if (future.isCancelled()) {
                log.warn("[CandidateCollector] {} timed out after {}s", source.getCode(), timeout.toSeconds());
                providerErrors.put(source.getCode(), "timed out after " + timeout.toSeconds() + "s");
                continue;
            }
            try {
                candidates.addAll(normalizeAll(source, future.get()));
            } catch (ExecutionException e) {
                String reason = reasonOf(e.getCause());
                log.warn("[CandidateCollector] {} unavailable: {}", source.getCode(), reason);
                providerErrors.put(source.getCode(), reason);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SearchCancelledException("Search cancelled while collecting provider results", e);
            }
        }

        log.info("[CandidateCollector] collected {} candidates, provider errors: {}", candidates.size(), providerErrors);
        return new CollectedCandidates(candidates, providerErrors);
    }

    private List<JsonNode> fetchWithCache(LocationProvider provider, ProviderQuery query) {
        String cacheKey = query.cacheKey(provider.source());
        Optional<List<JsonNode>> cached = cacheService.getProviderRecords(cacheKey);
        if (cached.isPresent()) {
            log.debug("[CandidateCollector] cache hit - {}", cacheKey);
            return cached.get();
        }
        List<JsonNode> records = provider.fetch(query);
        cacheService.putProviderRecords(cacheKey, records);
        return records;
    }

    private List<CandidateLocation> normalizeAll(ProviderSource source, List<JsonNode> records) {
        RecordNormalizer normalizer = normalizers.get(source);
        if (normalizer == null) {
            throw new IllegalStateException("No normalizer registered for " + source.getCode());
        }

        List<CandidateLocation> normalized = new ArrayList<>();
        int malformed = 0;
        for (JsonNode record : records) {
            try {
                normalized.add(normalizer.normalize(record));
            } catch (MalformedRecordException e) {
                malformed++;
                log.debug("[CandidateCollector] dropped {} record: {}", source.getCode(), e.getMessage());
            }
        }

        if (!records.isEmpty() && (double) malformed / records.size() > corruptionThreshold) {
            log.warn("[CandidateCollector] {} of {} {} records were malformed",
                    malformed, records.size(), source.getCode());
        }
        return normalized;
    }

    private String reasonOf(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
