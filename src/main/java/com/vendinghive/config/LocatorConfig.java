package com.vendinghive.config;

import com.vendinghive.service.ranking.CandidateDeduplicator;
import com.vendinghive.service.ranking.CandidateMatcher;
import com.vendinghive.service.ranking.FootTrafficEstimator;
import com.vendinghive.service.ranking.PreferenceFilter;
import com.vendinghive.service.ranking.PriorityScorer;
import com.vendinghive.service.ranking.ProximityNameMatcher;
import com.vendinghive.service.ranking.RankingAssembler;
import com.vendinghive.service.ranking.SearchCriteriaResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 랭킹 파이프라인 컴포넌트 (상태 없음, locator.* 설정값으로 생성)
 */
@Configuration
public class LocatorConfig {

    @Bean
    public CandidateMatcher candidateMatcher(LocatorProperties properties) {
        return new ProximityNameMatcher(properties.getDedup().getProximityMeters(),
                properties.getDedup().getNameSimilarity());
    }

    @Bean
    public CandidateDeduplicator candidateDeduplicator(CandidateMatcher candidateMatcher) {
        return new CandidateDeduplicator(candidateMatcher);
    }

    @Bean
    public PriorityScorer priorityScorer(LocatorProperties properties) {
        return new PriorityScorer(properties.getScoring());
    }

    @Bean
    public FootTrafficEstimator footTrafficEstimator() {
        return new FootTrafficEstimator();
    }

    @Bean
    public SearchCriteriaResolver searchCriteriaResolver(LocatorProperties properties) {
        return new SearchCriteriaResolver(properties.getSearch().getDefaultMaxResults(),
                properties.getSearch().getMaxResultsCeiling());
    }

    @Bean
    public PreferenceFilter preferenceFilter(LocatorProperties properties) {
        return new PreferenceFilter(properties.getSearch().isIncludePermanentlyClosed());
    }

    @Bean
    public RankingAssembler rankingAssembler(LocatorProperties properties) {
        return new RankingAssembler(properties.getSearch().getMaxResultsCeiling());
    }
}
