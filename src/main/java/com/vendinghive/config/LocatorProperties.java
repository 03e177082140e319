package com.vendinghive.config;

import com.vendinghive.service.ranking.ScoringWeights;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * application.yml 의 locator.* 설정 바인딩
 * <pre>{@code
 * locator:
 *   search:
 *     max-results-ceiling: 100
 *   providers:
 *     timeout: 20s
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "locator")
@Getter
@Setter
public class LocatorProperties {

    private Search search = new Search();
    private Dedup dedup = new Dedup();
    private Providers providers = new Providers();
    private Cache cache = new Cache();
    private ScoringWeights scoring = new ScoringWeights();

    @Getter
    @Setter
    public static class Search {
        /** 요청 max_results 와 무관하게 넘지 않는 상한 */
        private int maxResultsCeiling = 100;
        private int defaultMaxResults = 20;
        /** false 면 영구 폐업 장소는 결과에서 제외 */
        private boolean includePermanentlyClosed = true;
        /** 유동인구 값이 없는 후보는 평점/리뷰/카테고리로 추정 */
        private boolean estimateFootTraffic = true;
    }

    @Getter
    @Setter
    public static class Dedup {
        private double proximityMeters = 30.0;
        private double nameSimilarity = 0.6;
    }

    @Getter
    @Setter
    public static class Providers {
        private String overpassUrl = "https://overpass-api.de/api/interpreter";
        private String nominatimUrl = "https://nominatim.openstreetmap.org";
        private String googlePlacesUrl = "https://maps.googleapis.com/maps/api/place";
        /** Overpass 쿼리 자체의 [timeout:N] 값 (초). provider 타임아웃보다 짧아야 함 */
        private int overpassQueryTimeout = 15;
        private Duration timeout = Duration.ofSeconds(20);
        private int threads = 8;
        /** provider 배치 중 이 비율 이상이 깨진 레코드면 WARN 로그 */
        private double corruptionThreshold = 0.25;
        private int googleMaxDetailLookups = 40;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration providerTtl = Duration.ofMinutes(10);
        private Duration geocodeTtl = Duration.ofDays(7);
    }
}
