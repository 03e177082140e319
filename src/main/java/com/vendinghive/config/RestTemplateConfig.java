package com.vendinghive.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Overpass / Google Places / Nominatim 호출용 RestTemplate
 */
@Configuration
public class RestTemplateConfig {

    private static final String USER_AGENT = "vendinghive-locator/0.1";

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, LocatorProperties properties) {
        // Nominatim 이용 정책상 User-Agent 필수
        return builder
                .setConnectTimeout(properties.getProviders().getConnectTimeout())
                .setReadTimeout(properties.getProviders().getReadTimeout())
                .defaultHeader("User-Agent", USER_AGENT)
                .build();
    }
}
