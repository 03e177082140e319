package com.vendinghive.service.provider;

import com.vendinghive.model.GeoPoint;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.ProviderSource;
import lombok.Value;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Value
public class ProviderQuery {

    GeoPoint center;
    int radiusMeters;
    Set<PlaceCategory> categories;

    /**
     * 캐시 키: provider, 중심(소수점 5자리), 반경, 카테고리
     */
    public String cacheKey(ProviderSource source) {
        String categoryKey = categories.stream()
                .map(PlaceCategory::name)
                .sorted()
                .collect(Collectors.joining(","));
        return String.format(Locale.ROOT, "locator:provider:%s:%.5f:%.5f:%d:%s",
                source.getCode(), center.getLatitude(), center.getLongitude(), radiusMeters, categoryKey);
    }
}
