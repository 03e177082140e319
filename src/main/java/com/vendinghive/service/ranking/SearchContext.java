package com.vendinghive.service.ranking;

import com.vendinghive.entity.UserLocationPreference;
import lombok.Getter;

import java.util.Optional;
import java.util.Set;

/**
 * 검색 1회 동안 고정되는 운영자 정보 (검색 시작 시점의 제외 목록/선호 설정 스냅샷)
 * 검색 도중 운영자가 제외 목록을 바꿔도 이 값은 변하지 않음
 */
@Getter
public class SearchContext {

    private final String operatorId;
    private final Set<String> excludedProviderIds;
    private final UserLocationPreference preference;

    public SearchContext(String operatorId, Set<String> excludedProviderIds, UserLocationPreference preference) {
        this.operatorId = operatorId;
        this.excludedProviderIds = excludedProviderIds == null ? Set.of() : Set.copyOf(excludedProviderIds);
        this.preference = preference;
    }

    public Optional<UserLocationPreference> findPreference() {
        return Optional.ofNullable(preference);
    }
}
