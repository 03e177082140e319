package com.vendinghive.service;

import com.vendinghive.dto.response.LocatorStatsResponse;
import com.vendinghive.exception.ResourceNotFoundException;
import com.vendinghive.model.MachineType;
import com.vendinghive.repository.ExcludedLocationRepository;
import com.vendinghive.repository.LocationDataRepository;
import com.vendinghive.repository.SearchHistoryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchHistoryServiceTest {

    @Mock
    private SearchHistoryRepository searchHistoryRepository;

    @Mock
    private LocationDataRepository locationDataRepository;

    @Mock
    private ExcludedLocationRepository excludedLocationRepository;

    @InjectMocks
    private SearchHistoryService searchHistoryService;

    @Test
    @DisplayName("통계: 이번 달 시작 기준, 평균은 소수 첫째 자리, 가장 많이 검색한 자판기 종류")
    void stats() {
        // given
        when(searchHistoryRepository.countByOperatorId("op-1")).thenReturn(12L);
        when(searchHistoryRepository.countByOperatorIdAndCreatedAtGreaterThanEqual(eq("op-1"), any())).thenReturn(3L);
        when(searchHistoryRepository.averageResultCount("op-1")).thenReturn(14.666);
        when(searchHistoryRepository.countByMachineType("op-1")).thenReturn(List.of(
                new Object[]{MachineType.COFFEE_MACHINE, 7L},
                new Object[]{MachineType.SNACK_MACHINE, 5L}));
        when(searchHistoryRepository.countByZipCode(eq("op-1"), any(Pageable.class))).thenReturn(List.of(
                new Object[]{"10001", 8L},
                new Object[]{"94105", 4L}));
        when(excludedLocationRepository.countByOperatorId("op-1")).thenReturn(6L);

        // when
        LocatorStatsResponse stats = searchHistoryService.stats("op-1");

        // then
        assertThat(stats.getTotalSearches()).isEqualTo(12L);
        assertThat(stats.getSearchesThisMonth()).isEqualTo(3L);
        assertThat(stats.getAverageResults()).isEqualTo(14.7);
        assertThat(stats.getFavoriteMachineType()).isEqualTo(MachineType.COFFEE_MACHINE);
        assertThat(stats.getTopZipCodes()).extracting(LocatorStatsResponse.ZipCodeCount::getZipCode)
                .containsExactly("10001", "94105");
        assertThat(stats.getExcludedLocations()).isEqualTo(6L);

        ArgumentCaptor<LocalDateTime> since = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(searchHistoryRepository).countByOperatorIdAndCreatedAtGreaterThanEqual(eq("op-1"), since.capture());
        assertThat(since.getValue()).isEqualTo(LocalDate.now().withDayOfMonth(1).atStartOfDay());
    }

    @Test
    @DisplayName("검색 기록이 없으면 평균 0, 선호 종류 없음")
    void emptyStats() {
        when(searchHistoryRepository.countByMachineType("op-2")).thenReturn(List.of());
        when(searchHistoryRepository.countByZipCode(eq("op-2"), any(Pageable.class))).thenReturn(List.of());

        LocatorStatsResponse stats = searchHistoryService.stats("op-2");

        assertThat(stats.getAverageResults()).isZero();
        assertThat(stats.getFavoriteMachineType()).isNull();
        assertThat(stats.getTopZipCodes()).isEmpty();
    }

    @Test
    @DisplayName("페이지 크기는 최대 100")
    void capsPageSize() {
        when(searchHistoryRepository.findByOperatorIdOrderByCreatedAtDesc(eq("op-1"), any(Pageable.class)))
                .thenReturn(Page.empty());

        searchHistoryService.list("op-1", -1, 1_000);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(searchHistoryRepository).findByOperatorIdOrderByCreatedAtDesc(eq("op-1"), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isZero();
        assertThat(pageable.getValue().getPageSize()).isEqualTo(100);
    }

    @Test
    @DisplayName("다른 운영자의 검색은 조회할 수 없음")
    void detailRequiresOwnership() {
        UUID searchId = UUID.randomUUID();
        when(searchHistoryRepository.findByIdAndOperatorId(searchId, "op-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> searchHistoryService.detail("op-1", searchId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("최근 리드는 30일, 50개 제한으로 조회")
    void recentLocations() {
        when(locationDataRepository.findRecentForOperator(eq("op-1"), any(), any(Pageable.class)))
                .thenReturn(List.of());

        assertThat(searchHistoryService.recentLocations("op-1")).isEmpty();

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(locationDataRepository).findRecentForOperator(eq("op-1"), any(), pageable.capture());
        assertThat(pageable.getValue().getPageSize()).isEqualTo(50);
    }
}
