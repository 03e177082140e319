package com.vendinghive.controller;

import com.vendinghive.dto.response.LocatorStatsResponse;
import com.vendinghive.dto.response.SearchHistoryResponse;
import com.vendinghive.exception.ResourceNotFoundException;
import com.vendinghive.model.MachineType;
import com.vendinghive.service.ApiLogService;
import com.vendinghive.service.SearchHistoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchHistoryController.class)
class SearchHistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchHistoryService searchHistoryService;

    @MockBean
    private ApiLogService apiLogService;

    @Test
    @DisplayName("이력 목록은 페이지 정보와 함께 반환")
    void history() throws Exception {
        // given
        SearchHistoryResponse summary = SearchHistoryResponse.builder()
                .id(UUID.randomUUID())
                .zipCode("10001")
                .radius(10)
                .machineType(MachineType.SNACK_MACHINE)
                .resultCount(4)
                .build();
        when(searchHistoryService.list("op-1", 1, 5))
                .thenReturn(new PageImpl<>(List.of(summary), PageRequest.of(1, 5), 6));

        // when & then
        mockMvc.perform(get("/api/locator/history")
                        .param("page", "1")
                        .param("size", "5")
                        .header(ApiLogService.OPERATOR_HEADER, "op-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.searches[0].zip_code").value("10001"))
                .andExpect(jsonPath("$.searches[0].machine_type").value("snack_machine"))
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.total_elements").value(6))
                .andExpect(jsonPath("$.total_pages").value(2));
    }

    @Test
    @DisplayName("다른 운영자 이력 조회는 404")
    void historyDetailNotFound() throws Exception {
        UUID searchId = UUID.randomUUID();
        when(searchHistoryService.detail("op-1", searchId))
                .thenThrow(new ResourceNotFoundException("Search not found: " + searchId));

        mockMvc.perform(get("/api/locator/history/" + searchId).header(ApiLogService.OPERATOR_HEADER, "op-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("잘못된 UUID 는 400")
    void malformedSearchId() throws Exception {
        mockMvc.perform(get("/api/locator/history/not-a-uuid").header(ApiLogService.OPERATOR_HEADER, "op-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("통계")
    void stats() throws Exception {
        when(searchHistoryService.stats("op-1")).thenReturn(LocatorStatsResponse.builder()
                .totalSearches(4L)
                .searchesThisMonth(2L)
                .averageResults(1.5)
                .favoriteMachineType(MachineType.COFFEE_MACHINE)
                .topZipCodes(List.of(new LocatorStatsResponse.ZipCodeCount("10001", 2L)))
                .excludedLocations(3L)
                .build());

        mockMvc.perform(get("/api/locator/stats").header(ApiLogService.OPERATOR_HEADER, "op-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.average_results").value(1.5))
                .andExpect(jsonPath("$.favorite_machine_type").value("coffee_machine"))
                .andExpect(jsonPath("$.top_zip_codes[0].zip_code").value("10001"));
    }
}
