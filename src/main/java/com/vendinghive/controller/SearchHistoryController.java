package com.vendinghive.controller;

import com.vendinghive.dto.response.LocatorStatsResponse;
import com.vendinghive.dto.response.RankedLocationResponse;
import com.vendinghive.dto.response.SearchHistoryResponse;
import com.vendinghive.service.ApiLogService;
import com.vendinghive.service.SearchHistoryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/locator")
@CrossOrigin(origins = {"https://app.vendinghive.com", "http://localhost:3000"})
public class SearchHistoryController {

    @Autowired
    private SearchHistoryService searchHistoryService;

    /**
     * 검색 이력 (최신순, 페이지)
     * GET /api/locator/history?page=0&size=20
     */
    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> history(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        Page<SearchHistoryResponse> searches = searchHistoryService.list(operatorId, page, size);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("searches", searches.getContent());
        response.put("page", searches.getNumber());
        response.put("size", searches.getSize());
        response.put("total_elements", searches.getTotalElements());
        response.put("total_pages", searches.getTotalPages());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/history/{searchId}")
    public ResponseEntity<SearchHistoryResponse> historyDetail(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId,
            @PathVariable UUID searchId
    ) {
        return ResponseEntity.ok(searchHistoryService.detail(operatorId, searchId));
    }

    /**
     * 최근 30일 리드 (점수 순 최대 50개)
     */
    @GetMapping("/recent")
    public ResponseEntity<Map<String, Object>> recent(@RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId) {
        List<RankedLocationResponse> locations = searchHistoryService.recentLocations(operatorId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("locations", locations);
        response.put("count", locations.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    public ResponseEntity<LocatorStatsResponse> stats(@RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId) {
        return ResponseEntity.ok(searchHistoryService.stats(operatorId));
    }
}
