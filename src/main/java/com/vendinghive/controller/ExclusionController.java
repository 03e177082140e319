package com.vendinghive.controller;

import com.vendinghive.dto.request.BulkExclusionRequest;
import com.vendinghive.dto.request.ExclusionRequest;
import com.vendinghive.dto.response.BulkExclusionResponse;
import com.vendinghive.dto.response.ExclusionResponse;
import com.vendinghive.service.ApiLogService;
import com.vendinghive.service.ExclusionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 검색 결과에서 제외할 장소 관리 API
 */
@RestController
@RequestMapping("/api/locator/excluded")
@CrossOrigin(origins = {"https://app.vendinghive.com", "http://localhost:3000"})
public class ExclusionController {

    @Autowired
    private ExclusionService exclusionService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId) {
        List<ExclusionResponse> exclusions = exclusionService.list(operatorId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("excluded_locations", exclusions);
        response.put("count", exclusions.size());
        return ResponseEntity.ok(response);
    }

    @PostMapping
    public ResponseEntity<ExclusionResponse> create(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId,
            @RequestBody ExclusionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exclusionService.create(operatorId, request));
    }

    @DeleteMapping("/{exclusionId}")
    public ResponseEntity<Map<String, Object>> delete(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId,
            @PathVariable Long exclusionId) {
        exclusionService.delete(operatorId, exclusionId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Location removed from exclusion list");
        return ResponseEntity.ok(response);
    }

    /**
     * 검색 결과 id 목록으로 한 번에 제외
     * POST /api/locator/excluded/bulk
     */
    @PostMapping("/bulk")
    public ResponseEntity<BulkExclusionResponse> bulkExclude(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId,
            @RequestBody BulkExclusionRequest request) {
        return ResponseEntity.ok(exclusionService.bulkExclude(operatorId, request));
    }
}
