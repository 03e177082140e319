package com.vendinghive.controller;

import com.vendinghive.dto.request.LocationSearchRequest;
import com.vendinghive.dto.response.LocationSearchResponse;
import com.vendinghive.service.ApiLogService;
import com.vendinghive.service.LocationSearchService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 자판기 설치 후보 검색 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/locator")
@CrossOrigin(origins = {"https://app.vendinghive.com", "http://localhost:3000"})
public class LocationSearchController {

    @Autowired
    private LocationSearchService locationSearchService;

    /**
     * 후보 장소 검색 및 우선순위 정렬
     * POST /api/locator/search
     * 본문에 operator_id 가 없으면 X-Operator-Id 헤더 사용
     */
    @PostMapping("/search")
    public ResponseEntity<LocationSearchResponse> search(
            @RequestBody LocationSearchRequest request,
            @RequestHeader(value = ApiLogService.OPERATOR_HEADER, required = false) String operatorId
    ) {
        if (StringUtils.isBlank(request.getOperatorId()) && StringUtils.isNotBlank(operatorId)) {
            request.setOperatorId(operatorId);
        }
        return ResponseEntity.ok(locationSearchService.search(request));
    }
}
