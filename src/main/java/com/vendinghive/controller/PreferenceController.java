package com.vendinghive.controller;

import com.vendinghive.dto.request.PreferenceRequest;
import com.vendinghive.dto.response.PreferenceResponse;
import com.vendinghive.service.ApiLogService;
import com.vendinghive.service.PreferenceService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 운영자 검색 선호 설정 API
 */
@RestController
@RequestMapping("/api/locator/preferences")
@CrossOrigin(origins = {"https://app.vendinghive.com", "http://localhost:3000"})
public class PreferenceController {

    @Autowired
    private PreferenceService preferenceService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getPreferences(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId) {
        Optional<PreferenceResponse> preference = preferenceService.getPreference(operatorId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("preferences", preference.orElse(null));
        if (preference.isEmpty()) {
            response.put("message", "No preferences set");
        }
        return ResponseEntity.ok(response);
    }

    /**
     * 부분 업데이트. 설정이 없으면 새로 생성
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> savePreferences(
            @RequestHeader(ApiLogService.OPERATOR_HEADER) String operatorId,
            @RequestBody PreferenceRequest request) {
        PreferenceResponse saved = preferenceService.upsert(operatorId, request);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Preferences saved");
        response.put("preferences", saved);
        return ResponseEntity.ok(response);
    }
}
