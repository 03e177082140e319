package com.vendinghive.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendinghive.entity.ApiLog;
import com.vendinghive.repository.ApiLogRepository;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 감사 로그 서비스
 * 요청 스레드에서 {@link #capture} 로 값을 뽑고, 저장은 apiLogExecutor 에서 비동기로
 */
@Service
public class ApiLogService {

    private static final Logger logger = LoggerFactory.getLogger(ApiLogService.class);
    private static final Logger apiLogger = LoggerFactory.getLogger("API_LOGGER");

    public static final String OPERATOR_HEADER = "X-Operator-Id";

    static final int MAX_BODY_LENGTH = 5000;
    static final int MAX_ERROR_LENGTH = 1000;

    @Autowired
    private ApiLogRepository apiLogRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 요청이 끝난 시점의 값으로 ApiLog 생성 (요청 객체는 비동기 스레드로 넘기지 않음)
     */
    public ApiLog capture(HttpServletRequest request, int statusCode, long responseTimeMs,
                          String requestBody, String responseBody, Exception exception) {
        String endpoint = request.getRequestURI();
        if (request.getQueryString() != null) {
            endpoint += "?" + request.getQueryString();
        }
        String errorMessage = exception != null
                ? StringUtils.truncate(exception.getMessage(), MAX_ERROR_LENGTH)
                : null;

        return ApiLog.builder()
                .method(request.getMethod())
                .endpoint(StringUtils.truncate(endpoint, 500))
                .operatorId(resolveOperatorId(request.getHeader(OPERATOR_HEADER), requestBody))
                .ipAddress(getClientIpAddress(request))
                .userAgent(StringUtils.truncate(request.getHeader("User-Agent"), 500))
                .requestBody(truncate(requestBody))
                .responseBody(truncate(responseBody))
                .statusCode(statusCode)
                .responseTimeMs(responseTimeMs)
                .errorMessage(errorMessage)
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Async("apiLogExecutor")
    public void save(ApiLog apiLog) {
        try {
            apiLogRepository.save(apiLog);
            logToFile(apiLog);
        } catch (Exception e) {
            logger.error("Failed to save API log for {} {}", apiLog.getMethod(), apiLog.getEndpoint(), e);
        }
    }

    /**
     * 헤더 우선, 없으면 검색 요청 본문의 operator_id
     */
    String resolveOperatorId(String header, String requestBody) {
        if (StringUtils.isNotBlank(header)) {
            return StringUtils.truncate(header.trim(), 100);
        }
        if (StringUtils.isBlank(requestBody)) {
            return null;
        }
        try {
            JsonNode body = objectMapper.readTree(requestBody);
            String operatorId = body.path("operator_id").asText(null);
            return StringUtils.isBlank(operatorId) ? null : StringUtils.truncate(operatorId.trim(), 100);
        } catch (Exception e) {
            // JSON 본문이 아님
            return null;
        }
    }

    private void logToFile(ApiLog apiLog) {
        try {
            Map<String, Object> logEntry = new LinkedHashMap<>();
            logEntry.put("timestamp", apiLog.getCreatedAt().toString());
            logEntry.put("method", apiLog.getMethod());
            logEntry.put("endpoint", apiLog.getEndpoint());
            logEntry.put("operatorId", apiLog.getOperatorId());
            logEntry.put("ipAddress", apiLog.getIpAddress());
            logEntry.put("statusCode", apiLog.getStatusCode());
            logEntry.put("responseTimeMs", apiLog.getResponseTimeMs());
            if (apiLog.getErrorMessage() != null) {
                logEntry.put("error", apiLog.getErrorMessage());
            }
            apiLogger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to write JSON log to file", e);
        }
    }

    private String getClientIpAddress(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (StringUtils.isBlank(ip) || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("X-Real-IP");
        }
        if (StringUtils.isBlank(ip) || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        // X-Forwarded-For 는 첫 번째가 실제 클라이언트
        if (ip != null && ip.contains(",")) {
            ip = ip.split(",")[0].trim();
        }
        return ip;
    }

    private String truncate(String body) {
        if (body == null || body.length() <= MAX_BODY_LENGTH) {
            return body;
        }
        return body.substring(0, MAX_BODY_LENGTH) + "... (truncated)";
    }
}
