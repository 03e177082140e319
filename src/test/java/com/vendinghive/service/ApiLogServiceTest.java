package com.vendinghive.service;

import com.vendinghive.entity.ApiLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ApiLogServiceTest {

    private final ApiLogService apiLogService = new ApiLogService();

    @Test
    @DisplayName("운영자 id 는 헤더 우선, 없으면 요청 본문의 operator_id")
    void resolvesOperatorId() {
        assertThat(apiLogService.resolveOperatorId("op-header", "{\"operator_id\":\"op-body\"}")).isEqualTo("op-header");
        assertThat(apiLogService.resolveOperatorId(null, "{\"operator_id\":\"op-body\"}")).isEqualTo("op-body");
        assertThat(apiLogService.resolveOperatorId(null, "not json")).isNull();
        assertThat(apiLogService.resolveOperatorId(" ", null)).isNull();
    }

    @Test
    @DisplayName("요청 정보와 프록시 IP 를 담은 로그 생성, 긴 응답은 잘라냄")
    void capturesRequest() {
        // given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/locator/search");
        request.setQueryString("debug=true");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        request.addHeader(ApiLogService.OPERATOR_HEADER, "op-9");
        String longBody = "x".repeat(ApiLogService.MAX_BODY_LENGTH + 10);

        // when
        ApiLog apiLog = apiLogService.capture(request, 200, 42L, "{}", longBody, null);

        // then
        assertThat(apiLog.getMethod()).isEqualTo("POST");
        assertThat(apiLog.getEndpoint()).isEqualTo("/api/locator/search?debug=true");
        assertThat(apiLog.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(apiLog.getOperatorId()).isEqualTo("op-9");
        assertThat(apiLog.getResponseBody()).endsWith("... (truncated)");
        assertThat(apiLog.getResponseBody()).hasSize(ApiLogService.MAX_BODY_LENGTH + "... (truncated)".length());
        assertThat(apiLog.getStatusCode()).isEqualTo(200);
        assertThat(apiLog.getErrorMessage()).isNull();
    }
}
