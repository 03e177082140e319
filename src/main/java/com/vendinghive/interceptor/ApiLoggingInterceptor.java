package com.vendinghive.interceptor;

import com.vendinghive.service.ApiLogService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.WebUtils;

import java.nio.charset.StandardCharsets;

/**
 * /api 요청 감사 로그 Interceptor
 */
@Component
public class ApiLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(ApiLoggingInterceptor.class);

    private static final String START_TIME_ATTRIBUTE = ApiLoggingInterceptor.class.getName() + ".startTime";

    @Autowired
    private ApiLogService apiLogService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        try {
            Long startTime = (Long) request.getAttribute(START_TIME_ATTRIBUTE);
            if (startTime == null) {
                return;
            }
            long responseTimeMs = System.currentTimeMillis() - startTime;

            ContentCachingRequestWrapper requestWrapper =
                    WebUtils.getNativeRequest(request, ContentCachingRequestWrapper.class);
            ContentCachingResponseWrapper responseWrapper =
                    WebUtils.getNativeResponse(response, ContentCachingResponseWrapper.class);

            String requestBody = requestWrapper != null ? asString(requestWrapper.getContentAsByteArray()) : null;
            String responseBody = responseWrapper != null ? asString(responseWrapper.getContentAsByteArray()) : null;

            apiLogService.save(apiLogService.capture(request, response.getStatus(), responseTimeMs,
                    requestBody, responseBody, ex));
        } catch (Exception e) {
            logger.error("Error in API logging interceptor", e);
        }
    }

    private String asString(byte[] content) {
        return content.length > 0 ? new String(content, StandardCharsets.UTF_8) : null;
    }
}
