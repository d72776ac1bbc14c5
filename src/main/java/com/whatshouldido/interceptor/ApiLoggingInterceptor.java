package com.whatshouldido.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * API 요청/응답 로깅 Interceptor
 */
public class ApiLoggingInterceptor implements HandlerInterceptor {

    private static final Logger apiLogger = LoggerFactory.getLogger("API_LOGGER");

    private static final String START_TIME_ATTRIBUTE = "startTime";
    private static final String USER_HEADER = "X-User-Id";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // 요청 시작 시간 기록
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                               Object handler, Exception ex) {
        Long startTime = (Long) request.getAttribute(START_TIME_ATTRIBUTE);
        if (startTime == null) {
            return;
        }

        long responseTimeMs = System.currentTimeMillis() - startTime;
        String endpoint = request.getRequestURI();
        if (request.getQueryString() != null) {
            endpoint += "?" + request.getQueryString();
        }
        String userId = request.getHeader(USER_HEADER);

        if (ex != null || response.getStatus() >= 500) {
            apiLogger.warn("{} {} status={} user={} time={}ms error={}",
                    request.getMethod(), endpoint, response.getStatus(),
                    userId != null ? userId : "anonymous", responseTimeMs,
                    ex != null ? ex.getMessage() : null);
        } else {
            apiLogger.info("{} {} status={} user={} time={}ms",
                    request.getMethod(), endpoint, response.getStatus(),
                    userId != null ? userId : "anonymous", responseTimeMs);
        }
    }
}
