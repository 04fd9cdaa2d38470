package com.uptimer.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptimer.api.ErrorResponse;
import com.uptimer.config.UptimerProperties;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects {@code POST /api/**} requests that do not carry the pre-shared key in {@code X-API-Key}.
 *
 * <p>Runs before the body is read. Other methods pass through so the dispatcher answers them with
 * 405. A blank configured key rejects every request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiKeyFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String PROTECTED_PREFIX = "/api/";

    private final UptimerProperties properties;
    private final ObjectMapper objectMapper;

    public ApiKeyFilter(UptimerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpRequest
                && response instanceof HttpServletResponse httpResponse
                && requiresApiKey(httpRequest)
                && !isAuthorized(httpRequest.getHeader(API_KEY_HEADER))) {
            log.warn("Rejected request with missing or invalid API key: method={}, path={}, trace_id={}",
                    httpRequest.getMethod(), httpRequest.getRequestURI(), MDC.get(TraceIdFilter.MDC_TRACE_ID));
            writeUnauthorized(httpResponse);
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean requiresApiKey(HttpServletRequest request) {
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return false;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.startsWith(PROTECTED_PREFIX);
    }

    boolean isAuthorized(String presentedKey) {
        String expectedKey = properties.getApiKey();
        if (expectedKey == null || expectedKey.isBlank() || presentedKey == null || presentedKey.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                presentedKey.getBytes(StandardCharsets.UTF_8),
                expectedKey.getBytes(StandardCharsets.UTF_8)
        );
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        ErrorResponse error = ErrorResponse.builder()
                .code("UNAUTHORIZED")
                .message("Unauthorized")
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
