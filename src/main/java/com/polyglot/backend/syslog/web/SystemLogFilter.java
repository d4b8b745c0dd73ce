package com.polyglot.backend.syslog.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.backend.auth.security.IdentityHeaderFilter;
import com.polyglot.backend.common.web.ApiExceptionHandler;
import com.polyglot.backend.common.web.ClientAddress;
import com.polyglot.backend.common.web.RequestIdFilter;
import com.polyglot.backend.syslog.service.SystemLogEntry;
import com.polyglot.backend.syslog.service.SystemLogService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * /api/** 每個請求結束後寫一筆 system log。
 * 排在 RequestIdFilter 之後、Spring Security 之前：401 也會被記到。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class SystemLogFilter extends OncePerRequestFilter {

    private final SystemLogService service;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;

    public SystemLogFilter(
            SystemLogService service,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.audit.enabled:true}") boolean enabled
    ) {
        this.service = service;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled || !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long startNs = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long tookMs = (System.nanoTime() - startNs) / 1_000_000L;
            service.recordAsync(buildEntry(req, res, tookMs));
        }
    }

    SystemLogEntry buildEntry(HttpServletRequest req, HttpServletResponse res, long tookMs) {
        String endpoint = routePattern(req);
        Object user = req.getAttribute(IdentityHeaderFilter.ATTR);
        Object error = req.getAttribute(ApiExceptionHandler.ERROR_ATTR);

        return new SystemLogEntry(
                user == null ? null : String.valueOf(user),
                actionOf(req.getMethod(), endpoint),
                endpoint,
                req.getMethod(),
                res.getStatus(),
                tookMs,
                ClientAddress.of(req),
                req.getHeader("User-Agent"),
                error == null ? null : String.valueOf(error),
                requestData(req),
                clock.instant()
        );
    }

    // ===== helpers =====

    /** 有對到 handler 就用 route pattern（/api/v1/history/{id}），否則用原始 URI */
    private static String routePattern(HttpServletRequest req) {
        Object pattern = req.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern == null ? req.getRequestURI() : String.valueOf(pattern);
    }

    /** e.g. POST /api/v1/history/clear → post_history_clear */
    static String actionOf(String method, String endpoint) {
        String path = endpoint.startsWith("/api/v1/") ? endpoint.substring("/api/v1/".length()) : endpoint;
        String slug = path.replaceAll("\\{[^}]*}", "id")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        String m = method == null ? "" : method.toLowerCase(Locale.ROOT);
        return slug.isEmpty() ? m : m + "_" + slug;
    }

    /** 只記 metadata，不記 body（翻譯原文不進稽核表） */
    private String requestData(HttpServletRequest req) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("request_id", req.getAttribute(RequestIdFilter.ATTR));
        data.put("query", req.getQueryString());
        data.put("content_length", req.getContentLengthLong());
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("system log request_data serialize failed: {}", e.toString());
            return null;
        }
    }
}
