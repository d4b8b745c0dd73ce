package com.polyglot.backend.syslog.service;

import java.time.Instant;

public record SystemLogEntry(
        String userEmail,
        String action,
        String endpoint,
        String method,
        int statusCode,
        long responseTimeMs,
        String ipAddress,
        String userAgent,
        String errorMessage,
        String requestData,
        Instant createdAt
) {}
