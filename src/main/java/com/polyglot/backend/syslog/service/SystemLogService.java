package com.polyglot.backend.syslog.service;

import com.polyglot.backend.syslog.entity.SystemLogEntity;
import com.polyglot.backend.syslog.repo.SystemLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * 稽核紀錄寫入。跑在 auditExecutor 上，寫失敗只記 WARN，不影響 API 回應。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class SystemLogService {

    private final SystemLogRepository repo;

    @Async("auditExecutor")
    public void recordAsync(SystemLogEntry entry) {
        record(entry);
    }

    public void record(SystemLogEntry entry) {
        try {
            repo.save(toEntity(entry));
        } catch (RuntimeException ex) {
            log.warn("system log write failed action={} endpoint={} status={} err={}",
                    entry.action(), entry.endpoint(), entry.statusCode(), ex.toString());
        }
    }

    // ===== helpers =====

    static SystemLogEntity toEntity(SystemLogEntry e) {
        SystemLogEntity row = new SystemLogEntity();
        row.setUserEmail(e.userEmail());
        row.setAction(truncate(e.action(), 128));
        row.setEndpoint(truncate(e.endpoint(), 255));
        row.setMethod(e.method());
        row.setStatusCode(e.statusCode());
        row.setResponseTimeMs(e.responseTimeMs());
        row.setIpAddress(truncate(e.ipAddress(), 64));
        row.setUserAgent(truncate(e.userAgent(), 512));
        row.setErrorMessage(truncate(e.errorMessage(), 1024));
        row.setRequestData(e.requestData());
        row.setCreatedAt(e.createdAt());
        return row;
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
