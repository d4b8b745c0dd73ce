package com.polyglot.backend.syslog.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** 每個 API 呼叫一列，只寫不改 */
@Getter
@Setter
@Entity
@Table(
        name = "system_logs",
        indexes = {
                @Index(name = "idx_system_logs_created", columnList = "created_at"),
                @Index(name = "idx_system_logs_user_created", columnList = "user_email,created_at")
        }
)
public class SystemLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_email", length = 255, updatable = false)
    private String userEmail;

    @Column(name = "action", length = 128, nullable = false, updatable = false)
    private String action;

    @Column(name = "endpoint", length = 255, nullable = false, updatable = false)
    private String endpoint;

    @Column(name = "method", length = 16, nullable = false, updatable = false)
    private String method;

    @Column(name = "status_code", nullable = false, updatable = false)
    private int statusCode;

    @Column(name = "response_time_ms", nullable = false, updatable = false)
    private long responseTimeMs;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Column(name = "error_message", length = 1024, updatable = false)
    private String errorMessage;

    @Column(name = "request_data", columnDefinition = "TEXT", updatable = false)
    private String requestData;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
