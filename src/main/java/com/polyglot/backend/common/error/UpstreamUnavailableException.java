package com.polyglot.backend.common.error;

/**
 * 翻譯 provider 不可用：
 * - PROVIDER_GIVE_UP：暫時性錯誤重試到上限
 * - PROVIDER_REJECTED：永久性錯誤（不重試）
 */
public class UpstreamUnavailableException extends ApiException {

    private final int attempts;
    private final String lastErrorCode;

    public UpstreamUnavailableException(String code, String message, int attempts, String lastErrorCode) {
        super(code, message, "RETRY_LATER");
        this.attempts = attempts;
        this.lastErrorCode = lastErrorCode;
    }

    public int attempts() { return attempts; }
    public String lastErrorCode() { return lastErrorCode; }
}
