package com.polyglot.backend.translation.provider;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 把呼叫 provider 時的例外分類成錯誤碼 + 能不能重試。
 * - 可重試：timeout / 408 / 429 / 5xx / 連線錯誤 / 其他未知錯誤
 * - 不可重試：401 / 403（設定錯）/ 其他 4xx（請求本身有問題）
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {}

    public record Mapped(String code, String message, boolean retryable) {

        public TranslationProvider.ProviderResult toResult() {
            return retryable
                    ? TranslationProvider.ProviderResult.transientFailure(code, message)
                    : TranslationProvider.ProviderResult.permanentFailure(code, message);
        }
    }

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("PROVIDER_FAILED", null, true);

        // 先攔截任何 timeout（RestClient 常把它包在 ResourceAccessException 裡）
        if (isTimeoutThrowable(e)) {
            return new Mapped("PROVIDER_TIMEOUT", safeMsg(e), true);
        }

        if (e instanceof RestClientResponseException re) {
            HttpStatusCode sc = re.getStatusCode();
            int status = sc.value();

            if (status == 401 || status == 403) return new Mapped("PROVIDER_AUTH_FAILED", "auth failed (" + status + ")", false);
            if (status == 429) return new Mapped("PROVIDER_RATE_LIMITED", "rate limited", true);
            if (status == 408) return new Mapped("PROVIDER_TIMEOUT", "timeout", true);

            if (sc.is5xxServerError()) return new Mapped("PROVIDER_UPSTREAM_5XX", "upstream " + status, true);
            if (sc.is4xxClientError()) return new Mapped("PROVIDER_BAD_REQUEST", bodyOrStatus(re), false);

            return new Mapped("PROVIDER_FAILED", "http " + status, true);
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped("PROVIDER_NETWORK_ERROR", safeMsg(rae), true);
        }

        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof ConnectException || c instanceof UnknownHostException) {
                return new Mapped("PROVIDER_NETWORK_ERROR", safeMsg(c), true);
            }
        }

        if (e instanceof RestClientException rce) {
            // 沒有 status code 的 client exception（例如回應解析失敗）
            return new Mapped("PROVIDER_CLIENT_ERROR", safeMsg(rce), true);
        }

        return new Mapped("PROVIDER_FAILED", safeMsg(e), true);
    }

    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            if (c instanceof java.net.http.HttpTimeoutException) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timed out") || s.contains("timeout")) return true;
            }
        }
        return false;
    }

    private static String bodyOrStatus(RestClientResponseException re) {
        String body = re.getResponseBodyAsString();
        if (body == null || body.isBlank()) return "bad request (" + re.getStatusCode().value() + ")";
        return body.length() > 300 ? body.substring(0, 300) : body;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
