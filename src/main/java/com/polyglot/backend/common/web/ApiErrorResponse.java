package com.polyglot.backend.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 所有 API 失敗回應的統一格式。
 * success 永遠是 false；error 給人看，errorCode 給程式判斷。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        boolean success,
        String error,
        String errorCode,
        String requestId,
        String clientAction,
        Integer retryAfterSec
) {
    public static ApiErrorResponse of(String errorCode, String error, String requestId) {
        return new ApiErrorResponse(false, error, errorCode, requestId, null, null);
    }

    public static ApiErrorResponse of(String errorCode, String error, String requestId,
                                      String clientAction, Integer retryAfterSec) {
        return new ApiErrorResponse(false, error, errorCode, requestId, clientAction, retryAfterSec);
    }
}
