package com.polyglot.backend.common.web;

import com.polyglot.backend.common.error.ApiException;
import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.common.error.PersistenceUnavailableException;
import com.polyglot.backend.common.error.RateLimitedException;
import com.polyglot.backend.common.error.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 統一把例外轉成可預期的 HTTP 狀態碼與 {@link ApiErrorResponse}：
 * - 400：InvalidInput / 參數格式錯 / body 壞掉
 * - 401：沒有使用者身分
 * - 404：使用者或資源不存在
 * - 429：冷卻中（帶 Retry-After）
 * - 503：provider 或資料庫不可用
 * - 500：其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    /** 稽核 filter 從這個 attribute 讀錯誤訊息 */
    public static final String ERROR_ATTR = "apiErrorMessage";

    // ===== 400 =====

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalid(InvalidInputException e, HttpServletRequest req) {
        return coded(HttpStatus.BAD_REQUEST, e, req);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        String msg = e.getBindingResult().getFieldErrors().isEmpty()
                ? "Request validation failed"
                : e.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", msg, req);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingParam(MissingServletRequestParameterException e,
                                                               HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, "PARAMETER_REQUIRED",
                "Missing required parameter: " + e.getParameterName(), req);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                               HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, "PARAMETER_INVALID",
                "Invalid value for parameter: " + e.getName(), req);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, "BODY_INVALID", "Request body is missing or malformed", req);
    }

    // ===== 401 / 404 / 405 =====

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorResponse> handleStatus(ResponseStatusException e, HttpServletRequest req) {
        HttpStatusCode status = e.getStatusCode();
        String code = (e.getReason() == null || e.getReason().isBlank()) ? "HTTP_" + status.value() : e.getReason();
        String msg = status.value() == 401 ? "User identity is required" : code;
        return respond(status, code, msg, req);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest req) {
        return coded(HttpStatus.NOT_FOUND, e, req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoRoute(NoResourceFoundException e, HttpServletRequest req) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Endpoint not found", req);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMethod(HttpRequestMethodNotSupportedException e,
                                                         HttpServletRequest req) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", e.getMessage(), req);
    }

    // ===== 429 =====

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimited(RateLimitedException e, HttpServletRequest req) {
        markForAudit(req, e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSec()))
                .body(ApiErrorResponse.of(
                        e.code(),
                        e.getMessage(),
                        rid(req),
                        e.clientAction(),
                        e.retryAfterSec()
                ));
    }

    // ===== 503 =====

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleUpstream(UpstreamUnavailableException e, HttpServletRequest req) {
        return coded(HttpStatus.SERVICE_UNAVAILABLE, e, req);
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handlePersistence(PersistenceUnavailableException e,
                                                              HttpServletRequest req) {
        return coded(HttpStatus.SERVICE_UNAVAILABLE, e, req);
    }

    /** 讀取路徑上的 DB 錯誤不重試，直接 503 */
    @ExceptionHandler({DataAccessException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ApiErrorResponse> handleDataAccess(Exception e, HttpServletRequest req) {
        log.warn("persistence unavailable: {}", e.toString());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "PERSISTENCE_UNAVAILABLE",
                "Database is temporarily unavailable", req);
    }

    // ===== 500 fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled error on {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", req);
    }

    // ===== helpers =====

    private static ResponseEntity<ApiErrorResponse> coded(HttpStatus status, ApiException e, HttpServletRequest req) {
        markForAudit(req, e.getMessage());
        return ResponseEntity.status(status)
                .body(ApiErrorResponse.of(e.code(), safeMsgOrCode(e, e.code()), rid(req), e.clientAction(), null));
    }

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatusCode status, String code, String msg,
                                                            HttpServletRequest req) {
        markForAudit(req, msg);
        return ResponseEntity.status(status).body(ApiErrorResponse.of(code, msg, rid(req)));
    }

    private static void markForAudit(HttpServletRequest req, String msg) {
        req.setAttribute(ERROR_ATTR, msg);
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
