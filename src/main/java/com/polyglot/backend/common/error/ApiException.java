package com.polyglot.backend.common.error;

/**
 * 有穩定錯誤碼的業務例外基底。
 * code 會原封不動輸出到 error_code，message 是給使用者看的說明。
 */
public abstract class ApiException extends RuntimeException {

    private final String code;
    private final String clientAction;

    protected ApiException(String code, String message, String clientAction) {
        super(message);
        this.code = code;
        this.clientAction = clientAction;
    }

    protected ApiException(String code, String message, String clientAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.clientAction = clientAction;
    }

    public String code() { return code; }
    public String clientAction() { return clientAction; }
}
