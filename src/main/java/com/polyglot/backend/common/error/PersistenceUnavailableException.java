package com.polyglot.backend.common.error;

/** 資料庫寫入失敗：本身不重試，由呼叫端決定要不要整個請求重來 */
public class PersistenceUnavailableException extends ApiException {

    public PersistenceUnavailableException(String code, String message, Throwable cause) {
        super(code, message, "RETRY_LATER", cause);
    }
}
