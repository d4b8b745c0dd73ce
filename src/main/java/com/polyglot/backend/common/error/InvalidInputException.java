package com.polyglot.backend.common.error;

/** 呼叫端參數錯誤：不重試，原樣回 400 */
public class InvalidInputException extends ApiException {

    public InvalidInputException(String code, String message) {
        super(code, message, "FIX_REQUEST");
    }
}
