package com.polyglot.backend.common.error;

public class NotFoundException extends ApiException {

    public NotFoundException(String code, String message) {
        super(code, message, null);
    }
}
