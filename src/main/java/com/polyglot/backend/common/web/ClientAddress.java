package com.polyglot.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;

/** 取 client 位址：有 proxy 就用 X-Forwarded-For 的第一個 */
public final class ClientAddress {

    private ClientAddress() {}

    public static String of(HttpServletRequest req) {
        String xff = req.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            String first = xff.split(",")[0].trim();
            if (!first.isEmpty()) return first;
        }
        return req.getRemoteAddr();
    }
}
