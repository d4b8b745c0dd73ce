package com.polyglot.backend.auth.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Locale;

/**
 * 使用者身分由前面的 gateway / session 層解析好，用 header 帶進來。
 * 這裡只做格式檢查，並把 email 放進 SecurityContext。
 */
@Component
public class IdentityHeaderFilter extends OncePerRequestFilter {

    public static final String ATTR = "userEmail";

    private static final int MAX_EMAIL_LEN = 255;

    private final String headerName;

    public IdentityHeaderFilter(@Value("${app.identity.header:X-User-Email}") String headerName) {
        this.headerName = headerName;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String email = normalize(req.getHeader(headerName));
        if (email == null) {
            chain.doFilter(req, res); // 匿名，由 EntryPoint 回 401
            return;
        }

        var authentication = new UsernamePasswordAuthenticationToken(
                email, // principal 只放 email 字串
                null,
                Collections.emptyList()
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        req.setAttribute(ATTR, email);

        chain.doFilter(req, res);
    }

    static String normalize(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty() || v.length() > MAX_EMAIL_LEN) return null;
        int at = v.indexOf('@');
        if (at <= 0 || at != v.lastIndexOf('@') || at == v.length() - 1) return null;
        for (int i = 0; i < v.length(); i++) {
            if (Character.isWhitespace(v.charAt(i)) || Character.isISOControl(v.charAt(i))) return null;
        }
        return v;
    }
}
